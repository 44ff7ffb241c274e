package com.xelogen.lint;

import com.xelogen.graph.Node;

import java.util.List;

/**
 * One independent check over a finished graph. Implementations are annotated with
 * {@link com.xelogen.annotations.LintRule} or registered with explicit metadata via
 * {@link LintEngine#register(String, String[], LintPass)}.
 */
@FunctionalInterface
public interface LintPass {

    /**
     * Inspects the nodes this pass applies to, in graph insertion order. Must not mutate them.
     *
     * @param nodes nodes whose type matches the pass's applicable node types
     * @return one warning per problem found (built with {@link LintWarning#at(Node, String)}); never null
     */
    List<LintWarning> check(List<Node> nodes);
}
