package com.xelogen.lint.passes;

import com.xelogen.annotations.LintRule;
import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;
import com.xelogen.lint.LintPass;
import com.xelogen.lint.LintWarning;

import java.util.ArrayList;
import java.util.List;

/**
 * Dynamic variable naming convention: the name of a WriteDynVar node should come from a string literal
 * holding a {@code space/name} path. Names computed by other nodes are not inspected.
 */
@LintRule(name = DynVarNamingPass.NAME, applicableNodeTypes = { "WriteDynVar.*" })
public final class DynVarNamingPass implements LintPass {

    public static final String NAME = "dynvar-naming";

    static final String NAME_INPUT = "name";
    static final String STRING_INPUT = "StringInput";
    static final String PATH_SEPARATOR = "/";

    @Override
    public List<LintWarning> check(List<Node> nodes) {
        List<LintWarning> warnings = new ArrayList<>();
        for (Node node : nodes) {
            if (!node.getSpec().getInputs().containsKey(NAME_INPUT)) continue;
            List<OutputPort> bound = node.bound(NAME_INPUT);
            if (bound.isEmpty()) {
                warnings.add(LintWarning.at(node, "Node " + node.getTypeName() + " has no name input connected."));
                continue;
            }
            Node source = bound.get(0).getNode();
            if (!STRING_INPUT.equals(source.getTypeName())) continue;
            Object varName = source.getContent();
            if (varName == null) {
                warnings.add(LintWarning.at(node, "Name input for " + node.getTypeName() + " is empty."));
            } else if (!varName.toString().contains(PATH_SEPARATOR)) {
                warnings.add(LintWarning.at(node, "Name input for " + node.getTypeName() + " ('" + varName
                        + "') has no " + PATH_SEPARATOR + " separating space and name. This can result in surprises."));
            }
        }
        return warnings;
    }
}
