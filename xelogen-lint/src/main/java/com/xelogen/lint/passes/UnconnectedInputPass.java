package com.xelogen.lint.passes;

import com.xelogen.annotations.LintRule;
import com.xelogen.graph.Datatype;
import com.xelogen.graph.Node;
import com.xelogen.lint.LintPass;
import com.xelogen.lint.LintWarning;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Scalar inputs left unbound. List inputs, impulses included, may legitimately stay empty. */
@LintRule(name = UnconnectedInputPass.NAME, applicableNodeTypes = { "*" })
public final class UnconnectedInputPass implements LintPass {

    public static final String NAME = "unconnected-input";

    @Override
    public List<LintWarning> check(List<Node> nodes) {
        List<LintWarning> warnings = new ArrayList<>();
        for (Node node : nodes) {
            for (Map.Entry<String, Datatype> input : node.getSpec().getInputs().entrySet()) {
                if (input.getValue().isList()) continue;
                if (node.bound(input.getKey()).isEmpty()) {
                    warnings.add(LintWarning.at(node, "Input " + input.getKey() + " (" + input.getValue()
                            + ") is not connected."));
                }
            }
        }
        return warnings;
    }
}
