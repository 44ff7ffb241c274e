package com.xelogen.lint;

import com.xelogen.graph.Node;

import java.util.Objects;

/**
 * Advisory finding on one node. {@code pass} is filled in by the engine with the name the pass was
 * registered under.
 */
public record LintWarning(String pass, int nodeId, String nodeType, String message) {

    public LintWarning {
        Objects.requireNonNull(nodeType, "nodeType");
        Objects.requireNonNull(message, "message");
    }

    /** Warning on {@code node}, not yet attributed to a pass. */
    public static LintWarning at(Node node, String message) {
        return new LintWarning(null, node.getId(), node.getTypeName(), message);
    }

    LintWarning withPass(String passName) {
        return new LintWarning(passName, nodeId, nodeType, message);
    }

    @Override
    public String toString() {
        return "[" + pass + "] " + nodeId + "<" + nodeType + ">: " + message;
    }
}
