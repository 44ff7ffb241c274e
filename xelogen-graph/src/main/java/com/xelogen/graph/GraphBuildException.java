package com.xelogen.graph;

import java.util.Objects;

/**
 * Thrown when a graph construction operation violates a wiring, typing or nesting rule.
 * {@link #getCode()} tells which rule failed.
 */
public final class GraphBuildException extends RuntimeException {

    private final ErrorCode code;

    public GraphBuildException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return "GraphBuildException[" + code + "]: " + getMessage();
    }
}
