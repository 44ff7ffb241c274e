package com.xelogen.graph.value;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.ErrorCode;
import com.xelogen.graph.Graph;
import com.xelogen.graph.GraphBuildException;
import com.xelogen.graph.OutputPort;

import java.util.Objects;

/**
 * Typed wrapper over an output, for building expressions without naming ports. Subclasses fix the
 * datatype and add the operations that make sense for it.
 */
public abstract class Value {

    private final OutputPort output;

    protected Value(OutputPort output, Datatype expected) {
        this.output = Objects.requireNonNull(output, "output");
        if (output.datatype() != expected) {
            throw new GraphBuildException(ErrorCode.TYPE_MISMATCH,
                    "Output " + output + " is " + output.datatype() + ", expected " + expected + ".");
        }
    }

    public OutputPort output() {
        return output;
    }

    protected Graph graph() {
        return output.getNode().graph();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + output + ")";
    }
}
