package com.xelogen.graph.combine;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.OutputPort;

import java.util.Objects;

/** An existing output of another node in the same graph. */
public record OutputOperand(OutputPort output) implements Operand {

    public OutputOperand {
        Objects.requireNonNull(output, "output");
    }

    @Override
    public Datatype datatype() {
        return output.datatype();
    }
}
