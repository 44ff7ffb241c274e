package com.xelogen.graph.value;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.OutputPort;
import com.xelogen.graph.combine.Operand;

public final class IntValue extends Value {

    public IntValue(OutputPort output) {
        super(output, Datatype.INT);
    }

    public IntValue plus(int amount) {
        return new IntValue(output().combine(Operand.of(amount)).onlyOutput());
    }

    public IntValue plus(IntValue other) {
        return new IntValue(output().combine(Operand.of(other.output())).onlyOutput());
    }
}
