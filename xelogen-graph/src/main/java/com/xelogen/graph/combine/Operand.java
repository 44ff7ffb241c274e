package com.xelogen.graph.combine;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;

/**
 * Right-hand side of a combination. Each variant has its own {@link Combinator} in a
 * {@link CombinatorRegistry}; a new operand kind is a new variant plus its combinator.
 */
public sealed interface Operand permits IntegerLiteral, StringLiteral, OutputOperand {

    /** Datatype the operand contributes; must equal the source output's datatype. */
    Datatype datatype();

    static Operand of(int value) {
        return new IntegerLiteral(value);
    }

    static Operand of(String value) {
        return new StringLiteral(value);
    }

    static Operand of(OutputPort output) {
        return new OutputOperand(output);
    }

    /** The {@value Node#ONLY_OUTPUT} output of {@code node}. */
    static Operand of(Node node) {
        return new OutputOperand(node.onlyOutput());
    }
}
