package com.xelogen.graph.combine;

import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;

final class OutputOperandCombinator implements Combinator<OutputOperand> {

    @Override
    public Node combine(OutputPort source, OutputOperand operand) {
        OutputPort other = operand.output();
        if (other.getNode().graph() != source.getNode().graph()) {
            throw new IllegalArgumentException("Cannot combine outputs of different graphs: " + source + " and " + other);
        }
        return Accumulators.accumulate(source.datatype(), source, other);
    }
}
