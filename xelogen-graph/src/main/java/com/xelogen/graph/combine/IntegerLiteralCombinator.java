package com.xelogen.graph.combine;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.Graph;
import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;

final class IntegerLiteralCombinator implements Combinator<IntegerLiteral> {

    @Override
    public Node combine(OutputPort source, IntegerLiteral operand) {
        Graph graph = source.getNode().graph();
        if (operand.value() == 1) {
            Node plusOne = graph.addNode(Accumulators.PLUS_ONE_INT);
            plusOne.input(Accumulators.PLUS_ONE_INPUT).connect(source);
            return plusOne;
        }
        OutputPort literal = Accumulators.literal(graph, Accumulators.INT_INPUT, operand.value());
        return Accumulators.accumulate(Datatype.INT, source, literal);
    }
}
