package com.xelogen.graph.combine;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;

final class StringLiteralCombinator implements Combinator<StringLiteral> {

    @Override
    public Node combine(OutputPort source, StringLiteral operand) {
        OutputPort literal = Accumulators.literal(source.getNode().graph(), Accumulators.STRING_INPUT, operand.value());
        return Accumulators.accumulate(Datatype.STRING, source, literal);
    }
}
