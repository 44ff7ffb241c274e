package com.xelogen.graph.value;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.Graph;
import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;
import com.xelogen.graph.combine.Operand;

public final class StringValue extends Value {

    static final String STRING_INPUT = "StringInput";

    public StringValue(OutputPort output) {
        super(output, Datatype.STRING);
    }

    /** New StringInput node holding {@code text}. */
    public static StringValue literal(Graph graph, String text) {
        Node node = graph.addNode(STRING_INPUT);
        node.setContent(text);
        return new StringValue(node.onlyOutput());
    }

    public StringValue concat(String suffix) {
        return new StringValue(output().combine(Operand.of(suffix)).onlyOutput());
    }

    public StringValue concat(StringValue other) {
        return new StringValue(output().combine(Operand.of(other.output())).onlyOutput());
    }
}
