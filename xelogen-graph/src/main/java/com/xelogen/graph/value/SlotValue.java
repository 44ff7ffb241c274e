package com.xelogen.graph.value;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.Graph;
import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;

/** A slot in the host scene tree. */
public final class SlotValue extends Value {

    static final String NUM_CHILDREN = "NumChildren";

    public SlotValue(OutputPort output) {
        super(output, Datatype.SLOT);
    }

    /** The graph's root slot. */
    public static SlotValue root(Graph graph) {
        return new SlotValue(graph.root().onlyOutput());
    }

    /** Number of children of this slot (a new NumChildren node). */
    public IntValue numChildren() {
        Node node = graph().addNode(NUM_CHILDREN);
        node.input("slot").connect(output());
        return new IntValue(node.onlyOutput());
    }
}
