package com.xelogen.graph;

import com.xelogen.graph.combine.Operand;
import com.xelogen.graph.flow.ImpulseChain;

/** Output of a node. Source side of every binding. */
public final class OutputPort extends Port {

    OutputPort(Node node, String name) {
        super(node, name);
    }

    @Override
    public Datatype datatype() {
        return getNode().getSpec().getOutputs().get(getName());
    }

    /**
     * Builds and wires a new node combining this output with {@code operand}; see
     * {@link com.xelogen.graph.combine.CombinatorRegistry} for the rules.
     *
     * @return the new combinator node
     */
    public Node combine(Operand operand) {
        return getNode().graph().combinators().combine(this, operand);
    }

    /**
     * Opens an impulse chain starting at this output.
     *
     * @throws GraphBuildException {@link ErrorCode#NOT_AN_IMPULSE} if this output is not an impulse
     */
    public ImpulseChain chain() {
        return new ImpulseChain(this);
    }
}
