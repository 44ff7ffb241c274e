package com.xelogen.graph.flow;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.ErrorCode;
import com.xelogen.graph.GraphBuildException;
import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Sequential impulse wiring. The chain holds the impulse output still waiting for a consumer;
 * {@link #append(Node)} sends it into the appended node's first impulse input and moves the cursor to
 * that node's first impulse output.
 */
public final class ImpulseChain {

    private OutputPort current;
    private final List<Node> history = new ArrayList<>();

    /**
     * @throws GraphBuildException {@link ErrorCode#NOT_AN_IMPULSE} if {@code start} is not an impulse output
     */
    public ImpulseChain(OutputPort start) {
        Objects.requireNonNull(start, "start");
        if (start.datatype() != Datatype.IMPULSE) {
            throw new GraphBuildException(ErrorCode.NOT_AN_IMPULSE,
                    "Output " + start.getName() + " of node " + start.getNode().getTypeName() + " is not an impulse.");
        }
        this.current = start;
    }

    /**
     * Extends the chain with {@code node}. Both impulse ports are resolved before anything is bound,
     * so a failure leaves the chain and the node unchanged.
     *
     * @throws GraphBuildException {@link ErrorCode#MISSING_IMPULSE_INPUT} or {@link ErrorCode#MISSING_IMPULSE_OUTPUT}
     */
    public ImpulseChain append(Node node) {
        Objects.requireNonNull(node, "node");
        String inputName = node.firstInputImpulse();
        OutputPort next = node.firstOutputImpulse();
        node.input(inputName).connect(current);
        current = next;
        history.add(node);
        return this;
    }

    /** Impulse output the next appended node will be triggered by. */
    public OutputPort current() {
        return current;
    }

    /** Appended nodes, in order. */
    public List<Node> history() {
        return Collections.unmodifiableList(history);
    }
}
