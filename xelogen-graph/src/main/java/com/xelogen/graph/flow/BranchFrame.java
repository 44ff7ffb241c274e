package com.xelogen.graph.flow;

import com.xelogen.graph.Node;

/** Nesting-stack entry for one If node and the progress of its Else. */
final class BranchFrame {

    enum State {
        /** True branch in progress. */
        OPEN,
        ELSE_PENDING,
        ELSE_OPEN,
        ELSE_CLOSED
    }

    private final Node ifNode;
    private State state = State.OPEN;

    BranchFrame(Node ifNode) {
        this.ifNode = ifNode;
    }

    Node ifNode() {
        return ifNode;
    }

    State state() {
        return state;
    }

    void state(State state) {
        this.state = state;
    }
}
