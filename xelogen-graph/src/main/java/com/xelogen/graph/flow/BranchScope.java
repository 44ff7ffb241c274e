package com.xelogen.graph.flow;

import com.xelogen.graph.Node;

/**
 * An open If or Else branch. Nodes appended to {@link #chain()} run when the branch is taken.
 * Closing pops the scope from its graph's nesting stack; use try-with-resources so scopes close
 * innermost first.
 */
public final class BranchScope implements AutoCloseable {

    private final BranchStack stack;
    private final BranchFrame frame;
    private final boolean isElse;
    private final ImpulseChain chain;
    private final BranchStack.Level level;
    private boolean closed;

    BranchScope(BranchStack stack, BranchFrame frame, boolean isElse, ImpulseChain chain, BranchStack.Level level) {
        this.stack = stack;
        this.frame = frame;
        this.isElse = isElse;
        this.chain = chain;
        this.level = level;
    }

    public ImpulseChain chain() {
        return chain;
    }

    /** Shorthand for {@code chain().append(node)}. */
    public BranchScope append(Node node) {
        chain.append(node);
        return this;
    }

    public Node ifNode() {
        return frame.ifNode();
    }

    public boolean isElse() {
        return isElse;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        stack.exit(this);
        closed = true;
    }

    BranchFrame frame() {
        return frame;
    }

    BranchStack.Level level() {
        return level;
    }
}
