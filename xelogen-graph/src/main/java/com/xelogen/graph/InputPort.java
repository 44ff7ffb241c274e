package com.xelogen.graph;

import java.util.List;

/**
 * Input of a node. {@link #datatype()} is the type an output must have to be bound here (the element
 * type for list inputs); {@link #declaredType()} is the type from the schema.
 */
public final class InputPort extends Port {

    InputPort(Node node, String name) {
        super(node, name);
    }

    @Override
    public Datatype datatype() {
        return declaredType().bindingType();
    }

    public Datatype declaredType() {
        return getNode().getSpec().getInputs().get(getName());
    }

    public boolean isList() {
        return declaredType().isList();
    }

    /**
     * Binds {@code output} to this input. A scalar input takes at most one output; a list input
     * appends.
     *
     * @throws GraphBuildException {@link ErrorCode#DUPLICATE_BINDING} if this scalar input is already bound,
     *                             {@link ErrorCode#TYPE_MISMATCH} if the output's type differs from {@link #datatype()}
     */
    public InputPort connect(OutputPort output) {
        getNode().bind(getName(), output);
        return this;
    }

    /**
     * Appends {@code output} to this list input.
     *
     * @throws GraphBuildException {@link ErrorCode#NOT_A_LIST} if this input is scalar
     */
    public InputPort append(OutputPort output) {
        if (!isList()) {
            throw new GraphBuildException(ErrorCode.NOT_A_LIST,
                    "Cannot append to non-list input " + getName() + " of node " + getNode().getTypeName() + ".");
        }
        return connect(output);
    }

    /**
     * Binds the first output of {@code source} (declaration order) whose type matches {@link #datatype()}.
     *
     * @throws GraphBuildException {@link ErrorCode#NO_MATCHING_OUTPUT} if {@code source} has none
     */
    public InputPort bindToFirstMatchingOutput(Node source) {
        return connect(source.firstOutputOfType(datatype()));
    }

    /** Outputs bound to this input, in bind order. */
    public List<OutputPort> bound() {
        return getNode().bound(getName());
    }
}
