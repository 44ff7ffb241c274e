package com.xelogen.graph;

import com.xelogen.graph.combine.Operand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A vertex of a {@link Graph}: an instance of a {@link NodeSpec} with bound inputs and optional literal
 * content. Created only by {@link Graph#addNode(String)}; its id is its insertion index and never changes.
 * Inputs and content change only through the validated operations below.
 */
public final class Node {

    /** Name of the single output of value nodes. */
    public static final String ONLY_OUTPUT = "*";

    private final Graph graph;
    private final NodeSpec spec;
    private final int id;
    private final Map<String, List<OutputPort>> inputs = new LinkedHashMap<>();
    private Object content;

    Node(Graph graph, NodeSpec spec, int id) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.spec = Objects.requireNonNull(spec, "spec");
        this.id = id;
        for (String inputName : spec.getInputs().keySet()) {
            inputs.put(inputName, new ArrayList<>());
        }
    }

    public int getId() {
        return id;
    }

    public NodeSpec getSpec() {
        return spec;
    }

    public String getTypeName() {
        return spec.getName();
    }

    /** Graph that owns this node. */
    public Graph graph() {
        return graph;
    }

    /**
     * Resolves a port by name: outputs first, then inputs.
     *
     * @throws GraphBuildException {@link ErrorCode#UNKNOWN_PORT} if neither declares {@code name}
     */
    public Port port(String name) {
        if (spec.getOutputs().containsKey(name)) return new OutputPort(this, name);
        if (spec.getInputs().containsKey(name)) return new InputPort(this, name);
        throw new GraphBuildException(ErrorCode.UNKNOWN_PORT,
                "Port " + name + " is not in node " + spec.getName() + ".");
    }

    public OutputPort output(String name) {
        if (!spec.getOutputs().containsKey(name)) {
            throw new GraphBuildException(ErrorCode.UNKNOWN_PORT,
                    "Output " + name + " is not in node " + spec.getName() + ".");
        }
        return new OutputPort(this, name);
    }

    public InputPort input(String name) {
        if (!spec.getInputs().containsKey(name)) {
            throw new GraphBuildException(ErrorCode.UNKNOWN_PORT,
                    "Input " + name + " is not in node " + spec.getName() + ".");
        }
        return new InputPort(this, name);
    }

    /** The output named {@value #ONLY_OUTPUT}. */
    public OutputPort onlyOutput() {
        return output(ONLY_OUTPUT);
    }

    /** Outputs bound to the given input, in bind order. Unmodifiable. */
    public List<OutputPort> bound(String inputName) {
        List<OutputPort> bound = inputs.get(inputName);
        if (bound == null) {
            throw new GraphBuildException(ErrorCode.UNKNOWN_PORT,
                    "Input " + inputName + " is not in node " + spec.getName() + ".");
        }
        return Collections.unmodifiableList(bound);
    }

    /** Every input with its bound outputs, in declaration order. Unmodifiable view. */
    public Map<String, List<OutputPort>> getInputs() {
        Map<String, List<OutputPort>> view = new LinkedHashMap<>();
        for (Map.Entry<String, List<OutputPort>> e : inputs.entrySet()) {
            view.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
        }
        return Collections.unmodifiableMap(view);
    }

    void bind(String inputName, OutputPort output) {
        Objects.requireNonNull(output, "output");
        List<OutputPort> bound = inputs.get(inputName);
        if (bound == null) {
            throw new GraphBuildException(ErrorCode.UNKNOWN_PORT,
                    "Input " + inputName + " is not in node " + spec.getName() + ".");
        }
        if (output.getNode().graph() != graph) {
            throw new IllegalArgumentException("Output " + output + " belongs to a different graph than node " + id);
        }
        Datatype declared = spec.getInputs().get(inputName);
        if (!declared.isList() && !bound.isEmpty()) {
            throw new GraphBuildException(ErrorCode.DUPLICATE_BINDING,
                    "Cannot add another " + output.datatype() + " to input " + inputName
                            + " of node " + spec.getName() + ".");
        }
        Datatype expected = declared.bindingType();
        if (output.datatype() != expected) {
            throw new GraphBuildException(ErrorCode.TYPE_MISMATCH,
                    "Connecting an output of type " + output.datatype() + " to the " + inputName
                            + " input of node " + spec.getName() + " of type " + expected + " is not possible.");
        }
        bound.add(output);
    }

    public boolean hasContentSlot() {
        return spec.hasContent();
    }

    /** Literal content, or null if never set. */
    public Object getContent() {
        if (!spec.hasContent()) {
            throw new GraphBuildException(ErrorCode.NO_CONTENT_SLOT,
                    "Node " + spec.getName() + " does not have content.");
        }
        return content;
    }

    /**
     * @throws GraphBuildException {@link ErrorCode#NO_CONTENT_SLOT} if the node type has no content,
     *                             {@link ErrorCode#CONTENT_TYPE_MISMATCH} if {@code value} is not a literal of that type
     */
    public void setContent(Object value) {
        Datatype contentType = spec.getContentType();
        if (contentType == null) {
            throw new GraphBuildException(ErrorCode.NO_CONTENT_SLOT,
                    "Node " + spec.getName() + " does not have content to set.");
        }
        if (!contentType.acceptsContent(value)) {
            throw new GraphBuildException(ErrorCode.CONTENT_TYPE_MISMATCH,
                    "Node " + spec.getName() + " can only take content of type " + contentType + ", and "
                            + (value == null ? "null" : value.getClass().getSimpleName()) + " is not compatible");
        }
        this.content = value;
    }

    /**
     * Name of the first input of kind {@link Datatype#IMPULSE_LIST}.
     *
     * @throws GraphBuildException {@link ErrorCode#MISSING_IMPULSE_INPUT} if there is none
     */
    public String firstInputImpulse() {
        for (Map.Entry<String, Datatype> e : spec.getInputs().entrySet()) {
            if (e.getValue() == Datatype.IMPULSE_LIST) return e.getKey();
        }
        throw new GraphBuildException(ErrorCode.MISSING_IMPULSE_INPUT,
                "Node " + spec.getName() + " has no input impulses.");
    }

    /**
     * @throws GraphBuildException {@link ErrorCode#MISSING_IMPULSE_OUTPUT} if there is no impulse output
     */
    public OutputPort firstOutputImpulse() {
        for (Map.Entry<String, Datatype> e : spec.getOutputs().entrySet()) {
            if (e.getValue() == Datatype.IMPULSE) return new OutputPort(this, e.getKey());
        }
        throw new GraphBuildException(ErrorCode.MISSING_IMPULSE_OUTPUT,
                "Node " + spec.getName() + " has no output impulses.");
    }

    /**
     * First output in declaration order whose type is {@code datatype}, or its element type when
     * {@code datatype} is a list kind.
     *
     * @throws GraphBuildException {@link ErrorCode#NO_MATCHING_OUTPUT} if there is none
     */
    public OutputPort firstOutputOfType(Datatype datatype) {
        Datatype wanted = Objects.requireNonNull(datatype, "datatype").bindingType();
        for (Map.Entry<String, Datatype> e : spec.getOutputs().entrySet()) {
            if (e.getValue() == wanted) return new OutputPort(this, e.getKey());
        }
        throw new GraphBuildException(ErrorCode.NO_MATCHING_OUTPUT,
                "Node " + spec.getName() + " has no output of type " + wanted + ".");
    }

    /** Combines this node's {@value #ONLY_OUTPUT} output with {@code operand}. */
    public Node combine(Operand operand) {
        return onlyOutput().combine(operand);
    }

    @Override
    public String toString() {
        return id + "<" + spec.getName() + ">";
    }
}
