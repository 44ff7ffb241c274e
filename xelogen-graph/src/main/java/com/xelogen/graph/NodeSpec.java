package com.xelogen.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable schema of a node type: named inputs and outputs with their datatypes, in declaration
 * order, plus an optional content (literal value) type. Shared by every node of that type.
 */
public final class NodeSpec {

    private final String name;
    private final Map<String, Datatype> inputs;
    private final Map<String, Datatype> outputs;
    private final Datatype contentType;

    public NodeSpec(String name, Map<String, Datatype> inputs, Map<String, Datatype> outputs, Datatype contentType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Node spec name must be non-blank");
        }
        this.name = name;
        this.inputs = copyOrdered(inputs, name, "input");
        this.outputs = copyOrdered(outputs, name, "output");
        this.contentType = contentType;
    }

    public NodeSpec(String name, Map<String, Datatype> inputs, Map<String, Datatype> outputs) {
        this(name, inputs, outputs, null);
    }

    private static Map<String, Datatype> copyOrdered(Map<String, Datatype> source, String specName, String kind) {
        if (source == null || source.isEmpty()) return Map.of();
        Map<String, Datatype> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Datatype> e : source.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw new IllegalArgumentException("Blank " + kind + " name in node spec " + specName);
            }
            copy.put(e.getKey(), Objects.requireNonNull(e.getValue(), kind + " type of " + specName + "." + e.getKey()));
        }
        return Collections.unmodifiableMap(copy);
    }

    public String getName() {
        return name;
    }

    /** Input name to declared type, in declaration order. Unmodifiable. */
    public Map<String, Datatype> getInputs() {
        return inputs;
    }

    /** Output name to type, in declaration order. Unmodifiable. */
    public Map<String, Datatype> getOutputs() {
        return outputs;
    }

    /** Content type, or null when nodes of this type hold no literal. */
    public Datatype getContentType() {
        return contentType;
    }

    public boolean hasContent() {
        return contentType != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeSpec that = (NodeSpec) o;
        return name.equals(that.name) && inputs.equals(that.inputs) && outputs.equals(that.outputs)
                && contentType == that.contentType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, inputs, outputs, contentType);
    }

    @Override
    public String toString() {
        return "NodeSpec{" + name + ", inputs=" + inputs + ", outputs=" + outputs
                + (contentType != null ? ", content=" + contentType : "") + "}";
    }
}
