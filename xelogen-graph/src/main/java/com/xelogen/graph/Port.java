package com.xelogen.graph;

import java.util.Objects;

/**
 * Transient handle on a named input or output of a node. Ports are not stored; two handles on the
 * same node and name are equal.
 */
public abstract class Port {

    private final Node node;
    private final String name;

    Port(Node node, String name) {
        this.node = Objects.requireNonNull(node, "node");
        this.name = Objects.requireNonNull(name, "name");
    }

    public Node getNode() {
        return node;
    }

    public String getName() {
        return name;
    }

    /** Datatype carried by this port. For list inputs this is the element type. */
    public abstract Datatype datatype();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Port that = (Port) o;
        return node == that.node && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(node), name);
    }

    @Override
    public String toString() {
        return node.getId() + "<" + node.getTypeName() + ">:" + name;
    }
}
