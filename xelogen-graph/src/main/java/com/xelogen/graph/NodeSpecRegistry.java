package com.xelogen.graph;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Read-only lookup of node schemas by type name. A {@link Graph} consults it once per node it creates.
 */
public interface NodeSpecRegistry {

    /**
     * @throws GraphBuildException with {@link ErrorCode#UNKNOWN_NODE_TYPE} if no schema has that name
     */
    NodeSpec specOf(String name);

    boolean contains(String name);

    /** All registered type names. */
    Set<String> names();

    /** In-memory registry over the given specs; duplicate names are rejected. */
    static NodeSpecRegistry of(Collection<NodeSpec> specs) {
        return new InMemoryNodeSpecRegistry(specs);
    }

    static NodeSpecRegistry of(NodeSpec... specs) {
        return new InMemoryNodeSpecRegistry(List.of(specs));
    }
}
