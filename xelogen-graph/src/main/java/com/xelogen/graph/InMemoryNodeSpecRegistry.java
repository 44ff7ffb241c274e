package com.xelogen.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Registry backed by an insertion-ordered map. Immutable after construction. */
final class InMemoryNodeSpecRegistry implements NodeSpecRegistry {

    private final Map<String, NodeSpec> byName;

    InMemoryNodeSpecRegistry(Collection<NodeSpec> specs) {
        Objects.requireNonNull(specs, "specs");
        Map<String, NodeSpec> map = new LinkedHashMap<>();
        for (NodeSpec spec : specs) {
            Objects.requireNonNull(spec, "spec");
            if (map.putIfAbsent(spec.getName(), spec) != null) {
                throw new IllegalArgumentException("Node spec already registered: " + spec.getName());
            }
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    @Override
    public NodeSpec specOf(String name) {
        NodeSpec spec = name != null ? byName.get(name) : null;
        if (spec == null) {
            throw new GraphBuildException(ErrorCode.UNKNOWN_NODE_TYPE, "Unknown node type: " + name);
        }
        return spec;
    }

    @Override
    public boolean contains(String name) {
        return name != null && byName.containsKey(name);
    }

    @Override
    public Set<String> names() {
        return byName.keySet();
    }
}
