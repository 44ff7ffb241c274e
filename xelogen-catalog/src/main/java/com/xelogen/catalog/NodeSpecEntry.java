package com.xelogen.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.xelogen.graph.Datatype;
import com.xelogen.graph.NodeSpec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the catalog's {@code nodes} array. Type names are parsed with {@link Datatype#fromValue(String)};
 * port maps keep the order in which the JSON declares them.
 */
public final class NodeSpecEntry {

    private final NodeSpec spec;

    @JsonCreator
    public NodeSpecEntry(
            @JsonProperty("name") String name,
            @JsonProperty("inputs") Map<String, String> inputs,
            @JsonProperty("outputs") Map<String, String> outputs,
            @JsonProperty("contentType") String contentType) {
        this.spec = new NodeSpec(name, toDatatypes(inputs), toDatatypes(outputs),
                contentType != null ? Datatype.fromValue(contentType) : null);
    }

    private static Map<String, Datatype> toDatatypes(Map<String, String> ports) {
        Map<String, Datatype> out = new LinkedHashMap<>();
        if (ports == null) return out;
        for (Map.Entry<String, String> e : ports.entrySet()) {
            out.put(e.getKey(), Datatype.fromValue(e.getValue()));
        }
        return out;
    }

    public NodeSpec toNodeSpec() {
        return spec;
    }
}
