package com.xelogen.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Root of a catalog JSON document: version and node entries in declaration order. */
public final class CatalogDocument {

    private final String version;
    private final List<NodeSpecEntry> nodes;

    @JsonCreator
    public CatalogDocument(
            @JsonProperty("version") String version,
            @JsonProperty("nodes") List<NodeSpecEntry> nodes) {
        this.version = version;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
    }

    public String getVersion() {
        return version;
    }

    public List<NodeSpecEntry> getNodes() {
        return nodes;
    }
}
