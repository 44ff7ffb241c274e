package com.xelogen.catalog;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xelogen.config.XelogenConfig;
import com.xelogen.graph.NodeSpec;
import com.xelogen.graph.NodeSpecRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Node schema registry read from JSON. The bundled catalog lives at {@value #BUNDLED_RESOURCE};
 * {@link #load(XelogenConfig)} reads XELOGEN_CATALOG_FILE instead when it is set.
 * <p>
 * Format: {@code {"version": "1.0", "nodes": [{"name": "If", "inputs": {..}, "outputs": {..}, "contentType": ".."}]}}.
 * Duplicate keys inside a JSON object fail parsing; a node name declared twice fails construction.
 * Immutable once built.
 */
public final class NodeCatalog implements NodeSpecRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeCatalog.class);

    public static final String BUNDLED_RESOURCE = "/xelogen/node-catalog.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    private final String version;
    private final NodeSpecRegistry specs;

    private NodeCatalog(String version, Collection<NodeSpec> specs) {
        this.version = version;
        this.specs = NodeSpecRegistry.of(specs);
    }

    /** In-memory catalog over the given specs (no version). */
    public static NodeCatalog of(NodeSpec... specs) {
        return new NodeCatalog(null, List.of(specs));
    }

    /**
     * Parses a catalog document.
     *
     * @throws UncheckedIOException     on malformed JSON, duplicate keys or unknown datatype names
     * @throws IllegalArgumentException if a node name is declared twice
     */
    public static NodeCatalog fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return fromDocument(MAPPER.readValue(json, CatalogDocument.class));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Catalog bundled on the classpath. */
    public static NodeCatalog loadBundled() {
        try (InputStream in = NodeCatalog.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled node catalog not found on classpath: " + BUNDLED_RESOURCE);
            }
            NodeCatalog catalog = fromDocument(MAPPER.readValue(in, CatalogDocument.class));
            logLoaded(BUNDLED_RESOURCE, catalog);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static NodeCatalog load(Path file) {
        Objects.requireNonNull(file, "file");
        try {
            NodeCatalog catalog = fromDocument(MAPPER.readValue(Files.readString(file), CatalogDocument.class));
            logLoaded(file.toString(), catalog);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** The file named by {@link XelogenConfig#getCatalogFile()}, or the bundled catalog when unset. */
    public static NodeCatalog load(XelogenConfig config) {
        Objects.requireNonNull(config, "config");
        String file = config.getCatalogFile();
        return file != null ? load(Path.of(file)) : loadBundled();
    }

    private static NodeCatalog fromDocument(CatalogDocument document) {
        List<NodeSpec> specs = new ArrayList<>(document.getNodes().size());
        for (NodeSpecEntry entry : document.getNodes()) {
            specs.add(Objects.requireNonNull(entry, "catalog node entry").toNodeSpec());
        }
        return new NodeCatalog(document.getVersion(), specs);
    }

    private static void logLoaded(String source, NodeCatalog catalog) {
        if (log.isInfoEnabled()) {
            log.info("Node catalog loaded | source={} | version={} | nodes={}",
                    source, catalog.getVersion(), catalog.names().size());
        }
    }

    /** Catalog version from the document, or null for in-memory catalogs. */
    public String getVersion() {
        return version;
    }

    @Override
    public NodeSpec specOf(String name) {
        return specs.specOf(name);
    }

    @Override
    public boolean contains(String name) {
        return specs.contains(name);
    }

    @Override
    public Set<String> names() {
        return specs.names();
    }
}
