package com.xelogen.lint;

import com.xelogen.annotations.LintRule;
import com.xelogen.graph.Graph;
import com.xelogen.graph.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Session-local collection of lint passes. Register classes annotated with {@link LintRule} or pass the
 * metadata explicitly; {@link #run(Graph)} invokes every pass in registration order over the nodes it
 * applies to and sums the warnings.
 * <p>
 * Lint never fails the caller: a pass that throws is logged and counted as zero warnings.
 */
public final class LintEngine {

    private static final Logger log = LoggerFactory.getLogger(LintEngine.class);

    private final Map<String, PassEntry> byName = new LinkedHashMap<>();
    private final boolean verbose;

    public LintEngine() {
        this(false);
    }

    /**
     * @param verbose when true, each pass logs a summary line at INFO
     */
    public LintEngine(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * Registers a pass whose class is annotated with {@link LintRule}; stored by {@link LintRule#name()}.
     *
     * @throws IllegalArgumentException if the class is not annotated, the name is blank or already registered
     */
    public LintEngine register(LintPass pass) {
        Objects.requireNonNull(pass, "pass");
        Class<?> clazz = pass.getClass();
        LintRule ann = clazz.getAnnotation(LintRule.class);
        if (ann == null) {
            throw new IllegalArgumentException("Lint pass must be annotated with @LintRule: " + clazz.getName());
        }
        return register(ann.name(), ann.applicableNodeTypes(), pass);
    }

    /**
     * Registers a pass with explicit metadata.
     *
     * @param applicableNodeTypes exact names, "Prefix.*" or "*"; null or empty = all nodes
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public LintEngine register(String name, String[] applicableNodeTypes, LintPass pass) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pass, "pass");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Lint pass name must be non-blank: " + pass.getClass().getName());
        }
        if (byName.putIfAbsent(name, new PassEntry(name, applicableNodeTypes, pass)) != null) {
            throw new IllegalArgumentException("Lint pass already registered: " + name);
        }
        return this;
    }

    public PassEntry get(String name) {
        return byName.get(name);
    }

    /** Registered pass names in registration order. */
    public List<String> names() {
        return List.copyOf(byName.keySet());
    }

    /** Runs every pass and returns the total warning count. */
    public int run(Graph graph) {
        return report(graph).count();
    }

    /** Runs every pass and returns the warnings grouped by pass. The graph is not modified. */
    public LintReport report(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        Map<String, List<LintWarning>> byPass = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        for (PassEntry entry : byName.values()) {
            List<Node> applicable = new ArrayList<>();
            for (Node node : graph.nodes()) {
                if (entry.appliesTo(node.getTypeName())) applicable.add(node);
            }
            List<LintWarning> warnings = new ArrayList<>();
            try {
                List<LintWarning> found = entry.getPass().check(Collections.unmodifiableList(applicable));
                if (found != null) {
                    for (LintWarning w : found) {
                        warnings.add(w.withPass(entry.getName()));
                    }
                }
            } catch (RuntimeException e) {
                log.error("Lint pass failed | pass={} | nodes={}", entry.getName(), applicable.size(), e);
                warnings.clear();
                failed.add(entry.getName());
            }
            for (LintWarning w : warnings) {
                log.warn("Lint warning | pass={} | nodeId={} | type={} | {}", w.pass(), w.nodeId(), w.nodeType(), w.message());
            }
            if (verbose && log.isInfoEnabled()) {
                log.info("Lint pass done | pass={} | nodes={} | warnings={}", entry.getName(), applicable.size(), warnings.size());
            }
            byPass.put(entry.getName(), warnings);
        }
        LintReport report = new LintReport(byPass, failed);
        if (verbose && log.isInfoEnabled()) {
            log.info("Lint done | graphSize={} | passes={} | warnings={}", graph.size(), byPass.size(), report.count());
        }
        return report;
    }

    /**
     * Registered pass: metadata plus the implementation.
     */
    public static final class PassEntry {
        private final String name;
        private final String[] applicableNodeTypes;
        private final LintPass pass;

        PassEntry(String name, String[] applicableNodeTypes, LintPass pass) {
            this.name = name;
            this.applicableNodeTypes = applicableNodeTypes != null ? applicableNodeTypes.clone() : new String[0];
            this.pass = pass;
        }

        public String getName() { return name; }
        public LintPass getPass() { return pass; }
        public String[] getApplicableNodeTypes() { return applicableNodeTypes.clone(); }

        /** Empty patterns and "*" match every type; "Prefix.*" matches by prefix; anything else exactly. */
        public boolean appliesTo(String nodeType) {
            if (applicableNodeTypes.length == 0) return true;
            String t = nodeType != null ? nodeType : "";
            for (String pattern : applicableNodeTypes) {
                if (pattern == null) continue;
                if ("*".equals(pattern.trim())) return true;
                if (pattern.endsWith(".*")) {
                    if (t.startsWith(pattern.substring(0, pattern.length() - 2))) return true;
                } else if (pattern.equals(t)) {
                    return true;
                }
            }
            return false;
        }
    }
}
