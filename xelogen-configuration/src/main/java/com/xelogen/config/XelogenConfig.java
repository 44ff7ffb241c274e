package com.xelogen.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Settings loaded from environment variables.
 * <p>
 * Catalog: XELOGEN_CATALOG_FILE (path to a node catalog JSON file; unset uses the bundled catalog).
 * Lint: XELOGEN_LINT_DISABLED (comma-separated pass names to skip), XELOGEN_LINT_VERBOSE.
 */
public final class XelogenConfig {

    private static final String ENV_CATALOG_FILE = "XELOGEN_CATALOG_FILE";
    private static final String ENV_LINT_DISABLED = "XELOGEN_LINT_DISABLED";
    private static final String ENV_LINT_VERBOSE = "XELOGEN_LINT_VERBOSE";

    private static final boolean DEFAULT_LINT_VERBOSE = false;

    private final String catalogFile;
    private final List<String> disabledLintPasses;
    private final boolean lintVerbose;

    private XelogenConfig(Builder b) {
        this.catalogFile = b.catalogFile;
        this.disabledLintPasses = Collections.unmodifiableList(new ArrayList<>(b.disabledLintPasses));
        this.lintVerbose = b.lintVerbose;
    }

    /** Path of the catalog JSON file, or null to use the catalog bundled on the classpath. */
    public String getCatalogFile() {
        return catalogFile;
    }

    /** Lint pass names that must not be registered. Unmodifiable. */
    public List<String> getDisabledLintPasses() {
        return disabledLintPasses;
    }

    public boolean isLintPassDisabled(String passName) {
        return passName != null && disabledLintPasses.contains(passName);
    }

    /** When true, lint logs a per-pass summary at INFO. Default false. */
    public boolean isLintVerbose() {
        return lintVerbose;
    }

    public static XelogenConfig fromEnvironment() {
        return fromVariables(System::getenv);
    }

    /** Same as {@link #fromEnvironment()} over an explicit variable map. */
    public static XelogenConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return fromVariables(env::get);
    }

    private static XelogenConfig fromVariables(Function<String, String> env) {
        return builder()
                .catalogFile(getEnv(env, ENV_CATALOG_FILE, null))
                .disabledLintPasses(parseCommaSeparated(env.apply(ENV_LINT_DISABLED)))
                .lintVerbose(parseBoolean(env.apply(ENV_LINT_VERBOSE), DEFAULT_LINT_VERBOSE))
                .build();
    }

    /** Bundled catalog, all lint passes, quiet lint. */
    public static XelogenConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "XelogenConfig{catalogFile=" + catalogFile + ", disabledLintPasses=" + disabledLintPasses
                + ", lintVerbose=" + lintVerbose + "}";
    }

    public static final class Builder {
        private String catalogFile;
        private List<String> disabledLintPasses = List.of();
        private boolean lintVerbose = DEFAULT_LINT_VERBOSE;

        public Builder catalogFile(String catalogFile) {
            this.catalogFile = catalogFile != null && !catalogFile.isBlank() ? catalogFile : null;
            return this;
        }

        public Builder disabledLintPasses(List<String> disabledLintPasses) {
            this.disabledLintPasses = Objects.requireNonNull(disabledLintPasses, "disabledLintPasses");
            return this;
        }

        public Builder lintVerbose(boolean lintVerbose) {
            this.lintVerbose = lintVerbose;
            return this;
        }

        public XelogenConfig build() {
            return new XelogenConfig(this);
        }
    }
}
