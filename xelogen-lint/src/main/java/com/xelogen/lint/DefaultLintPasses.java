package com.xelogen.lint;

import com.xelogen.config.XelogenConfig;
import com.xelogen.lint.passes.DynVarNamingPass;
import com.xelogen.lint.passes.UnconnectedInputPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Registers the built-in lint passes in one place, skipping those named in XELOGEN_LINT_DISABLED.
 */
public final class DefaultLintPasses {

    private static final Logger log = LoggerFactory.getLogger(DefaultLintPasses.class);

    private DefaultLintPasses() {
    }

    /**
     * @param engine engine to register with
     * @param config supplies the disabled pass names
     */
    public static void register(LintEngine engine, XelogenConfig config) {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(config, "config");

        if (config.isLintPassDisabled(DynVarNamingPass.NAME)) {
            log.info("Lint pass disabled | pass={}", DynVarNamingPass.NAME);
        } else {
            engine.register(new DynVarNamingPass());
            log.debug("Registered dynvar-naming pass (WriteDynVar.*, literal names need a space/name path)");
        }

        if (config.isLintPassDisabled(UnconnectedInputPass.NAME)) {
            log.info("Lint pass disabled | pass={}", UnconnectedInputPass.NAME);
        } else {
            engine.register(new UnconnectedInputPass());
            log.debug("Registered unconnected-input pass (all nodes, unbound scalar inputs)");
        }
    }

    /** New engine with the built-in passes, verbosity taken from {@code config}. */
    public static LintEngine newEngine(XelogenConfig config) {
        LintEngine engine = new LintEngine(config.isLintVerbose());
        register(engine, config);
        return engine;
    }
}
