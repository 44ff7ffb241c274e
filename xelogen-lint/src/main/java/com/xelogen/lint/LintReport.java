package com.xelogen.lint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one lint run: warnings grouped by pass in registration order, plus the passes that threw.
 */
public final class LintReport {

    private final Map<String, List<LintWarning>> byPass;
    private final List<String> failedPasses;

    LintReport(Map<String, List<LintWarning>> byPass, List<String> failedPasses) {
        Map<String, List<LintWarning>> copy = new LinkedHashMap<>();
        byPass.forEach((name, warnings) -> copy.put(name, List.copyOf(warnings)));
        this.byPass = Collections.unmodifiableMap(copy);
        this.failedPasses = List.copyOf(failedPasses);
    }

    /** Total number of warnings over all passes. */
    public int count() {
        int total = 0;
        for (List<LintWarning> warnings : byPass.values()) {
            total += warnings.size();
        }
        return total;
    }

    public boolean isClean() {
        return count() == 0;
    }

    /** Every warning, pass by pass. */
    public List<LintWarning> warnings() {
        List<LintWarning> all = new ArrayList<>();
        byPass.values().forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    /** Warnings of one pass; empty if the pass did not run or found nothing. */
    public List<LintWarning> forPass(String passName) {
        return byPass.getOrDefault(passName, List.of());
    }

    /** Pass name to warnings, for every pass that ran. */
    public Map<String, List<LintWarning>> byPass() {
        return byPass;
    }

    /** Passes that threw; they count as zero warnings. */
    public List<String> getFailedPasses() {
        return failedPasses;
    }

    @Override
    public String toString() {
        return "LintReport{warnings=" + count() + ", passes=" + byPass.keySet() + ", failed=" + failedPasses + "}";
    }
}
