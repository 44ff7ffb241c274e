/**
 * Post-build lint: independent advisory passes over a finished graph.
 * <ul>
 *   <li>{@link com.xelogen.lint.LintEngine} – session-local pass registry; {@code run(graph)} returns the warning count</li>
 *   <li>{@link com.xelogen.lint.LintPass} / {@link com.xelogen.lint.LintWarning} / {@link com.xelogen.lint.LintReport} – pass contract and results</li>
 *   <li>{@link com.xelogen.lint.DefaultLintPasses} – built-in passes from {@code com.xelogen.lint.passes}</li>
 * </ul>
 */
package com.xelogen.lint;
