/**
 * Xelogen annotations: metadata read at registration time.
 * <ul>
 *   <li>{@link com.xelogen.annotations.LintRule} – lint pass (name, applicableNodeTypes)</li>
 * </ul>
 */
package com.xelogen.annotations;
