package com.xelogen.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a lint pass that can be registered with a lint engine. The engine reads the name and
 * the node type patterns from this annotation when the pass is registered without explicit metadata.
 * <p>
 * {@link #applicableNodeTypes()} supports exact match ("If"), prefix ("WriteDynVar.*") and "*" for all nodes.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface LintRule {

    /** Unique pass identifier (used in warnings, in the engine and in XELOGEN_LINT_DISABLED). */
    String name();

    /** Node type patterns the pass inspects. Empty = all. */
    String[] applicableNodeTypes() default { };
}
