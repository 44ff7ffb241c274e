package com.xelogen.graph;

import java.util.Locale;

/**
 * Port datatypes.
 * <p>
 * The {@code _LIST} kinds are only used for inputs that take zero or more connections of their element
 * type. {@link #IMPULSE_LIST} is the kind of every impulse input; the other list kinds belong to
 * expandable inputs such as the values of a Plus node.
 */
public enum Datatype {
    IMPULSE,
    IMPULSE_LIST,
    FLOAT,
    INT,
    INT_LIST,
    STRING,
    STRING_LIST,
    SLOT,
    BOOL;

    public boolean isList() {
        return this == IMPULSE_LIST || this == INT_LIST || this == STRING_LIST;
    }

    /**
     * Element type of a list kind.
     *
     * @throws GraphBuildException with {@link ErrorCode#NOT_A_LIST} for scalar kinds
     */
    public Datatype elementType() {
        switch (this) {
            case IMPULSE_LIST:
                return IMPULSE;
            case INT_LIST:
                return INT;
            case STRING_LIST:
                return STRING;
            default:
                throw new GraphBuildException(ErrorCode.NOT_A_LIST, "Type " + name() + " is not a list.");
        }
    }

    /** Type an output must have to be bound to a port of this type: the element type for lists, else itself. */
    public Datatype bindingType() {
        return isList() ? elementType() : this;
    }

    /**
     * Whether {@code value} is a literal of this kind. Only INT, FLOAT, STRING and BOOL have literals;
     * null is never accepted.
     */
    public boolean acceptsContent(Object value) {
        if (value == null) return false;
        return switch (this) {
            case INT -> value instanceof Integer || value instanceof Long;
            case FLOAT -> value instanceof Double || value instanceof Float;
            case STRING -> value instanceof String;
            case BOOL -> value instanceof Boolean;
            default -> false;
        };
    }

    /** Parses a catalog type name, case-insensitively. */
    public static Datatype fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Datatype name must be non-blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Datatype t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        throw new IllegalArgumentException("Unknown datatype: " + value);
    }
}
