package com.xelogen.graph.combine;

import com.xelogen.graph.Datatype;

import java.util.Objects;

/** A raw string; materialized as a StringInput node. */
public record StringLiteral(String value) implements Operand {

    public StringLiteral {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Datatype datatype() {
        return Datatype.STRING;
    }
}
