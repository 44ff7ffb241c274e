package com.xelogen.graph.combine;

import com.xelogen.graph.Datatype;

/** A raw integer; materialized as an IntInput node when it needs a holder. */
public record IntegerLiteral(int value) implements Operand {

    @Override
    public Datatype datatype() {
        return Datatype.INT;
    }
}
