package com.xelogen.graph.combine;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.ErrorCode;
import com.xelogen.graph.Graph;
import com.xelogen.graph.GraphBuildException;
import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;

/** Node type names and wiring shared by the built-in combinators. */
final class Accumulators {

    static final String PLUS_ONE_INT = "PlusOne<Int>";
    static final String PLUS_INT = "Plus<Int>";
    static final String PLUS_STRING = "Plus<String>";
    static final String INT_INPUT = "IntInput";
    static final String STRING_INPUT = "StringInput";
    static final String PLUS_ONE_INPUT = "value";
    static final String ACCUMULATOR_INPUT = "values";

    private Accumulators() {
    }

    /** Plus node for the datatype, with {@code first} then {@code second} appended to its values. */
    static Node accumulate(Datatype datatype, OutputPort first, OutputPort second) {
        Graph graph = first.getNode().graph();
        Node plus = graph.addNode(accumulatorFor(datatype));
        plus.input(ACCUMULATOR_INPUT).append(first);
        plus.input(ACCUMULATOR_INPUT).append(second);
        return plus;
    }

    static String accumulatorFor(Datatype datatype) {
        return switch (datatype) {
            case INT -> PLUS_INT;
            case STRING -> PLUS_STRING;
            default -> throw unsupported(datatype);
        };
    }

    /** New literal holder node of the given type holding {@code value}. */
    static OutputPort literal(Graph graph, String holderType, Object value) {
        Node holder = graph.addNode(holderType);
        holder.setContent(value);
        return holder.onlyOutput();
    }

    static GraphBuildException unsupported(Datatype datatype) {
        return new GraphBuildException(ErrorCode.UNSUPPORTED_COMBINATION,
                "Don't know how to combine two " + datatype + " values.");
    }
}
