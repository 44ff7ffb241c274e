package com.xelogen.graph.combine;

import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;

/**
 * Builds the node implementing {@code source + operand} for one operand variant. Called only after the
 * registry has checked that the operand's datatype equals the source's.
 *
 * @param <O> operand variant handled
 */
@FunctionalInterface
public interface Combinator<O extends Operand> {

    /**
     * @return the new, already wired combinator node
     * @throws com.xelogen.graph.GraphBuildException {@link com.xelogen.graph.ErrorCode#UNSUPPORTED_COMBINATION}
     *         when no rule exists for the source datatype
     */
    Node combine(OutputPort source, O operand);
}
