package com.xelogen.graph.combine;

import com.xelogen.graph.ErrorCode;
import com.xelogen.graph.GraphBuildException;
import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps each {@link Operand} variant to its {@link Combinator}. Dispatch uses the operand's runtime
 * variant, never the type of the source node.
 * <ul>
 *   <li>{@link IntegerLiteral} on an INT output: 1 gives PlusOne&lt;Int&gt;, anything else an IntInput
 *       holder accumulated with the source in Plus&lt;Int&gt;</li>
 *   <li>{@link StringLiteral} on a STRING output: StringInput holder concatenated in Plus&lt;String&gt;</li>
 *   <li>{@link OutputOperand}: Plus&lt;Int&gt; for INT, Plus&lt;String&gt; for STRING</li>
 * </ul>
 * Accumulator inputs receive the source first, then the operand.
 */
public final class CombinatorRegistry {

    private final Map<Class<? extends Operand>, Combinator<?>> byVariant = new HashMap<>();

    /** Registry with the built-in rules. */
    public static CombinatorRegistry defaults() {
        CombinatorRegistry registry = new CombinatorRegistry();
        registry.register(IntegerLiteral.class, new IntegerLiteralCombinator());
        registry.register(StringLiteral.class, new StringLiteralCombinator());
        registry.register(OutputOperand.class, new OutputOperandCombinator());
        return registry;
    }

    /** Registers or replaces the combinator for one operand variant. */
    public <O extends Operand> CombinatorRegistry register(Class<O> variant, Combinator<O> combinator) {
        byVariant.put(Objects.requireNonNull(variant, "variant"), Objects.requireNonNull(combinator, "combinator"));
        return this;
    }

    public boolean supports(Class<? extends Operand> variant) {
        return byVariant.containsKey(variant);
    }

    /**
     * @throws GraphBuildException {@link ErrorCode#TYPE_MISMATCH} if the operand's datatype differs from the
     *                             source's; {@link ErrorCode#UNSUPPORTED_COMBINATION} if no rule applies
     */
    public Node combine(OutputPort source, Operand operand) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(operand, "operand");
        if (operand.datatype() != source.datatype()) {
            throw new GraphBuildException(ErrorCode.TYPE_MISMATCH,
                    "Cannot combine " + source + " of type " + source.datatype()
                            + " with an operand of type " + operand.datatype() + ".");
        }
        Combinator<?> combinator = byVariant.get(operand.getClass());
        if (combinator == null) {
            throw new GraphBuildException(ErrorCode.UNSUPPORTED_COMBINATION,
                    "No combinator for operand kind " + operand.getClass().getSimpleName() + ".");
        }
        return apply(combinator, source, operand);
    }

    @SuppressWarnings("unchecked")
    private static <O extends Operand> Node apply(Combinator<O> combinator, OutputPort source, Operand operand) {
        return combinator.combine(source, (O) operand);
    }
}
