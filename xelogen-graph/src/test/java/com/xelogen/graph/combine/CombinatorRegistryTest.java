package com.xelogen.graph.combine;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.ErrorCode;
import com.xelogen.graph.Graph;
import com.xelogen.graph.GraphBuildException;
import com.xelogen.graph.Node;
import com.xelogen.graph.NodeSpec;
import com.xelogen.graph.NodeSpecRegistry;
import com.xelogen.graph.OutputPort;
import com.xelogen.graph.TestSchemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CombinatorRegistryTest {

    private Graph graph;

    @BeforeEach
    void setUp() {
        graph = TestSchemas.newGraph();
    }

    @Test
    void intPlusOne_usesPlusOneNode() {
        Node count = graph.addNode("IntInput");
        int before = graph.size();

        Node result = count.combine(Operand.of(1));

        assertEquals("PlusOne<Int>", result.getTypeName());
        assertEquals(before + 1, graph.size());
        assertEquals(List.of(count.onlyOutput()), result.bound("value"));
    }

    @Test
    void intPlusOther_addsHolderAndAccumulator() {
        Node count = graph.addNode("IntInput");

        Node result = count.combine(Operand.of(5));

        assertEquals("Plus<Int>", result.getTypeName());
        List<OutputPort> values = result.bound("values");
        assertEquals(2, values.size());
        assertSame(count, values.get(0).getNode());
        Node holder = values.get(1).getNode();
        assertEquals("IntInput", holder.getTypeName());
        assertEquals(5, holder.getContent());
    }

    @Test
    void intPlusZeroAndNegative_areNotSpecialCased() {
        Node count = graph.addNode("IntInput");
        assertEquals("Plus<Int>", count.combine(Operand.of(0)).getTypeName());
        assertEquals("Plus<Int>", count.combine(Operand.of(-1)).getTypeName());
    }

    @Test
    void stringPlusLiteral_concatenatesSourceFirst() {
        Node name = graph.addNode("StringInput");
        name.setContent("World");

        Node result = name.combine(Operand.of("/Meow"));

        assertEquals("Plus<String>", result.getTypeName());
        List<OutputPort> values = result.bound("values");
        assertSame(name, values.get(0).getNode());
        assertEquals("/Meow", values.get(1).getNode().getContent());
    }

    @Test
    void outputPlusOutput_usesAccumulatorForDatatype() {
        Node a = graph.addNode("IntInput");
        Node b = graph.addNode("IntInput");
        Node sum = a.combine(Operand.of(b));
        assertEquals("Plus<Int>", sum.getTypeName());
        assertEquals(List.of(a.onlyOutput(), b.onlyOutput()), sum.bound("values"));

        Node s = graph.addNode("StringInput");
        Node t = graph.addNode("StringInput");
        Node joined = s.onlyOutput().combine(Operand.of(t.onlyOutput()));
        assertEquals("Plus<String>", joined.getTypeName());
        assertEquals(List.of(s.onlyOutput(), t.onlyOutput()), joined.bound("values"));
    }

    @Test
    void mismatchedOperand_isTypeMismatchAndAddsNothing() {
        Node count = graph.addNode("IntInput");
        Node text = graph.addNode("StringInput");
        int before = graph.size();

        assertEquals(ErrorCode.TYPE_MISMATCH,
                assertThrows(GraphBuildException.class, () -> count.combine(Operand.of("x"))).getCode());
        assertEquals(ErrorCode.TYPE_MISMATCH,
                assertThrows(GraphBuildException.class, () -> text.combine(Operand.of(3))).getCode());
        assertEquals(ErrorCode.TYPE_MISMATCH,
                assertThrows(GraphBuildException.class, () -> count.combine(Operand.of(text))).getCode());
        assertEquals(before, graph.size());
    }

    @Test
    void unsupportedDatatype_isRejected() {
        Node a = graph.addNode("BoolInput");
        Node b = graph.addNode("BoolInput");
        GraphBuildException e = assertThrows(GraphBuildException.class, () -> a.combine(Operand.of(b)));
        assertEquals(ErrorCode.UNSUPPORTED_COMBINATION, e.getCode());
    }

    @Test
    void floatOutputs_areUnsupported() {
        NodeSpecRegistry registry = NodeSpecRegistry.of(
                new NodeSpec("FloatInput", Map.of(), Map.of("*", Datatype.FLOAT), Datatype.FLOAT));
        Graph floats = new Graph(registry);
        Node a = floats.addNode("FloatInput");
        Node b = floats.addNode("FloatInput");
        GraphBuildException e = assertThrows(GraphBuildException.class, () -> a.combine(Operand.of(b)));
        assertEquals(ErrorCode.UNSUPPORTED_COMBINATION, e.getCode());
    }

    @Test
    void outputsOfDifferentGraphs_areRejected() {
        Graph other = TestSchemas.newGraph();
        Node a = graph.addNode("IntInput");
        Node b = other.addNode("IntInput");
        assertThrows(IllegalArgumentException.class, () -> a.combine(Operand.of(b)));
    }

    @Test
    void emptyRegistry_rejectsEveryOperand() {
        CombinatorRegistry empty = new CombinatorRegistry();
        assertFalse(empty.supports(IntegerLiteral.class));
        Graph bare = new Graph(TestSchemas.registry(), empty);
        Node count = bare.addNode("IntInput");
        GraphBuildException e = assertThrows(GraphBuildException.class, () -> count.combine(Operand.of(1)));
        assertEquals(ErrorCode.UNSUPPORTED_COMBINATION, e.getCode());
    }

    @Test
    void register_replacesRuleForVariant() {
        CombinatorRegistry registry = CombinatorRegistry.defaults()
                .register(IntegerLiteral.class, (source, operand) -> {
                    Node plusOne = source.getNode().graph().addNode("PlusOne<Int>");
                    plusOne.input("value").connect(source);
                    return plusOne;
                });
        assertTrue(registry.supports(IntegerLiteral.class));
        Graph custom = new Graph(TestSchemas.registry(), registry);
        Node count = custom.addNode("IntInput");
        assertEquals("PlusOne<Int>", count.combine(Operand.of(7)).getTypeName());
    }
}
