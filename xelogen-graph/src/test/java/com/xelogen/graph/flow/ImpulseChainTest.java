package com.xelogen.graph.flow;

import com.xelogen.graph.ErrorCode;
import com.xelogen.graph.Graph;
import com.xelogen.graph.GraphBuildException;
import com.xelogen.graph.Node;
import com.xelogen.graph.TestSchemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImpulseChainTest {

    private Graph graph;

    @BeforeEach
    void setUp() {
        graph = TestSchemas.newGraph();
    }

    @Test
    void start_requiresImpulseOutput() {
        Node number = graph.addNode("IntInput");
        GraphBuildException e = assertThrows(GraphBuildException.class, () -> new ImpulseChain(number.onlyOutput()));
        assertEquals(ErrorCode.NOT_AN_IMPULSE, e.getCode());
    }

    @Test
    void append_wiresCursorAndAdvances() {
        Node pulse = graph.addNode("Pulse");
        Node first = graph.addNode("WriteDynVar<Int>");
        Node second = graph.addNode("WriteDynVar<Int>");

        ImpulseChain chain = pulse.onlyOutput().chain().append(first).append(second);

        assertEquals(List.of(pulse.onlyOutput()), first.bound("write"));
        assertEquals(List.of(first.output("success")), second.bound("write"));
        assertEquals(second.output("success"), chain.current());
        assertEquals(List.of(first, second), chain.history());
    }

    @Test
    void append_nodeWithoutImpulseInputLeavesChainUnchanged() {
        Node pulse = graph.addNode("Pulse");
        ImpulseChain chain = new ImpulseChain(pulse.onlyOutput());
        Node text = graph.addNode("StringInput");

        GraphBuildException e = assertThrows(GraphBuildException.class, () -> chain.append(text));
        assertEquals(ErrorCode.MISSING_IMPULSE_INPUT, e.getCode());
        assertEquals(pulse.onlyOutput(), chain.current());
        assertTrue(chain.history().isEmpty());
    }

    @Test
    void append_nodeWithoutImpulseOutputBindsNothing() {
        Node pulse = graph.addNode("Pulse");
        ImpulseChain chain = new ImpulseChain(pulse.onlyOutput());
        Node display = graph.addNode("ImpulseDisplay");

        GraphBuildException e = assertThrows(GraphBuildException.class, () -> chain.append(display));
        assertEquals(ErrorCode.MISSING_IMPULSE_OUTPUT, e.getCode());
        assertTrue(display.bound("impulse").isEmpty());
        assertEquals(pulse.onlyOutput(), chain.current());
    }

    @Test
    void chains_canFanOutFromOneImpulse() {
        Node pulse = graph.addNode("Pulse");
        Node a = graph.addNode("WriteDynVar<Int>");
        Node b = graph.addNode("WriteDynVar<Int>");
        pulse.onlyOutput().chain().append(a);
        pulse.onlyOutput().chain().append(b);
        assertEquals(List.of(pulse.onlyOutput()), a.bound("write"));
        assertEquals(List.of(pulse.onlyOutput()), b.bound("write"));
    }
}
