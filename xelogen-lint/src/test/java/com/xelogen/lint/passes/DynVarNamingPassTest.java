package com.xelogen.lint.passes;

import com.xelogen.catalog.NodeCatalog;
import com.xelogen.graph.Graph;
import com.xelogen.graph.Node;
import com.xelogen.lint.LintEngine;
import com.xelogen.lint.LintReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DynVarNamingPassTest {

    private Graph graph;
    private LintEngine engine;

    @BeforeEach
    void setUp() {
        graph = new Graph(NodeCatalog.loadBundled());
        engine = new LintEngine().register(new DynVarNamingPass());
    }

    private Node writeNamed(String name) {
        Node write = graph.addNode("WriteDynVar<Int>");
        Node literal = graph.addNode("StringInput");
        if (name != null) literal.setContent(name);
        write.input("name").connect(literal.onlyOutput());
        return write;
    }

    @Test
    void nameWithoutSeparator_warnsOnce() {
        Node write = writeNamed("World");

        LintReport report = engine.report(graph);

        assertEquals(1, report.count());
        assertEquals(write.getId(), report.warnings().get(0).nodeId());
        assertEquals(DynVarNamingPass.NAME, report.warnings().get(0).pass());
    }

    @Test
    void pathName_isClean() {
        writeNamed("World/Meow");
        assertTrue(engine.report(graph).isClean());
    }

    @Test
    void emptyLiteral_warns() {
        writeNamed(null);
        LintReport report = engine.report(graph);
        assertEquals(1, report.count());
        assertTrue(report.warnings().get(0).message().contains("empty"));
    }

    @Test
    void unconnectedName_warns() {
        graph.addNode("WriteDynVar<Int>");
        LintReport report = engine.report(graph);
        assertEquals(1, report.count());
        assertTrue(report.warnings().get(0).message().contains("no name input"));
    }

    @Test
    void computedName_isSkipped() {
        Node write = graph.addNode("WriteDynVar<Int>");
        Node literal = graph.addNode("StringInput");
        literal.setContent("World");
        Node concat = graph.addNode("Plus<String>");
        concat.input("values").append(literal.onlyOutput());
        write.input("name").connect(concat.onlyOutput());

        assertEquals(0, engine.run(graph));
    }

    @Test
    void otherNodeTypes_areIgnored() {
        Node literal = graph.addNode("StringInput");
        literal.setContent("World");
        graph.addNode("If");
        assertEquals(0, engine.run(graph));
    }

    @Test
    void eachWriteNode_isCheckedIndependently() {
        writeNamed("World");
        writeNamed("World/Meow");
        writeNamed("Other");
        assertEquals(2, engine.run(graph));
    }
}
