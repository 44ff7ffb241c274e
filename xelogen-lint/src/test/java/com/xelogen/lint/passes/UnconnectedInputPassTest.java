package com.xelogen.lint.passes;

import com.xelogen.catalog.NodeCatalog;
import com.xelogen.graph.Graph;
import com.xelogen.graph.Node;
import com.xelogen.lint.LintEngine;
import com.xelogen.lint.LintReport;
import com.xelogen.lint.LintWarning;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UnconnectedInputPassTest {

    @Test
    void reportsUnboundScalarInputsOnly() {
        Graph graph = new Graph(NodeCatalog.loadBundled());
        Node write = graph.addNode("WriteDynVar<Int>");
        write.input("slot").connect(graph.root().onlyOutput());
        graph.addNode("Plus<String>");
        graph.addNode("ImpulseDisplay");

        LintReport report = new LintEngine().register(new UnconnectedInputPass()).report(graph);

        List<String> messages = report.warnings().stream().map(LintWarning::message).toList();
        assertEquals(List.of("Input name (STRING) is not connected.", "Input value (INT) is not connected."), messages);
        assertEquals(List.of(write.getId(), write.getId()),
                report.warnings().stream().map(LintWarning::nodeId).toList());
    }

    @Test
    void fullyWiredGraph_isClean() {
        Graph graph = new Graph(NodeCatalog.loadBundled());
        Node numChildren = graph.addNode("NumChildren");
        numChildren.input("slot").connect(graph.root().onlyOutput());
        assertEquals(0, new LintEngine().register(new UnconnectedInputPass()).run(graph));
    }
}
