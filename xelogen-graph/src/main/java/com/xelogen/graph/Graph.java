package com.xelogen.graph;

import com.xelogen.graph.combine.CombinatorRegistry;
import com.xelogen.graph.flow.BranchScope;
import com.xelogen.graph.flow.BranchStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One construction session: owns its nodes in insertion order, the cached root slot node and the
 * If/Else nesting stack. Not thread-safe; a graph has a single writer. Build independent graphs in
 * separate instances.
 */
public final class Graph {

    private static final Logger log = LoggerFactory.getLogger(Graph.class);

    public static final String ROOT_SLOT_TYPE = "RootSlot";

    private final NodeSpecRegistry registry;
    private final CombinatorRegistry combinators;
    private final List<Node> nodes = new ArrayList<>();
    private final BranchStack branches;
    private Node rootNode;

    public Graph(NodeSpecRegistry registry) {
        this(registry, CombinatorRegistry.defaults());
    }

    public Graph(NodeSpecRegistry registry, CombinatorRegistry combinators) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.combinators = Objects.requireNonNull(combinators, "combinators");
        this.branches = new BranchStack(this);
    }

    /**
     * Creates a node of the given type and appends it; its id is the number of nodes before it.
     *
     * @throws GraphBuildException {@link ErrorCode#UNKNOWN_NODE_TYPE} if the registry has no such type
     */
    public Node addNode(String typeName) {
        NodeSpec spec = registry.specOf(typeName);
        Node node = new Node(this, spec, nodes.size());
        nodes.add(node);
        if (log.isDebugEnabled()) {
            log.debug("Node added | id={} | type={}", node.getId(), typeName);
        }
        return node;
    }

    /** The graph's RootSlot node, created on first call and reused after. */
    public Node root() {
        if (rootNode == null) {
            rootNode = addNode(ROOT_SLOT_TYPE);
        }
        return rootNode;
    }

    /** All nodes in insertion order. Unmodifiable view. */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public Node node(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IndexOutOfBoundsException("No node with id " + id + " (size " + nodes.size() + ")");
        }
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    public NodeSpecRegistry registry() {
        return registry;
    }

    public CombinatorRegistry combinators() {
        return combinators;
    }

    /**
     * Creates an If node triggered by {@code trigger} on {@code condition} and opens its true branch.
     * Close the returned scope (try-with-resources) before opening its Else with {@link #branchElse()}.
     *
     * @throws GraphBuildException {@link ErrorCode#NOT_AN_IMPULSE} or {@link ErrorCode#NOT_A_BOOLEAN}
     */
    public BranchScope branchIf(OutputPort trigger, OutputPort condition) {
        return branches.openIf(trigger, condition);
    }

    /**
     * Opens the false branch of the If whose scope was the last one closed at the current nesting level.
     *
     * @throws GraphBuildException {@link ErrorCode#DANGLING_ELSE} if there is no such If or its Else was already opened
     */
    public BranchScope branchElse() {
        return branches.openElse();
    }

    /** Number of branch scopes currently open. */
    public int branchDepth() {
        return branches.depth();
    }
}
