package com.xelogen.graph.flow;

import com.xelogen.graph.Datatype;
import com.xelogen.graph.ErrorCode;
import com.xelogen.graph.Graph;
import com.xelogen.graph.GraphBuildException;
import com.xelogen.graph.Node;
import com.xelogen.graph.OutputPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * If/Else nesting state of one {@link Graph}.
 * <p>
 * Every open branch scope owns a nesting level. Each level remembers the frame of the last scope closed
 * directly inside it; an Else resolves against that frame, so an Else must follow its If at the same
 * level with no other branch scope opened and closed in between. Inner levels are discarded when their
 * scope closes, which is what lets nested pairs resolve independently of the outer ones.
 */
public final class BranchStack {

    private static final Logger log = LoggerFactory.getLogger(BranchStack.class);

    public static final String IF_TYPE = "If";
    static final String IF_IMPULSE_INPUT = "impulse";
    static final String IF_CONDITION_INPUT = "condition";
    static final String IF_TRUE_OUTPUT = "true";
    static final String IF_FALSE_OUTPUT = "false";

    private final Graph graph;
    private final Deque<Level> levels = new ArrayDeque<>();

    public BranchStack(Graph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
        levels.push(new Level());
    }

    public BranchScope openIf(OutputPort trigger, OutputPort condition) {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(condition, "condition");
        if (trigger.datatype() != Datatype.IMPULSE) {
            throw new GraphBuildException(ErrorCode.NOT_AN_IMPULSE,
                    "Output " + trigger.getName() + " of " + trigger.getNode().getTypeName() + " is not an impulse.");
        }
        if (condition.datatype() != Datatype.BOOL) {
            throw new GraphBuildException(ErrorCode.NOT_A_BOOLEAN,
                    "Output " + condition.getName() + " of " + condition.getNode().getTypeName() + " is not a bool.");
        }
        if (trigger.getNode().graph() != graph || condition.getNode().graph() != graph) {
            throw new IllegalArgumentException("If trigger and condition must belong to this graph");
        }
        Node ifNode = graph.addNode(IF_TYPE);
        ifNode.input(IF_IMPULSE_INPUT).connect(trigger);
        ifNode.input(IF_CONDITION_INPUT).connect(condition);
        BranchFrame frame = new BranchFrame(ifNode);
        if (log.isDebugEnabled()) {
            log.debug("Branch If opened | ifNodeId={} | depth={}", ifNode.getId(), depth());
        }
        return enter(frame, false, ifNode.output(IF_TRUE_OUTPUT));
    }

    public BranchScope openElse() {
        BranchFrame frame = levels.peek().lastClosed;
        if (frame == null) {
            throw new GraphBuildException(ErrorCode.DANGLING_ELSE,
                    "Cannot have Else without If first at this nesting level.");
        }
        if (frame.state() != BranchFrame.State.ELSE_PENDING) {
            throw new GraphBuildException(ErrorCode.DANGLING_ELSE,
                    "If node " + frame.ifNode().getId() + " already has an Else.");
        }
        frame.state(BranchFrame.State.ELSE_OPEN);
        if (log.isDebugEnabled()) {
            log.debug("Branch Else opened | ifNodeId={} | depth={}", frame.ifNode().getId(), depth());
        }
        return enter(frame, true, frame.ifNode().output(IF_FALSE_OUTPUT));
    }

    private BranchScope enter(BranchFrame frame, boolean isElse, OutputPort start) {
        ImpulseChain chain = new ImpulseChain(start);
        Level inner = new Level();
        levels.push(inner);
        return new BranchScope(this, frame, isElse, chain, inner);
    }

    void exit(BranchScope scope) {
        if (levels.peek() != scope.level()) {
            throw new IllegalStateException("Branch scopes must be closed innermost first (If node "
                    + scope.ifNode().getId() + ")");
        }
        levels.pop();
        BranchFrame frame = scope.frame();
        frame.state(scope.isElse() ? BranchFrame.State.ELSE_CLOSED : BranchFrame.State.ELSE_PENDING);
        levels.peek().lastClosed = frame;
        if (log.isDebugEnabled()) {
            log.debug("Branch {} closed | ifNodeId={} | depth={}", scope.isElse() ? "Else" : "If",
                    frame.ifNode().getId(), depth());
        }
    }

    /** Number of open branch scopes. */
    public int depth() {
        return levels.size() - 1;
    }

    static final class Level {
        private BranchFrame lastClosed;
    }
}
