package io.causelog.lineage.report;

import io.causelog.lineage.Branch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Box-drawing tree of a correlation's branches, one line per event:
 *
 * <pre>
 * └── [1] CreateOrder
 *     ├── [2] ReserveStock
 *     └── [3] ChargeCard
 * </pre>
 */
public final class EventTreeRenderer {
    static final String RULE = "═".repeat(50);

    public String render(String correlationId, List<Branch> branches) {
        Map<Long, Node> nodes = new LinkedHashMap<>();
        List<Node> roots = new ArrayList<>();
        for (Branch branch : branches) {
            Node node = nodes.computeIfAbsent(branch.event().id(), Node::new);
            node.command = branch.event().command();
            List<Long> path = branch.path();
            if (path.size() == 1) {
                roots.add(node);
            } else {
                Node parent = nodes.computeIfAbsent(path.get(path.size() - 2), Node::new);
                parent.children.add(node);
            }
        }

        StringBuilder out = new StringBuilder();
        out.append("Event Tree for Correlation ID: ").append(correlationId).append('\n');
        out.append(RULE).append("\n\n");

        Deque<Frame> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(new Frame(roots.get(i), "", i == roots.size() - 1));
        }
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            out.append(frame.prefix())
                    .append(frame.last() ? "└── " : "├── ")
                    .append('[').append(frame.node().id).append("] ").append(frame.node().command)
                    .append('\n');
            String childPrefix = frame.prefix() + (frame.last() ? "    " : "│   ");
            List<Node> children = frame.node().children;
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), childPrefix, i == children.size() - 1));
            }
        }
        return out.toString();
    }

    private static final class Node {
        private final long id;
        private String command;
        private final List<Node> children = new ArrayList<>();

        private Node(long id) {
            this.id = id;
        }
    }

    private record Frame(Node node, String prefix, boolean last) {
    }
}
