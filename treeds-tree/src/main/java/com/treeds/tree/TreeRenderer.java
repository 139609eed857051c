package com.treeds.tree;

import com.treeds.error.NodeNotFoundException;
import com.treeds.error.TreeFormatException;
import com.treeds.node.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Box-drawing outline of a tree:
 * <pre>
 * Sample Tree
 * ***********
 * 1: 2
 * └── 2: 3
 *     ├── 3: 6
 *     │   └── 5: 6
 *     └── 4: 5
 * </pre>
 */
final class TreeRenderer {

    static final String BRANCH = "├── ";
    static final String LAST_BRANCH = "└── ";
    static final String CONTINUATION = "│   ";
    static final String BLANK = "    ";

    private TreeRenderer() {
    }

    static <Q, T> String render(Tree<Q, T> tree) {
        StringBuilder out = new StringBuilder();
        tree.getName().ifPresent(name -> out.append(name).append('\n')
                .append("*".repeat(name.codePointCount(0, name.length()))).append('\n'));
        Node<Q, T> root = tree.getRootNode().orElseThrow(() -> new TreeFormatException("Tree has no root node"));

        Set<Q> seen = new HashSet<>();
        Deque<Line<Q>> stack = new ArrayDeque<>();
        stack.push(new Line<>(root.getId(), "", true, true));
        while (!stack.isEmpty()) {
            Line<Q> line = stack.pop();
            Node<Q, T> node = tree.getNodeById(line.id).orElseThrow(() -> {
                NodeNotFoundException cause = new NodeNotFoundException(line.id);
                return new TreeFormatException("Cannot render tree: " + cause.getMessage(), cause);
            });
            if (!seen.add(node.getId())) {
                throw new IllegalStateException("Cycle detected: node " + node.getId() + " reached twice");
            }

            String childPrefix;
            out.append(line.prefix);
            if (line.root) {
                out.append(node).append('\n');
                childPrefix = line.prefix;
            } else if (line.last) {
                out.append(LAST_BRANCH).append(node).append('\n');
                childPrefix = line.prefix + BLANK;
            } else {
                out.append(BRANCH).append(node).append('\n');
                childPrefix = line.prefix + CONTINUATION;
            }

            List<Q> children = node.getChildrenIds();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Line<>(children.get(i), childPrefix, i == children.size() - 1, false));
            }
        }
        return out.toString();
    }

    private static final class Line<Q> {
        private final Q id;
        private final String prefix;
        private final boolean last;
        private final boolean root;

        private Line(Q id, String prefix, boolean last, boolean root) {
            this.id = id;
            this.prefix = prefix;
            this.last = last;
            this.root = root;
        }
    }
}
