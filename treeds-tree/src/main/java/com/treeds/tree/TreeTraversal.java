package com.treeds.tree;

import com.treeds.error.NodeNotFoundException;
import com.treeds.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Depth-first walks over a {@link Tree} with explicit stacks, so tree depth is bounded by heap rather than
 * by the call stack. Child ids are resolved against the tree as they are reached; an id that does not
 * resolve fails the walk with {@link NodeNotFoundException}. A node reached twice in one walk means the
 * linkage has a cycle and fails with {@link IllegalStateException}.
 */
final class TreeTraversal {

    private static final Logger log = LoggerFactory.getLogger(TreeTraversal.class);

    private TreeTraversal() {
    }

    static <Q, T> List<Q> traverse(Tree<Q, T> tree, Q startId, TraversalStrategy order) {
        Objects.requireNonNull(order, "order");
        Node<Q, T> start = resolve(tree, startId);
        List<Q> result;
        switch (order) {
            case PRE_ORDER:
                result = preOrder(tree, start);
                break;
            case POST_ORDER:
                result = postOrder(tree, start);
                break;
            case IN_ORDER:
                result = inOrder(tree, start);
                break;
            default:
                throw new IllegalArgumentException("Unsupported traversal: " + order);
        }
        if (log.isDebugEnabled()) {
            log.debug("Tree traverse | startId={} | order={} | visited={}", startId, order, result.size());
        }
        return result;
    }

    private static <Q, T> List<Q> preOrder(Tree<Q, T> tree, Node<Q, T> start) {
        List<Q> visited = new ArrayList<>();
        Set<Q> seen = new HashSet<>();
        Deque<Q> stack = new ArrayDeque<>();
        stack.push(start.getId());
        while (!stack.isEmpty()) {
            Node<Q, T> node = resolve(tree, stack.pop());
            markSeen(seen, node.getId());
            visited.add(node.getId());
            List<Q> children = node.getChildrenIds();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return visited;
    }

    private static <Q, T> List<Q> postOrder(Tree<Q, T> tree, Node<Q, T> start) {
        List<Q> visited = new ArrayList<>();
        Set<Q> seen = new HashSet<>();
        Deque<Frame<Q>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(start.getId(), false));
        while (!stack.isEmpty()) {
            Frame<Q> frame = stack.pop();
            if (frame.emit) {
                visited.add(frame.id);
                continue;
            }
            Node<Q, T> node = resolve(tree, frame.id);
            markSeen(seen, node.getId());
            stack.push(new Frame<>(node.getId(), true));
            List<Q> children = node.getChildrenIds();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame<>(children.get(i), false));
            }
        }
        return visited;
    }

    /*
     * Expansion of a node n with children c0..ck:
     *   expand(c0), c0, n, c1, expand(c1), ..., ck, expand(ck)
     * A leaf expands to itself. Repeats are dropped afterwards, first occurrence wins.
     */
    private static <Q, T> List<Q> inOrder(Tree<Q, T> tree, Node<Q, T> start) {
        Set<Q> emitted = new LinkedHashSet<>();
        Set<Q> seen = new HashSet<>();
        Deque<Frame<Q>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(start.getId(), false));
        while (!stack.isEmpty()) {
            Frame<Q> frame = stack.pop();
            if (frame.emit) {
                emitted.add(frame.id);
                continue;
            }
            Node<Q, T> node = resolve(tree, frame.id);
            markSeen(seen, node.getId());
            List<Q> children = node.getChildrenIds();
            if (children.isEmpty()) {
                emitted.add(node.getId());
                continue;
            }
            for (int i = children.size() - 1; i >= 1; i--) {
                stack.push(new Frame<>(children.get(i), false));
                stack.push(new Frame<>(children.get(i), true));
            }
            stack.push(new Frame<>(node.getId(), true));
            stack.push(new Frame<>(children.get(0), true));
            stack.push(new Frame<>(children.get(0), false));
        }
        return new ArrayList<>(emitted);
    }

    private static <Q, T> Node<Q, T> resolve(Tree<Q, T> tree, Q id) {
        return tree.getNodeById(id).orElseThrow(() -> new NodeNotFoundException(id));
    }

    private static <Q> void markSeen(Set<Q> seen, Q id) {
        if (!seen.add(id)) {
            throw new IllegalStateException("Cycle detected: node " + id + " reached twice");
        }
    }

    private static final class Frame<Q> {
        private final Q id;
        private final boolean emit;

        private Frame(Q id, boolean emit) {
            this.id = id;
            this.emit = emit;
        }
    }
}
