package com.treeds.tree;

import com.treeds.error.InvalidOperationException;
import com.treeds.error.NodeNotFoundException;
import com.treeds.error.RootNodeAlreadyPresentException;
import com.treeds.node.Node;
import com.treeds.node.NodeCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered n-ary tree of {@link Node} handles. Nodes link to each other by id; the tree resolves those ids
 * against its {@link NodeCollection}. At most one node is parentless (the root).
 * <p>
 * A {@code Tree} is also used as a detached fragment ("subtree") for {@link #getSubtree} and
 * {@link #addSubtree}; the fragment's root is its first parentless node.
 * <p>
 * Not thread-safe. Individual nodes may be {@link com.treeds.node.NodeOwnership#THREAD_SHARED}, but
 * operations spanning several nodes are not atomic.
 *
 * @param <Q> type of the node id
 * @param <T> type of the stored value
 */
public final class Tree<Q, T> {

    private static final Logger log = LoggerFactory.getLogger(Tree.class);

    private String name;
    private final NodeCollection<Q, T> nodes;

    public Tree() {
        this(null);
    }

    public Tree(String name) {
        this(name, new NodeCollection<>());
    }

    private Tree(String name, NodeCollection<Q, T> nodes) {
        this.name = name;
        this.nodes = nodes;
    }

    /**
     * Wraps already-linked nodes (e.g. decoded from JSON) without checking their linkage.
     */
    public static <Q, T> Tree<Q, T> of(String name, NodeCollection<Q, T> nodes) {
        return new Tree<>(name, Objects.requireNonNull(nodes, "nodes"));
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public void rename(String name) {
        this.name = name;
    }

    /** The live node collection, in insertion order. */
    public NodeCollection<Q, T> getNodes() {
        return nodes;
    }

    /** Adds {@code node} as the root. Same as {@code addNode(node, null)}. */
    public Q addNode(Node<Q, T> node) {
        return addNode(node, null);
    }

    /**
     * Adds {@code node} under {@code parentId}, or as the root when {@code parentId} is null.
     *
     * @return the id of the added node
     * @throws NodeNotFoundException if {@code parentId} is not in the tree
     * @throws RootNodeAlreadyPresentException if {@code parentId} is null and the tree has a root
     * @throws InvalidOperationException if a node with the same id is already in the tree
     */
    public Q addNode(Node<Q, T> node, Q parentId) {
        Objects.requireNonNull(node, "node");
        if (nodes.containsId(node.getId())) {
            throw new InvalidOperationException("Node " + node.getId() + " is already present in the tree");
        }
        if (parentId != null) {
            requireNode(parentId).addChild(node);
        } else if (getRootNode().isPresent()) {
            throw new RootNodeAlreadyPresentException();
        }
        nodes.push(node);
        if (log.isDebugEnabled()) {
            log.debug("Tree addNode | nodeId={} | parentId={}", node.getId(), parentId);
        }
        return node.getId();
    }

    public Optional<Node<Q, T>> getNodeById(Q id) {
        return nodes.getById(id);
    }

    /** The first parentless node. */
    public Optional<Node<Q, T>> getRootNode() {
        return nodes.stream().filter(n -> n.getParentId().isEmpty()).findFirst();
    }

    /**
     * Edges on the longest downward path from {@code id}; 0 for a leaf.
     *
     * @throws NodeNotFoundException if {@code id} or any descendant id does not resolve
     */
    public int getNodeHeight(Q id) {
        List<Q> bottomUp = traverse(id, TraversalStrategy.POST_ORDER);
        Map<Q, Integer> heights = new HashMap<>();
        for (Q current : bottomUp) {
            int height = 0;
            for (Q child : requireNode(current).getChildrenIds()) {
                height = Math.max(height, heights.get(child) + 1);
            }
            heights.put(current, height);
        }
        return heights.get(id);
    }

    /** Number of parent hops from {@code id} up to the root. */
    public int getNodeDepth(Q id) {
        return getAncestorIds(id).size();
    }

    /** Parent ids from nearest to farthest. */
    public List<Q> getAncestorIds(Q id) {
        Node<Q, T> node = requireNode(id);
        List<Q> ancestors = new ArrayList<>();
        Set<Q> seen = new HashSet<>();
        seen.add(id);
        Optional<Q> parent = node.getParentId();
        while (parent.isPresent()) {
            Q parentId = parent.get();
            if (!seen.add(parentId)) {
                throw new IllegalStateException("Cycle detected: node " + parentId + " is its own ancestor");
            }
            ancestors.add(parentId);
            parent = requireNode(parentId).getParentId();
        }
        return ancestors;
    }

    /**
     * Height of the root node.
     *
     * @throws InvalidOperationException if the tree has no root
     */
    public int getHeight() {
        Node<Q, T> root = getRootNode().orElseThrow(() -> new InvalidOperationException("Tree has no root node"));
        return getNodeHeight(root.getId());
    }

    /** Number of direct children of {@code id}. */
    public int getNodeDegree(Q id) {
        return requireNode(id).getChildrenIds().size();
    }

    /**
     * Children of {@code id}'s parent in child order, with or without {@code id} itself. A parentless
     * node has no siblings: the result is {@code [id]} when inclusive, else empty.
     */
    public List<Q> getSiblingIds(Q id, boolean inclusive) {
        Node<Q, T> node = requireNode(id);
        Optional<Q> parentId = node.getParentId();
        if (parentId.isEmpty()) {
            return inclusive ? List.of(id) : List.of();
        }
        List<Q> siblings = new ArrayList<>(requireNode(parentId.get()).getChildrenIds());
        if (!inclusive) {
            siblings.removeIf(id::equals);
        }
        return siblings;
    }

    /**
     * Removes {@code id} from the tree.
     *
     * @throws NodeNotFoundException if {@code id} (or, for {@link NodeRemovalStrategy#REMOVE_NODE_AND_CHILDREN},
     *                               any descendant id) does not resolve; the tree is left untouched
     * @throws InvalidOperationException if {@code id} is the root and the strategy is
     *                                   {@link NodeRemovalStrategy#RETAIN_CHILDREN}
     */
    public void removeNode(Q id, NodeRemovalStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");
        Node<Q, T> node = requireNode(id);
        switch (strategy) {
            case RETAIN_CHILDREN:
                removeRetainingChildren(node);
                break;
            case REMOVE_NODE_AND_CHILDREN:
                removeWithDescendants(node);
                break;
            default:
                throw new IllegalArgumentException("Unsupported removal strategy: " + strategy);
        }
    }

    private void removeRetainingChildren(Node<Q, T> node) {
        Q parentId = node.getParentId().orElseThrow(
                () -> new InvalidOperationException("Cannot remove root node with RetainChildren strategy"));
        Node<Q, T> parent = requireNode(parentId);
        List<Node<Q, T>> children = new ArrayList<>();
        for (Q childId : node.getChildrenIds()) {
            children.add(requireNode(childId));
        }

        parent.removeChild(node);
        for (Node<Q, T> child : children) {
            node.removeChild(child);
            parent.addChild(child);
        }
        Q id = node.getId();
        nodes.retain(n -> !n.getId().equals(id));
        if (log.isDebugEnabled()) {
            log.debug("Tree removeNode | nodeId={} | strategy={} | reparented={} | newParentId={}",
                    id, NodeRemovalStrategy.RETAIN_CHILDREN, children.size(), parentId);
        }
    }

    private void removeWithDescendants(Node<Q, T> node) {
        Map<Q, Node<Q, T>> doomed = new LinkedHashMap<>();
        for (Q descendantId : traverse(node.getId(), TraversalStrategy.PRE_ORDER)) {
            doomed.put(descendantId, requireNode(descendantId));
        }
        Optional<Node<Q, T>> parent = node.getParentId().map(this::requireNode);

        parent.ifPresent(p -> p.removeChild(node));
        for (Node<Q, T> removed : doomed.values()) {
            for (Q childId : removed.getChildrenIds()) {
                removed.removeChild(doomed.get(childId));
            }
        }
        nodes.retain(n -> !doomed.containsKey(n.getId()));
        if (log.isDebugEnabled()) {
            log.debug("Tree removeNode | nodeId={} | strategy={} | removed={}",
                    node.getId(), NodeRemovalStrategy.REMOVE_NODE_AND_CHILDREN, doomed.size());
        }
    }

    /**
     * Copies {@code id} and its descendants into a new tree named after {@code id}. The copy of {@code id}
     * comes first and has no parent; the other copies follow in pre-order. This tree is not modified.
     *
     * @param generations how many levels below {@code id} to copy; null copies all, 0 (or less) only {@code id}
     * @throws NodeNotFoundException if {@code id} or a copied child id does not resolve
     */
    public Tree<Q, T> getSubtree(Q id, Integer generations) {
        Node<Q, T> source = requireNode(id);
        int limit = generations == null ? Integer.MAX_VALUE : Math.max(0, generations);
        Tree<Q, T> subtree = new Tree<>(String.valueOf(id));

        Node<Q, T> rootCopy = source.copy();
        subtree.nodes.push(rootCopy);
        Set<Q> seen = new HashSet<>();
        seen.add(id);
        Deque<PendingCopy<Q, T>> stack = new ArrayDeque<>();
        pushChildren(stack, source, rootCopy, 1, limit);
        while (!stack.isEmpty()) {
            PendingCopy<Q, T> pending = stack.pop();
            Node<Q, T> original = requireNode(pending.childId);
            if (!seen.add(original.getId())) {
                throw new IllegalStateException("Cycle detected: node " + original.getId() + " reached twice");
            }
            Node<Q, T> copy = original.copy();
            pending.parentCopy.addChild(copy);
            subtree.nodes.push(copy);
            pushChildren(stack, original, copy, pending.generation + 1, limit);
        }
        if (log.isDebugEnabled()) {
            log.debug("Tree getSubtree | nodeId={} | generations={} | copied={}", id, generations, subtree.nodes.size());
        }
        return subtree;
    }

    private static <Q, T> void pushChildren(Deque<PendingCopy<Q, T>> stack, Node<Q, T> original,
                                            Node<Q, T> copy, int generation, int limit) {
        if (generation > limit) return;
        List<Q> children = original.getChildrenIds();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new PendingCopy<>(children.get(i), copy, generation));
        }
    }

    /**
     * Attaches {@code subtree}'s root under {@code id} and moves every node of {@code subtree} into this
     * tree; {@code subtree} is left empty. Ids are not checked for collisions.
     *
     * @throws NodeNotFoundException if {@code id} is not in this tree
     * @throws InvalidOperationException if {@code subtree} has no root
     */
    public void addSubtree(Q id, Tree<Q, T> subtree) {
        Objects.requireNonNull(subtree, "subtree");
        Node<Q, T> node = requireNode(id);
        Node<Q, T> subtreeRoot = subtree.getRootNode()
                .orElseThrow(() -> new InvalidOperationException("Subtree has no root node."));
        int moved = subtree.nodes.size();
        node.addChild(subtreeRoot);
        nodes.append(subtree.nodes);
        if (log.isDebugEnabled()) {
            log.debug("Tree addSubtree | parentId={} | subtreeRootId={} | moved={}", id, subtreeRoot.getId(), moved);
        }
    }

    /**
     * Ids reachable from {@code id} in the given order, each exactly once.
     *
     * @throws NodeNotFoundException if {@code id} or a child id met on the way does not resolve
     */
    public List<Q> traverse(Q id, TraversalStrategy order) {
        return TreeTraversal.traverse(this, id, order);
    }

    /**
     * Name, underline and box-drawing outline.
     *
     * @throws com.treeds.error.TreeFormatException if the tree has no root or a child id does not resolve
     */
    public String render() {
        return TreeRenderer.render(this);
    }

    /** Hash over the name and every node's id, value, children and parent. */
    public int structuralHash() {
        int hash = Objects.hashCode(name);
        for (Node<Q, T> node : nodes) {
            hash = 31 * hash + node.structuralHash();
        }
        return hash;
    }

    Node<Q, T> requireNode(Q id) {
        return nodes.getById(id).orElseThrow(() -> new NodeNotFoundException(id));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Tree<?, ?> tree = (Tree<?, ?>) o;
        return Objects.equals(name, tree.name) && nodes.equals(tree.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, nodes);
    }

    /** Same as {@link #render()}; a tree without a root prints as {@code Tree{name=..., nodes=N}}. */
    @Override
    public String toString() {
        if (getRootNode().isEmpty()) {
            return "Tree{name=" + name + ", nodes=" + nodes.size() + '}';
        }
        return render();
    }

    private static final class PendingCopy<Q, T> {
        private final Q childId;
        private final Node<Q, T> parentCopy;
        private final int generation;

        private PendingCopy(Q childId, Node<Q, T> parentCopy, int generation) {
            this.childId = childId;
            this.parentCopy = parentCopy;
            this.generation = generation;
        }
    }
}
