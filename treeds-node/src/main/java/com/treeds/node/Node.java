package com.treeds.node;

import com.treeds.error.InvalidOperationException;
import com.treeds.node.id.NodeFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * A shared, mutable handle to one tree entry: an immutable id, an optional value, the id of the parent
 * and the ordered ids of the children. Every holder of the same {@code Node} instance (the tree's
 * collection, the caller) sees every mutation.
 * <p>
 * Linkage is stored as ids only; the owning tree resolves them against its node collection. Access to the
 * mutable fields goes through the {@link NodeOwnership} chosen at construction.
 * <p>
 * Equality covers {@code id} and {@code value} only, so equal entries compare equal even when they sit in
 * different trees. {@link #hashCode()} agrees with that; {@link #structuralHash()} also covers linkage.
 * Nodes are mutable: do not keep them in hash-based collections across value changes.
 *
 * @param <Q> type of the node id
 * @param <T> type of the stored value
 */
public final class Node<Q, T> {

    private final Q id;
    private final NodeOwnership ownership;
    private final NodeAccess access;
    private final List<Q> children = new ArrayList<>();
    private T value;
    private Q parent;

    public Node(Q id, T value) {
        this(id, value, NodeOwnership.SINGLE_THREADED);
    }

    public Node(Q id, T value, NodeOwnership ownership) {
        this.id = Objects.requireNonNull(id, "id");
        this.ownership = Objects.requireNonNull(ownership, "ownership");
        this.access = ownership.newAccess();
        this.value = value;
    }

    /**
     * Creates a single-threaded node whose id comes from the process-wide default generator.
     */
    public static <T> Node<Long, T> withAutoId(T value) {
        return NodeFactory.longIds().create(value);
    }

    /**
     * Rebuilds a node with explicit linkage, as read from a stored record. Neither the children ids
     * nor the parent id are checked against any tree.
     */
    public static <Q, T> Node<Q, T> restore(Q id, T value, NodeOwnership ownership, List<Q> childrenIds, Q parentId) {
        Node<Q, T> node = new Node<>(id, value, ownership);
        for (Q childId : Objects.requireNonNull(childrenIds, "childrenIds")) {
            node.children.add(Objects.requireNonNull(childId, "childId"));
        }
        node.parent = parentId;
        return node;
    }

    public Q getId() {
        return id;
    }

    public NodeOwnership getOwnership() {
        return ownership;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(access.read(id, () -> value));
    }

    public void setValue(T value) {
        access.mutate(id, () -> this.value = value);
    }

    /**
     * Replaces the value with {@code modifier.apply(current)} inside one critical section. The modifier
     * receives {@code null} when no value is set and may return {@code null} to clear it. It must not touch
     * this node; doing so fails with {@link com.treeds.error.AccessConflictException}.
     */
    public void updateValue(UnaryOperator<T> modifier) {
        Objects.requireNonNull(modifier, "modifier");
        access.mutate(id, () -> this.value = modifier.apply(this.value));
    }

    /** Snapshot of the children ids in insertion order. */
    public List<Q> getChildrenIds() {
        return access.read(id, () -> List.copyOf(children));
    }

    public Optional<Q> getParentId() {
        return Optional.ofNullable(access.read(id, () -> parent));
    }

    /**
     * Appends {@code child} to this node's children and points the child's parent at this node.
     *
     * @throws InvalidOperationException if {@code child} carries this node's id
     */
    public void addChild(Node<Q, T> child) {
        Objects.requireNonNull(child, "child");
        if (id.equals(child.id)) {
            throw new InvalidOperationException("Node " + id + " cannot be a child of itself");
        }
        access.mutate(id, () -> children.add(child.id));
        child.access.mutate(child.id, () -> child.parent = id);
    }

    /**
     * Drops {@code child}'s id from this node's children and clears the child's parent.
     */
    public void removeChild(Node<Q, T> child) {
        Objects.requireNonNull(child, "child");
        access.mutate(id, () -> children.removeIf(c -> c.equals(child.id)));
        child.access.mutate(child.id, () -> child.parent = null);
    }

    /**
     * Links this node under {@code parent} (same as {@code parent.addChild(this)}), or clears the parent
     * link when {@code parent} is null. The previous parent's children are left as they are.
     */
    public void setParent(Node<Q, T> parent) {
        if (parent != null) {
            parent.addChild(this);
        } else {
            access.mutate(id, () -> this.parent = null);
        }
    }

    /**
     * Reorders the children ids. The comparator runs outside the node's critical section, so it may
     * query the tree (e.g. compare by subtree height). If the children change while sorting, the sort
     * starts over from the current list.
     */
    public void sortChildren(Comparator<? super Q> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        boolean applied;
        do {
            List<Q> snapshot = getChildrenIds();
            List<Q> sorted = new ArrayList<>(snapshot);
            sorted.sort(comparator);
            applied = access.write(id, () -> {
                if (!children.equals(snapshot)) {
                    return false;
                }
                children.clear();
                children.addAll(sorted);
                return true;
            });
        } while (!applied);
    }

    /**
     * Returns a new detached node with the same id, value and ownership, and no linkage. The value
     * reference itself is shared.
     */
    public Node<Q, T> copy() {
        return new Node<>(id, access.read(id, () -> value), ownership);
    }

    /** Hash over id, value, children ids and parent id. */
    public int structuralHash() {
        return access.read(id, () -> Objects.hash(id, value, children, parent));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node<?, ?> that = (Node<?, ?>) o;
        return id.equals(that.id) && Objects.equals(getValue(), that.getValue());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, getValue());
    }

    /** {@code "<id>: <value>"}, or just {@code "<id>"} when no value is set. */
    @Override
    public String toString() {
        return getValue().map(v -> id + ": " + v).orElseGet(id::toString);
    }
}
