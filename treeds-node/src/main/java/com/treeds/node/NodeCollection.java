package com.treeds.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collector;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ordered sequence of node handles, looked up by position or by id (linear scan, first match).
 * Ids are not de-duplicated here; the owning tree keeps them unique.
 *
 * @param <Q> type of the node id
 * @param <T> type of the stored value
 */
public final class NodeCollection<Q, T> implements Iterable<Node<Q, T>> {

    private final List<Node<Q, T>> nodes;

    public NodeCollection() {
        this.nodes = new ArrayList<>();
    }

    private NodeCollection(List<Node<Q, T>> nodes) {
        this.nodes = nodes;
    }

    public static <Q, T> NodeCollection<Q, T> from(Iterable<Node<Q, T>> source) {
        Objects.requireNonNull(source, "source");
        List<Node<Q, T>> copy = new ArrayList<>();
        source.forEach(copy::add);
        return new NodeCollection<>(copy);
    }

    public static <Q, T> Collector<Node<Q, T>, ?, NodeCollection<Q, T>> toNodeCollection() {
        return Collectors.collectingAndThen(
                Collectors.<Node<Q, T>, List<Node<Q, T>>>toCollection(ArrayList::new),
                list -> new NodeCollection<Q, T>(list));
    }

    public void push(Node<Q, T> node) {
        nodes.add(Objects.requireNonNull(node, "node"));
    }

    /**
     * Removes and returns the node at {@code index}.
     *
     * @throws IndexOutOfBoundsException if the index is outside {@code [0, size)}
     */
    public Node<Q, T> remove(int index) {
        return nodes.remove(index);
    }

    /** Keeps only the nodes matching {@code predicate}, preserving their order. */
    public void retain(Predicate<? super Node<Q, T>> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        nodes.removeIf(predicate.negate());
    }

    public Optional<Node<Q, T>> get(int index) {
        if (index < 0 || index >= nodes.size()) return Optional.empty();
        return Optional.of(nodes.get(index));
    }

    public Optional<Node<Q, T>> getById(Q id) {
        if (id == null) return Optional.empty();
        for (Node<Q, T> node : nodes) {
            if (id.equals(node.getId())) return Optional.of(node);
        }
        return Optional.empty();
    }

    public boolean containsId(Q id) {
        return getById(id).isPresent();
    }

    /** Moves every node of {@code other} to the end of this collection; {@code other} ends up empty. */
    public void append(NodeCollection<Q, T> other) {
        Objects.requireNonNull(other, "other");
        if (other == this) return;
        appendRaw(other.nodes);
    }

    /** Moves every node of {@code other} to the end of this collection; {@code other} ends up empty. */
    public void appendRaw(List<Node<Q, T>> other) {
        Objects.requireNonNull(other, "other");
        nodes.addAll(other);
        other.clear();
    }

    public void clear() {
        nodes.clear();
    }

    public Optional<Node<Q, T>> first() {
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** Read-only view in insertion order. */
    public List<Node<Q, T>> asList() {
        return Collections.unmodifiableList(nodes);
    }

    public Stream<Node<Q, T>> stream() {
        return nodes.stream();
    }

    @Override
    public Iterator<Node<Q, T>> iterator() {
        return asList().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeCollection<?, ?> that = (NodeCollection<?, ?>) o;
        return nodes.equals(that.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    /** Renderings of all nodes, concatenated in order. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        nodes.forEach(sb::append);
        return sb.toString();
    }
}
