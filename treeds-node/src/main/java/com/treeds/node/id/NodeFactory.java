package com.treeds.node.id;

import com.treeds.node.Node;
import com.treeds.node.NodeOwnership;

import java.util.Objects;
import java.util.function.LongFunction;

/**
 * Creates nodes with a fixed {@link NodeOwnership}, drawing ids from an {@link IdentifierGenerator} and
 * converting them to the tree's id type with a caller-supplied function (e.g. {@code Long::valueOf},
 * {@code Long::toString}).
 *
 * @param <Q> type of the node id
 */
public final class NodeFactory<Q> {

    private static final NodeFactory<Long> LONG_IDS =
            new NodeFactory<>(IdentifierGenerators.defaultGenerator(), Long::valueOf, NodeOwnership.SINGLE_THREADED);

    private final IdentifierGenerator generator;
    private final LongFunction<Q> idConverter;
    private final NodeOwnership ownership;

    public NodeFactory(IdentifierGenerator generator, LongFunction<Q> idConverter, NodeOwnership ownership) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.idConverter = Objects.requireNonNull(idConverter, "idConverter");
        this.ownership = Objects.requireNonNull(ownership, "ownership");
    }

    /** Single-threaded {@code Long} ids from the process-wide default generator. */
    public static NodeFactory<Long> longIds() {
        return LONG_IDS;
    }

    /** Node with the next generated id. */
    public <T> Node<Q, T> create(T value) {
        return new Node<>(nextId(), value, ownership);
    }

    /** Node with an explicit id and this factory's ownership. */
    public <T> Node<Q, T> create(Q id, T value) {
        return new Node<>(id, value, ownership);
    }

    public Q nextId() {
        Q id = idConverter.apply(generator.next());
        if (id == null) {
            throw new IllegalStateException("Id converter returned null");
        }
        return id;
    }

    public NodeOwnership getOwnership() {
        return ownership;
    }

    public IdentifierGenerator getGenerator() {
        return generator;
    }
}
