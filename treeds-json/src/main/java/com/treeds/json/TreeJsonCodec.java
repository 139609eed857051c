package com.treeds.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.treeds.node.Node;
import com.treeds.node.NodeOwnership;
import com.treeds.tree.Tree;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * JSON text for trees and single nodes:
 * <pre>
 * {"name":"Sample Tree","nodes":[{"node_id":1,"value":2,"children":[2],"parent":null}, ...]}
 * </pre>
 * {@code name} is omitted for unnamed trees; {@code children} is omitted in {@link SerializationMode#COMPACT}
 * mode and rebuilt from parent ids on read. Decoding does not check tree invariants.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class TreeJsonCodec {

    private static final TreeJsonCodec FULL = new TreeJsonCodec(SerializationMode.FULL, NodeOwnership.SINGLE_THREADED);
    private static final TreeJsonCodec COMPACT = new TreeJsonCodec(SerializationMode.COMPACT, NodeOwnership.SINGLE_THREADED);

    private final SerializationMode mode;
    private final ObjectMapper mapper;

    public TreeJsonCodec(SerializationMode mode, NodeOwnership ownership) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.mapper = new ObjectMapper().registerModule(new TreeJsonModule(mode, ownership));
    }

    /** Writes children lists; nodes read are single-threaded. */
    public static TreeJsonCodec full() {
        return FULL;
    }

    /** Omits children lists; nodes read are single-threaded. */
    public static TreeJsonCodec compact() {
        return COMPACT;
    }

    public SerializationMode getMode() {
        return mode;
    }

    /**
     * Serializes the tree to a single-line JSON string.
     *
     * @throws UncheckedIOException on serialization failure (e.g. a value Jackson cannot write)
     */
    public String toJson(Tree<?, ?> tree) {
        try {
            return mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes the tree to a pretty-printed JSON string.
     */
    public String toJsonPretty(Tree<?, ?> tree) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Deserializes a tree whose ids and values are plain classes.
     *
     * @throws UncheckedIOException on malformed JSON or a record that does not match the types
     */
    public <Q, T> Tree<Q, T> fromJson(String json, Class<Q> idType, Class<T> valueType) {
        JavaType type = mapper.getTypeFactory().constructParametricType(Tree.class, idType, valueType);
        try {
            return mapper.readValue(json, type);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Deserializes a tree with generic id or value types, e.g. {@code new TypeReference<Tree<Long, List<String>>>() {}}.
     */
    public <Q, T> Tree<Q, T> fromJson(String json, TypeReference<Tree<Q, T>> type) {
        try {
            return mapper.readValue(json, type);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String nodeToJson(Node<?, ?> node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Deserializes one node record. Its children and parent ids are kept as stored.
     */
    public <Q, T> Node<Q, T> nodeFromJson(String json, Class<Q> idType, Class<T> valueType) {
        JavaType type = mapper.getTypeFactory().constructParametricType(Node.class, idType, valueType);
        try {
            return mapper.readValue(json, type);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
