package com.treeds.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.treeds.node.Node;
import com.treeds.node.NodeOwnership;

import java.io.IOException;

/** Reads a single node record; children and parent ids are kept as stored. */
final class NodeDeserializer extends TypedNodeDeserializer<Node<?, ?>> {

    NodeDeserializer(NodeOwnership ownership) {
        this(null, null, ownership);
    }

    private NodeDeserializer(JavaType idType, JavaType valueType, NodeOwnership ownership) {
        super(Node.class, idType, valueType, ownership);
    }

    @Override
    protected NodeDeserializer withTypes(JavaType idType, JavaType valueType) {
        return new NodeDeserializer(idType, valueType, ownership);
    }

    @Override
    public Node<?, ?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        return NodeRecords.readNode(ctxt.readTree(p), idType, valueType, ownership, this, ctxt);
    }
}
