package com.treeds.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.treeds.node.NodeCollection;
import com.treeds.node.NodeOwnership;

import java.io.IOException;

/** Reads a JSON array of node records, rebuilding children for records stored without them. */
final class NodeCollectionDeserializer extends TypedNodeDeserializer<NodeCollection<?, ?>> {

    NodeCollectionDeserializer(NodeOwnership ownership) {
        this(null, null, ownership);
    }

    private NodeCollectionDeserializer(JavaType idType, JavaType valueType, NodeOwnership ownership) {
        super(NodeCollection.class, idType, valueType, ownership);
    }

    @Override
    protected NodeCollectionDeserializer withTypes(JavaType idType, JavaType valueType) {
        return new NodeCollectionDeserializer(idType, valueType, ownership);
    }

    @Override
    public NodeCollection<?, ?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        return NodeRecords.readCollection(ctxt.readTree(p), idType, valueType, ownership, this, ctxt);
    }
}
