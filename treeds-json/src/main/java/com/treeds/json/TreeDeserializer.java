package com.treeds.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.treeds.node.NodeCollection;
import com.treeds.node.NodeOwnership;
import com.treeds.tree.Tree;

import java.io.IOException;

/** Reads {@code {"name": ..., "nodes": [...]}}; {@code name} may be absent or null. */
final class TreeDeserializer extends TypedNodeDeserializer<Tree<?, ?>> {

    TreeDeserializer(NodeOwnership ownership) {
        this(null, null, ownership);
    }

    private TreeDeserializer(JavaType idType, JavaType valueType, NodeOwnership ownership) {
        super(Tree.class, idType, valueType, ownership);
    }

    @Override
    protected TreeDeserializer withTypes(JavaType idType, JavaType valueType) {
        return new TreeDeserializer(idType, valueType, ownership);
    }

    @Override
    public Tree<?, ?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = ctxt.readTree(p);
        if (!root.isObject()) {
            return ctxt.reportInputMismatch(this, "Expected JSON object for tree, got %s", root.getNodeType());
        }
        JsonNode nameNode = root.get(JsonFields.NAME);
        String name = null;
        if (nameNode != null && !nameNode.isNull()) {
            if (!nameNode.isTextual()) {
                return ctxt.reportInputMismatch(this, "'%s' must be a string, got %s", JsonFields.NAME, nameNode.getNodeType());
            }
            name = nameNode.textValue();
        }
        NodeCollection<Object, Object> nodes =
                NodeRecords.readCollection(root.get(JsonFields.NODES), idType, valueType, ownership, this, ctxt);
        return Tree.of(name, nodes);
    }
}
