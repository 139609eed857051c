package com.treeds.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.treeds.node.NodeCollection;

import java.io.IOException;

/** Writes a node collection as a JSON array of node records. */
final class NodeCollectionSerializer extends StdSerializer<NodeCollection<?, ?>> {

    private final NodeSerializer nodeSerializer;

    NodeCollectionSerializer(NodeSerializer nodeSerializer) {
        super(NodeCollection.class, false);
        this.nodeSerializer = nodeSerializer;
    }

    @Override
    public void serialize(NodeCollection<?, ?> nodes, JsonGenerator gen, SerializerProvider provider) throws IOException {
        nodeSerializer.serializeAll(nodes, gen, provider);
    }
}
