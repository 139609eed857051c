package com.treeds.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.treeds.node.Node;

import java.io.IOException;

/**
 * Writes one node record. Ids and values go through the provider, so any type Jackson can write is
 * supported; absent values and parents are written as {@code null}.
 */
final class NodeSerializer extends StdSerializer<Node<?, ?>> {

    private final SerializationMode mode;

    NodeSerializer(SerializationMode mode) {
        super(Node.class, false);
        this.mode = mode;
    }

    @Override
    public void serialize(Node<?, ?> node, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(JsonFields.NODE_ID);
        provider.defaultSerializeValue(node.getId(), gen);
        gen.writeFieldName(JsonFields.VALUE);
        provider.defaultSerializeValue(node.getValue().orElse(null), gen);
        if (mode == SerializationMode.FULL) {
            gen.writeFieldName(JsonFields.CHILDREN);
            gen.writeStartArray();
            for (Object childId : node.getChildrenIds()) {
                provider.defaultSerializeValue(childId, gen);
            }
            gen.writeEndArray();
        }
        gen.writeFieldName(JsonFields.PARENT);
        provider.defaultSerializeValue(node.getParentId().orElse(null), gen);
        gen.writeEndObject();
    }

    void serializeAll(Iterable<? extends Node<?, ?>> nodes, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartArray();
        for (Node<?, ?> node : nodes) {
            serialize(node, gen, provider);
        }
        gen.writeEndArray();
    }
}
