package com.treeds.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.treeds.tree.Tree;

import java.io.IOException;
import java.util.Optional;

/** Writes {@code {"name": ..., "nodes": [...]}}; {@code name} is omitted for unnamed trees. */
final class TreeSerializer extends StdSerializer<Tree<?, ?>> {

    private final NodeSerializer nodeSerializer;

    TreeSerializer(NodeSerializer nodeSerializer) {
        super(Tree.class, false);
        this.nodeSerializer = nodeSerializer;
    }

    @Override
    public void serialize(Tree<?, ?> tree, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        Optional<String> name = tree.getName();
        if (name.isPresent()) {
            gen.writeStringField(JsonFields.NAME, name.get());
        }
        gen.writeFieldName(JsonFields.NODES);
        nodeSerializer.serializeAll(tree.getNodes(), gen, provider);
        gen.writeEndObject();
    }
}
