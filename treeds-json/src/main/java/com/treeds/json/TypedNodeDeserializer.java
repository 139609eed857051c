package com.treeds.json;

import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.treeds.node.NodeOwnership;

/**
 * Base for the deserializers of {@code Node<Q, T>}, {@code NodeCollection<Q, T>} and {@code Tree<Q, T>}.
 * The id and value types are taken from the declared type being read ({@code TypeReference}, property
 * type, or the parametric type built by {@link TreeJsonCodec}); when unknown they default to natural
 * JSON mapping ({@code Integer}, {@code String}, {@code Map}, ...).
 */
abstract class TypedNodeDeserializer<R> extends StdDeserializer<R> implements ContextualDeserializer {

    protected final JavaType idType;
    protected final JavaType valueType;
    protected final NodeOwnership ownership;

    protected TypedNodeDeserializer(Class<?> handledType, JavaType idType, JavaType valueType, NodeOwnership ownership) {
        super(handledType);
        this.idType = idType != null ? idType : TypeFactory.unknownType();
        this.valueType = valueType != null ? valueType : TypeFactory.unknownType();
        this.ownership = ownership;
    }

    protected abstract TypedNodeDeserializer<R> withTypes(JavaType idType, JavaType valueType);

    @Override
    public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) {
        JavaType type = ctxt.getContextualType();
        if (type == null && property != null) {
            type = property.getType();
        }
        if (type == null || type.containedTypeCount() < 2) {
            return this;
        }
        return withTypes(type.containedType(0), type.containedType(1));
    }
}
