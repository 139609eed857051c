package com.treeds.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import com.treeds.node.Node;
import com.treeds.node.NodeCollection;
import com.treeds.node.NodeOwnership;
import com.treeds.tree.Tree;

import java.util.Objects;

/**
 * Jackson module for {@link Tree}, {@link NodeCollection} and {@link Node}. Register it on any
 * {@code ObjectMapper} to embed trees in other documents:
 * <pre>
 * ObjectMapper mapper = new ObjectMapper().registerModule(new TreeJsonModule(SerializationMode.COMPACT));
 * Tree&lt;Long, String&gt; tree = mapper.readValue(json, new TypeReference&lt;Tree&lt;Long, String&gt;&gt;() {});
 * </pre>
 */
public final class TreeJsonModule extends SimpleModule {

    private final SerializationMode mode;
    private final NodeOwnership ownership;

    public TreeJsonModule() {
        this(SerializationMode.FULL);
    }

    public TreeJsonModule(SerializationMode mode) {
        this(mode, NodeOwnership.SINGLE_THREADED);
    }

    /**
     * @param mode      record layout used when writing
     * @param ownership ownership given to every node read
     */
    public TreeJsonModule(SerializationMode mode, NodeOwnership ownership) {
        super("TreeJsonModule");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.ownership = Objects.requireNonNull(ownership, "ownership");

        NodeSerializer nodeSerializer = new NodeSerializer(mode);
        addSerializer(nodeSerializer);
        addSerializer(new NodeCollectionSerializer(nodeSerializer));
        addSerializer(new TreeSerializer(nodeSerializer));
        addDeserializer(Node.class, new NodeDeserializer(ownership));
        addDeserializer(NodeCollection.class, new NodeCollectionDeserializer(ownership));
        addDeserializer(Tree.class, new TreeDeserializer(ownership));
    }

    public SerializationMode getMode() {
        return mode;
    }

    public NodeOwnership getOwnership() {
        return ownership;
    }
}
