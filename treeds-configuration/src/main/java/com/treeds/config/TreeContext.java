package com.treeds.config;

import com.treeds.json.TreeJsonCodec;
import com.treeds.node.id.IdentifierGenerator;
import com.treeds.node.id.NodeFactory;

/**
 * Components wired from a {@link TreeConfig} by {@link TreeBootstrap#initialize(TreeConfig)}.
 */
public final class TreeContext {

    private final TreeConfig config;
    private final IdentifierGenerator identifierGenerator;
    private final NodeFactory<Long> nodeFactory;
    private final TreeJsonCodec codec;

    TreeContext(TreeConfig config, IdentifierGenerator identifierGenerator, NodeFactory<Long> nodeFactory,
                TreeJsonCodec codec) {
        this.config = config;
        this.identifierGenerator = identifierGenerator;
        this.nodeFactory = nodeFactory;
        this.codec = codec;
    }

    public TreeConfig getConfig() {
        return config;
    }

    public IdentifierGenerator getIdentifierGenerator() {
        return identifierGenerator;
    }

    /** Creates {@code Long}-id nodes with the configured generator and ownership. */
    public NodeFactory<Long> getNodeFactory() {
        return nodeFactory;
    }

    /** Codec writing the configured layout and reading nodes with the configured ownership. */
    public TreeJsonCodec getCodec() {
        return codec;
    }
}
