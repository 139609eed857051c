package com.treeds.config;

import com.treeds.json.TreeJsonCodec;
import com.treeds.node.id.IdentifierGenerator;
import com.treeds.node.id.IdentifierGenerators;
import com.treeds.node.id.NodeFactory;
import com.treeds.node.id.SequentialIdentifierGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wires the id generator, node factory and JSON codec from configuration.
 */
public final class TreeBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TreeBootstrap.class);

    private TreeBootstrap() {
    }

    /** Loads {@link TreeConfig#fromEnvironment()} and wires from it. */
    public static TreeContext initialize() {
        log.info("Bootstrap: loading tree configuration from environment");
        return initialize(TreeConfig.fromEnvironment());
    }

    /**
     * EPOCH uses the process-wide default generator, so ids stay unique across contexts; SEQUENTIAL gets
     * a fresh counter per context.
     */
    public static TreeContext initialize(TreeConfig config) {
        Objects.requireNonNull(config, "config");
        IdentifierGenerator generator;
        switch (config.getIdGenerator()) {
            case SEQUENTIAL:
                generator = new SequentialIdentifierGenerator(config.getIdSequenceStart());
                break;
            case EPOCH:
            default:
                generator = IdentifierGenerators.defaultGenerator();
                break;
        }
        NodeFactory<Long> nodeFactory = new NodeFactory<>(generator, Long::valueOf, config.getNodeOwnership());
        TreeJsonCodec codec = new TreeJsonCodec(config.getSerializationMode(), config.getNodeOwnership());
        log.info("Bootstrap: tree context ready; serializationMode={}, nodeOwnership={}, idGenerator={}",
                config.getSerializationMode(), config.getNodeOwnership(), config.getIdGenerator());
        return new TreeContext(config, generator, nodeFactory, codec);
    }
}
