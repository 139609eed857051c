package com.treeds.config;

import com.treeds.json.SerializationMode;
import com.treeds.node.NodeOwnership;
import com.treeds.node.id.SequentialIdentifierGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Library settings loaded from environment variables.
 * <p>
 * TREEDS_SERIALIZATION_MODE: FULL or COMPACT (default FULL).
 * TREEDS_NODE_OWNERSHIP: SINGLE_THREADED or THREAD_SHARED (default SINGLE_THREADED).
 * TREEDS_ID_GENERATOR: EPOCH or SEQUENTIAL (default EPOCH); TREEDS_ID_SEQUENCE_START (default 1).
 * <p>
 * Unset or blank variables take the default; unparseable ones too, with a warning.
 */
public final class TreeConfig {

    private static final Logger log = LoggerFactory.getLogger(TreeConfig.class);

    static final String ENV_SERIALIZATION_MODE = "TREEDS_SERIALIZATION_MODE";
    static final String ENV_NODE_OWNERSHIP = "TREEDS_NODE_OWNERSHIP";
    static final String ENV_ID_GENERATOR = "TREEDS_ID_GENERATOR";
    static final String ENV_ID_SEQUENCE_START = "TREEDS_ID_SEQUENCE_START";

    private static final SerializationMode DEFAULT_SERIALIZATION_MODE = SerializationMode.FULL;
    private static final NodeOwnership DEFAULT_NODE_OWNERSHIP = NodeOwnership.SINGLE_THREADED;
    private static final IdGeneratorKind DEFAULT_ID_GENERATOR = IdGeneratorKind.EPOCH;
    private static final long DEFAULT_ID_SEQUENCE_START = SequentialIdentifierGenerator.DEFAULT_START;

    private final SerializationMode serializationMode;
    private final NodeOwnership nodeOwnership;
    private final IdGeneratorKind idGenerator;
    private final long idSequenceStart;

    private TreeConfig(Builder b) {
        this.serializationMode = b.serializationMode;
        this.nodeOwnership = b.nodeOwnership;
        this.idGenerator = b.idGenerator;
        this.idSequenceStart = b.idSequenceStart;
    }

    public static TreeConfig fromEnvironment() {
        return fromVariables(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reads from the given map. */
    public static TreeConfig fromVariables(Map<String, String> variables) {
        Objects.requireNonNull(variables, "variables");
        return builder()
                .serializationMode(parse(variables, ENV_SERIALIZATION_MODE, SerializationMode::fromValue, DEFAULT_SERIALIZATION_MODE))
                .nodeOwnership(parse(variables, ENV_NODE_OWNERSHIP, v -> NodeOwnership.valueOf(v.toUpperCase()), DEFAULT_NODE_OWNERSHIP))
                .idGenerator(parse(variables, ENV_ID_GENERATOR, v -> IdGeneratorKind.valueOf(v.toUpperCase()), DEFAULT_ID_GENERATOR))
                .idSequenceStart(parse(variables, ENV_ID_SEQUENCE_START, Long::parseLong, DEFAULT_ID_SEQUENCE_START))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static <E> E parse(Map<String, String> variables, String key, Function<String, E> parser, E defaultValue) {
        String value = variables.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return parser.apply(value.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for {}: '{}'; using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /** Record layout written by the codec (TREEDS_SERIALIZATION_MODE). Default FULL. */
    public SerializationMode getSerializationMode() {
        return serializationMode;
    }

    /** Ownership of nodes created by the factory and read by the codec (TREEDS_NODE_OWNERSHIP). */
    public NodeOwnership getNodeOwnership() {
        return nodeOwnership;
    }

    public IdGeneratorKind getIdGenerator() {
        return idGenerator;
    }

    /** First id of the sequential generator (TREEDS_ID_SEQUENCE_START). Ignored for EPOCH. */
    public long getIdSequenceStart() {
        return idSequenceStart;
    }

    @Override
    public String toString() {
        return "TreeConfig{serializationMode=" + serializationMode
                + ", nodeOwnership=" + nodeOwnership
                + ", idGenerator=" + idGenerator
                + ", idSequenceStart=" + idSequenceStart + '}';
    }

    public static final class Builder {
        private SerializationMode serializationMode = DEFAULT_SERIALIZATION_MODE;
        private NodeOwnership nodeOwnership = DEFAULT_NODE_OWNERSHIP;
        private IdGeneratorKind idGenerator = DEFAULT_ID_GENERATOR;
        private long idSequenceStart = DEFAULT_ID_SEQUENCE_START;

        public Builder serializationMode(SerializationMode serializationMode) {
            this.serializationMode = serializationMode != null ? serializationMode : DEFAULT_SERIALIZATION_MODE;
            return this;
        }

        public Builder nodeOwnership(NodeOwnership nodeOwnership) {
            this.nodeOwnership = nodeOwnership != null ? nodeOwnership : DEFAULT_NODE_OWNERSHIP;
            return this;
        }

        public Builder idGenerator(IdGeneratorKind idGenerator) {
            this.idGenerator = idGenerator != null ? idGenerator : DEFAULT_ID_GENERATOR;
            return this;
        }

        public Builder idSequenceStart(long idSequenceStart) {
            this.idSequenceStart = idSequenceStart;
            return this;
        }

        public TreeConfig build() {
            return new TreeConfig(this);
        }
    }
}
