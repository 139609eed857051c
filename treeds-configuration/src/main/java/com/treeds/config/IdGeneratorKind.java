package com.treeds.config;

/** Which {@link com.treeds.node.id.IdentifierGenerator} the bootstrap wires in. */
public enum IdGeneratorKind {
    /** Microseconds since the epoch, strictly increasing. */
    EPOCH,
    /** Counter starting at {@code TREEDS_ID_SEQUENCE_START}. */
    SEQUENTIAL
}
