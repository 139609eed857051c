package com.treeds.node.id;

/**
 * Holder of the process-wide default generator used by {@link com.treeds.node.Node#withAutoId(Object)}.
 */
public final class IdentifierGenerators {

    private static final IdentifierGenerator DEFAULT = new EpochIdentifierGenerator();

    private IdentifierGenerators() {
    }

    public static IdentifierGenerator defaultGenerator() {
        return DEFAULT;
    }
}
