package com.treeds.json;

/** Field names of the tree and node records. */
final class JsonFields {

    static final String NAME = "name";
    static final String NODES = "nodes";
    static final String NODE_ID = "node_id";
    static final String VALUE = "value";
    static final String CHILDREN = "children";
    static final String PARENT = "parent";

    private JsonFields() {
    }
}
