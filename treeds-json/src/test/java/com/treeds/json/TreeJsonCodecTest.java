package com.treeds.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.treeds.node.Node;
import com.treeds.node.NodeOwnership;
import com.treeds.tree.Tree;
import com.treeds.tree.TraversalStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeJsonCodecTest {

    private static final String FULL_JSON = "{\"nodes\":["
            + "{\"node_id\":1,\"value\":2,\"children\":[2],\"parent\":null},"
            + "{\"node_id\":2,\"value\":3,\"children\":[3,4],\"parent\":1},"
            + "{\"node_id\":3,\"value\":6,\"children\":[5],\"parent\":2},"
            + "{\"node_id\":4,\"value\":5,\"children\":[],\"parent\":2},"
            + "{\"node_id\":5,\"value\":6,\"children\":[],\"parent\":3}]}";

    private static final String COMPACT_JSON = "{\"nodes\":["
            + "{\"node_id\":1,\"value\":2,\"parent\":null},"
            + "{\"node_id\":2,\"value\":3,\"parent\":1},"
            + "{\"node_id\":3,\"value\":6,\"parent\":2},"
            + "{\"node_id\":4,\"value\":5,\"parent\":2},"
            + "{\"node_id\":5,\"value\":6,\"parent\":3}]}";

    /** 1 -> 2, 2 -> {3, 4}, 3 -> 5. */
    private static Tree<Integer, Integer> sample(String name) {
        Tree<Integer, Integer> tree = new Tree<>(name);
        tree.addNode(new Node<>(1, 2));
        tree.addNode(new Node<>(2, 3), 1);
        tree.addNode(new Node<>(3, 6), 2);
        tree.addNode(new Node<>(4, 5), 2);
        tree.addNode(new Node<>(5, 6), 3);
        return tree;
    }

    @Test
    void toJson_fullLayout() {
        assertEquals(FULL_JSON, TreeJsonCodec.full().toJson(sample(null)));
    }

    @Test
    void toJson_compactLayout() {
        assertEquals(COMPACT_JSON, TreeJsonCodec.compact().toJson(sample(null)));
    }

    @Test
    void toJson_namedTreeStartsWithName() {
        String json = TreeJsonCodec.full().toJson(sample("Sample Tree"));

        assertTrue(json.startsWith("{\"name\":\"Sample Tree\",\"nodes\":["));
    }

    @Test
    void fromJson_full() {
        Tree<Integer, Integer> tree = TreeJsonCodec.full().fromJson(FULL_JSON, Integer.class, Integer.class);

        assertEquals(sample(null), tree);
        assertEquals(sample(null).structuralHash(), tree.structuralHash());
        assertTrue(tree.getName().isEmpty());
    }

    @Test
    void fromJson_compactRebuildsChildren() {
        Tree<Integer, Integer> tree = TreeJsonCodec.compact().fromJson(COMPACT_JSON, Integer.class, Integer.class);

        assertEquals(sample(null), tree);
        assertEquals(sample(null).structuralHash(), tree.structuralHash());
        assertEquals(List.of(3, 4), tree.getNodeById(2).orElseThrow().getChildrenIds());
        assertEquals(List.of(1, 2, 3, 5, 4), tree.traverse(1, TraversalStrategy.PRE_ORDER));
    }

    @Test
    void fromJson_eitherCodecReadsEitherLayout() {
        Tree<Integer, Integer> fromCompact = TreeJsonCodec.full().fromJson(COMPACT_JSON, Integer.class, Integer.class);
        Tree<Integer, Integer> fromFull = TreeJsonCodec.compact().fromJson(FULL_JSON, Integer.class, Integer.class);

        assertEquals(fromFull.structuralHash(), fromCompact.structuralHash());
    }

    @Test
    void fromJson_compactChildOrderFollowsRecordOrder() {
        String json = "{\"nodes\":["
                + "{\"node_id\":1,\"value\":0,\"parent\":null},"
                + "{\"node_id\":9,\"value\":0,\"parent\":1},"
                + "{\"node_id\":4,\"value\":0,\"parent\":1},"
                + "{\"node_id\":7,\"value\":0,\"parent\":1}]}";

        Tree<Integer, Integer> tree = TreeJsonCodec.compact().fromJson(json, Integer.class, Integer.class);

        assertEquals(List.of(9, 4, 7), tree.getNodeById(1).orElseThrow().getChildrenIds());
    }

    @Test
    void fromJson_compactChildBeforeParentStillLinked() {
        String json = "{\"nodes\":["
                + "{\"node_id\":2,\"value\":0,\"parent\":1},"
                + "{\"node_id\":1,\"value\":0,\"parent\":null}]}";

        Tree<Integer, Integer> tree = TreeJsonCodec.compact().fromJson(json, Integer.class, Integer.class);

        assertEquals(List.of(2), tree.getNodeById(1).orElseThrow().getChildrenIds());
        assertEquals(1, tree.getRootNode().orElseThrow().getId());
    }

    @Test
    void fromJson_danglingParentKeptAsIs() {
        String json = "{\"nodes\":["
                + "{\"node_id\":1,\"value\":0,\"parent\":null},"
                + "{\"node_id\":2,\"value\":0,\"parent\":42}]}";

        Tree<Integer, Integer> tree = TreeJsonCodec.compact().fromJson(json, Integer.class, Integer.class);

        assertEquals(Optional.of(42), tree.getNodeById(2).orElseThrow().getParentId());
        assertTrue(tree.getNodeById(1).orElseThrow().getChildrenIds().isEmpty());
    }

    @Test
    void fromJson_mixedLayoutRebuildsOnlyRecordsWithoutChildren() {
        String json = "{\"nodes\":["
                + "{\"node_id\":1,\"value\":0,\"children\":[2],\"parent\":null},"
                + "{\"node_id\":2,\"value\":0,\"parent\":1},"
                + "{\"node_id\":3,\"value\":0,\"children\":[],\"parent\":2}]}";

        Tree<Integer, Integer> tree = TreeJsonCodec.full().fromJson(json, Integer.class, Integer.class);

        assertEquals(List.of(2), tree.getNodeById(1).orElseThrow().getChildrenIds());
        assertEquals(List.of(3), tree.getNodeById(2).orElseThrow().getChildrenIds());
        assertEquals(List.of(1, 2, 3), tree.traverse(1, TraversalStrategy.PRE_ORDER));
        assertEquals("1: 0\n└── 2: 0\n    └── 3: 0\n", tree.render());
    }

    @ParameterizedTest
    @EnumSource(SerializationMode.class)
    void roundTrip_namedTree(SerializationMode mode) {
        TreeJsonCodec codec = new TreeJsonCodec(mode, NodeOwnership.SINGLE_THREADED);
        Tree<Integer, Integer> tree = sample("Sample Tree");

        Tree<Integer, Integer> decoded = codec.fromJson(codec.toJson(tree), Integer.class, Integer.class);

        assertEquals(tree, decoded);
        assertEquals(tree.structuralHash(), decoded.structuralHash());
        assertEquals(tree.render(), decoded.render());
    }

    @ParameterizedTest
    @EnumSource(SerializationMode.class)
    void roundTrip_prettyPrinted(SerializationMode mode) {
        TreeJsonCodec codec = new TreeJsonCodec(mode, NodeOwnership.SINGLE_THREADED);
        Tree<Integer, Integer> tree = sample("Sample Tree");

        String pretty = codec.toJsonPretty(tree);

        assertTrue(pretty.contains("\n"));
        assertEquals(tree, codec.fromJson(pretty, Integer.class, Integer.class));
    }

    @Test
    void roundTrip_stringIdsAndNullValues() {
        Tree<String, String> tree = new Tree<>("docs");
        tree.addNode(new Node<>("root", "r"));
        tree.addNode(new Node<>("empty", null), "root");
        tree.addNode(new Node<>("leaf", "quoted \"text\""), "empty");

        String json = TreeJsonCodec.full().toJson(tree);
        Tree<String, String> decoded = TreeJsonCodec.full().fromJson(json, String.class, String.class);

        assertTrue(json.contains("{\"node_id\":\"empty\",\"value\":null,\"children\":[\"leaf\"],\"parent\":\"root\"}"));
        assertEquals(tree, decoded);
        assertTrue(decoded.getNodeById("empty").orElseThrow().getValue().isEmpty());
    }

    @Test
    void fromJson_typeReferenceWithGenericValues() {
        Tree<Long, List<String>> tree = new Tree<>("tags");
        tree.addNode(new Node<>(10L, List.of("a", "b")));
        tree.addNode(new Node<>(11L, List.of()), 10L);

        TreeJsonCodec codec = TreeJsonCodec.compact();
        Tree<Long, List<String>> decoded = codec.fromJson(codec.toJson(tree), new TypeReference<Tree<Long, List<String>>>() {
        });

        assertEquals(tree, decoded);
        assertEquals(Long.class, decoded.getRootNode().orElseThrow().getId().getClass());
        assertEquals(List.of(11L), decoded.getNodeById(10L).orElseThrow().getChildrenIds());
    }

    @Test
    void fromJson_ownershipAppliedToDecodedNodes() {
        TreeJsonCodec codec = new TreeJsonCodec(SerializationMode.FULL, NodeOwnership.THREAD_SHARED);

        Tree<Integer, Integer> tree = codec.fromJson(FULL_JSON, Integer.class, Integer.class);

        assertTrue(tree.getNodes().stream().allMatch(n -> n.getOwnership() == NodeOwnership.THREAD_SHARED));
    }

    @Test
    void fromJson_emptyNodeList() {
        Tree<Integer, Integer> tree = TreeJsonCodec.full().fromJson("{\"name\":\"x\",\"nodes\":[]}", Integer.class, Integer.class);

        assertEquals(Optional.of("x"), tree.getName());
        assertTrue(tree.getNodes().isEmpty());
    }

    @Test
    void fromJson_malformedInputRejected() {
        TreeJsonCodec codec = TreeJsonCodec.full();

        assertThrows(UncheckedIOException.class, () -> codec.fromJson("{\"nodes\":[", Integer.class, Integer.class));
        assertThrows(UncheckedIOException.class, () -> codec.fromJson("[]", Integer.class, Integer.class));
        assertThrows(UncheckedIOException.class, () -> codec.fromJson("{\"name\":\"x\"}", Integer.class, Integer.class));
        assertThrows(UncheckedIOException.class,
                () -> codec.fromJson("{\"nodes\":[{\"value\":1,\"parent\":null}]}", Integer.class, Integer.class));
        assertThrows(UncheckedIOException.class,
                () -> codec.fromJson("{\"nodes\":[{\"node_id\":\"abc\",\"value\":1}]}", Integer.class, Integer.class));
    }

    @Test
    void node_fullRecord() {
        Node<Integer, Integer> node = new Node<>(1, 2);

        String json = TreeJsonCodec.full().nodeToJson(node);

        assertEquals("{\"node_id\":1,\"value\":2,\"children\":[],\"parent\":null}", json);
        assertEquals(node, TreeJsonCodec.full().nodeFromJson(json, Integer.class, Integer.class));
    }

    @Test
    void node_compactRecordKeepsParent() {
        Node<Integer, Integer> parent = new Node<>(1, 2);
        Node<Integer, Integer> node = new Node<>(2, 3);
        parent.addChild(node);

        String json = TreeJsonCodec.compact().nodeToJson(node);
        Node<Integer, Integer> decoded = TreeJsonCodec.compact().nodeFromJson(json, Integer.class, Integer.class);

        assertEquals("{\"node_id\":2,\"value\":3,\"parent\":1}", json);
        assertEquals(Optional.of(1), decoded.getParentId());
        assertFalse(decoded.getParentId().isEmpty());
        assertTrue(decoded.getChildrenIds().isEmpty());
    }
}
