package com.treeds.node;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeCollectionTest {

    private static NodeCollection<Integer, Integer> collectionOf(int... ids) {
        NodeCollection<Integer, Integer> nodes = new NodeCollection<>();
        for (int id : ids) {
            nodes.push(new Node<>(id, id * 10));
        }
        return nodes;
    }

    private static List<Integer> ids(NodeCollection<Integer, Integer> nodes) {
        return nodes.stream().map(Node::getId).collect(Collectors.toList());
    }

    @Test
    void push_appendsInOrder() {
        NodeCollection<Integer, Integer> nodes = collectionOf(3, 1, 2);

        assertEquals(List.of(3, 1, 2), ids(nodes));
        assertEquals(3, nodes.size());
    }

    @Test
    void get_outOfRangeIsEmpty() {
        NodeCollection<Integer, Integer> nodes = collectionOf(1, 2);

        assertEquals(2, nodes.get(1).orElseThrow().getId());
        assertTrue(nodes.get(2).isEmpty());
        assertTrue(nodes.get(-1).isEmpty());
    }

    @Test
    void getById_returnsSameHandle() {
        Node<Integer, Integer> node = new Node<>(5, 50);
        NodeCollection<Integer, Integer> nodes = collectionOf(1);
        nodes.push(node);

        assertSame(node, nodes.getById(5).orElseThrow());
        assertTrue(nodes.getById(9).isEmpty());
        assertTrue(nodes.getById(null).isEmpty());
        assertTrue(nodes.containsId(1));
    }

    @Test
    void remove_returnsNodeAtIndex() {
        NodeCollection<Integer, Integer> nodes = collectionOf(1, 2, 3);

        assertEquals(2, nodes.remove(1).getId());
        assertEquals(List.of(1, 3), ids(nodes));
        assertThrows(IndexOutOfBoundsException.class, () -> nodes.remove(5));
    }

    @Test
    void retain_keepsMatchingInOrder() {
        NodeCollection<Integer, Integer> nodes = collectionOf(1, 2, 3, 4, 5);

        nodes.retain(n -> n.getId() % 2 == 1);

        assertEquals(List.of(1, 3, 5), ids(nodes));
    }

    @Test
    void append_movesNodes() {
        NodeCollection<Integer, Integer> target = collectionOf(1);
        NodeCollection<Integer, Integer> source = collectionOf(2, 3);

        target.append(source);

        assertEquals(List.of(1, 2, 3), ids(target));
        assertTrue(source.isEmpty());
    }

    @Test
    void appendRaw_movesListContent() {
        NodeCollection<Integer, Integer> target = collectionOf(1);
        List<Node<Integer, Integer>> raw = new ArrayList<>(List.of(new Node<>(4, 0)));

        target.appendRaw(raw);

        assertEquals(List.of(1, 4), ids(target));
        assertTrue(raw.isEmpty());
    }

    @Test
    void clearAndFirst() {
        NodeCollection<Integer, Integer> nodes = collectionOf(7, 8);
        assertEquals(7, nodes.first().orElseThrow().getId());

        nodes.clear();

        assertTrue(nodes.isEmpty());
        assertEquals(Optional.empty(), nodes.first());
    }

    @Test
    void collector_andFrom_buildCollections() {
        NodeCollection<Integer, Integer> collected = Stream.of(new Node<>(1, 1), new Node<>(2, 2))
                .collect(NodeCollection.toNodeCollection());
        NodeCollection<Integer, Integer> copied = NodeCollection.from(collected);

        assertEquals(collected, copied);
        assertEquals(List.of(1, 2), ids(copied));
    }

    @Test
    void asList_isReadOnly() {
        NodeCollection<Integer, Integer> nodes = collectionOf(1);

        assertThrows(UnsupportedOperationException.class, () -> nodes.asList().clear());
    }

    @Test
    void toString_concatenatesNodes() {
        NodeCollection<Integer, Integer> nodes = new NodeCollection<>();
        nodes.push(new Node<>(1, 2));
        nodes.push(new Node<>(2, null));

        assertEquals("1: 22", nodes.toString());
    }
}
