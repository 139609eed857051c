package com.treeds.tree;

import com.treeds.error.InvalidOperationException;
import com.treeds.error.NodeNotFoundException;
import com.treeds.node.Node;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeRemovalTest {

    /** 1 -> {2, 3}, 2 -> {4, 5}, 3 -> {6}. */
    private static Tree<Integer, Integer> sample() {
        Tree<Integer, Integer> tree = new Tree<>("Sample Tree");
        tree.addNode(new Node<>(1, 10));
        tree.addNode(new Node<>(2, 20), 1);
        tree.addNode(new Node<>(3, 30), 1);
        tree.addNode(new Node<>(4, 40), 2);
        tree.addNode(new Node<>(5, 50), 2);
        tree.addNode(new Node<>(6, 60), 3);
        return tree;
    }

    private static List<Integer> ids(Tree<Integer, Integer> tree) {
        return tree.getNodes().stream().map(Node::getId).collect(Collectors.toList());
    }

    @Test
    void retainChildren_onChainReparentsGrandchild() {
        Tree<Integer, Integer> tree = new Tree<>("Sample Tree");
        tree.addNode(new Node<>(1, 2));
        tree.addNode(new Node<>(2, 3), 1);
        tree.addNode(new Node<>(3, 6), 2);

        tree.removeNode(2, NodeRemovalStrategy.RETAIN_CHILDREN);

        assertEquals(List.of(1, 3), ids(tree));
        assertEquals(Optional.of(1), tree.getNodeById(3).orElseThrow().getParentId());
        assertEquals(List.of(3), tree.getNodeById(1).orElseThrow().getChildrenIds());
    }

    @Test
    void retainChildren_appendsChildrenToParent() {
        Tree<Integer, Integer> tree = sample();
        Node<Integer, Integer> removed = tree.getNodeById(2).orElseThrow();

        tree.removeNode(2, NodeRemovalStrategy.RETAIN_CHILDREN);

        assertEquals(5, tree.getNodes().size());
        assertTrue(tree.getNodeById(2).isEmpty());
        assertEquals(List.of(3, 4, 5), tree.getNodeById(1).orElseThrow().getChildrenIds());
        assertEquals(Optional.of(1), tree.getNodeById(4).orElseThrow().getParentId());
        assertEquals(Optional.of(1), tree.getNodeById(5).orElseThrow().getParentId());
        assertTrue(removed.getChildrenIds().isEmpty());
        assertTrue(removed.getParentId().isEmpty());
    }

    @Test
    void retainChildren_rootRejected() {
        Tree<Integer, Integer> tree = sample();

        InvalidOperationException ex = assertThrows(InvalidOperationException.class,
                () -> tree.removeNode(1, NodeRemovalStrategy.RETAIN_CHILDREN));
        assertEquals("Cannot remove root node with RetainChildren strategy", ex.getMessage());
        assertEquals(6, tree.getNodes().size());
    }

    @Test
    void removeWithChildren_dropsWholeSubtree() {
        Tree<Integer, Integer> tree = sample();

        tree.removeNode(2, NodeRemovalStrategy.REMOVE_NODE_AND_CHILDREN);

        assertEquals(List.of(1, 3, 6), ids(tree));
        assertEquals(List.of(3), tree.getNodeById(1).orElseThrow().getChildrenIds());
    }

    @Test
    void removeWithChildren_rootEmptiesTree() {
        Tree<Integer, Integer> tree = sample();

        tree.removeNode(1, NodeRemovalStrategy.REMOVE_NODE_AND_CHILDREN);

        assertTrue(tree.getNodes().isEmpty());
        assertTrue(tree.getRootNode().isEmpty());
    }

    @Test
    void removeWithChildren_leafRemovesOne() {
        Tree<Integer, Integer> tree = sample();

        tree.removeNode(6, NodeRemovalStrategy.REMOVE_NODE_AND_CHILDREN);

        assertEquals(5, tree.getNodes().size());
        assertTrue(tree.getNodeById(3).orElseThrow().getChildrenIds().isEmpty());
    }

    @Test
    void removeWithChildren_danglingChildLeavesTreeUntouched() {
        Tree<Integer, Integer> tree = sample();
        tree.getNodeById(3).orElseThrow().addChild(new Node<>(99, 0));

        assertThrows(NodeNotFoundException.class,
                () -> tree.removeNode(1, NodeRemovalStrategy.REMOVE_NODE_AND_CHILDREN));
        assertEquals(6, tree.getNodes().size());
        assertEquals(List.of(2, 3), tree.getNodeById(1).orElseThrow().getChildrenIds());
    }

    @ParameterizedTest
    @EnumSource(NodeRemovalStrategy.class)
    void missingNodeRejected(NodeRemovalStrategy strategy) {
        Tree<Integer, Integer> tree = sample();

        NodeNotFoundException ex = assertThrows(NodeNotFoundException.class, () -> tree.removeNode(9, strategy));
        assertEquals("9", ex.getNodeId());
        assertEquals(6, tree.getNodes().size());
    }
}
