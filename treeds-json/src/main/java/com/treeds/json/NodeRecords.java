package com.treeds.json;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.treeds.node.Node;
import com.treeds.node.NodeCollection;
import com.treeds.node.NodeOwnership;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns node records into nodes. Linkage is taken as stored: no id is checked against the other records.
 * A record without {@code children} (every record of a compact document, or some records of a mixed one)
 * gets its children rebuilt by walking the records in order and adding each one whose parent is such a
 * record.
 */
final class NodeRecords {

    private static final Logger log = LoggerFactory.getLogger(NodeRecords.class);

    private NodeRecords() {
    }

    static Node<Object, Object> readNode(JsonNode record, JavaType idType, JavaType valueType, NodeOwnership ownership,
                                         JsonDeserializer<?> source, DeserializationContext ctxt) throws IOException {
        return toNode(parse(record, idType, valueType, source, ctxt), ownership);
    }

    static NodeCollection<Object, Object> readCollection(JsonNode array, JavaType idType, JavaType valueType,
                                                         NodeOwnership ownership, JsonDeserializer<?> source,
                                                         DeserializationContext ctxt) throws IOException {
        if (array == null || !array.isArray()) {
            return ctxt.reportInputMismatch(source, "Expected JSON array of node records, got %s",
                    array == null ? "nothing" : array.getNodeType());
        }
        List<NodeRecord> records = new ArrayList<>(array.size());
        Set<Object> withoutChildren = new HashSet<>();
        for (JsonNode element : array) {
            NodeRecord record = parse(element, idType, valueType, source, ctxt);
            if (record.childrenIds == null) {
                withoutChildren.add(record.id);
            }
            records.add(record);
        }

        NodeCollection<Object, Object> nodes = new NodeCollection<>();
        for (NodeRecord record : records) {
            nodes.push(toNode(record, ownership));
        }
        if (!withoutChildren.isEmpty()) {
            rebuildChildren(nodes, withoutChildren);
        }
        if (log.isDebugEnabled()) {
            log.debug("Json readCollection | records={} | withoutChildren={}", records.size(), withoutChildren.size());
        }
        return nodes;
    }

    /** Fills the children of every node whose record had no children list, walking the nodes in order. */
    private static void rebuildChildren(NodeCollection<Object, Object> nodes, Set<Object> withoutChildren) {
        for (Node<Object, Object> node : nodes) {
            Optional<Object> parentId = node.getParentId();
            if (parentId.isEmpty()) continue;
            Optional<Node<Object, Object>> parent = nodes.getById(parentId.get());
            if (parent.isEmpty() || parent.get() == node) {
                log.warn("Json rebuildChildren | parent not found | nodeId={} | parentId={}", node.getId(), parentId.get());
                continue;
            }
            if (withoutChildren.contains(parentId.get())) {
                parent.get().addChild(node);
            }
        }
    }

    private static Node<Object, Object> toNode(NodeRecord record, NodeOwnership ownership) {
        List<Object> children = record.childrenIds != null ? record.childrenIds : List.of();
        return Node.restore(record.id, record.value, ownership, children, record.parentId);
    }

    private static NodeRecord parse(JsonNode record, JavaType idType, JavaType valueType,
                                    JsonDeserializer<?> source, DeserializationContext ctxt) throws IOException {
        if (record == null || !record.isObject()) {
            return ctxt.reportInputMismatch(source, "Expected JSON object as node record, got %s",
                    record == null ? "nothing" : record.getNodeType());
        }
        Object id = readValue(record.get(JsonFields.NODE_ID), idType, ctxt);
        if (id == null) {
            return ctxt.reportInputMismatch(source, "Node record without '%s': %s", JsonFields.NODE_ID, record);
        }
        Object value = readValue(record.get(JsonFields.VALUE), valueType, ctxt);
        Object parentId = readValue(record.get(JsonFields.PARENT), idType, ctxt);

        List<Object> childrenIds = null;
        JsonNode children = record.get(JsonFields.CHILDREN);
        if (children != null && !children.isNull()) {
            if (!children.isArray()) {
                return ctxt.reportInputMismatch(source, "'%s' of node %s must be an array", JsonFields.CHILDREN, id);
            }
            childrenIds = new ArrayList<>(children.size());
            for (JsonNode child : children) {
                Object childId = readValue(child, idType, ctxt);
                if (childId == null) {
                    return ctxt.reportInputMismatch(source, "Null child id in node %s", id);
                }
                childrenIds.add(childId);
            }
        }
        return new NodeRecord(id, value, childrenIds, parentId);
    }

    private static Object readValue(JsonNode node, JavaType type, DeserializationContext ctxt) throws IOException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return ctxt.readTreeAsValue(node, type);
    }

    private static final class NodeRecord {
        private final Object id;
        private final Object value;
        private final List<Object> childrenIds;
        private final Object parentId;

        private NodeRecord(Object id, Object value, List<Object> childrenIds, Object parentId) {
            this.id = id;
            this.value = value;
            this.childrenIds = childrenIds;
            this.parentId = parentId;
        }
    }
}
