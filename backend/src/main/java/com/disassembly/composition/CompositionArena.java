package com.disassembly.composition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loaded slice of the product forest: node records indexed by ID plus a parent-to-children index.
 * Nodes link to each other through IDs only.
 */
public class CompositionArena {

    private final Map<Long, NodeRecord> nodes = new LinkedHashMap<>();
    private final Map<Long, List<Long>> childIndex = new LinkedHashMap<>();
    private final List<Long> topIds = new ArrayList<>();

    /**
     * Register a node where a read starts.
     */
    public void addTop(NodeRecord record) {
        nodes.putIfAbsent(record.id(), record);
        topIds.add(record.id());
    }

    /**
     * Register a node under its parent. Returns false when the node was already present, which
     * only happens for corrupt, cyclic data.
     */
    public boolean addChild(NodeRecord record) {
        childIndex.computeIfAbsent(record.parentId(), k -> new ArrayList<>()).add(record.id());
        return nodes.putIfAbsent(record.id(), record) == null;
    }

    /**
     * Drop a child from its parent's index, e.g. to see the parent as it would look after a delete.
     * The child's own record stays loaded.
     */
    public void detachChild(Long parentId, Long childId) {
        List<Long> children = childIndex.get(parentId);
        if (children != null) {
            children.remove(childId);
        }
    }

    public NodeRecord get(Long id) {
        return nodes.get(id);
    }

    public boolean contains(Long id) {
        return nodes.containsKey(id);
    }

    public List<Long> childrenOf(Long id) {
        return Collections.unmodifiableList(childIndex.getOrDefault(id, List.of()));
    }

    public List<Long> topIds() {
        return Collections.unmodifiableList(topIds);
    }

    public Set<Long> allIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Tree view of a loaded node, for validation. Children resolve through the arena on access.
     */
    public TreeNode treeNode(Long id) {
        NodeRecord record = nodes.get(id);
        if (record == null) {
            throw new IllegalArgumentException("Node " + id + " is not loaded");
        }
        return new ArenaNode(record);
    }

    private final class ArenaNode implements TreeNode {

        private final NodeRecord record;

        private ArenaNode(NodeRecord record) {
            this.record = record;
        }

        @Override
        public Long id() {
            return record.id();
        }

        @Override
        public String name() {
            return record.name();
        }

        @Override
        public Integer amountInParent() {
            return record.amountInParent();
        }

        @Override
        public List<MaterialLine> billOfMaterials() {
            return record.billOfMaterials();
        }

        @Override
        public List<? extends TreeNode> components() {
            return childrenOf(record.id()).stream()
                .filter(nodes::containsKey)
                .map(childId -> new ArenaNode(nodes.get(childId)))
                .toList();
        }
    }
}
