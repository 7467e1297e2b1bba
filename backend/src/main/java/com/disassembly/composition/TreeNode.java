package com.disassembly.composition;

import java.util.List;

/**
 * Read-only view of one node of a composition tree, either a candidate definition that is not yet
 * persisted or a snapshot loaded from the store. Children are values, never back-pointers.
 */
public interface TreeNode {

    /**
     * Persisted or declared ID; null for a brand-new node.
     */
    Long id();

    /**
     * Human-readable name used in error references.
     */
    String name();

    Integer amountInParent();

    List<MaterialLine> billOfMaterials();

    List<? extends TreeNode> components();
}
