package com.disassembly.composition;

/**
 * Selects where a tree read starts: one product, or every base product.
 */
public record RootSelector(Long nodeId) {

    private static final RootSelector ALL_ROOTS = new RootSelector(null);

    public static RootSelector node(Long nodeId) {
        if (nodeId == null) {
            throw new IllegalArgumentException("Node id is required");
        }
        return new RootSelector(nodeId);
    }

    public static RootSelector allRoots() {
        return ALL_ROOTS;
    }

    public boolean isAllRoots() {
        return nodeId == null;
    }
}
