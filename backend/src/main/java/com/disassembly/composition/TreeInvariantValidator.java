package com.disassembly.composition;

import com.disassembly.composition.exception.CompositionRuleException;
import com.disassembly.composition.exception.CycleException;
import com.disassembly.composition.exception.IncompleteBomException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Structural checks over an in-memory composition tree.
 *
 * Rules:
 * - Acyclic: no declared ID appears twice and no node object contains itself
 * - Non-empty composition: every node has materials or components
 * - Amount in parent: null on the root, positive on every component
 * - Material lines: material set, positive finite quantity, no material twice on one node
 * - Leaf resolution: every node without components has a bill of materials
 *
 * Nothing here touches the store; callers run it before any write.
 */
@Component
public class TreeInvariantValidator {

    private static final String PATH_SEPARATOR = " > ";

    /**
     * Validate a whole tree whose top node sits at {@code position}.
     */
    public void validateTree(TreeNode root, NodePosition position) {
        validateTree(root, position, Set.of());
    }

    /**
     * Validate a whole tree that will be grafted below the given persisted ancestors.
     */
    public void validateTree(TreeNode root, NodePosition position, Set<Long> ancestorIds) {
        checkAcyclic(root, ancestorIds);
        checkCompositionRecursively(root, position, rootRef(root));
        checkLeavesResolve(root);
    }

    // ========================================================================
    // Acyclicity
    // ========================================================================

    public void checkAcyclic(TreeNode root) {
        checkAcyclic(root, Set.of());
    }

    /**
     * Walks the nesting with a visited-ID set seeded with {@code ancestorIds}, plus an identity set of
     * the nodes on the current path.
     */
    public void checkAcyclic(TreeNode root, Set<Long> ancestorIds) {
        Set<Long> seenIds = new HashSet<>(ancestorIds);
        Set<TreeNode> onPath = Collections.newSetFromMap(new IdentityHashMap<>());
        visitAcyclic(root, seenIds, onPath, rootRef(root));
    }

    private void visitAcyclic(TreeNode node, Set<Long> seenIds, Set<TreeNode> onPath, String path) {
        if (!onPath.add(node)) {
            throw new CycleException(nodeRef(node, path));
        }
        if (node.id() != null && !seenIds.add(node.id())) {
            throw new CycleException(nodeRef(node, path));
        }

        List<? extends TreeNode> children = node.components();
        for (int i = 0; i < children.size(); i++) {
            TreeNode child = children.get(i);
            visitAcyclic(child, seenIds, onPath, childPath(path, child, i));
        }
        onPath.remove(node);
    }

    // ========================================================================
    // Composition rules
    // ========================================================================

    /**
     * Checks the node itself, not its descendants.
     */
    public void checkComposition(TreeNode node, NodePosition position) {
        checkComposition(node, position, rootRef(node));
    }

    private void checkCompositionRecursively(TreeNode node, NodePosition position, String path) {
        checkComposition(node, position, path);

        List<? extends TreeNode> children = node.components();
        for (int i = 0; i < children.size(); i++) {
            TreeNode child = children.get(i);
            checkCompositionRecursively(child, NodePosition.COMPONENT, childPath(path, child, i));
        }
    }

    private void checkComposition(TreeNode node, NodePosition position, String path) {
        String ref = nodeRef(node, path);

        if (node.billOfMaterials().isEmpty() && node.components().isEmpty()) {
            throw new CompositionRuleException(ref, CompositionRuleException.NON_EMPTY_COMPOSITION,
                "A product must have at least one material or one component.");
        }

        Integer amount = node.amountInParent();
        if (position == NodePosition.ROOT) {
            if (amount != null) {
                throw new CompositionRuleException(ref, CompositionRuleException.ROOT_AMOUNT,
                    "A base product must not have an amount in parent.");
            }
        } else if (amount == null || amount <= 0) {
            throw new CompositionRuleException(ref, CompositionRuleException.COMPONENT_AMOUNT,
                "A component must have a positive amount in parent, got " + amount + ".");
        }

        Set<Long> materialIds = new HashSet<>();
        for (MaterialLine line : node.billOfMaterials()) {
            if (line == null || line.materialId() == null) {
                throw new CompositionRuleException(ref, CompositionRuleException.MATERIAL_LINE,
                    "Every bill-of-materials line needs a material.");
            }
            if (!(line.quantity() > 0) || Double.isInfinite(line.quantity())) {
                throw new CompositionRuleException(ref, CompositionRuleException.MATERIAL_LINE,
                    "Quantity of material " + line.materialId() + " must be a positive number, got "
                        + line.quantity() + ".");
            }
            if (!materialIds.add(line.materialId())) {
                throw new CompositionRuleException(ref, CompositionRuleException.DUPLICATE_MATERIAL,
                    "Material " + line.materialId() + " is listed more than once.");
            }
        }
    }

    // ========================================================================
    // Leaf resolution
    // ========================================================================

    public void checkLeavesResolve(TreeNode root) {
        visitLeaves(root, rootRef(root));
    }

    private void visitLeaves(TreeNode node, String path) {
        List<? extends TreeNode> children = node.components();
        if (children.isEmpty()) {
            if (node.billOfMaterials().isEmpty()) {
                throw new IncompleteBomException(nodeRef(node, path));
            }
            return;
        }
        for (int i = 0; i < children.size(); i++) {
            TreeNode child = children.get(i);
            visitLeaves(child, childPath(path, child, i));
        }
    }

    // ========================================================================
    // Node references
    // ========================================================================

    private static String rootRef(TreeNode node) {
        return node.name() != null ? node.name() : "<unnamed>";
    }

    private static String childPath(String parentPath, TreeNode child, int index) {
        String name = child.name() != null ? child.name() : "<unnamed>";
        return parentPath + PATH_SEPARATOR + name + "[" + index + "]";
    }

    private static String nodeRef(TreeNode node, String path) {
        return node.id() != null ? "id " + node.id() + " (" + path + ")" : path;
    }
}
