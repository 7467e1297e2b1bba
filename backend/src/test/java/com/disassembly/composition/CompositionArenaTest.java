package com.disassembly.composition;

import com.disassembly.composition.exception.CompositionRuleException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompositionArenaTest {

    private final TreeInvariantValidator validator = new TreeInvariantValidator();

    private static NodeRecord node(Long id, Long parentId, Integer amount, List<MaterialLine> lines) {
        return new NodeRecord(id, parentId, null, null, "node-" + id, null, null, null, amount, lines);
    }

    private static CompositionArena seatWithOneCushion() {
        CompositionArena arena = new CompositionArena();
        arena.addTop(node(10L, 1L, 2, List.of()));
        arena.addChild(node(11L, 10L, 3, List.of(MaterialLine.of(1L, 0.5))));
        return arena;
    }

    @Test
    void treeNodeResolvesChildrenThroughTheArena() {
        TreeNode seat = seatWithOneCushion().treeNode(10L);

        assertThat(seat.name()).isEqualTo("node-10");
        assertThat(seat.amountInParent()).isEqualTo(2);
        assertThat(seat.components()).extracting(TreeNode::id).containsExactly(11L);
        assertThat(seat.components().get(0).billOfMaterials()).hasSize(1);
    }

    @Test
    void detachedChildIsNoLongerAComponent() {
        CompositionArena arena = seatWithOneCushion();

        arena.detachChild(10L, 11L);

        assertThat(arena.childrenOf(10L)).isEmpty();
        assertThat(arena.contains(11L)).isTrue();
        assertThat(arena.treeNode(10L).components()).isEmpty();
    }

    @Test
    void parentLeftEmptyByADetachFailsValidation() {
        CompositionArena arena = seatWithOneCushion();
        assertThatCode(() -> validator.checkComposition(arena.treeNode(10L), NodePosition.COMPONENT))
            .doesNotThrowAnyException();

        arena.detachChild(10L, 11L);

        assertThatThrownBy(() -> validator.checkComposition(arena.treeNode(10L), NodePosition.COMPONENT))
            .isInstanceOf(CompositionRuleException.class)
            .hasMessageContaining(CompositionRuleException.NON_EMPTY_COMPOSITION);
    }

    @Test
    void baseProductIsTheNodeWithoutParent() {
        assertThat(node(1L, null, null, List.of()).isBaseProduct()).isTrue();
        assertThat(node(10L, 1L, 2, List.of()).isBaseProduct()).isFalse();
    }

    @Test
    void unloadedNodeHasNoTreeView() {
        assertThatThrownBy(() -> seatWithOneCushion().treeNode(99L))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
