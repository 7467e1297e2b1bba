package com.disassembly.composition;

import com.disassembly.composition.exception.IncompatibleUnitsException;
import com.disassembly.composition.exception.InvariantViolationException;
import com.disassembly.model.enums.Unit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BillOfMaterialsAggregatorTest {

    private static final UUID OWNER = UUID.fromString("00000000-0000-0000-0000-000000000001");

    private static NodeRecord node(Long id, Long parentId, Integer amount, MaterialLine... lines) {
        return new NodeRecord(id, parentId, OWNER, null, "node-" + id, null, null, null, amount, List.of(lines));
    }

    @Test
    void multipliesQuantitiesAlongThePath() {
        // Chair -> 2 x Seat -> 3 x Cushion (0.5 kg of material 1 each)
        CompositionArena arena = new CompositionArena();
        arena.addTop(node(1L, null, null));
        arena.addChild(node(2L, 1L, 2));
        arena.addChild(node(3L, 2L, 3, MaterialLine.of(1L, 0.5)));

        List<MaterialTotal> totals = BillOfMaterialsAggregator.rollUp(arena, 1L);

        assertThat(totals).hasSize(1);
        assertThat(totals.get(0).materialId()).isEqualTo(1L);
        assertThat(totals.get(0).quantity()).isCloseTo(3.0, within(1e-9));
        assertThat(totals.get(0).unit()).isEqualTo(Unit.KILOGRAM);
    }

    @Test
    void sumsTheSameMaterialAcrossNodes() {
        CompositionArena arena = new CompositionArena();
        arena.addTop(node(1L, null, null, MaterialLine.of(10L, 1.0)));
        arena.addChild(node(2L, 1L, 4, MaterialLine.of(10L, 0.25), MaterialLine.of(11L, 2.0)));
        arena.addChild(node(3L, 1L, 1, MaterialLine.of(11L, 1.0)));

        List<MaterialTotal> totals = BillOfMaterialsAggregator.rollUp(arena, 1L);

        assertThat(totals).extracting(MaterialTotal::materialId).containsExactly(10L, 11L);
        assertThat(totals.get(0).quantity()).isCloseTo(2.0, within(1e-9));
        assertThat(totals.get(1).quantity()).isCloseTo(9.0, within(1e-9));
    }

    @Test
    void leafRootReturnsItsOwnLines() {
        CompositionArena arena = new CompositionArena();
        arena.addTop(node(1L, null, null, MaterialLine.of(5L, 1.25)));

        assertThat(BillOfMaterialsAggregator.rollUp(arena, 1L))
            .containsExactly(new MaterialTotal(5L, 1.25, Unit.KILOGRAM));
    }

    @Test
    void keepsTheUnitOfTheLines() {
        CompositionArena arena = new CompositionArena();
        arena.addTop(node(1L, null, null));
        arena.addChild(node(2L, 1L, 3, new MaterialLine(4L, 20.0, Unit.CENTIMETER)));

        assertThat(BillOfMaterialsAggregator.rollUp(arena, 1L))
            .containsExactly(new MaterialTotal(4L, 60.0, Unit.CENTIMETER));
    }

    @Test
    void mixedUnitsForOneMaterialAreRejected() {
        CompositionArena arena = new CompositionArena();
        arena.addTop(node(1L, null, null, new MaterialLine(4L, 1.0, Unit.KILOGRAM)));
        arena.addChild(node(2L, 1L, 1, new MaterialLine(4L, 200.0, Unit.GRAM)));

        assertThatThrownBy(() -> BillOfMaterialsAggregator.rollUp(arena, 1L))
            .isInstanceOf(IncompatibleUnitsException.class)
            .satisfies(ex -> {
                IncompatibleUnitsException iue = (IncompatibleUnitsException) ex;
                assertThat(iue.getMaterialId()).isEqualTo(4L);
                assertThat(iue.getUnits()).containsExactlyInAnyOrder(Unit.KILOGRAM, Unit.GRAM);
            });
    }

    @Test
    void storedCycleIsReportedAsInvariantViolation() {
        CompositionArena arena = new CompositionArena();
        arena.addTop(node(1L, null, null));
        arena.addChild(node(2L, 1L, 1, MaterialLine.of(1L, 1.0)));
        arena.addChild(node(3L, 2L, 1, MaterialLine.of(1L, 1.0)));
        // Corrupt row pointing back at 2
        arena.addChild(node(2L, 3L, 1, MaterialLine.of(1L, 1.0)));

        assertThatThrownBy(() -> BillOfMaterialsAggregator.rollUp(arena, 1L))
            .isInstanceOf(InvariantViolationException.class)
            .satisfies(ex -> assertThat(((InvariantViolationException) ex).getNodeId()).isEqualTo(2L));
    }

    @Test
    void storedComponentWithoutAmountIsReportedAsInvariantViolation() {
        CompositionArena arena = new CompositionArena();
        arena.addTop(node(1L, null, null));
        arena.addChild(node(2L, 1L, null, MaterialLine.of(1L, 1.0)));

        assertThatThrownBy(() -> BillOfMaterialsAggregator.rollUp(arena, 1L))
            .isInstanceOf(InvariantViolationException.class)
            .hasMessageContaining("amount in parent");
    }
}
