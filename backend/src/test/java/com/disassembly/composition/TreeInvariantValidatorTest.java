package com.disassembly.composition;

import com.disassembly.composition.exception.CompositionRuleException;
import com.disassembly.composition.exception.CycleException;
import com.disassembly.composition.exception.IncompleteBomException;
import com.disassembly.composition.exception.TreeValidationException;
import com.disassembly.model.enums.Unit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeInvariantValidatorTest {

    private TreeInvariantValidator validator;

    @BeforeEach
    void setUp() {
        validator = new TreeInvariantValidator();
    }

    private static TreeDefinition leaf(String name, Integer amount, MaterialLine... lines) {
        return TreeDefinition.builder()
            .name(name)
            .amountInParent(amount)
            .billOfMaterials(List.of(lines))
            .build();
    }

    private static TreeDefinition chair() {
        TreeDefinition cushion = leaf("Cushion", 3, MaterialLine.of(1L, 0.5));
        TreeDefinition seat = TreeDefinition.builder()
            .name("Seat")
            .amountInParent(2)
            .components(List.of(cushion))
            .build();
        return TreeDefinition.builder()
            .name("Chair")
            .components(List.of(seat))
            .build();
    }

    @Test
    void validTreePasses() {
        assertThatCode(() -> validator.validateTree(chair(), NodePosition.ROOT))
            .doesNotThrowAnyException();
    }

    @Test
    void rootWithoutMaterialsOrComponentsIsRejected() {
        TreeDefinition empty = TreeDefinition.builder().name("Lamp").build();

        assertThatThrownBy(() -> validator.validateTree(empty, NodePosition.ROOT))
            .isInstanceOf(CompositionRuleException.class)
            .satisfies(ex -> {
                TreeValidationException tve = (TreeValidationException) ex;
                assertThat(tve.getConstraint()).isEqualTo(CompositionRuleException.NON_EMPTY_COMPOSITION);
                assertThat(tve.getNodeRef()).isEqualTo("Lamp");
            });
    }

    @Test
    void rootWithAmountInParentIsRejected() {
        TreeDefinition root = leaf("Lamp", 1, MaterialLine.of(1L, 1.0));

        assertThatThrownBy(() -> validator.validateTree(root, NodePosition.ROOT))
            .isInstanceOf(CompositionRuleException.class)
            .hasMessageContaining(CompositionRuleException.ROOT_AMOUNT);
    }

    @Test
    void componentWithoutPositiveAmountIsRejected() {
        TreeDefinition root = TreeDefinition.builder()
            .name("Chair")
            .components(List.of(leaf("Leg", 0, MaterialLine.of(1L, 1.0))))
            .build();

        assertThatThrownBy(() -> validator.validateTree(root, NodePosition.ROOT))
            .isInstanceOf(CompositionRuleException.class)
            .satisfies(ex -> {
                TreeValidationException tve = (TreeValidationException) ex;
                assertThat(tve.getConstraint()).isEqualTo(CompositionRuleException.COMPONENT_AMOUNT);
                assertThat(tve.getNodeRef()).isEqualTo("Chair > Leg[0]");
            });
    }

    @Test
    void componentDefinitionWithoutAmountIsRejectedAtComponentPosition() {
        TreeDefinition component = leaf("Leg", null, MaterialLine.of(1L, 1.0));

        assertThatThrownBy(() -> validator.validateTree(component, NodePosition.COMPONENT))
            .isInstanceOf(CompositionRuleException.class)
            .hasMessageContaining(CompositionRuleException.COMPONENT_AMOUNT);
    }

    @Test
    void nonPositiveOrNonFiniteQuantityIsRejected() {
        assertThatThrownBy(() -> validator.validateTree(leaf("Lamp", null, MaterialLine.of(1L, 0.0)), NodePosition.ROOT))
            .hasMessageContaining(CompositionRuleException.MATERIAL_LINE);
        assertThatThrownBy(() -> validator.validateTree(leaf("Lamp", null, MaterialLine.of(1L, Double.NaN)), NodePosition.ROOT))
            .hasMessageContaining(CompositionRuleException.MATERIAL_LINE);
        assertThatThrownBy(() -> validator.validateTree(
                leaf("Lamp", null, MaterialLine.of(1L, Double.POSITIVE_INFINITY)), NodePosition.ROOT))
            .hasMessageContaining(CompositionRuleException.MATERIAL_LINE);
    }

    @Test
    void lineWithoutMaterialIsRejected() {
        TreeDefinition root = leaf("Lamp", null, new MaterialLine(null, 1.0, Unit.KILOGRAM));

        assertThatThrownBy(() -> validator.validateTree(root, NodePosition.ROOT))
            .hasMessageContaining(CompositionRuleException.MATERIAL_LINE);
    }

    @Test
    void sameMaterialTwiceOnOneNodeIsRejected() {
        TreeDefinition root = leaf("Lamp", null, MaterialLine.of(1L, 1.0), MaterialLine.of(1L, 2.0));

        assertThatThrownBy(() -> validator.validateTree(root, NodePosition.ROOT))
            .hasMessageContaining(CompositionRuleException.DUPLICATE_MATERIAL);
    }

    @Test
    void sameMaterialOnDifferentNodesIsAllowed() {
        TreeDefinition root = TreeDefinition.builder()
            .name("Chair")
            .billOfMaterials(List.of(MaterialLine.of(1L, 1.0)))
            .components(List.of(leaf("Leg", 4, MaterialLine.of(1L, 0.2))))
            .build();

        assertThatCode(() -> validator.validateTree(root, NodePosition.ROOT)).doesNotThrowAnyException();
    }

    @Test
    void leafWithoutMaterialsFailsLeafResolution() {
        // Passes the per-node rules only because each node is checked on its own
        TreeNode root = new TestNode(null, "Chair", null, List.of(MaterialLine.of(1L, 1.0)),
            List.of(new TestNode(null, "Seat", 1, List.of(), List.of())));

        assertThatThrownBy(() -> validator.checkLeavesResolve(root))
            .isInstanceOf(IncompleteBomException.class)
            .satisfies(ex -> assertThat(((TreeValidationException) ex).getNodeRef()).isEqualTo("Chair > Seat[0]"));
    }

    @Test
    void nodeContainingItselfIsACycle() {
        List<TreeDefinition> children = new ArrayList<>();
        TreeDefinition loop = TreeDefinition.builder()
            .name("Loop")
            .amountInParent(1)
            .components(children)
            .build();
        children.add(loop);
        TreeDefinition root = TreeDefinition.builder()
            .name("Root")
            .components(List.of(loop))
            .build();

        assertThatThrownBy(() -> validator.validateTree(root, NodePosition.ROOT))
            .isInstanceOf(CycleException.class)
            .satisfies(ex -> assertThat(((TreeValidationException) ex).getNodeRef()).isEqualTo("Root > Loop[0] > Loop[0]"));
    }

    @Test
    void repeatedDeclaredIdIsACycle() {
        TreeDefinition inner = TreeDefinition.builder()
            .id(7L)
            .name("Inner")
            .amountInParent(1)
            .billOfMaterials(List.of(MaterialLine.of(1L, 1.0)))
            .build();
        TreeDefinition outer = TreeDefinition.builder()
            .id(7L)
            .name("Outer")
            .components(List.of(inner))
            .build();

        assertThatThrownBy(() -> validator.checkAcyclic(outer))
            .isInstanceOf(CycleException.class)
            .hasMessageContaining("id 7 (Outer > Inner[0])")
            .hasMessageContaining(CycleException.CONSTRAINT);
    }

    @Test
    void declaredIdMatchingAnAncestorIsACycle() {
        TreeDefinition component = TreeDefinition.builder()
            .id(1L)
            .name("Chair again")
            .amountInParent(1)
            .billOfMaterials(List.of(MaterialLine.of(1L, 1.0)))
            .build();

        assertThatThrownBy(() -> validator.validateTree(component, NodePosition.COMPONENT, Set.of(1L, 2L)))
            .isInstanceOf(CycleException.class);
        assertThatCode(() -> validator.validateTree(component, NodePosition.COMPONENT, Set.of(2L, 3L)))
            .doesNotThrowAnyException();
    }

    @Test
    void sharedSubtreeObjectWithoutIdsIsNotACycle() {
        TreeDefinition wheel = leaf("Wheel", 2, MaterialLine.of(3L, 1.5));
        TreeDefinition cart = TreeDefinition.builder()
            .name("Cart")
            .components(List.of(wheel, wheel))
            .build();

        assertThatCode(() -> validator.validateTree(cart, NodePosition.ROOT)).doesNotThrowAnyException();
    }

    @Test
    void checkCompositionLooksAtTheNodeOnly() {
        TreeNode node = new TestNode(5L, "Seat", 2, List.of(),
            List.of(new TestNode(6L, "Broken", -1, List.of(), List.of())));

        assertThatCode(() -> validator.checkComposition(node, NodePosition.COMPONENT)).doesNotThrowAnyException();
    }

    private record TestNode(
        Long id,
        String name,
        Integer amountInParent,
        List<MaterialLine> billOfMaterials,
        List<TestNode> components
    ) implements TreeNode {
    }
}
