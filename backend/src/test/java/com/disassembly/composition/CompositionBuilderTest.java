package com.disassembly.composition;

import com.disassembly.composition.exception.CompositionRuleException;
import com.disassembly.composition.exception.CycleException;
import com.disassembly.composition.exception.ModelNotFoundException;
import com.disassembly.config.CompositionProperties;
import com.disassembly.model.product.Product;
import com.disassembly.model.reference.Material;
import com.disassembly.model.reference.ProductType;
import com.disassembly.model.reference.UserAccount;
import com.disassembly.repository.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@Import({
    CompositionBuilder.class,
    ReferenceResolver.class,
    TreeInvariantValidator.class,
    CompositionArenaLoader.class,
    BillOfMaterialsAggregator.class,
    CompositionProperties.class
})
class CompositionBuilderTest {

    @Autowired
    private CompositionBuilder builder;

    @Autowired
    private BillOfMaterialsAggregator aggregator;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private TestEntityManager entityManager;

    private UserAccount owner;
    private Material steel;
    private Material foam;

    @BeforeEach
    void setUp() {
        owner = entityManager.persist(UserAccount.builder().username("alice").email("alice@example.org").build());
        steel = entityManager.persist(Material.builder().name("Steel").densityKgM3(7850.0).build());
        foam = entityManager.persist(Material.builder().name("Foam").build());
        entityManager.flush();
    }

    private TreeDefinition chair() {
        TreeDefinition cushion = TreeDefinition.builder()
            .name("Cushion")
            .amountInParent(3)
            .billOfMaterials(List.of(MaterialLine.of(foam.getId(), 0.5)))
            .build();
        TreeDefinition seat = TreeDefinition.builder()
            .name("Seat")
            .amountInParent(2)
            .components(List.of(cushion))
            .build();
        TreeDefinition leg = TreeDefinition.builder()
            .name("Leg")
            .amountInParent(4)
            .billOfMaterials(List.of(MaterialLine.of(steel.getId(), 0.75)))
            .build();
        return TreeDefinition.builder()
            .name("Chair")
            .brand("Acme")
            .components(List.of(seat, leg))
            .build();
    }

    @Test
    void createsWholeTreeWithOwnerOnEveryNode() {
        ProductType furniture = entityManager.persist(ProductType.builder().name("Furniture").build());

        Long rootId = builder.createComposition(chair(), owner.getId(), furniture.getId());
        entityManager.flush();
        entityManager.clear();

        List<Product> all = productRepository.findAll();
        assertThat(all).hasSize(4);
        assertThat(all).allSatisfy(p -> assertThat(p.getOwner().getId()).isEqualTo(owner.getId()));

        Product root = productRepository.findById(rootId).orElseThrow();
        assertThat(root.isBaseProduct()).isTrue();
        assertThat(root.getAmountInParent()).isNull();
        assertThat(root.getProductType().getId()).isEqualTo(furniture.getId());
        assertThat(root.getComponents()).extracting(Product::getName).containsExactly("Seat", "Leg");
        assertThat(root.getDismantlingTimeStart()).isNotNull();
    }

    @Test
    void storesCircularityPropertiesGivenOnCreate() {
        TreeDefinition lamp = TreeDefinition.builder()
            .name("Lamp")
            .billOfMaterials(List.of(MaterialLine.of(steel.getId(), 1.1)))
            .circularityProperties(new TreeDefinition.CircularityPropertiesDefinition(
                "Shade and base unscrew", null, null,
                "Bulb socket is replaceable", "easy", "iFixit guide",
                null, null, null))
            .build();

        Long lampId = builder.createComposition(lamp, owner.getId(), null);
        entityManager.flush();
        entityManager.clear();

        Product stored = productRepository.findById(lampId).orElseThrow();
        assertThat(stored.getCircularityProperties()).isNotNull();
        assertThat(stored.getCircularityProperties().getRecyclabilityObservation()).isEqualTo("Shade and base unscrew");
        assertThat(stored.getCircularityProperties().getRepairabilityReference()).isEqualTo("iFixit guide");
        assertThat(stored.getCircularityProperties().getRemanufacturabilityComment()).isNull();
    }

    @Test
    void aggregatesTheCreatedTree() {
        Long rootId = builder.createComposition(chair(), owner.getId(), null);
        entityManager.flush();
        entityManager.clear();

        Map<Long, Double> totals = aggregator.aggregateBillOfMaterials(rootId);

        assertThat(totals).containsOnlyKeys(foam.getId(), steel.getId());
        assertThat(totals.get(foam.getId())).isCloseTo(3.0, within(1e-9));
        assertThat(totals.get(steel.getId())).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void invalidTreeWritesNothing() {
        TreeDefinition empty = TreeDefinition.builder().name("Empty box").build();

        assertThatThrownBy(() -> builder.createComposition(empty, owner.getId(), null))
            .isInstanceOf(CompositionRuleException.class);

        assertThat(productRepository.count()).isZero();
    }

    @Test
    void reportsAllMissingMaterialsTogether() {
        TreeDefinition root = TreeDefinition.builder()
            .name("Lamp")
            .billOfMaterials(List.of(
                MaterialLine.of(steel.getId(), 1.0),
                MaterialLine.of(999L, 1.0),
                MaterialLine.of(998L, 2.0)))
            .build();

        assertThatThrownBy(() -> builder.createComposition(root, owner.getId(), null))
            .isInstanceOf(ModelNotFoundException.class)
            .hasMessage("Materials with ids {998, 999} not found")
            .satisfies(ex -> assertThat(((ModelNotFoundException) ex).getMissingIds())
                .containsExactly(998L, 999L));

        assertThat(productRepository.count()).isZero();
    }

    @Test
    void unknownOwnerIsNotFound() {
        UUID stranger = UUID.randomUUID();

        assertThatThrownBy(() -> builder.createComposition(chair(), stranger, null))
            .isInstanceOf(ModelNotFoundException.class)
            .hasMessage("User with id " + stranger + " not found");
    }

    @Test
    void unknownProductTypeIsNotFound() {
        assertThatThrownBy(() -> builder.createComposition(chair(), owner.getId(), 4242L))
            .isInstanceOf(ModelNotFoundException.class)
            .hasMessageContaining("ProductType");

        assertThat(productRepository.count()).isZero();
    }

    @Test
    void addComponentInheritsOwnerFromParent() {
        Long rootId = builder.createComposition(chair(), owner.getId(), null);
        Long seatId = productRepository.findById(rootId).orElseThrow().getComponents().get(0).getId();

        TreeDefinition spring = TreeDefinition.builder()
            .name("Spring")
            .amountInParent(8)
            .billOfMaterials(List.of(MaterialLine.of(steel.getId(), 0.01)))
            .build();
        Long springId = builder.addComponent(seatId, spring);
        entityManager.flush();
        entityManager.clear();

        Product stored = productRepository.findById(springId).orElseThrow();
        assertThat(stored.getParent().getId()).isEqualTo(seatId);
        assertThat(stored.getOwner().getId()).isEqualTo(owner.getId());
        assertThat(stored.getAmountInParent()).isEqualTo(8);
        assertThat(productRepository.findById(seatId).orElseThrow().getComponents())
            .extracting(Product::getName).containsExactly("Cushion", "Spring");
    }

    @Test
    void addComponentWithoutAmountIsRejected() {
        Long rootId = builder.createComposition(chair(), owner.getId(), null);
        long before = productRepository.count();

        TreeDefinition armrest = TreeDefinition.builder()
            .name("Armrest")
            .billOfMaterials(List.of(MaterialLine.of(steel.getId(), 0.2)))
            .build();

        assertThatThrownBy(() -> builder.addComponent(rootId, armrest))
            .isInstanceOf(CompositionRuleException.class)
            .hasMessageContaining(CompositionRuleException.COMPONENT_AMOUNT);
        assertThat(productRepository.count()).isEqualTo(before);
    }

    @Test
    void addingAnAncestorBelowItselfIsACycle() {
        Long rootId = builder.createComposition(chair(), owner.getId(), null);
        Long seatId = productRepository.findById(rootId).orElseThrow().getComponents().get(0).getId();
        long before = productRepository.count();

        TreeDefinition chairAgain = TreeDefinition.builder()
            .id(rootId)
            .name("Chair")
            .amountInParent(1)
            .billOfMaterials(List.of(MaterialLine.of(steel.getId(), 1.0)))
            .build();

        assertThatThrownBy(() -> builder.addComponent(seatId, chairAgain))
            .isInstanceOf(CycleException.class);
        assertThat(productRepository.count()).isEqualTo(before);
    }

    @Test
    void addComponentToUnknownParentIsNotFound() {
        TreeDefinition leg = TreeDefinition.builder()
            .name("Leg")
            .amountInParent(1)
            .billOfMaterials(List.of(MaterialLine.of(steel.getId(), 1.0)))
            .build();

        assertThatThrownBy(() -> builder.addComponent(12345L, leg))
            .isInstanceOf(ModelNotFoundException.class)
            .hasMessage("Product with id 12345 not found");
    }
}
