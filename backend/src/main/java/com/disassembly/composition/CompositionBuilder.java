package com.disassembly.composition;

import com.disassembly.composition.exception.IntegrityConflictException;
import com.disassembly.composition.exception.InvariantViolationException;
import com.disassembly.composition.exception.ModelNotFoundException;
import com.disassembly.model.product.CircularityProperties;
import com.disassembly.model.product.MaterialProductLink;
import com.disassembly.model.product.PhysicalProperties;
import com.disassembly.model.product.Product;
import com.disassembly.model.product.ProductVideo;
import com.disassembly.model.reference.Material;
import com.disassembly.model.reference.ProductType;
import com.disassembly.model.reference.UserAccount;
import com.disassembly.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Composition Builder
 *
 * Creates a whole product tree, or a sub-tree under an existing product, in one transaction:
 * 1. validate the complete definition in memory (nothing is written on failure)
 * 2. resolve owner / parent, product type and all materials (materials in one batch)
 * 3. insert depth-first, pre-order; each node is flushed so its children can point at its ID
 *
 * The owner of a sub-tree is always inherited from the product it is attached to.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CompositionBuilder {

    private final ProductRepository productRepository;
    private final ReferenceResolver references;
    private final TreeInvariantValidator validator;

    /**
     * Create a new base product with all its components.
     *
     * @return ID of the new base product
     */
    @Transactional
    public Long createComposition(TreeDefinition definition, UUID ownerId, Long productTypeId) {
        validator.validateTree(definition, NodePosition.ROOT);

        UserAccount owner = references.requireOwner(ownerId);
        ProductType productType = references.resolveProductType(productTypeId);
        Map<Long, Material> materials = references.requireMaterials(collectMaterialIds(definition));

        Product root = insert(definition, null, owner, productType, materials);
        log.info("Created product {} with owner {}", root, ownerId);
        return root.getId();
    }

    /**
     * Attach a new component tree under an existing product.
     *
     * @return ID of the new component
     */
    @Transactional
    public Long addComponent(Long parentId, TreeDefinition definition) {
        validator.validateTree(definition, NodePosition.COMPONENT);

        Product parent = productRepository.findById(parentId)
            .orElseThrow(() -> new ModelNotFoundException("Product", parentId));
        validator.checkAcyclic(definition, ancestorChain(parent));

        Map<Long, Material> materials = references.requireMaterials(collectMaterialIds(definition));

        Product component = insert(definition, parent, parent.getOwner(), null, materials);
        log.info("Added component {} to product {}", component, parentId);
        return component.getId();
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private Product insert(TreeDefinition definition, Product parent, UserAccount owner,
                           ProductType productType, Map<Long, Material> materials) {
        Product product = Product.builder()
            .name(definition.name())
            .description(definition.description())
            .brand(definition.brand())
            .model(definition.model())
            .dismantlingNotes(definition.dismantlingNotes())
            .dismantlingTimeStart(definition.dismantlingTimeStart() != null
                ? definition.dismantlingTimeStart()
                : LocalDateTime.now())
            .dismantlingTimeEnd(definition.dismantlingTimeEnd())
            .amountInParent(definition.amountInParent())
            .owner(owner)
            .productType(productType)
            .build();

        if (definition.physicalProperties() != null) {
            TreeDefinition.PhysicalPropertiesDefinition props = definition.physicalProperties();
            product.attachPhysicalProperties(PhysicalProperties.builder()
                .weightKg(props.weightKg())
                .heightCm(props.heightCm())
                .widthCm(props.widthCm())
                .depthCm(props.depthCm())
                .build());
        }

        if (definition.circularityProperties() != null) {
            TreeDefinition.CircularityPropertiesDefinition props = definition.circularityProperties();
            product.attachCircularityProperties(CircularityProperties.builder()
                .recyclabilityObservation(props.recyclabilityObservation())
                .recyclabilityComment(props.recyclabilityComment())
                .recyclabilityReference(props.recyclabilityReference())
                .repairabilityObservation(props.repairabilityObservation())
                .repairabilityComment(props.repairabilityComment())
                .repairabilityReference(props.repairabilityReference())
                .remanufacturabilityObservation(props.remanufacturabilityObservation())
                .remanufacturabilityComment(props.remanufacturabilityComment())
                .remanufacturabilityReference(props.remanufacturabilityReference())
                .build());
        }

        for (TreeDefinition.VideoDefinition video : definition.videos()) {
            product.addVideo(ProductVideo.builder()
                .url(video.url())
                .title(video.title())
                .description(video.description())
                .build());
        }

        for (MaterialLine line : definition.billOfMaterials()) {
            product.addMaterialLink(MaterialProductLink.builder()
                .material(materials.get(line.materialId()))
                .quantity(line.quantity())
                .unit(line.unit())
                .build());
        }

        if (parent != null) {
            parent.addComponent(product);
        }

        // Flush assigns the ID children refer to; the commit happens when the outermost call returns
        Product saved = saveAndFlush(product);

        for (TreeDefinition child : definition.components()) {
            insert(child, saved, owner, null, materials);
        }
        return saved;
    }

    private Product saveAndFlush(Product product) {
        try {
            return productRepository.saveAndFlush(product);
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityConflictException("Could not store product '" + product.getName() + "'", e);
        }
    }

    /**
     * IDs of the product and all its stored ancestors.
     */
    private Set<Long> ancestorChain(Product product) {
        Set<Long> chain = new LinkedHashSet<>();
        Product current = product;
        while (current != null) {
            if (!chain.add(current.getId())) {
                throw new InvariantViolationException(current.getId(), "Cycle in stored ancestors");
            }
            current = current.getParent();
        }
        return chain;
    }

    private static Set<Long> collectMaterialIds(TreeDefinition definition) {
        Set<Long> ids = new LinkedHashSet<>();
        collectMaterialIds(definition, ids);
        return ids;
    }

    private static void collectMaterialIds(TreeDefinition definition, Set<Long> ids) {
        for (MaterialLine line : definition.billOfMaterials()) {
            ids.add(line.materialId());
        }
        for (TreeDefinition child : definition.components()) {
            collectMaterialIds(child, ids);
        }
    }
}
