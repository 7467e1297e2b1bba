package com.disassembly.service;

import com.disassembly.composition.BillOfMaterialsAggregator;
import com.disassembly.composition.CompositionArena;
import com.disassembly.composition.CompositionArenaLoader;
import com.disassembly.composition.CompositionBuilder;
import com.disassembly.composition.MaterialLine;
import com.disassembly.composition.MaterialTotal;
import com.disassembly.composition.NodePosition;
import com.disassembly.composition.NodeRecord;
import com.disassembly.composition.ReferenceResolver;
import com.disassembly.composition.RootSelector;
import com.disassembly.composition.SubtreeQueryService;
import com.disassembly.composition.TreeDefinition;
import com.disassembly.composition.TreeDefinition.CircularityPropertiesDefinition;
import com.disassembly.composition.TreeDefinition.PhysicalPropertiesDefinition;
import com.disassembly.composition.TreeInvariantValidator;
import com.disassembly.composition.TreeNode;
import com.disassembly.composition.TreeView;
import com.disassembly.composition.exception.IntegrityConflictException;
import com.disassembly.composition.exception.ModelNotFoundException;
import com.disassembly.model.enums.Unit;
import com.disassembly.model.product.CircularityProperties;
import com.disassembly.model.product.MaterialProductLink;
import com.disassembly.model.product.PhysicalProperties;
import com.disassembly.model.product.Product;
import com.disassembly.model.product.ProductFile;
import com.disassembly.model.reference.Material;
import com.disassembly.repository.CircularityPropertiesRepository;
import com.disassembly.repository.MaterialProductLinkRepository;
import com.disassembly.repository.PhysicalPropertiesRepository;
import com.disassembly.repository.ProductFileRepository;
import com.disassembly.repository.ProductRepository;
import com.disassembly.service.storage.FileStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Product Composition Service
 *
 * Entry point for callers working with product trees:
 * - Tree creation and component grafting (delegated to CompositionBuilder)
 * - Depth-bounded tree reads and bill-of-materials roll-up
 * - Scalar updates and bill-of-materials maintenance, re-validated before any change is written
 * - Physical and circularity properties of single products
 * - Cascading subtree deletion with post-commit removal of stored file bytes
 *
 * One transaction per call.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class ProductCompositionService {

    private static final String PHYSICAL_PROPERTIES = "Physical properties of product";
    private static final String CIRCULARITY_PROPERTIES = "Circularity properties of product";

    private final CompositionBuilder compositionBuilder;
    private final SubtreeQueryService subtreeQueryService;
    private final BillOfMaterialsAggregator billOfMaterialsAggregator;
    private final CompositionArenaLoader arenaLoader;
    private final TreeInvariantValidator validator;
    private final ReferenceResolver references;
    private final ProductRepository productRepository;
    private final MaterialProductLinkRepository linkRepository;
    private final ProductFileRepository fileRepository;
    private final PhysicalPropertiesRepository physicalPropertiesRepository;
    private final CircularityPropertiesRepository circularityPropertiesRepository;
    private final FileStorage fileStorage;

    // ========================================================================
    // Tree Operations
    // ========================================================================

    public Long createComposition(TreeDefinition definition, UUID ownerId, Long productTypeId) {
        return compositionBuilder.createComposition(definition, ownerId, productTypeId);
    }

    public Long addComponent(Long parentId, TreeDefinition definition) {
        return compositionBuilder.addComponent(parentId, definition);
    }

    @Transactional(readOnly = true)
    public TreeView getSubtree(Long nodeId, int maxDepth) {
        return subtreeQueryService.getSubtree(RootSelector.node(nodeId), maxDepth).get(0);
    }

    /**
     * All base products with their components.
     */
    @Transactional(readOnly = true)
    public List<TreeView> getProductTrees(int maxDepth) {
        return subtreeQueryService.getSubtree(RootSelector.allRoots(), maxDepth);
    }

    @Transactional(readOnly = true)
    public Map<Long, Double> aggregateBillOfMaterials(Long rootId) {
        return billOfMaterialsAggregator.aggregateBillOfMaterials(rootId);
    }

    @Transactional(readOnly = true)
    public List<MaterialTotal> aggregateWithUnits(Long rootId) {
        return billOfMaterialsAggregator.aggregateWithUnits(rootId);
    }

    /**
     * Delete a product together with all its components, their bill-of-materials lines and attached
     * rows. Stored file bytes are removed after commit, best-effort.
     * Rejected when the parent would be left with neither components nor materials.
     */
    public void deleteSubtree(Long nodeId) {
        Product product = requireProduct(nodeId);
        if (product.getParent() != null) {
            checkParentWithout(product.getParent().getId(), nodeId);
        }

        CompositionArena subtree = arenaLoader.load(RootSelector.node(nodeId), CompositionArenaLoader.UNBOUNDED);
        List<String> storagePaths = fileRepository.findStoragePathsByProductIdIn(subtree.allIds());

        if (product.getParent() != null) {
            product.getParent().removeComponent(product);
        }
        productRepository.delete(product);
        productRepository.flush();

        runAfterCommit(() -> deleteStoredFiles(storagePaths));
        log.info("Deleted product {} with {} descendant(s)", nodeId, subtree.size() - 1);
    }

    // ========================================================================
    // Single Product Operations
    // ========================================================================

    @Transactional(readOnly = true)
    public Product getProduct(Long id) {
        return requireProduct(id);
    }

    /**
     * Update scalar fields and the product type. Does not touch structure.
     */
    public Product updateProduct(Long id, ProductUpdate update) {
        Product existing = requireProduct(id);

        if (update.name() != null) {
            existing.setName(update.name());
        }
        if (update.description() != null) {
            existing.setDescription(update.description());
        }
        if (update.brand() != null) {
            existing.setBrand(update.brand());
        }
        if (update.model() != null) {
            existing.setModel(update.model());
        }
        if (update.dismantlingNotes() != null) {
            existing.setDismantlingNotes(update.dismantlingNotes());
        }
        if (update.dismantlingTimeStart() != null) {
            existing.setDismantlingTimeStart(update.dismantlingTimeStart());
        }
        if (update.dismantlingTimeEnd() != null) {
            existing.setDismantlingTimeEnd(update.dismantlingTimeEnd());
        }
        if (existing.getDismantlingTimeEnd() != null
                && existing.getDismantlingTimeEnd().isBefore(existing.getDismantlingTimeStart())) {
            throw new IllegalArgumentException("End time " + existing.getDismantlingTimeEnd()
                + " must be after start time " + existing.getDismantlingTimeStart());
        }
        if (update.productTypeId() != null) {
            existing.setProductType(references.resolveProductType(update.productTypeId()));
        }

        return productRepository.save(existing);
    }

    /**
     * Register a file whose bytes were already written to storage.
     */
    public ProductFile attachFile(Long productId, String filename, String storagePath) {
        Product product = requireProduct(productId);
        ProductFile file = ProductFile.builder()
            .filename(filename)
            .storagePath(storagePath)
            .build();
        product.addFile(file);
        return fileRepository.saveAndFlush(file);
    }

    /**
     * Distinct brands, trimmed and title-cased, sorted.
     */
    @Transactional(readOnly = true)
    public List<String> getUniqueBrands() {
        Set<String> brands = new TreeSet<>();
        for (String brand : productRepository.findDistinctBrands()) {
            if (!brand.isBlank()) {
                brands.add(titleCase(brand.strip()));
            }
        }
        return List.copyOf(brands);
    }

    // ========================================================================
    // Physical and Circularity Properties
    // ========================================================================

    @Transactional(readOnly = true)
    public PhysicalProperties getPhysicalProperties(Long productId) {
        requireProduct(productId);
        return physicalPropertiesRepository.findByProductId(productId)
            .orElseThrow(() -> new ModelNotFoundException(PHYSICAL_PROPERTIES, productId));
    }

    public PhysicalProperties createPhysicalProperties(Long productId, PhysicalPropertiesDefinition definition) {
        Product product = requireProduct(productId);
        if (product.getPhysicalProperties() != null) {
            throw new IntegrityConflictException("Product with id " + productId + " already has physical properties");
        }
        PhysicalProperties properties = new PhysicalProperties();
        mergePhysical(properties, definition);
        product.attachPhysicalProperties(properties);
        return physicalPropertiesRepository.saveAndFlush(properties);
    }

    /**
     * Null fields keep their current value.
     */
    public PhysicalProperties updatePhysicalProperties(Long productId, PhysicalPropertiesDefinition definition) {
        PhysicalProperties properties = getPhysicalProperties(productId);
        mergePhysical(properties, definition);
        return physicalPropertiesRepository.saveAndFlush(properties);
    }

    public void deletePhysicalProperties(Long productId) {
        Product product = requireProduct(productId);
        PhysicalProperties properties = product.getPhysicalProperties();
        if (properties == null) {
            throw new ModelNotFoundException(PHYSICAL_PROPERTIES, productId);
        }
        product.setPhysicalProperties(null);
        physicalPropertiesRepository.delete(properties);
        physicalPropertiesRepository.flush();
    }

    @Transactional(readOnly = true)
    public CircularityProperties getCircularityProperties(Long productId) {
        requireProduct(productId);
        return circularityPropertiesRepository.findByProductId(productId)
            .orElseThrow(() -> new ModelNotFoundException(CIRCULARITY_PROPERTIES, productId));
    }

    public CircularityProperties createCircularityProperties(Long productId,
                                                             CircularityPropertiesDefinition definition) {
        Product product = requireProduct(productId);
        if (product.getCircularityProperties() != null) {
            throw new IntegrityConflictException("Product with id " + productId + " already has circularity properties");
        }
        CircularityProperties properties = new CircularityProperties();
        mergeCircularity(properties, definition);
        product.attachCircularityProperties(properties);
        return circularityPropertiesRepository.saveAndFlush(properties);
    }

    /**
     * Null fields keep their current value.
     */
    public CircularityProperties updateCircularityProperties(Long productId,
                                                             CircularityPropertiesDefinition definition) {
        CircularityProperties properties = getCircularityProperties(productId);
        mergeCircularity(properties, definition);
        return circularityPropertiesRepository.saveAndFlush(properties);
    }

    public void deleteCircularityProperties(Long productId) {
        Product product = requireProduct(productId);
        CircularityProperties properties = product.getCircularityProperties();
        if (properties == null) {
            throw new ModelNotFoundException(CIRCULARITY_PROPERTIES, productId);
        }
        product.setCircularityProperties(null);
        circularityPropertiesRepository.delete(properties);
        circularityPropertiesRepository.flush();
    }

    // ========================================================================
    // Bill of Materials
    // ========================================================================

    @Transactional(readOnly = true)
    public List<MaterialProductLink> getBillOfMaterials(Long productId) {
        requireProduct(productId);
        return linkRepository.findByProductIdOrderById(productId);
    }

    public List<MaterialProductLink> addMaterials(Long productId, List<MaterialLine> lines) {
        Product product = requireProductWithMaterials(productId);

        List<MaterialLine> candidate = currentLines(product);
        candidate.addAll(lines);
        checkNode(product, candidate);

        Set<Long> materialIds = new LinkedHashSet<>();
        lines.forEach(line -> materialIds.add(line.materialId()));
        Map<Long, Material> materials = references.requireMaterials(materialIds);

        List<MaterialProductLink> added = new ArrayList<>();
        for (MaterialLine line : lines) {
            MaterialProductLink link = MaterialProductLink.builder()
                .material(materials.get(line.materialId()))
                .quantity(line.quantity())
                .unit(line.unit())
                .build();
            product.addMaterialLink(link);
            added.add(link);
        }
        List<MaterialProductLink> saved = linkRepository.saveAllAndFlush(added);
        log.info("Added {} material(s) to product {}", lines.size(), productId);
        return saved;
    }

    /**
     * Change quantity and/or unit of one line. Null arguments keep the current value.
     */
    public MaterialProductLink updateMaterial(Long productId, Long materialId, Double quantity, Unit unit) {
        Product product = requireProductWithMaterials(productId);
        MaterialProductLink link = linkRepository.findByProductIdAndMaterialId(productId, materialId)
            .orElseThrow(() -> new ModelNotFoundException("Material", materialId));

        double newQuantity = quantity != null ? quantity : link.getQuantity();
        Unit newUnit = unit != null ? unit : link.getUnit();

        List<MaterialLine> candidate = new ArrayList<>();
        for (MaterialLine line : currentLines(product)) {
            candidate.add(line.materialId().equals(materialId)
                ? new MaterialLine(materialId, newQuantity, newUnit)
                : line);
        }
        checkNode(product, candidate);

        link.setQuantity(newQuantity);
        link.setUnit(newUnit);
        return linkRepository.saveAndFlush(link);
    }

    public void removeMaterials(Long productId, Collection<Long> materialIds) {
        Product product = requireProductWithMaterials(productId);

        Set<Long> present = new LinkedHashSet<>();
        product.getBillOfMaterials().forEach(link -> present.add(link.getMaterial().getId()));
        Set<Long> missing = new TreeSet<>(materialIds);
        missing.removeAll(present);
        if (!missing.isEmpty()) {
            throw new ModelNotFoundException("Material", missing);
        }

        List<MaterialLine> candidate = currentLines(product);
        candidate.removeIf(line -> materialIds.contains(line.materialId()));
        checkNode(product, candidate);

        List<MaterialProductLink> toRemove = product.getBillOfMaterials().stream()
            .filter(link -> materialIds.contains(link.getMaterial().getId()))
            .toList();
        toRemove.forEach(product::removeMaterialLink);
        productRepository.saveAndFlush(product);
        log.info("Removed {} material(s) from product {}", toRemove.size(), productId);
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private Product requireProduct(Long id) {
        return productRepository.findById(id)
            .orElseThrow(() -> new ModelNotFoundException("Product", id));
    }

    private Product requireProductWithMaterials(Long id) {
        return productRepository.findByIdWithMaterials(id)
            .orElseThrow(() -> new ModelNotFoundException("Product", id));
    }

    private static List<MaterialLine> currentLines(Product product) {
        List<MaterialLine> lines = new ArrayList<>();
        for (MaterialProductLink link : product.getBillOfMaterials()) {
            lines.add(new MaterialLine(link.getMaterial().getId(), link.getQuantity(), link.getUnit()));
        }
        return lines;
    }

    private static void mergePhysical(PhysicalProperties target, PhysicalPropertiesDefinition source) {
        if (source.weightKg() != null) {
            target.setWeightKg(source.weightKg());
        }
        if (source.heightCm() != null) {
            target.setHeightCm(source.heightCm());
        }
        if (source.widthCm() != null) {
            target.setWidthCm(source.widthCm());
        }
        if (source.depthCm() != null) {
            target.setDepthCm(source.depthCm());
        }
    }

    private static void mergeCircularity(CircularityProperties target, CircularityPropertiesDefinition source) {
        if (source.recyclabilityObservation() != null) {
            target.setRecyclabilityObservation(source.recyclabilityObservation());
        }
        if (source.recyclabilityComment() != null) {
            target.setRecyclabilityComment(source.recyclabilityComment());
        }
        if (source.recyclabilityReference() != null) {
            target.setRecyclabilityReference(source.recyclabilityReference());
        }
        if (source.repairabilityObservation() != null) {
            target.setRepairabilityObservation(source.repairabilityObservation());
        }
        if (source.repairabilityComment() != null) {
            target.setRepairabilityComment(source.repairabilityComment());
        }
        if (source.repairabilityReference() != null) {
            target.setRepairabilityReference(source.repairabilityReference());
        }
        if (source.remanufacturabilityObservation() != null) {
            target.setRemanufacturabilityObservation(source.remanufacturabilityObservation());
        }
        if (source.remanufacturabilityComment() != null) {
            target.setRemanufacturabilityComment(source.remanufacturabilityComment());
        }
        if (source.remanufacturabilityReference() != null) {
            target.setRemanufacturabilityReference(source.remanufacturabilityReference());
        }
    }

    private static String titleCase(String brand) {
        StringBuilder result = new StringBuilder(brand.length());
        boolean startOfWord = true;
        for (char c : brand.toCharArray()) {
            result.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
            startOfWord = !Character.isLetterOrDigit(c);
        }
        return result.toString();
    }

    /**
     * Validate the node as it would look with {@code lines} as its bill of materials.
     */
    private void checkNode(Product product, List<MaterialLine> lines) {
        List<NodeCandidate> components = product.getComponents().stream()
            .map(c -> new NodeCandidate(c.getId(), c.getName(), c.getAmountInParent(), List.of(), List.of()))
            .toList();
        NodeCandidate candidate = new NodeCandidate(
            product.getId(), product.getName(), product.getAmountInParent(), lines, components);
        validator.checkComposition(candidate,
            product.isBaseProduct() ? NodePosition.ROOT : NodePosition.COMPONENT);
    }

    /**
     * Validate the stored parent as it would look without {@code childId}.
     */
    private void checkParentWithout(Long parentId, Long childId) {
        CompositionArena family = arenaLoader.load(RootSelector.node(parentId), 1);
        family.detachChild(parentId, childId);
        NodeRecord parent = family.get(parentId);
        validator.checkComposition(family.treeNode(parentId),
            parent.isBaseProduct() ? NodePosition.ROOT : NodePosition.COMPONENT);
    }

    private void deleteStoredFiles(List<String> storagePaths) {
        for (String path : storagePaths) {
            try {
                fileStorage.delete(path);
            } catch (IOException | RuntimeException e) {
                log.warn("Could not delete stored file {}; it is now orphaned", path, e);
            }
        }
    }

    private static void runAfterCommit(Runnable task) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            task.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                task.run();
            }
        });
    }

    private record NodeCandidate(
        Long id,
        String name,
        Integer amountInParent,
        List<MaterialLine> billOfMaterials,
        List<NodeCandidate> components
    ) implements TreeNode {
    }
}
