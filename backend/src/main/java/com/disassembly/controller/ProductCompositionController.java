package com.disassembly.controller;

import com.disassembly.composition.MaterialTotal;
import com.disassembly.composition.TreeView;
import com.disassembly.composition.exception.IncompatibleUnitsException;
import com.disassembly.composition.exception.IntegrityConflictException;
import com.disassembly.composition.exception.InvariantViolationException;
import com.disassembly.composition.exception.ModelNotFoundException;
import com.disassembly.composition.exception.TreeValidationException;
import com.disassembly.config.CompositionProperties;
import com.disassembly.dto.mapper.ProductMapper;
import com.disassembly.dto.request.AddMaterialsRequest;
import com.disassembly.dto.request.AttachFileRequest;
import com.disassembly.dto.request.CircularityPropertiesRequest;
import com.disassembly.dto.request.ComponentRequest;
import com.disassembly.dto.request.CreateProductRequest;
import com.disassembly.dto.request.PhysicalPropertiesRequest;
import com.disassembly.dto.request.UpdateMaterialLineRequest;
import com.disassembly.dto.request.UpdateProductRequest;
import com.disassembly.dto.response.BillOfMaterialsTotalDto;
import com.disassembly.dto.response.MaterialLineDto;
import com.disassembly.dto.response.ProductDto;
import com.disassembly.dto.response.ProductDto.CircularityPropertiesDto;
import com.disassembly.dto.response.ProductDto.PhysicalPropertiesDto;
import com.disassembly.dto.response.ProductFileDto;
import com.disassembly.model.product.CircularityProperties;
import com.disassembly.model.product.MaterialProductLink;
import com.disassembly.model.product.PhysicalProperties;
import com.disassembly.model.product.ProductFile;
import com.disassembly.service.ProductCompositionService;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for product composition trees.
 * Thin adapter: maps requests onto the composition service and failures onto HTTP status codes.
 */
@Slf4j
@RestController
@RequestMapping("/api/products")
public class ProductCompositionController {

    private final ProductCompositionService compositionService;
    private final ProductMapper productMapper;
    private final CompositionProperties properties;

    public ProductCompositionController(
            ProductCompositionService compositionService,
            ProductMapper productMapper,
            CompositionProperties properties) {
        this.compositionService = compositionService;
        this.productMapper = productMapper;
        this.properties = properties;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    /**
     * Get all base products with components expanded to {@code depth} levels.
     */
    @GetMapping("/tree")
    public ResponseEntity<List<TreeView>> getProductTrees(@RequestParam(required = false) Integer depth) {
        return ResponseEntity.ok(compositionService.getProductTrees(resolveDepth(depth)));
    }

    /**
     * Distinct brands across all products, for filter drop-downs.
     */
    @GetMapping("/brands")
    public ResponseEntity<List<String>> getBrands() {
        return ResponseEntity.ok(compositionService.getUniqueBrands());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProductDto> getProduct(@PathVariable Long id) {
        return ResponseEntity.ok(productMapper.toDto(compositionService.getProduct(id)));
    }

    @GetMapping("/{id}/tree")
    public ResponseEntity<TreeView> getSubtree(
            @PathVariable Long id,
            @RequestParam(required = false) Integer depth) {
        return ResponseEntity.ok(compositionService.getSubtree(id, resolveDepth(depth)));
    }

    /**
     * Total material quantities for one unit of the product, components included.
     */
    @GetMapping("/{id}/bill-of-materials/total")
    public ResponseEntity<BillOfMaterialsTotalDto> getBillOfMaterialsTotal(@PathVariable Long id) {
        List<MaterialTotal> totals = compositionService.aggregateWithUnits(id);
        return ResponseEntity.ok(new BillOfMaterialsTotalDto(id, totals));
    }

    @GetMapping("/{id}/bill-of-materials")
    public ResponseEntity<List<MaterialLineDto>> getBillOfMaterials(@PathVariable Long id) {
        List<MaterialProductLink> links = compositionService.getBillOfMaterials(id);
        return ResponseEntity.ok(productMapper.toMaterialLineDtoList(links));
    }

    // ========================================================================
    // Create Operations
    // ========================================================================

    /**
     * Create a base product together with its whole component tree.
     */
    @PostMapping
    public ResponseEntity<ProductDto> createProduct(@Valid @RequestBody CreateProductRequest request) {
        Long id = compositionService.createComposition(
            productMapper.toDefinition(request), request.ownerId(), request.productTypeId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(productMapper.toDto(compositionService.getProduct(id)));
    }

    /**
     * Attach a new component subtree under an existing product.
     */
    @PostMapping("/{id}/components")
    public ResponseEntity<ProductDto> addComponent(
            @PathVariable Long id,
            @Valid @RequestBody ComponentRequest request) {
        Long componentId = compositionService.addComponent(id, productMapper.toDefinition(request));
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(productMapper.toDto(compositionService.getProduct(componentId)));
    }

    @PostMapping("/{id}/bill-of-materials")
    public ResponseEntity<List<MaterialLineDto>> addMaterials(
            @PathVariable Long id,
            @Valid @RequestBody AddMaterialsRequest request) {
        List<MaterialProductLink> added = compositionService.addMaterials(
            id, productMapper.toMaterialLines(request.materials()));
        return ResponseEntity.status(HttpStatus.CREATED).body(productMapper.toMaterialLineDtoList(added));
    }

    /**
     * Register a file already written to storage.
     */
    @PostMapping("/{id}/files")
    public ResponseEntity<ProductFileDto> attachFile(
            @PathVariable Long id,
            @Valid @RequestBody AttachFileRequest request) {
        ProductFile file = compositionService.attachFile(id, request.filename(), request.storagePath());
        return ResponseEntity.status(HttpStatus.CREATED).body(productMapper.toFileDto(file));
    }

    // ========================================================================
    // Update Operations
    // ========================================================================

    @PutMapping("/{id}")
    public ResponseEntity<ProductDto> updateProduct(
            @PathVariable Long id,
            @Valid @RequestBody UpdateProductRequest request) {
        return ResponseEntity.ok(productMapper.toDto(
            compositionService.updateProduct(id, productMapper.toUpdate(request))));
    }

    @PutMapping("/{id}/bill-of-materials/{materialId}")
    public ResponseEntity<MaterialLineDto> updateMaterial(
            @PathVariable Long id,
            @PathVariable Long materialId,
            @Valid @RequestBody UpdateMaterialLineRequest request) {
        MaterialProductLink link = compositionService.updateMaterial(
            id, materialId, request.quantity(), productMapper.parseUnit(request.unit()));
        return ResponseEntity.ok(productMapper.toMaterialLineDto(link));
    }

    // ========================================================================
    // Delete Operations
    // ========================================================================

    /**
     * Delete a product and everything below it.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteProduct(@PathVariable Long id) {
        compositionService.deleteSubtree(id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}/bill-of-materials")
    public ResponseEntity<Void> removeMaterials(
            @PathVariable Long id,
            @RequestParam List<Long> materialIds) {
        compositionService.removeMaterials(id, materialIds);
        return ResponseEntity.noContent().build();
    }

    // ========================================================================
    // Physical and Circularity Properties
    // ========================================================================

    @GetMapping("/{id}/physical-properties")
    public ResponseEntity<PhysicalPropertiesDto> getPhysicalProperties(@PathVariable Long id) {
        return ResponseEntity.ok(productMapper.toPhysicalPropertiesDto(
            compositionService.getPhysicalProperties(id)));
    }

    @PostMapping("/{id}/physical-properties")
    public ResponseEntity<PhysicalPropertiesDto> createPhysicalProperties(
            @PathVariable Long id,
            @Valid @RequestBody PhysicalPropertiesRequest request) {
        PhysicalProperties created = compositionService.createPhysicalProperties(
            id, productMapper.toPhysicalProperties(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(productMapper.toPhysicalPropertiesDto(created));
    }

    /**
     * Partial update: omitted fields keep their stored value.
     */
    @PutMapping("/{id}/physical-properties")
    public ResponseEntity<PhysicalPropertiesDto> updatePhysicalProperties(
            @PathVariable Long id,
            @Valid @RequestBody PhysicalPropertiesRequest request) {
        return ResponseEntity.ok(productMapper.toPhysicalPropertiesDto(
            compositionService.updatePhysicalProperties(id, productMapper.toPhysicalProperties(request))));
    }

    @DeleteMapping("/{id}/physical-properties")
    public ResponseEntity<Void> deletePhysicalProperties(@PathVariable Long id) {
        compositionService.deletePhysicalProperties(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/circularity-properties")
    public ResponseEntity<CircularityPropertiesDto> getCircularityProperties(@PathVariable Long id) {
        return ResponseEntity.ok(productMapper.toCircularityPropertiesDto(
            compositionService.getCircularityProperties(id)));
    }

    @PostMapping("/{id}/circularity-properties")
    public ResponseEntity<CircularityPropertiesDto> createCircularityProperties(
            @PathVariable Long id,
            @Valid @RequestBody CircularityPropertiesRequest request) {
        CircularityProperties created = compositionService.createCircularityProperties(
            id, productMapper.toCircularityProperties(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(productMapper.toCircularityPropertiesDto(created));
    }

    @PutMapping("/{id}/circularity-properties")
    public ResponseEntity<CircularityPropertiesDto> updateCircularityProperties(
            @PathVariable Long id,
            @Valid @RequestBody CircularityPropertiesRequest request) {
        return ResponseEntity.ok(productMapper.toCircularityPropertiesDto(
            compositionService.updateCircularityProperties(id, productMapper.toCircularityProperties(request))));
    }

    @DeleteMapping("/{id}/circularity-properties")
    public ResponseEntity<Void> deleteCircularityProperties(@PathVariable Long id) {
        compositionService.deleteCircularityProperties(id);
        return ResponseEntity.noContent().build();
    }

    // ========================================================================
    // Exception Handlers
    // ========================================================================

    @ExceptionHandler(TreeValidationException.class)
    public ResponseEntity<Map<String, String>> handleTreeValidation(TreeValidationException ex) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", ex.getMessage());
        body.put("node", ex.getNodeRef());
        body.put("constraint", ex.getConstraint());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleModelNotFound(ModelNotFoundException ex) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", ex.getMessage());
        body.put("model", ex.getModelName());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(EntityNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler({IntegrityConflictException.class, DataIntegrityViolationException.class})
    public ResponseEntity<Map<String, String>> handleConflict(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(IncompatibleUnitsException.class)
    public ResponseEntity<Map<String, String>> handleIncompatibleUnits(IncompatibleUnitsException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<Map<String, String>> handleInvariantViolation(InvariantViolationException ex) {
        log.error("Stored composition is corrupt at node {}", ex.getNodeId(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", ex.getMessage()));
    }

    private int resolveDepth(Integer depth) {
        return depth != null ? depth : properties.getQuery().getDefaultDepth();
    }
}
