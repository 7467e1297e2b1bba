package com.disassembly.dto.mapper;

import com.disassembly.composition.MaterialLine;
import com.disassembly.composition.TreeDefinition;
import com.disassembly.composition.TreeDefinition.CircularityPropertiesDefinition;
import com.disassembly.composition.TreeDefinition.PhysicalPropertiesDefinition;
import com.disassembly.composition.TreeDefinition.VideoDefinition;
import com.disassembly.dto.request.CircularityPropertiesRequest;
import com.disassembly.dto.request.ComponentRequest;
import com.disassembly.dto.request.CreateProductRequest;
import com.disassembly.dto.request.MaterialLineRequest;
import com.disassembly.dto.request.PhysicalPropertiesRequest;
import com.disassembly.dto.request.UpdateProductRequest;
import com.disassembly.dto.request.VideoRequest;
import com.disassembly.dto.response.MaterialLineDto;
import com.disassembly.dto.response.ProductDto;
import com.disassembly.dto.response.ProductDto.CircularityPropertiesDto;
import com.disassembly.dto.response.ProductDto.PhysicalPropertiesDto;
import com.disassembly.dto.response.ProductFileDto;
import com.disassembly.model.enums.Unit;
import com.disassembly.model.product.CircularityProperties;
import com.disassembly.model.product.MaterialProductLink;
import com.disassembly.model.product.PhysicalProperties;
import com.disassembly.model.product.Product;
import com.disassembly.model.product.ProductFile;
import com.disassembly.service.ProductUpdate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper for converting between product entities, tree definitions and DTOs.
 */
@Component
public class ProductMapper {

    // ========================================================================
    // Entity -> DTO Conversions
    // ========================================================================

    /**
     * Convert a product to a full DTO.
     */
    public ProductDto toDto(Product entity) {
        if (entity == null) {
            return null;
        }

        return new ProductDto(
            entity.getId(),
            entity.getName(),
            entity.getDescription(),
            entity.getBrand(),
            entity.getModel(),
            entity.getDismantlingNotes(),
            entity.getDismantlingTimeStart(),
            entity.getDismantlingTimeEnd(),
            entity.getParent() != null ? entity.getParent().getId() : null,
            entity.getAmountInParent(),
            entity.getOwner() != null ? entity.getOwner().getId() : null,
            entity.getProductType() != null ? entity.getProductType().getId() : null,
            entity.isBaseProduct(),
            entity.isLeafNode(),
            toMaterialLineDtoList(entity.getBillOfMaterials()),
            entity.getComponents().stream().map(Product::getId).toList(),
            toPhysicalPropertiesDto(entity.getPhysicalProperties()),
            toCircularityPropertiesDto(entity.getCircularityProperties()),
            entity.getCreatedAt(),
            entity.getUpdatedAt()
        );
    }

    public MaterialLineDto toMaterialLineDto(MaterialProductLink link) {
        return new MaterialLineDto(
            link.getMaterial().getId(),
            link.getQuantity(),
            link.getUnit().getValue()
        );
    }

    public List<MaterialLineDto> toMaterialLineDtoList(List<MaterialProductLink> links) {
        return links.stream().map(this::toMaterialLineDto).toList();
    }

    public ProductFileDto toFileDto(ProductFile file) {
        return new ProductFileDto(file.getId(), file.getFilename(), file.getStoragePath());
    }

    public PhysicalPropertiesDto toPhysicalPropertiesDto(PhysicalProperties properties) {
        if (properties == null) {
            return null;
        }
        return new PhysicalPropertiesDto(
            properties.getWeightKg(),
            properties.getHeightCm(),
            properties.getWidthCm(),
            properties.getDepthCm(),
            properties.getVolumeCm3()
        );
    }

    public CircularityPropertiesDto toCircularityPropertiesDto(CircularityProperties properties) {
        if (properties == null) {
            return null;
        }
        return new CircularityPropertiesDto(
            properties.getRecyclabilityObservation(),
            properties.getRecyclabilityComment(),
            properties.getRecyclabilityReference(),
            properties.getRepairabilityObservation(),
            properties.getRepairabilityComment(),
            properties.getRepairabilityReference(),
            properties.getRemanufacturabilityObservation(),
            properties.getRemanufacturabilityComment(),
            properties.getRemanufacturabilityReference()
        );
    }

    // ========================================================================
    // Request -> Domain Conversions
    // ========================================================================

    /**
     * Convert a create request into a tree definition, recursing into nested components.
     */
    public TreeDefinition toDefinition(CreateProductRequest request) {
        return TreeDefinition.builder()
            .name(request.name())
            .description(request.description())
            .brand(request.brand())
            .model(request.model())
            .dismantlingNotes(request.dismantlingNotes())
            .dismantlingTimeStart(request.dismantlingTimeStart())
            .dismantlingTimeEnd(request.dismantlingTimeEnd())
            .amountInParent(request.amountInParent())
            .physicalProperties(toPhysicalProperties(request.physicalProperties()))
            .circularityProperties(toCircularityProperties(request.circularityProperties()))
            .videos(toVideos(request.videos()))
            .billOfMaterials(toMaterialLines(request.billOfMaterials()))
            .components(toDefinitions(request.components()))
            .build();
    }

    public TreeDefinition toDefinition(ComponentRequest request) {
        return TreeDefinition.builder()
            .name(request.name())
            .description(request.description())
            .brand(request.brand())
            .model(request.model())
            .dismantlingNotes(request.dismantlingNotes())
            .dismantlingTimeStart(request.dismantlingTimeStart())
            .dismantlingTimeEnd(request.dismantlingTimeEnd())
            .amountInParent(request.amountInParent())
            .physicalProperties(toPhysicalProperties(request.physicalProperties()))
            .circularityProperties(toCircularityProperties(request.circularityProperties()))
            .videos(toVideos(request.videos()))
            .billOfMaterials(toMaterialLines(request.billOfMaterials()))
            .components(toDefinitions(request.components()))
            .build();
    }

    public List<MaterialLine> toMaterialLines(List<MaterialLineRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        return requests.stream()
            .map(line -> new MaterialLine(line.materialId(), line.quantity(), parseUnit(line.unit())))
            .toList();
    }

    public ProductUpdate toUpdate(UpdateProductRequest request) {
        return new ProductUpdate(
            request.name(),
            request.description(),
            request.brand(),
            request.model(),
            request.dismantlingNotes(),
            request.dismantlingTimeStart(),
            request.dismantlingTimeEnd(),
            request.productTypeId()
        );
    }

    /**
     * Null stays null; unknown values raise IllegalArgumentException.
     */
    public Unit parseUnit(String value) {
        return value != null ? Unit.fromValue(value) : null;
    }

    private List<TreeDefinition> toDefinitions(List<ComponentRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        return requests.stream().map(this::toDefinition).toList();
    }

    public PhysicalPropertiesDefinition toPhysicalProperties(PhysicalPropertiesRequest request) {
        if (request == null) {
            return null;
        }
        return new PhysicalPropertiesDefinition(
            request.weightKg(), request.heightCm(), request.widthCm(), request.depthCm());
    }

    public CircularityPropertiesDefinition toCircularityProperties(CircularityPropertiesRequest request) {
        if (request == null) {
            return null;
        }
        return new CircularityPropertiesDefinition(
            request.recyclabilityObservation(),
            request.recyclabilityComment(),
            request.recyclabilityReference(),
            request.repairabilityObservation(),
            request.repairabilityComment(),
            request.repairabilityReference(),
            request.remanufacturabilityObservation(),
            request.remanufacturabilityComment(),
            request.remanufacturabilityReference());
    }

    private List<VideoDefinition> toVideos(List<VideoRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        return requests.stream()
            .map(v -> new VideoDefinition(v.url(), v.title(), v.description()))
            .toList();
    }
}
