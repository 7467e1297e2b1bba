package com.disassembly.composition;

import lombok.Builder;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Candidate product tree submitted for creation.
 * Lists are kept as given (not copied) so validation sees exactly what the caller built.
 *
 * @param id optional declared ID of an existing node this definition claims to be; used only
 *           for cycle detection
 */
@Builder
public record TreeDefinition(
    Long id,
    String name,
    String description,
    String brand,
    String model,
    String dismantlingNotes,
    LocalDateTime dismantlingTimeStart,
    LocalDateTime dismantlingTimeEnd,
    Integer amountInParent,
    List<MaterialLine> billOfMaterials,
    List<TreeDefinition> components,
    PhysicalPropertiesDefinition physicalProperties,
    CircularityPropertiesDefinition circularityProperties,
    List<VideoDefinition> videos
) implements TreeNode {

    public TreeDefinition {
        billOfMaterials = Objects.requireNonNullElse(billOfMaterials, List.of());
        components = Objects.requireNonNullElse(components, List.of());
        videos = Objects.requireNonNullElse(videos, List.of());
        if (dismantlingTimeStart != null && dismantlingTimeEnd != null
                && dismantlingTimeEnd.isBefore(dismantlingTimeStart)) {
            throw new IllegalArgumentException("End time " + dismantlingTimeEnd
                + " must be after start time " + dismantlingTimeStart);
        }
    }

    public record PhysicalPropertiesDefinition(Double weightKg, Double heightCm, Double widthCm, Double depthCm) {

        public PhysicalPropertiesDefinition {
            requirePositive("weightKg", weightKg);
            requirePositive("heightCm", heightCm);
            requirePositive("widthCm", widthCm);
            requirePositive("depthCm", depthCm);
        }

        private static void requirePositive(String field, Double value) {
            if (value != null && !(value > 0)) {
                throw new IllegalArgumentException(field + " must be positive, got " + value);
            }
        }
    }

    public record CircularityPropertiesDefinition(
        String recyclabilityObservation,
        String recyclabilityComment,
        String recyclabilityReference,
        String repairabilityObservation,
        String repairabilityComment,
        String repairabilityReference,
        String remanufacturabilityObservation,
        String remanufacturabilityComment,
        String remanufacturabilityReference
    ) {
    }

    public record VideoDefinition(String url, String title, String description) {

        public VideoDefinition {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("Video url is required");
            }
        }
    }
}
