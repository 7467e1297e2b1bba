package com.disassembly.model.product;

import com.disassembly.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Observations on how well a product can be recycled, repaired and remanufactured.
 * Every field is optional free text.
 */
@Entity
@Table(name = "circularity_properties")
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class CircularityProperties extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false, unique = true)
    private Product product;

    // Recyclability
    @Column(name = "recyclability_observation", length = 500)
    private String recyclabilityObservation;

    @Column(name = "recyclability_comment", length = 100)
    private String recyclabilityComment;

    @Column(name = "recyclability_reference", length = 250)
    private String recyclabilityReference;

    // Repairability
    @Column(name = "repairability_observation", length = 500)
    private String repairabilityObservation;

    @Column(name = "repairability_comment", length = 100)
    private String repairabilityComment;

    @Column(name = "repairability_reference", length = 250)
    private String repairabilityReference;

    // Remanufacturability
    @Column(name = "remanufacturability_observation", length = 500)
    private String remanufacturabilityObservation;

    @Column(name = "remanufacturability_comment", length = 100)
    private String remanufacturabilityComment;

    @Column(name = "remanufacturability_reference", length = 250)
    private String remanufacturabilityReference;
}
