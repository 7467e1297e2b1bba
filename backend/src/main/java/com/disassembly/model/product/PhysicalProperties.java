package com.disassembly.model.product;

import com.disassembly.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Measured physical properties of a product, all optional and positive.
 */
@Entity
@Table(name = "physical_properties")
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class PhysicalProperties extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false, unique = true)
    private Product product;

    @Column(name = "weight_kg")
    private Double weightKg;

    @Column(name = "height_cm")
    private Double heightCm;

    @Column(name = "width_cm")
    private Double widthCm;

    @Column(name = "depth_cm")
    private Double depthCm;

    /**
     * Volume in cm3, or null unless all three dimensions are known.
     */
    public Double getVolumeCm3() {
        if (heightCm == null || widthCm == null || depthCm == null) {
            return null;
        }
        return heightCm * widthCm * depthCm;
    }
}
