package com.disassembly.model.reference;

import com.disassembly.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Raw material that bill-of-materials lines refer to.
 */
@Entity
@Table(name = "material", indexes = {
    @Index(name = "idx_material_name", columnList = "name")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Material extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 500)
    private String description;

    /**
     * Density in kg/m3, informational only.
     */
    @Column(name = "density_kg_m3")
    private Double densityKgM3;
}
