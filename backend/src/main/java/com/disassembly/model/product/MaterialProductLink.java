package com.disassembly.model.product;

import com.disassembly.model.AuditableEntity;
import com.disassembly.model.enums.Unit;
import com.disassembly.model.reference.Material;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * One bill-of-materials line: {@code quantity} {@code unit} of a material per one unit of the product.
 */
@Entity
@Table(name = "material_product_link",
    uniqueConstraints = @UniqueConstraint(name = "uk_material_product", columnNames = {"product_id", "material_id"}),
    indexes = {
        @Index(name = "idx_link_product", columnList = "product_id"),
        @Index(name = "idx_link_material", columnList = "material_id")
    })
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class MaterialProductLink extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "material_id", nullable = false)
    private Material material;

    @Column(nullable = false)
    private double quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Unit unit = Unit.KILOGRAM;
}
