package com.disassembly.model.product;

import com.disassembly.model.AuditableEntity;
import com.disassembly.model.reference.ProductType;
import com.disassembly.model.reference.UserAccount;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A product or one of its components.
 * Self-referencing: a row without parent is a base product, every other row is a component
 * embedded {@code amountInParent} times in its parent.
 */
@Entity
@Table(name = "product", indexes = {
    @Index(name = "idx_product_parent", columnList = "parent_id"),
    @Index(name = "idx_product_owner", columnList = "owner_id"),
    @Index(name = "idx_product_name", columnList = "name")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Product extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(length = 500)
    private String description;

    @Column(length = 100)
    private String brand;

    @Column(length = 100)
    private String model;

    @Column(name = "dismantling_notes", length = 500)
    private String dismantlingNotes;

    @Column(name = "dismantling_time_start", nullable = false)
    private LocalDateTime dismantlingTimeStart;

    @Column(name = "dismantling_time_end")
    private LocalDateTime dismantlingTimeEnd;

    /**
     * NULL for base products.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    private Product parent;

    @Column(name = "amount_in_parent")
    private Integer amountInParent;

    @OneToMany(mappedBy = "parent", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id")
    @Builder.Default
    private List<Product> components = new ArrayList<>();

    /**
     * Same owner as the root of the tree.
     */
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false)
    private UserAccount owner;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "product_type_id")
    private ProductType productType;

    @OneToMany(mappedBy = "product", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id")
    @Builder.Default
    private List<MaterialProductLink> billOfMaterials = new ArrayList<>();

    @OneToOne(mappedBy = "product", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    private PhysicalProperties physicalProperties;

    @OneToOne(mappedBy = "product", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    private CircularityProperties circularityProperties;

    @OneToMany(mappedBy = "product", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id")
    @Builder.Default
    private List<ProductVideo> videos = new ArrayList<>();

    @OneToMany(mappedBy = "product", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id")
    @Builder.Default
    private List<ProductFile> files = new ArrayList<>();

    public boolean isBaseProduct() {
        return parent == null;
    }

    public boolean isLeafNode() {
        return components == null || components.isEmpty();
    }

    /**
     * Helper method to add a component.
     */
    public void addComponent(Product component) {
        components.add(component);
        component.setParent(this);
    }

    /**
     * Helper method to remove a component.
     */
    public void removeComponent(Product component) {
        components.remove(component);
        component.setParent(null);
    }

    /**
     * Helper method to add a bill-of-materials line.
     */
    public void addMaterialLink(MaterialProductLink link) {
        billOfMaterials.add(link);
        link.setProduct(this);
    }

    public void removeMaterialLink(MaterialProductLink link) {
        billOfMaterials.remove(link);
        link.setProduct(null);
    }

    public void attachPhysicalProperties(PhysicalProperties properties) {
        this.physicalProperties = properties;
        properties.setProduct(this);
    }

    public void attachCircularityProperties(CircularityProperties properties) {
        this.circularityProperties = properties;
        properties.setProduct(this);
    }

    public void addVideo(ProductVideo video) {
        videos.add(video);
        video.setProduct(this);
    }

    public void addFile(ProductFile file) {
        files.add(file);
        file.setProduct(this);
    }

    @Override
    public String toString() {
        return name + " (id: " + id + ")";
    }
}
