package com.disassembly.repository;

import com.disassembly.model.product.Product;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for products and their components.
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, Long> {

    /**
     * Find products by ID with their bill of materials prefetched.
     */
    @EntityGraph(attributePaths = {"billOfMaterials", "billOfMaterials.material"})
    @Query("SELECT p FROM Product p WHERE p.id IN :ids")
    List<Product> findAllWithMaterialsByIdIn(@Param("ids") Collection<Long> ids);

    /**
     * Find the direct components of the given parents with their bill of materials prefetched.
     */
    @EntityGraph(attributePaths = {"billOfMaterials", "billOfMaterials.material"})
    @Query("SELECT p FROM Product p WHERE p.parent.id IN :parentIds ORDER BY p.id")
    List<Product> findAllWithMaterialsByParentIdIn(@Param("parentIds") Collection<Long> parentIds);

    /**
     * Find base products with their bill of materials prefetched.
     */
    @EntityGraph(attributePaths = {"billOfMaterials", "billOfMaterials.material"})
    @Query("SELECT p FROM Product p WHERE p.parent IS NULL ORDER BY p.id")
    List<Product> findBaseProductsWithMaterials();

    /**
     * Find product by ID with its bill of materials loaded.
     */
    @EntityGraph(attributePaths = {"billOfMaterials", "billOfMaterials.material"})
    @Query("SELECT p FROM Product p WHERE p.id = :id")
    Optional<Product> findByIdWithMaterials(@Param("id") Long id);

    /**
     * Count base products.
     */
    long countByParentIsNull();

    /**
     * Distinct non-null brands as stored, before any normalization.
     */
    @Query("SELECT DISTINCT p.brand FROM Product p WHERE p.brand IS NOT NULL")
    List<String> findDistinctBrands();
}
