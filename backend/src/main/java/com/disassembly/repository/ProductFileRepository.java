package com.disassembly.repository;

import com.disassembly.model.product.ProductFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for files attached to products.
 */
@Repository
public interface ProductFileRepository extends JpaRepository<ProductFile, Long> {

    /**
     * Storage paths of every file attached to one of the given products.
     */
    @Query("SELECT f.storagePath FROM ProductFile f WHERE f.product.id IN :productIds")
    List<String> findStoragePathsByProductIdIn(@Param("productIds") Collection<Long> productIds);
}
