package com.disassembly.repository;

import com.disassembly.model.product.MaterialProductLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for bill-of-materials lines.
 */
@Repository
public interface MaterialProductLinkRepository extends JpaRepository<MaterialProductLink, Long> {

    List<MaterialProductLink> findByProductIdOrderById(Long productId);

    Optional<MaterialProductLink> findByProductIdAndMaterialId(Long productId, Long materialId);

    long countByProductIdIn(Collection<Long> productIds);
}
