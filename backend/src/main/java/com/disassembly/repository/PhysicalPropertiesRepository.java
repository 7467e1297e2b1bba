package com.disassembly.repository;

import com.disassembly.model.product.PhysicalProperties;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the physical properties of products.
 */
@Repository
public interface PhysicalPropertiesRepository extends JpaRepository<PhysicalProperties, Long> {

    Optional<PhysicalProperties> findByProductId(Long productId);
}
