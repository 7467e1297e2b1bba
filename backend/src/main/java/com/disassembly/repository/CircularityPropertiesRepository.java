package com.disassembly.repository;

import com.disassembly.model.product.CircularityProperties;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the circularity properties of products.
 */
@Repository
public interface CircularityPropertiesRepository extends JpaRepository<CircularityProperties, Long> {

    Optional<CircularityProperties> findByProductId(Long productId);
}
