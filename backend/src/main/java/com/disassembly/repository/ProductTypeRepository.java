package com.disassembly.repository;

import com.disassembly.model.reference.ProductType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for product types.
 */
@Repository
public interface ProductTypeRepository extends JpaRepository<ProductType, Long> {
}
