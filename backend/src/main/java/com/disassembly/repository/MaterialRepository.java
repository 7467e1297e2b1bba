package com.disassembly.repository;

import com.disassembly.model.reference.Material;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Set;

/**
 * Repository for materials.
 */
@Repository
public interface MaterialRepository extends JpaRepository<Material, Long> {

    /**
     * Which of the given IDs exist, in one query.
     */
    @Query("SELECT m.id FROM Material m WHERE m.id IN :ids")
    Set<Long> findExistingIds(@Param("ids") Collection<Long> ids);
}
