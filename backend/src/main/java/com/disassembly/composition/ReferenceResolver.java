package com.disassembly.composition;

import com.disassembly.composition.exception.ModelNotFoundException;
import com.disassembly.model.reference.Material;
import com.disassembly.model.reference.ProductType;
import com.disassembly.model.reference.UserAccount;
import com.disassembly.repository.MaterialRepository;
import com.disassembly.repository.ProductTypeRepository;
import com.disassembly.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Existence checks for the owner, product type and materials a tree refers to.
 */
@Component
@RequiredArgsConstructor
public class ReferenceResolver {

    private final UserAccountRepository userAccountRepository;
    private final ProductTypeRepository productTypeRepository;
    private final MaterialRepository materialRepository;

    public UserAccount requireOwner(UUID ownerId) {
        if (ownerId == null) {
            throw new IllegalArgumentException("Owner id is required");
        }
        return userAccountRepository.findById(ownerId)
            .orElseThrow(() -> new ModelNotFoundException("User", ownerId));
    }

    /**
     * Null in, null out; otherwise the product type or NotFound.
     */
    public ProductType resolveProductType(Long productTypeId) {
        if (productTypeId == null) {
            return null;
        }
        return productTypeRepository.findById(productTypeId)
            .orElseThrow(() -> new ModelNotFoundException("ProductType", productTypeId));
    }

    /**
     * Checks all IDs with a single query and reports every missing one together.
     * Returns lazy references keyed by ID.
     */
    public Map<Long, Material> requireMaterials(Collection<Long> materialIds) {
        Map<Long, Material> references = new LinkedHashMap<>();
        if (materialIds.isEmpty()) {
            return references;
        }

        Set<Long> existing = materialRepository.findExistingIds(materialIds);
        Set<Long> missing = new TreeSet<>(materialIds);
        missing.removeAll(existing);
        if (!missing.isEmpty()) {
            throw new ModelNotFoundException("Material", missing);
        }

        for (Long id : materialIds) {
            references.put(id, materialRepository.getReferenceById(id));
        }
        return references;
    }
}
