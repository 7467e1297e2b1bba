package com.disassembly.composition;

import com.disassembly.composition.exception.ModelNotFoundException;
import com.disassembly.model.product.MaterialProductLink;
import com.disassembly.model.product.Product;
import com.disassembly.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Loads product trees into a {@link CompositionArena}, one query per level.
 * Never reads below {@code maxDepth} levels under the selected nodes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CompositionArenaLoader {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final ProductRepository productRepository;

    public CompositionArena load(RootSelector selector, int maxDepth) {
        CompositionArena arena = new CompositionArena();

        List<Product> tops;
        if (selector.isAllRoots()) {
            tops = productRepository.findBaseProductsWithMaterials();
        } else {
            tops = productRepository.findAllWithMaterialsByIdIn(List.of(selector.nodeId()));
            if (tops.isEmpty()) {
                throw new ModelNotFoundException("Product", selector.nodeId());
            }
        }

        List<Long> frontier = new ArrayList<>();
        for (Product product : tops) {
            arena.addTop(toRecord(product));
            frontier.add(product.getId());
        }

        int depth = 0;
        while (!frontier.isEmpty() && depth < maxDepth) {
            List<Long> next = new ArrayList<>();
            for (Product child : productRepository.findAllWithMaterialsByParentIdIn(frontier)) {
                if (arena.addChild(toRecord(child))) {
                    next.add(child.getId());
                } else {
                    log.warn("Product {} reached twice while loading tree from {}", child.getId(), selector);
                }
            }
            frontier = next;
            depth++;
        }

        log.debug("Loaded {} products for {} (depth limit {}, levels read {})",
            arena.size(), selector, maxDepth, depth);
        return arena;
    }

    static NodeRecord toRecord(Product product) {
        List<MaterialLine> lines = new ArrayList<>();
        for (MaterialProductLink link : product.getBillOfMaterials()) {
            lines.add(new MaterialLine(link.getMaterial().getId(), link.getQuantity(), link.getUnit()));
        }
        return new NodeRecord(
            product.getId(),
            product.getParent() != null ? product.getParent().getId() : null,
            product.getOwner() != null ? product.getOwner().getId() : null,
            product.getProductType() != null ? product.getProductType().getId() : null,
            product.getName(),
            product.getDescription(),
            product.getBrand(),
            product.getModel(),
            product.getAmountInParent(),
            lines
        );
    }
}
