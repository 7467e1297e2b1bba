package com.disassembly.composition;

import com.disassembly.composition.exception.IncompatibleUnitsException;
import com.disassembly.composition.exception.InvariantViolationException;
import com.disassembly.model.enums.Unit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bill of Materials Aggregator
 *
 * Rolls the bill of materials of every node in a tree up to its root:
 *   total(material) = sum over lines of quantity * product of amountInParent from the line's node up to the root
 *
 * The root multiplier is 1. Quantities for one material must share a unit; nothing is converted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BillOfMaterialsAggregator {

    private final CompositionArenaLoader arenaLoader;

    /**
     * Material ID to total quantity for the tree under {@code rootId}.
     *
     * @throws IncompatibleUnitsException if one material is measured in different units within the tree
     */
    @Transactional(readOnly = true)
    public Map<Long, Double> aggregateBillOfMaterials(Long rootId) {
        Map<Long, Double> totals = new LinkedHashMap<>();
        for (MaterialTotal total : aggregateWithUnits(rootId)) {
            totals.put(total.materialId(), total.quantity());
        }
        return totals;
    }

    /**
     * Totals per material, with the unit they are expressed in.
     */
    @Transactional(readOnly = true)
    public List<MaterialTotal> aggregateWithUnits(Long rootId) {
        CompositionArena arena = arenaLoader.load(RootSelector.node(rootId), CompositionArenaLoader.UNBOUNDED);
        List<MaterialTotal> totals = rollUp(arena, rootId);
        log.debug("Aggregated {} materials over {} products under {}", totals.size(), arena.size(), rootId);
        return totals;
    }

    /**
     * Pure roll-up over an already loaded arena.
     */
    public static List<MaterialTotal> rollUp(CompositionArena arena, Long rootId) {
        Accumulator accumulator = new Accumulator();
        traverse(arena, rootId, 1.0, new HashSet<>(), accumulator);
        return accumulator.totals();
    }

    private static void traverse(CompositionArena arena, Long nodeId, double multiplier,
                                 Set<Long> visited, Accumulator accumulator) {
        if (!visited.add(nodeId)) {
            InvariantViolationException ex = new InvariantViolationException(nodeId,
                "Cycle in stored composition data: product reached twice during aggregation");
            log.error("Aborting bill-of-materials aggregation", ex);
            throw ex;
        }

        NodeRecord node = arena.get(nodeId);
        for (MaterialLine line : node.billOfMaterials()) {
            accumulator.add(line, line.quantity() * multiplier);
        }

        for (Long childId : arena.childrenOf(nodeId)) {
            NodeRecord child = arena.get(childId);
            Integer amount = child.amountInParent();
            if (amount == null || amount <= 0) {
                InvariantViolationException ex = new InvariantViolationException(childId,
                    "Stored component has no positive amount in parent (" + amount + ")");
                log.error("Aborting bill-of-materials aggregation", ex);
                throw ex;
            }
            traverse(arena, childId, multiplier * amount, visited, accumulator);
        }
    }

    private static final class Accumulator {

        private final Map<Long, Double> quantities = new LinkedHashMap<>();
        private final Map<Long, Set<Unit>> units = new LinkedHashMap<>();

        void add(MaterialLine line, double quantity) {
            quantities.merge(line.materialId(), quantity, Double::sum);
            units.computeIfAbsent(line.materialId(), k -> EnumSet.noneOf(Unit.class)).add(line.unit());
        }

        List<MaterialTotal> totals() {
            return quantities.entrySet().stream()
                .map(e -> new MaterialTotal(e.getKey(), e.getValue(), singleUnit(e.getKey())))
                .toList();
        }

        private Unit singleUnit(Long materialId) {
            Set<Unit> found = units.get(materialId);
            if (found.size() > 1) {
                throw new IncompatibleUnitsException(materialId, found);
            }
            return found.iterator().next();
        }
    }
}
