package com.disassembly.composition.exception;

import com.disassembly.model.enums.Unit;

import java.util.Set;

/**
 * One material is listed in more than one unit within a tree, so its total cannot be summed.
 */
public class IncompatibleUnitsException extends RuntimeException {

    private final Long materialId;
    private final Set<Unit> units;

    public IncompatibleUnitsException(Long materialId, Set<Unit> units) {
        super("Material " + materialId + " is listed in incompatible units " + units
            + "; quantities are not converted between units");
        this.materialId = materialId;
        this.units = Set.copyOf(units);
    }

    public Long getMaterialId() {
        return materialId;
    }

    public Set<Unit> getUnits() {
        return units;
    }
}
