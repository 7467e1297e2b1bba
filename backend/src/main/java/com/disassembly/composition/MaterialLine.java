package com.disassembly.composition;

import com.disassembly.model.enums.Unit;

/**
 * Quantity of a material consumed by one unit of a node.
 */
public record MaterialLine(Long materialId, double quantity, Unit unit) {

    public MaterialLine {
        if (unit == null) {
            unit = Unit.KILOGRAM;
        }
    }

    public static MaterialLine of(Long materialId, double quantity) {
        return new MaterialLine(materialId, quantity, Unit.KILOGRAM);
    }
}
