package com.disassembly.composition;

import com.disassembly.model.enums.Unit;

/**
 * Total quantity of one material consumed by a whole assembly.
 */
public record MaterialTotal(Long materialId, double quantity, Unit unit) {
}
