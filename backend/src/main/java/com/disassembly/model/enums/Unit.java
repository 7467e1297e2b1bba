package com.disassembly.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Units allowed on a bill-of-materials line.
 * Quantities are never converted between units.
 */
public enum Unit {
    KILOGRAM("kg"),
    GRAM("g"),
    METER("m"),
    CENTIMETER("cm");

    private final String value;

    Unit(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Unit fromValue(String value) {
        for (Unit unit : values()) {
            if (unit.value.equals(value)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown Unit: " + value);
    }
}
