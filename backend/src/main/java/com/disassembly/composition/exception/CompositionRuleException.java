package com.disassembly.composition.exception;

/**
 * A single node breaks a composition rule (empty composition, amount in parent, bad material line).
 */
public class CompositionRuleException extends TreeValidationException {

    public static final String NON_EMPTY_COMPOSITION = "non_empty_composition";
    public static final String ROOT_AMOUNT = "root_amount_in_parent";
    public static final String COMPONENT_AMOUNT = "component_amount_in_parent";
    public static final String MATERIAL_LINE = "material_line";
    public static final String DUPLICATE_MATERIAL = "duplicate_material";

    public CompositionRuleException(String nodeRef, String constraint, String message) {
        super(nodeRef, constraint, message);
    }
}
