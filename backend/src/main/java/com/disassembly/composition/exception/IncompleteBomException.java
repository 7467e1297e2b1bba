package com.disassembly.composition.exception;

/**
 * A leaf component has no bill of materials.
 */
public class IncompleteBomException extends TreeValidationException {

    public static final String CONSTRAINT = "leaf_resolves_to_materials";

    public IncompleteBomException(String nodeRef) {
        super(nodeRef, CONSTRAINT, "All leaf components must have a non-empty bill of materials.");
    }
}
