package com.disassembly.composition.exception;

/**
 * A node would become its own ancestor.
 */
public class CycleException extends TreeValidationException {

    public static final String CONSTRAINT = "acyclic";

    public CycleException(String nodeRef) {
        super(nodeRef, CONSTRAINT, "Cycle detected: a product cannot contain itself directly or indirectly.");
    }
}
