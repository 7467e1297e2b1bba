package com.disassembly.composition.exception;

/**
 * Structural violation found in a composition tree before anything is written.
 * Carries the offending node and the name of the violated constraint.
 */
public abstract class TreeValidationException extends RuntimeException {

    private final String nodeRef;
    private final String constraint;

    protected TreeValidationException(String nodeRef, String constraint, String message) {
        super(message + " [node: " + nodeRef + ", constraint: " + constraint + "]");
        this.nodeRef = nodeRef;
        this.constraint = constraint;
    }

    public String getNodeRef() {
        return nodeRef;
    }

    public String getConstraint() {
        return constraint;
    }
}
