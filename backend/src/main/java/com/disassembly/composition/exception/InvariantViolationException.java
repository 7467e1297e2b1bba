package com.disassembly.composition.exception;

/**
 * Persisted data breaks a tree invariant that construction should have made impossible.
 * Signals corruption, not a caller error.
 */
public class InvariantViolationException extends RuntimeException {

    private final Long nodeId;

    public InvariantViolationException(Long nodeId, String message) {
        super(message + " [node: " + nodeId + "]");
        this.nodeId = nodeId;
    }

    public Long getNodeId() {
        return nodeId;
    }
}
