package com.disassembly.composition.exception;

/**
 * A write would collide with existing state, e.g. a second properties row for one product or a
 * duplicate rejected by the database at flush/commit time.
 */
public class IntegrityConflictException extends RuntimeException {

    public IntegrityConflictException(String message) {
        super(message);
    }

    public IntegrityConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
