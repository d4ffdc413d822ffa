package com.podshift.dependency.exception;

/**
 * The snapshot is structurally unusable (missing, empty, or with clashing ids)
 * and no meaningful graph can be produced from it.
 */
public class InvalidSnapshotException extends RuntimeException {

    public InvalidSnapshotException(String message) {
        super(message);
    }
}
