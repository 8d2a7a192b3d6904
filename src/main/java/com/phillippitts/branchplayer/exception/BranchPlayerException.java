package com.phillippitts.branchplayer.exception;

/**
 * Base exception for all branchplayer application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class BranchPlayerException extends RuntimeException {

    public BranchPlayerException(String message) {
        super(message);
    }

    public BranchPlayerException(String message, Throwable cause) {
        super(message, cause);
    }

    public BranchPlayerException(Throwable cause) {
        super(cause);
    }
}
