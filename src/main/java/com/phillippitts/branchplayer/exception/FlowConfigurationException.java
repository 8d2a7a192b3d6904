package com.phillippitts.branchplayer.exception;

/**
 * Thrown when the configured sequence cannot be played: no questions, or a bundle that must
 * play is missing its video reference.
 *
 * <p>Never fatal to the process. The flow state machine reports it and does not advance.
 */
public class FlowConfigurationException extends BranchPlayerException {

    public FlowConfigurationException(String message) {
        super(message);
    }

    public FlowConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
