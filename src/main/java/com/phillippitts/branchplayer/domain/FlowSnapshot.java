package com.phillippitts.branchplayer.domain;

/**
 * Read-only view of the flow state, safe to hand to other threads.
 *
 * @param phase phase of the last selected bundle
 * @param currentIndex zero-based question index; past the last playable question once complete
 * @param questionCount number of configured question sets
 * @param started whether the flow started successfully
 * @param awaitingChoice whether the question clip finished and a choice is pending
 * @param complete whether the sequence ran to its end
 * @param configurationError last configuration problem reported, or {@code null}
 */
public record FlowSnapshot(
        Phase phase,
        int currentIndex,
        int questionCount,
        boolean started,
        boolean awaitingChoice,
        boolean complete,
        String configurationError
) {

    public static FlowSnapshot notStarted(int questionCount) {
        return new FlowSnapshot(Phase.QUESTION, 0, questionCount, false, false, false, null);
    }
}
