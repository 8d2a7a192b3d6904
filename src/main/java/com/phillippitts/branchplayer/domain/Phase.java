package com.phillippitts.branchplayer.domain;

/**
 * Which part of the current question is playing: the question itself or one of its outcomes.
 */
public enum Phase {
    QUESTION,
    OUTCOME_SUCCESS,
    OUTCOME_FAILURE
}
