package com.phillippitts.branchplayer.domain;

/**
 * Media for one narrative step: the question and its two outcomes.
 */
public record QuestionSet(PhaseMedia question, PhaseMedia success, PhaseMedia failure) {

    public QuestionSet {
        question = question == null ? PhaseMedia.EMPTY : question;
        success = success == null ? PhaseMedia.EMPTY : success;
        failure = failure == null ? PhaseMedia.EMPTY : failure;
    }

    /**
     * Selects the media for a phase. This is the single place that maps a phase to its fields.
     */
    public PhaseMedia media(Phase phase) {
        return switch (phase) {
            case QUESTION -> question;
            case OUTCOME_SUCCESS -> success;
            case OUTCOME_FAILURE -> failure;
        };
    }

    public MediaBundle bundle(int index, Phase phase) {
        return new MediaBundle(phase, index, media(phase));
    }

    public boolean hasQuestionVideo() {
        return question.hasVideo();
    }
}
