package com.phillippitts.branchplayer.domain;

import com.phillippitts.branchplayer.exception.FlowConfigurationException;

import java.util.List;

/**
 * Ordered, immutable list of question sets configured at startup.
 *
 * <p>The position within the sequence is not stored here; it belongs to the flow state machine.
 */
public final class QuestionSequence {

    private final List<QuestionSet> questions;

    public QuestionSequence(List<QuestionSet> questions) {
        this.questions = questions == null ? List.of() : List.copyOf(questions);
    }

    public int size() {
        return questions.size();
    }

    public boolean isEmpty() {
        return questions.isEmpty();
    }

    public QuestionSet get(int index) {
        return questions.get(index);
    }

    /**
     * @return {@code true} if {@code index} is inside the sequence and has a question video
     */
    public boolean hasQuestionAt(int index) {
        return index >= 0 && index < questions.size() && questions.get(index).hasQuestionVideo();
    }

    /**
     * Verifies the sequence can start at index 0.
     *
     * @throws FlowConfigurationException if the sequence is empty or the first question has no video
     */
    public void requireStartable() {
        if (questions.isEmpty()) {
            throw new FlowConfigurationException("No questions configured (flow.questions is empty)");
        }
        if (!questions.get(0).hasQuestionVideo()) {
            throw new FlowConfigurationException(
                    "Missing question video for question 0 (flow.questions[0].question.video)");
        }
    }
}
