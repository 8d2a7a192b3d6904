package com.phillippitts.branchplayer.config.properties;

import com.phillippitts.branchplayer.domain.PhaseMedia;
import com.phillippitts.branchplayer.domain.QuestionSequence;
import com.phillippitts.branchplayer.domain.QuestionSet;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the branching flow.
 *
 * <pre>
 * flow.questions[0].question.video=clips/q1.mp4
 * flow.questions[0].question.narration=audio/q1.mp3
 * flow.questions[0].question.captions=classpath:captions/q1.srt
 * flow.questions[0].success.video=clips/q1-ok.mp4
 * flow.questions[0].failure.video=clips/q1-retry.mp4
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "flow")
public class FlowProperties {

    @NotNull
    private final List<Question> questions;

    /**
     * Signed shift in seconds added to the playback clock before caption lookup.
     * Negative values compensate for backend output latency.
     */
    private final double timeOffsetSeconds;

    /** Clear on-screen captions whenever playback is between cues. */
    private final boolean clearCaptionsInGaps;

    /** Scheduling tick interval in milliseconds. */
    @Min(1)
    private final long tickIntervalMs;

    /** Start the first question as soon as the application is up. */
    private final boolean autoStart;

    @ConstructorBinding
    public FlowProperties(List<Question> questions,
                          Double timeOffsetSeconds,
                          Boolean clearCaptionsInGaps,
                          Long tickIntervalMs,
                          Boolean autoStart) {
        this.questions = questions == null ? List.of() : List.copyOf(questions);
        this.timeOffsetSeconds = timeOffsetSeconds == null ? -0.12 : timeOffsetSeconds;
        this.clearCaptionsInGaps = clearCaptionsInGaps == null || clearCaptionsInGaps;
        this.tickIntervalMs = tickIntervalMs == null ? 16L : tickIntervalMs;
        this.autoStart = autoStart == null || autoStart;
    }

    public List<Question> getQuestions() {
        return questions;
    }

    public double getTimeOffsetSeconds() {
        return timeOffsetSeconds;
    }

    public boolean isClearCaptionsInGaps() {
        return clearCaptionsInGaps;
    }

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    /**
     * Builds the immutable sequence the flow plays.
     */
    public QuestionSequence toSequence() {
        return new QuestionSequence(questions.stream().map(Question::toQuestionSet).toList());
    }

    /** One question set: the question and its two outcomes. */
    public record Question(Media question, Media success, Media failure) {

        QuestionSet toQuestionSet() {
            return new QuestionSet(Media.toPhaseMedia(question), Media.toPhaseMedia(success),
                    Media.toPhaseMedia(failure));
        }
    }

    /** References for one phase; every field is optional here and checked at runtime. */
    public record Media(String video, String narration, String music, String captions) {

        static PhaseMedia toPhaseMedia(Media m) {
            return m == null ? PhaseMedia.EMPTY : new PhaseMedia(m.video, m.narration, m.music, m.captions);
        }
    }
}
