package com.phillippitts.branchplayer.service.flow;

import com.phillippitts.branchplayer.domain.Choice;
import com.phillippitts.branchplayer.domain.FlowSnapshot;
import com.phillippitts.branchplayer.domain.MediaBundle;
import com.phillippitts.branchplayer.domain.Phase;
import com.phillippitts.branchplayer.domain.QuestionSequence;
import com.phillippitts.branchplayer.exception.FlowConfigurationException;
import com.phillippitts.branchplayer.service.flow.event.AwaitingChoiceEvent;
import com.phillippitts.branchplayer.service.flow.event.FlowConfigurationErrorEvent;
import com.phillippitts.branchplayer.service.flow.event.SequenceCompletedEvent;
import com.phillippitts.branchplayer.service.metrics.PlaybackMetrics;
import com.phillippitts.branchplayer.service.playback.PlaybackSession;
import com.phillippitts.branchplayer.service.playback.event.BundleFinishedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;

/**
 * Deterministic automaton that decides which bundle plays next.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * start                          → QUESTION(0)
 * QUESTION finished              → awaiting choice (choice UI shown)
 * awaiting + SUCCESS             → OUTCOME_SUCCESS(i)
 * awaiting + FAILURE             → OUTCOME_FAILURE(i)
 * OUTCOME_SUCCESS finished       → QUESTION(i + 1), or COMPLETE when i + 1 has no question
 * OUTCOME_FAILURE finished       → QUESTION(i) again
 * </pre>
 *
 * <p>Choices arriving while not awaiting one are ignored. The awaiting state has no timeout.
 * Failure retries are unbounded.
 *
 * <p><b>Thread Safety:</b> transitions run on the tick thread only; {@link #snapshot()} may be
 * read from any thread.
 *
 * @since 1.0
 */
public class FlowStateMachine {

    private static final Logger LOG = LogManager.getLogger(FlowStateMachine.class);

    private final QuestionSequence sequence;
    private final PlaybackSession session;
    private final ChoiceUi choiceUi;
    private final ApplicationEventPublisher publisher;
    private final PlaybackMetrics metrics;

    private final FlowState state = new FlowState();
    private volatile FlowSnapshot snapshot;

    public FlowStateMachine(QuestionSequence sequence,
                            PlaybackSession session,
                            ChoiceUi choiceUi,
                            ApplicationEventPublisher publisher,
                            PlaybackMetrics metrics) {
        this.sequence = Objects.requireNonNull(sequence, "sequence must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.choiceUi = Objects.requireNonNull(choiceUi, "choiceUi must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.snapshot = FlowSnapshot.notStarted(sequence.size());
        session.addFinishedListener(this::onBundleFinished);
    }

    /**
     * Starts the flow with the first question.
     *
     * @return {@code true} if the first question was loaded (or the flow already runs),
     *         {@code false} if configuration prevents starting
     */
    public boolean start() {
        if (state.started) {
            LOG.debug("start() ignored; flow already started");
            return true;
        }
        try {
            sequence.requireStartable();
        } catch (FlowConfigurationException e) {
            reportConfigurationError(e);
            return false;
        }

        LOG.info("Starting flow with {} question(s)", sequence.size());
        if (!select(0, Phase.QUESTION)) {
            return false;
        }
        state.started = true;
        publishSnapshot();
        return true;
    }

    /**
     * Applies an operator choice.
     *
     * @return {@code true} if an outcome bundle was loaded
     */
    public boolean onChoice(Choice choice) {
        Objects.requireNonNull(choice, "choice must not be null");
        if (!state.awaitingChoice) {
            LOG.debug("Ignoring choice {} while not awaiting one (phase={}, index={})",
                    choice, state.phase, state.currentIndex);
            metrics.recordIgnoredChoice();
            return false;
        }

        LOG.info("Choice {} for question {}", choice, state.currentIndex);
        metrics.recordChoice(choice);
        if (!select(state.currentIndex, choice.outcome())) {
            // Outcome could not load; keep the choice open
            choiceUi.show();
            return false;
        }
        return true;
    }

    /**
     * Reacts to the end of the active bundle.
     */
    public void onBundleFinished(BundleFinishedEvent event) {
        if (!state.started || state.complete) {
            LOG.debug("Ignoring finished bundle {} (started={}, complete={})",
                    event.bundleId(), state.started, state.complete);
            return;
        }
        switch (state.phase) {
            case QUESTION -> awaitChoice();
            case OUTCOME_SUCCESS -> advance();
            case OUTCOME_FAILURE -> {
                LOG.info("Failure outcome finished; replaying question {}", state.currentIndex);
                select(state.currentIndex, Phase.QUESTION);
            }
        }
        publishSnapshot();
    }

    public FlowSnapshot snapshot() {
        return snapshot;
    }

    private void awaitChoice() {
        state.awaitingChoice = true;
        choiceUi.show();
        LOG.info("Question {} finished; awaiting choice", state.currentIndex);
        publisher.publishEvent(new AwaitingChoiceEvent(state.currentIndex, Instant.now()));
    }

    private void advance() {
        int next = state.currentIndex + 1;
        if (sequence.hasQuestionAt(next)) {
            select(next, Phase.QUESTION);
        } else {
            complete(next);
        }
    }

    private void complete(int finalIndex) {
        state.currentIndex = finalIndex;
        state.complete = true;
        state.awaitingChoice = false;
        session.stop();
        choiceUi.hide();
        metrics.recordSequenceCompleted();
        LOG.info("Sequence complete after {} of {} question(s)", finalIndex, sequence.size());
        publisher.publishEvent(new SequenceCompletedEvent(finalIndex, sequence.size(), Instant.now()));
    }

    /**
     * Loads the bundle for {@code (index, phase)}. Phase and index change only if the load succeeds.
     */
    private boolean select(int index, Phase phase) {
        MediaBundle bundle = sequence.get(index).bundle(index, phase);
        choiceUi.hide();
        try {
            session.load(bundle);
        } catch (FlowConfigurationException e) {
            reportConfigurationError(e);
            return false;
        }
        state.currentIndex = index;
        state.phase = phase;
        state.awaitingChoice = false;
        publishSnapshot();
        return true;
    }

    private void reportConfigurationError(FlowConfigurationException e) {
        LOG.error("Flow configuration error: {}", e.getMessage());
        state.configurationError = e.getMessage();
        publisher.publishEvent(new FlowConfigurationErrorEvent(e.getMessage(), Instant.now()));
        publishSnapshot();
    }

    private void publishSnapshot() {
        snapshot = new FlowSnapshot(state.phase, state.currentIndex, sequence.size(),
                state.started, state.awaitingChoice, state.complete, state.configurationError);
    }

    /** Mutable state owned by this machine. */
    private static final class FlowState {
        private int currentIndex;
        private Phase phase = Phase.QUESTION;
        private boolean started;
        private boolean awaitingChoice;
        private boolean complete;
        private String configurationError;
    }
}
