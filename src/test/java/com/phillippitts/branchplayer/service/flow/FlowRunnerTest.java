package com.phillippitts.branchplayer.service.flow;

import com.phillippitts.branchplayer.domain.Choice;
import com.phillippitts.branchplayer.domain.Phase;
import com.phillippitts.branchplayer.domain.QuestionSequence;
import com.phillippitts.branchplayer.service.caption.SrtCaptionParser;
import com.phillippitts.branchplayer.service.metrics.PlaybackMetrics;
import com.phillippitts.branchplayer.service.playback.MediaClock;
import com.phillippitts.branchplayer.service.playback.PlaybackSession;
import com.phillippitts.branchplayer.service.signal.FlowSignal;
import com.phillippitts.branchplayer.service.signal.SignalQueue;
import com.phillippitts.branchplayer.service.subtitle.SubtitleDriver;
import com.phillippitts.branchplayer.testutil.EventCapturingPublisher;
import com.phillippitts.branchplayer.testutil.FakeAudioBackend;
import com.phillippitts.branchplayer.testutil.FakeChoiceUi;
import com.phillippitts.branchplayer.testutil.FakeVideoBackend;
import com.phillippitts.branchplayer.testutil.FlowFixtures;
import com.phillippitts.branchplayer.testutil.MapCaptionLoader;
import com.phillippitts.branchplayer.testutil.RecordingCaptionDisplay;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static com.phillippitts.branchplayer.testutil.FlowFixtures.question;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FlowRunnerTest {

    private final FakeVideoBackend video = new FakeVideoBackend();
    private final FakeAudioBackend narration = new FakeAudioBackend();
    private final RecordingCaptionDisplay display = new RecordingCaptionDisplay();
    private final FakeChoiceUi choiceUi = new FakeChoiceUi();
    private final SignalQueue signals = new SignalQueue();
    private FlowStateMachine machine;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    private FlowRunner runner(boolean autoStart) {
        PlaybackMetrics metrics = new PlaybackMetrics(new SimpleMeterRegistry());
        SubtitleDriver subtitles = new SubtitleDriver(display, new MediaClock(video, narration), 0.0, true);
        PlaybackSession session = new PlaybackSession(video, narration, new FakeAudioBackend(), subtitles,
                new MapCaptionLoader().with("q0.srt", FlowFixtures.CAPTIONS), new SrtCaptionParser(),
                signals, metrics);
        machine = new FlowStateMachine(new QuestionSequence(List.of(question(0), question(1))),
                session, choiceUi, new EventCapturingPublisher(), metrics);
        return new FlowRunner(signals, machine, session, subtitles, autoStart);
    }

    @Test
    void lifecycleStartRequestsFlowStartWhenAutoStartEnabled() {
        FlowRunner runner = runner(true);

        runner.start();
        assertThat(runner.isRunning()).isTrue();
        assertThat(machine.snapshot().started()).isFalse();

        runner.tick();

        assertThat(machine.snapshot().started()).isTrue();
        assertThat(video.clip).isEqualTo("q0.mp4");
    }

    @Test
    void autoStartDisabledWaitsForExplicitStart() {
        FlowRunner runner = runner(false);

        runner.start();
        runner.tick();
        assertThat(machine.snapshot().started()).isFalse();

        signals.post(new FlowSignal.StartRequested());
        runner.tick();
        assertThat(machine.snapshot().started()).isTrue();
    }

    @Test
    void scheduledTickDoesNothingWhileStopped() {
        FlowRunner runner = runner(false);
        signals.post(new FlowSignal.StartRequested());

        runner.scheduledTick();
        assertThat(machine.snapshot().started()).isFalse();

        runner.start();
        runner.scheduledTick();
        assertThat(machine.snapshot().started()).isTrue();

        runner.stop();
        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    void drivesCaptionsFromMediaClockAfterPrepare() {
        FlowRunner runner = runner(true);
        runner.start();
        runner.tick();

        narration.time = 1.5;
        runner.tick();
        assertThat(display.current()).isEmpty();

        video.completePrepare();
        runner.tick();
        narration.time = 1.5;
        runner.tick();
        assertThat(display.current()).isEqualTo("A");

        narration.time = 2.5;
        runner.tick();
        assertThat(display.current()).isEmpty();

        narration.time = 3.2;
        runner.tick();
        assertThat(display.current()).isEqualTo("B");
    }

    @Test
    void choiceSignalsAreAppliedOnTick() {
        FlowRunner runner = runner(true);
        runner.start();
        runner.tick();
        video.completePrepare();
        runner.tick();
        video.finishClip();
        runner.tick();
        assertThat(choiceUi.visible).isTrue();

        signals.post(new FlowSignal.ChoiceMade(Choice.SUCCESS));
        runner.tick();

        assertThat(machine.snapshot().phase()).isEqualTo(Phase.OUTCOME_SUCCESS);
        assertThat(video.clip).isEqualTo("s0.mp4");
    }

    @Test
    void failingSignalDoesNotStallQueue() {
        SignalQueue queue = new SignalQueue();
        FlowStateMachine stateMachine = mock(FlowStateMachine.class);
        PlaybackSession session = mock(PlaybackSession.class);
        SubtitleDriver subtitles = mock(SubtitleDriver.class);
        UUID id = UUID.randomUUID();
        when(session.onPrepared(id)).thenThrow(new IllegalStateException("backend exploded"));
        FlowRunner runner = new FlowRunner(queue, stateMachine, session, subtitles, false);

        queue.post(new FlowSignal.MediaPrepared(id));
        queue.post(new FlowSignal.ChoiceMade(Choice.FAILURE));
        runner.tick();

        verify(stateMachine).onChoice(Choice.FAILURE);
        verify(subtitles).tick();
        assertThat(queue.size()).isZero();
    }

    @Test
    void tagsMediaSignalsWithBundleIdInLogContext() {
        SignalQueue queue = new SignalQueue();
        PlaybackSession session = mock(PlaybackSession.class);
        UUID id = UUID.randomUUID();
        AtomicReference<String> seen = new AtomicReference<>();
        doAnswer(invocation -> {
            seen.set(ThreadContext.get(FlowRunner.MDC_BUNDLE_ID));
            return true;
        }).when(session).onFinished(any());
        FlowRunner runner = new FlowRunner(queue, mock(FlowStateMachine.class), session,
                mock(SubtitleDriver.class), false);

        queue.post(new FlowSignal.MediaFinished(id));
        runner.tick();

        assertThat(seen.get()).isEqualTo(id.toString());
        assertThat(ThreadContext.get(FlowRunner.MDC_BUNDLE_ID)).isNull();
    }
}
