package com.phillippitts.branchplayer.service.flow;

import com.phillippitts.branchplayer.service.signal.FlowSignal;
import com.phillippitts.branchplayer.service.signal.SignalQueue;
import com.phillippitts.branchplayer.service.subtitle.SubtitleDriver;
import com.phillippitts.branchplayer.service.playback.PlaybackSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Objects;

/**
 * Host scheduling loop for the flow.
 *
 * <p>Every tick first drains queued signals (start, media prepared/finished, choices) and then
 * updates captions. Everything that mutates flow, session or subtitle state therefore runs on
 * the single scheduler thread.
 */
public class FlowRunner implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(FlowRunner.class);

    static final String MDC_BUNDLE_ID = "bundleId";

    private final SignalQueue signals;
    private final FlowStateMachine stateMachine;
    private final PlaybackSession session;
    private final SubtitleDriver subtitles;
    private final boolean autoStart;

    private volatile boolean running;

    public FlowRunner(SignalQueue signals,
                      FlowStateMachine stateMachine,
                      PlaybackSession session,
                      SubtitleDriver subtitles,
                      boolean autoStart) {
        this.signals = Objects.requireNonNull(signals, "signals must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.subtitles = Objects.requireNonNull(subtitles, "subtitles must not be null");
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        if (autoStart) {
            signals.post(new FlowSignal.StartRequested());
        }
        LOG.info("FlowRunner started (autoStart={})", autoStart);
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        LOG.info("FlowRunner stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Scheduled(fixedRateString = "${flow.tick-interval-ms:16}")
    public void scheduledTick() {
        if (running) {
            tick();
        }
    }

    /**
     * One scheduling tick: deliver pending signals, then update captions.
     */
    public void tick() {
        signals.drain(this::dispatch);
        subtitles.tick();
    }

    void dispatch(FlowSignal signal) {
        try {
            if (signal instanceof FlowSignal.MediaPrepared prepared) {
                ThreadContext.put(MDC_BUNDLE_ID, prepared.bundleId().toString());
                session.onPrepared(prepared.bundleId());
            } else if (signal instanceof FlowSignal.MediaFinished finished) {
                ThreadContext.put(MDC_BUNDLE_ID, finished.bundleId().toString());
                session.onFinished(finished.bundleId());
            } else if (signal instanceof FlowSignal.ChoiceMade choice) {
                stateMachine.onChoice(choice.choice());
            } else if (signal instanceof FlowSignal.StartRequested) {
                stateMachine.start();
            }
        } catch (RuntimeException e) {
            // keep draining; one bad signal must not stall the loop
            LOG.error("Failed to process {}", signal, e);
        } finally {
            ThreadContext.remove(MDC_BUNDLE_ID);
        }
    }
}
