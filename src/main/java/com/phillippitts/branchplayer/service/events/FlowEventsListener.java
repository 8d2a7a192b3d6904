package com.phillippitts.branchplayer.service.events;

import com.phillippitts.branchplayer.service.flow.event.AwaitingChoiceEvent;
import com.phillippitts.branchplayer.service.flow.event.FlowConfigurationErrorEvent;
import com.phillippitts.branchplayer.service.flow.event.SequenceCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized, log-only handler for operator-facing flow events. Configuration warnings are
 * throttled to avoid log spam when the same problem repeats.
 */
@Component
class FlowEventsListener {
    private static final Logger LOG = LogManager.getLogger(FlowEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onConfigurationError(FlowConfigurationErrorEvent e) {
        if (shouldLog("config-" + e.reason())) {
            LOG.warn("Flow cannot proceed: {}. Check flow.questions[*] in application properties.", e.reason());
        }
    }

    @EventListener
    void onAwaitingChoice(AwaitingChoiceEvent e) {
        LOG.info("Waiting for operator choice on question {}", e.questionIndex());
    }

    @EventListener
    void onSequenceCompleted(SequenceCompletedEvent e) {
        LOG.info("Sequence completed at index {} of {}", e.finalIndex(), e.questionCount());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
