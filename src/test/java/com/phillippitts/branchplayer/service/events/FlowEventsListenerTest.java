package com.phillippitts.branchplayer.service.events;

import com.phillippitts.branchplayer.service.flow.event.AwaitingChoiceEvent;
import com.phillippitts.branchplayer.service.flow.event.FlowConfigurationErrorEvent;
import com.phillippitts.branchplayer.service.flow.event.SequenceCompletedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class FlowEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        FlowEventsListener l = new FlowEventsListener();
        // shouldLog allows first occurrence
        assertThat(l.shouldLog("config-missing video")).isTrue();
        // but rejects immediately repeated
        assertThat(l.shouldLog("config-missing video")).isFalse();
        // other keys are tracked separately
        assertThat(l.shouldLog("config-other")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        FlowEventsListener l = new FlowEventsListener();
        // Just ensure no exceptions
        l.onConfigurationError(new FlowConfigurationErrorEvent("No questions configured", Instant.now()));
        l.onConfigurationError(new FlowConfigurationErrorEvent("No questions configured", Instant.now()));
        l.onAwaitingChoice(new AwaitingChoiceEvent(0, Instant.now()));
        l.onSequenceCompleted(new SequenceCompletedEvent(2, 2, Instant.now()));
        assertThat(true).isTrue();
    }
}
