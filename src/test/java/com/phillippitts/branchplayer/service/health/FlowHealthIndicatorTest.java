package com.phillippitts.branchplayer.service.health;

import com.phillippitts.branchplayer.domain.FlowSnapshot;
import com.phillippitts.branchplayer.domain.Phase;
import com.phillippitts.branchplayer.service.flow.FlowStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FlowHealthIndicatorTest {

    private FlowStateMachine stateMachine;
    private FlowHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        stateMachine = mock(FlowStateMachine.class);
        indicator = new FlowHealthIndicator(stateMachine);
    }

    @Test
    void shouldReportUpWhileRunning() {
        when(stateMachine.snapshot()).thenReturn(
                new FlowSnapshot(Phase.OUTCOME_SUCCESS, 1, 3, true, false, false, null));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("phase", "OUTCOME_SUCCESS")
                .containsEntry("currentIndex", 1)
                .containsEntry("questionCount", 3)
                .containsEntry("started", true);
    }

    @Test
    void shouldReportUpBeforeStart() {
        when(stateMachine.snapshot()).thenReturn(FlowSnapshot.notStarted(2));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void shouldReportDownWhenFlowCannotStart() {
        when(stateMachine.snapshot()).thenReturn(
                new FlowSnapshot(Phase.QUESTION, 0, 0, false, false, false, "No questions configured"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "No questions configured");
    }

    @Test
    void shouldStayUpWhenOutcomeMisconfiguredAfterStart() {
        when(stateMachine.snapshot()).thenReturn(
                new FlowSnapshot(Phase.QUESTION, 0, 1, true, true, false, "Missing video for OUTCOME_SUCCESS#0"));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void shouldReportCompleteAtEnd() {
        when(stateMachine.snapshot()).thenReturn(
                new FlowSnapshot(Phase.OUTCOME_SUCCESS, 2, 2, true, false, true, null));

        assertThat(indicator.health().getStatus().getCode()).isEqualTo("COMPLETE");
    }
}
