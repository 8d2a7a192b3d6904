package com.phillippitts.branchplayer.service.health;

import com.phillippitts.branchplayer.domain.FlowSnapshot;
import com.phillippitts.branchplayer.service.flow.FlowStateMachine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the branching flow.
 *
 * <ul>
 *   <li>UP: flow running, or waiting to start</li>
 *   <li>COMPLETE: sequence played to the end</li>
 *   <li>DOWN: flow could not start because of configuration</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class FlowHealthIndicator implements HealthIndicator {

    private final FlowStateMachine stateMachine;

    public FlowHealthIndicator(FlowStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public Health health() {
        FlowSnapshot s = stateMachine.snapshot();
        Health.Builder builder = new Health.Builder();

        if (!s.started() && s.configurationError() != null) {
            builder.down().withDetail("error", s.configurationError());
        } else if (s.complete()) {
            builder.status("COMPLETE");
        } else {
            builder.up();
        }

        return builder
                .withDetail("started", s.started())
                .withDetail("phase", s.phase().name())
                .withDetail("currentIndex", s.currentIndex())
                .withDetail("questionCount", s.questionCount())
                .withDetail("awaitingChoice", s.awaitingChoice())
                .build();
    }
}
