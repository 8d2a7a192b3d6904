package com.phillippitts.branchplayer.presentation.controller;

import com.phillippitts.branchplayer.domain.Choice;
import com.phillippitts.branchplayer.domain.FlowSnapshot;
import com.phillippitts.branchplayer.service.flow.ChoiceUi;
import com.phillippitts.branchplayer.service.flow.FlowStateMachine;
import com.phillippitts.branchplayer.service.signal.FlowSignal;
import com.phillippitts.branchplayer.service.signal.SignalQueue;
import com.phillippitts.branchplayer.service.subtitle.SubtitleDriver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Operator endpoints: read the flow state and submit success/failure choices.
 *
 * <p>Choices are only queued while the choice panel is shown; the tick thread applies them.
 */
@RestController
@RequestMapping("/api/flow")
class FlowController {

    private static final Logger LOG = LogManager.getLogger(FlowController.class);

    private final FlowStateMachine stateMachine;
    private final SubtitleDriver subtitles;
    private final ChoiceUi choiceUi;
    private final SignalQueue signals;

    FlowController(FlowStateMachine stateMachine,
                   SubtitleDriver subtitles,
                   ChoiceUi choiceUi,
                   SignalQueue signals) {
        this.stateMachine = stateMachine;
        this.subtitles = subtitles;
        this.choiceUi = choiceUi;
        this.signals = signals;
    }

    @GetMapping
    ResponseEntity<FlowStatus> status() {
        return ResponseEntity.ok(new FlowStatus(stateMachine.snapshot(), subtitles.displayedText(),
                choiceUi.isVisible()));
    }

    @PostMapping("/choice/{choice}")
    ResponseEntity<Map<String, Object>> choose(@PathVariable("choice") String choice) {
        Choice parsed = Choice.fromValue(choice);
        if (!choiceUi.isVisible()) {
            LOG.debug("Choice {} rejected; no choice pending", parsed);
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "status", "ignored",
                    "reason", "No choice is pending",
                    "timestamp", Instant.now().toString()
            ));
        }
        signals.post(new FlowSignal.ChoiceMade(parsed));
        LOG.info("Choice {} submitted", parsed);
        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "choice", parsed.name(),
                "timestamp", Instant.now().toString()
        ));
    }

    /**
     * Flow state plus what the caption surface currently shows.
     */
    record FlowStatus(FlowSnapshot flow, String caption, boolean choicesVisible) { }
}
