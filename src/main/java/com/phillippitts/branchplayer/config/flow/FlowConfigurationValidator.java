package com.phillippitts.branchplayer.config.flow;

import com.phillippitts.branchplayer.config.properties.FlowProperties;
import com.phillippitts.branchplayer.domain.Phase;
import com.phillippitts.branchplayer.domain.QuestionSequence;
import com.phillippitts.branchplayer.domain.QuestionSet;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks flow.questions at startup and logs actionable warnings.
 *
 * <p>Does not fail startup: an unplayable sequence is reported by the flow state machine when it
 * tries to start, and gaps later in the sequence only matter if the flow reaches them.
 */
@Component
class FlowConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(FlowConfigurationValidator.class);

    private final FlowProperties props;

    FlowConfigurationValidator(FlowProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        List<String> problems = findProblems();
        for (String p : problems) {
            LOG.warn("Flow configuration: {}", p);
        }
        if (problems.isEmpty()) {
            LOG.info("Flow configuration OK: {} question(s), time offset {}s, clear captions in gaps={}",
                    props.getQuestions().size(), props.getTimeOffsetSeconds(), props.isClearCaptionsInGaps());
        }
    }

    // Package-private for tests
    List<String> findProblems() {
        QuestionSequence sequence = props.toSequence();
        List<String> problems = new ArrayList<>();
        if (sequence.isEmpty()) {
            problems.add("flow.questions is empty; the flow will not start");
            return problems;
        }
        for (int i = 0; i < sequence.size(); i++) {
            QuestionSet set = sequence.get(i);
            if (!set.hasQuestionVideo()) {
                problems.add(i == 0
                        ? "flow.questions[0].question.video is missing; the flow will not start"
                        : "flow.questions[" + i + "].question.video is missing; the sequence completes before it");
            }
            if (!set.media(Phase.OUTCOME_SUCCESS).hasVideo()) {
                problems.add("flow.questions[" + i + "].success.video is missing; choosing success there is rejected");
            }
            if (!set.media(Phase.OUTCOME_FAILURE).hasVideo()) {
                problems.add("flow.questions[" + i + "].failure.video is missing; choosing failure there is rejected");
            }
        }
        return problems;
    }
}
