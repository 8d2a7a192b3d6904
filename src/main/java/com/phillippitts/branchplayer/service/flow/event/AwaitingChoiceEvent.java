package com.phillippitts.branchplayer.service.flow.event;

import java.time.Instant;

/**
 * Published when a question clip finishes and the flow waits for an operator choice.
 */
public record AwaitingChoiceEvent(int questionIndex, Instant at) { }
