package com.phillippitts.branchplayer.service.flow.event;

import java.time.Instant;

/**
 * Published when the last success outcome finishes and no further question is playable.
 *
 * @param finalIndex index the flow stopped at
 * @param questionCount number of configured question sets
 * @param at completion time
 */
public record SequenceCompletedEvent(int finalIndex, int questionCount, Instant at) { }
