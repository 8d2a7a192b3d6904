package com.phillippitts.branchplayer.service.signal;

import com.phillippitts.branchplayer.domain.Choice;

import java.util.Objects;
import java.util.UUID;

/**
 * Discrete input to the flow, queued from any thread and processed on the tick thread.
 *
 * <p>Media signals carry the id of the bundle they belong to so that signals for a superseded
 * bundle can be recognized and discarded.
 */
public sealed interface FlowSignal
        permits FlowSignal.StartRequested, FlowSignal.MediaPrepared, FlowSignal.MediaFinished, FlowSignal.ChoiceMade {

    /** Request to start the flow from the first question. */
    record StartRequested() implements FlowSignal { }

    /** The video backend finished preparing the clip of the given bundle. */
    record MediaPrepared(UUID bundleId) implements FlowSignal {
        public MediaPrepared {
            Objects.requireNonNull(bundleId, "bundleId must not be null");
        }
    }

    /** The video of the given bundle reached its end. */
    record MediaFinished(UUID bundleId) implements FlowSignal {
        public MediaFinished {
            Objects.requireNonNull(bundleId, "bundleId must not be null");
        }
    }

    /** The operator picked an outcome. */
    record ChoiceMade(Choice choice) implements FlowSignal {
        public ChoiceMade {
            Objects.requireNonNull(choice, "choice must not be null");
        }
    }
}
