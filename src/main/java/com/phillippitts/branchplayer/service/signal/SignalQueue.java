package com.phillippitts.branchplayer.service.signal;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Hands signals from backend callbacks and HTTP threads over to the single tick thread.
 *
 * <p>{@link #post(FlowSignal)} is safe from any thread. {@link #drain(Consumer)} must only be
 * called from the tick thread; signals posted while draining are delivered in the same drain.
 */
public class SignalQueue {

    private final Queue<FlowSignal> pending = new ConcurrentLinkedQueue<>();

    public void post(FlowSignal signal) {
        pending.add(Objects.requireNonNull(signal, "signal must not be null"));
    }

    /**
     * Delivers queued signals in arrival order.
     *
     * @return number of signals delivered
     */
    public int drain(Consumer<FlowSignal> handler) {
        int delivered = 0;
        FlowSignal signal;
        while ((signal = pending.poll()) != null) {
            handler.accept(signal);
            delivered++;
        }
        return delivered;
    }

    public int size() {
        return pending.size();
    }
}
