package com.phillippitts.branchplayer.service.backend;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SimulatedVideoBackendTest {

    @Test
    void prepareCompletesAfterDelay() {
        SimulatedVideoBackend backend = new SimulatedVideoBackend(0.2, 20);
        backend.setClip("clip.mp4");

        CompletableFuture<Void> prepared = backend.prepare();

        await().atMost(Duration.ofSeconds(2)).until(prepared::isDone);
        assertThat(backend.isPrepared()).isTrue();
    }

    @Test
    void playCompletesAtEndOfClip() {
        SimulatedVideoBackend backend = new SimulatedVideoBackend(0.1, 0);
        backend.setClip("clip.mp4");
        backend.prepare().join();

        CompletableFuture<Void> end = backend.play();
        assertThat(backend.isPlaying()).isTrue();

        await().atMost(Duration.ofSeconds(2)).until(end::isDone);
        assertThat(end.isCompletedExceptionally()).isFalse();
        assertThat(backend.isPlaying()).isFalse();
        assertThat(backend.currentTime()).isEqualTo(0.1);
    }

    @Test
    void stopCancelsPendingEndOfClip() {
        SimulatedVideoBackend backend = new SimulatedVideoBackend(5.0, 0);
        backend.setClip("clip.mp4");
        backend.prepare().join();
        CompletableFuture<Void> end = backend.play();

        backend.stop();

        assertThat(end.isCancelled()).isTrue();
        assertThat(backend.isPlaying()).isFalse();
        assertThat(backend.isPrepared()).isFalse();
    }

    @Test
    void positionAdvancesWhilePlaying() {
        SimulatedVideoBackend backend = new SimulatedVideoBackend(5.0, 0);
        backend.setClip("clip.mp4");
        backend.prepare().join();
        backend.play();

        await().atMost(Duration.ofSeconds(2)).until(() -> backend.currentTime() > 0.05);
        backend.stop();
    }

    @Test
    void rejectsNonPositiveDuration() {
        assertThatThrownBy(() -> new SimulatedVideoBackend(0.0, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
