package com.phillippitts.echoscribe.service.retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double that records requested delays.
 *
 * <p>In immediate mode every wait completes at once, so a whole retry sequence runs on the
 * calling thread. In manual mode the waits stay pending until {@link #releaseAll()}.
 */
class RecordingDelayScheduler implements DelayScheduler {

    private final boolean immediate;
    private final List<Duration> delays = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<Void>> pending = new CopyOnWriteArrayList<>();

    private RecordingDelayScheduler(boolean immediate) {
        this.immediate = immediate;
    }

    static RecordingDelayScheduler immediate() {
        return new RecordingDelayScheduler(true);
    }

    static RecordingDelayScheduler manual() {
        return new RecordingDelayScheduler(false);
    }

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        delays.add(delay);
        if (immediate) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> timer = new CompletableFuture<>();
        pending.add(timer);
        return timer;
    }

    List<Duration> delays() {
        return List.copyOf(delays);
    }

    List<CompletableFuture<Void>> pending() {
        return List.copyOf(pending);
    }

    void releaseAll() {
        pending.forEach(timer -> timer.complete(null));
    }
}
