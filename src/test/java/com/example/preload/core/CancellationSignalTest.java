package com.example.preload.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {

    @Test
    void callbacksRunOnceOnCancel() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger runs = new AtomicInteger();
        signal.onCancel(runs::incrementAndGet);

        assertThat(signal.isCancelled()).isFalse();
        signal.cancel();
        signal.cancel();

        assertThat(signal.isCancelled()).isTrue();
        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger runs = new AtomicInteger();

        signal.onCancel(runs::incrementAndGet);

        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger runs = new AtomicInteger();
        signal.onCancel(() -> {
            throw new IllegalStateException("handle already closed");
        });
        signal.onCancel(runs::incrementAndGet);

        signal.cancel();

        assertThat(runs.get()).isEqualTo(1);
    }
}
