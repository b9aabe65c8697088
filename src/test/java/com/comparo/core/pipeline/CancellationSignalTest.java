package com.comparo.core.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    @DisplayName("runs callbacks once on first cancel")
    void runsCallbacksOnce() {
        var signal = new CancellationSignal();
        var calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        assertTrue(signal.cancel());
        assertFalse(signal.cancel());
        assertTrue(signal.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("callback registered after cancel runs immediately")
    void lateRegistrationRunsImmediately() {
        var signal = new CancellationSignal();
        signal.cancel();
        var calls = new AtomicInteger();

        signal.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("unregistered callback does not run")
    void unregisteredCallbackDoesNotRun() {
        var signal = new CancellationSignal();
        var calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet).unregister();

        signal.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("failing callback does not stop the others")
    void failingCallbackIsContained() {
        var signal = new CancellationSignal();
        var calls = new AtomicInteger();
        signal.onCancel(() -> { throw new IllegalStateException("boom"); });
        signal.onCancel(calls::incrementAndGet);

        signal.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("child follows parent but can be cancelled alone")
    void childSignal() {
        var parent = new CancellationSignal();
        var first = parent.child();
        var second = parent.child();

        first.cancel();
        assertTrue(first.isCancelled());
        assertFalse(second.isCancelled());
        assertFalse(parent.isCancelled());

        parent.cancel();
        assertTrue(second.isCancelled());
    }
}
