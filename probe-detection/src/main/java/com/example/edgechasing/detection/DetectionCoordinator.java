package com.example.edgechasing.detection;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide single-flight gate: at most one detection round is in flight at a time.
 * The gate is claimed by the process that starts a round and released only by the process
 * that receives its own probe back.
 */
public final class DetectionCoordinator {
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicInteger roundsStarted = new AtomicInteger();
    private final AtomicInteger roundsConfirmed = new AtomicInteger();

    /** Claims the gate; false when another round is already running. */
    public boolean tryBeginRound() {
        if (!running.compareAndSet(false, true)) return false;
        roundsStarted.incrementAndGet();
        return true;
    }

    /** Releases the gate after a cycle has been confirmed. */
    public void confirmRound() {
        running.set(false);
        roundsConfirmed.incrementAndGet();
    }

    public boolean isRoundInFlight() {
        return running.get();
    }

    public int roundsStarted() {
        return roundsStarted.get();
    }

    public int roundsConfirmed() {
        return roundsConfirmed.get();
    }
}
