package dev.larder.fetch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token shared by one discovery or parsing run and everything it
 * spawns. Cancelling never interrupts a thread; workers check the flag between units of work.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** A fresh signal that nobody else holds, hence never cancelled. */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /** A signal that is already cancelled. */
    public static CancellationSignal cancelledSignal() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        return signal;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
