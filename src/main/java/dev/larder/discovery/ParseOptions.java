package dev.larder.discovery;

import dev.larder.fetch.CancellationSignal;

/**
 * Parameters of one parsing run.
 *
 * @param signal cancellation, checked before each page fetch
 */
public record ParseOptions(CancellationSignal signal) {

    public ParseOptions {
        signal = signal == null ? CancellationSignal.none() : signal;
    }
}
