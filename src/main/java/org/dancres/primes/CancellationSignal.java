package org.dancres.primes;

/**
 * Polled by the generator between iterations (and by the loader between files) to find out whether the user wants
 * the run to stop. Implementations must not block.
 */
public interface CancellationSignal {
    boolean pollCancelRequested();

    CancellationSignal NEVER = () -> false;
}
