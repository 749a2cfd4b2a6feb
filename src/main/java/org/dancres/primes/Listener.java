package org.dancres.primes;

/**
 * Receives progress of a generator run. Callbacks are made synchronously on the thread driving the generator, in
 * the order the underlying steps happen.
 */
public interface Listener {
    void transition(GenerationEvent anEvent);
}
