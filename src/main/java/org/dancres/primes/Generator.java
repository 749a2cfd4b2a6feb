package org.dancres.primes;

import java.math.BigInteger;
import java.util.List;

/**
 * Discovers primes by trial division against the primes found so far, checkpointing them into result files so a
 * later run can resume where this one stopped.
 *
 * <p>A run is driven by a single thread calling {@link #run()}. It first replays existing result files
 * (<code>LOADING</code>), then tests candidates against the primes held in memory (<code>MEMORY_GENERATION</code>).
 * Every time the number of primes found reaches a multiple of the file capacity, the primes not yet saved are
 * appended to the result files. Should the in-memory budget be exhausted, the unsaved primes are flushed
 * (<code>OVERFLOWING</code>) and generation would continue against the primes on disk (<code>DISK_GENERATION</code>),
 * which is currently unsupported and fails the run.</p>
 *
 * <p>The run ends when the {@link CancellationSignal} reports a cancellation, which is polled once per candidate
 * and never interrupts a test in progress. Primes found before cancellation remain in memory, only full files are
 * written.</p>
 *
 * @see GeneratorFactory
 * @see GenerationEvent
 */
public interface Generator {
    /**
     * @throws GenerationException if the run fails, carrying the candidate being worked on at the time
     */
    void run() throws GenerationException;

    void add(Listener aListener);

    Phase getPhase();

    /**
     * @return a read-only view of the primes held in memory
     */
    List<BigInteger> getCachedPrimes();

    /**
     * @return the next number to be tested
     */
    BigInteger getCandidate();

    /**
     * Releases the trial division workers.
     */
    void close();
}
