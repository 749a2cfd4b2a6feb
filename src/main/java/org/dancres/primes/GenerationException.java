package org.dancres.primes;

import java.math.BigInteger;

/**
 * Terminates a generator run. The cause is the original failure, unchanged; the candidate is the number that was
 * being worked on when it happened and is intended for the diagnostic log.
 */
public class GenerationException extends Exception {
    private static final long serialVersionUID = -6090843371288301227L;

    private final BigInteger _candidate;
    private final Phase _phase;

    public GenerationException(BigInteger aCandidate, Phase aPhase, Throwable aCause) {
        super("Generation failed in " + aPhase + " at candidate " + aCandidate + ": " + aCause, aCause);
        _candidate = aCandidate;
        _phase = aPhase;
    }

    public BigInteger getCandidate() {
        return _candidate;
    }

    public Phase getPhase() {
        return _phase;
    }
}
