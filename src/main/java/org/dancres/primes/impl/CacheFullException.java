package org.dancres.primes.impl;

/**
 * Raised by {@link PrimeCache} when adding primes would exceed its budget. This is the expected signal to stop
 * generating in memory and is always handled within the engine.
 */
public class CacheFullException extends Exception {
    private static final long serialVersionUID = 4476112180043926411L;

    private final int _limit;

    CacheFullException(int aLimit, int aRequested) {
        super("Cache limit of " + aLimit + " primes reached, couldn't add " + aRequested + " more");
        _limit = aLimit;
    }

    public int getLimit() {
        return _limit;
    }
}
