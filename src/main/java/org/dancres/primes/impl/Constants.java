package org.dancres.primes.impl;

import java.math.BigInteger;

public final class Constants {
    public static final BigInteger FIRST_CANDIDATE = BigInteger.TWO;

    /**
     * Smallest number of trial divisors worth handing to a worker of its own.
     */
    public static final int MIN_SLICE = 512;

    /**
     * Initial backing size of the cache, it grows from there up to the configured limit.
     */
    public static final int INITIAL_CACHE_SIZE = 1 << 20;
}
