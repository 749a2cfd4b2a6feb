package org.dancres.primes.impl;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ascending, gapless run of primes held in memory. Holds at most a fixed number of primes, refusing further
 * additions with {@link CacheFullException} rather than growing until the JVM runs out of heap.
 *
 * Mutated only by the thread driving generation, trial division workers only read it.
 */
class PrimeCache {
    private final ArrayList<BigInteger> _primes;
    private final List<BigInteger> _view;
    private final int _limit;

    PrimeCache(int aLimit) {
        assert (aLimit > 0);

        _limit = aLimit;
        _primes = new ArrayList<>(Math.min(aLimit, Constants.INITIAL_CACHE_SIZE));
        _view = Collections.unmodifiableList(_primes);
    }

    void add(BigInteger aPrime) throws CacheFullException {
        if (_primes.size() >= _limit)
            throw new CacheFullException(_limit, 1);

        assert (_primes.isEmpty() || (last().compareTo(aPrime) < 0));

        _primes.add(aPrime);
    }

    /**
     * Adds all or none of the primes.
     */
    void addAll(List<BigInteger> aPrimes) throws CacheFullException {
        if ((long) _primes.size() + aPrimes.size() > _limit)
            throw new CacheFullException(_limit, aPrimes.size());

        assert (_primes.isEmpty() || aPrimes.isEmpty() || (last().compareTo(aPrimes.get(0)) < 0));

        _primes.addAll(aPrimes);
    }

    int size() {
        return _primes.size();
    }

    int getLimit() {
        return _limit;
    }

    BigInteger last() {
        return _primes.get(_primes.size() - 1);
    }

    /**
     * @return a read-only view of the primes from <code>aFrom</code> (inclusive) to <code>aTo</code> (exclusive)
     */
    List<BigInteger> range(int aFrom, int aTo) {
        return _view.subList(aFrom, aTo);
    }

    /**
     * @return a read-only view of all the primes
     */
    List<BigInteger> asList() {
        return _view;
    }

    public String toString() {
        return "PrimeCache: " + _primes.size() + "/" + _limit;
    }
}
