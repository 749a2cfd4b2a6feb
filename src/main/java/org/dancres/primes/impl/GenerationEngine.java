package org.dancres.primes.impl;

import org.dancres.primes.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives a run through <code>LOADING</code>, <code>MEMORY_GENERATION</code>, <code>OVERFLOWING</code> and
 * <code>DISK_GENERATION</code> to <code>STOPPED</code>, gluing the loader, tester and store together. All state
 * changes and I/O happen on the thread calling {@link #run()}; checkpoint writes reported by the store are passed on
 * to listeners from within that same call.
 */
public class GenerationEngine implements Generator, ResultStore.WriteListener {
    private static final Logger _logger = LoggerFactory.getLogger(GenerationEngine.class);

    private final ResultStore _store;
    private final PrimalityTester _tester;
    private final CancellationSignal _signal;
    private final PrimeCache _cache;
    private final List<Listener> _listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<Phase> _phase = new AtomicReference<>(Phase.LOADING);
    private final AtomicBoolean _started = new AtomicBoolean(false);

    private volatile BigInteger _candidate = Constants.FIRST_CANDIDATE;

    /**
     * Index into the cache of the first prime not yet written to a result file.
     */
    private int _firstUnstored;

    /**
     * @param aStore holds the result files to resume from and write to
     * @param aTester performs trial division of candidates
     * @param aSignal is polled between candidates and between result files during loading
     * @param aCacheLimit is the maximum number of primes to hold in memory
     */
    public GenerationEngine(ResultStore aStore, PrimalityTester aTester, CancellationSignal aSignal,
                            int aCacheLimit) {
        _store = aStore;
        _tester = aTester;
        _signal = aSignal;
        _cache = new PrimeCache(aCacheLimit);
    }

    public void add(Listener aListener) {
        _listeners.add(aListener);
    }

    public Phase getPhase() {
        return _phase.get();
    }

    public List<BigInteger> getCachedPrimes() {
        return _cache.asList();
    }

    public BigInteger getCandidate() {
        return _candidate;
    }

    public void close() {
        _tester.close();
    }

    public void written(CheckpointWritten aWrite) {
        dispatch(GenerationEvent.checkpointWritten(aWrite));
    }

    public void run() throws GenerationException {
        if (! _started.compareAndSet(false, true))
            throw new IllegalStateException("Generator has already been run");

        _store.add(this);

        try {
            GenerationState myState = new ExistingStateLoader(_store, this::dispatch, _signal).load(_cache);

            if (myState.isAborted()) {
                transition(Phase.STOPPED);
                return;
            }

            _candidate = myState.getNextCandidate();
            _firstUnstored = _cache.size();

            dispatch(GenerationEvent.generationStarted());
            _store.generationStarted(System.currentTimeMillis());

            // Everything in the cache came from disk when the limit was hit during loading, so there is nothing
            // to flush before moving on
            //
            if (! myState.isMemoryLimitReached()) {
                checkResumable(myState);

                transition(Phase.MEMORY_GENERATION);

                if (! generateInMemory()) {
                    transition(Phase.STOPPED);
                    return;
                }

                transition(Phase.OVERFLOWING);
                storeAfterOverflow();
            }

            transition(Phase.DISK_GENERATION);
            generateOnDisk();

            transition(Phase.STOPPED);
        } catch (InterruptedException anIE) {
            Thread.currentThread().interrupt();
            throw fail(anIE);
        } catch (Exception anE) {
            throw fail(anE);
        }
    }

    /**
     * @return <code>true</code> if generation stopped because the cache is full, <code>false</code> if cancelled
     */
    private boolean generateInMemory() throws IOException, InterruptedException {
        int myCapacity = _store.getCapacity();

        while (! _signal.pollCancelRequested()) {
            BigInteger myCandidate = _candidate;

            if (_tester.isPrime(_cache.asList(), myCandidate)) {
                try {
                    _cache.add(myCandidate);
                } catch (CacheFullException aCFE) {
                    _logger.debug("Cache full at prime " + myCandidate, aCFE);
                    return true;
                }

                if (_cache.size() % myCapacity == 0)
                    flush();
            }

            _candidate = myCandidate.add(BigInteger.ONE);
        }

        _logger.debug("Cancelled at candidate " + _candidate + " with " + _cache.size() + " primes in memory");

        return false;
    }

    /**
     * Saves the primes found since the last checkpoint followed by the prime that didn't fit in the cache. That
     * prime passed trial division before the attempt to cache it failed.
     */
    private void storeAfterOverflow() throws IOException {
        flush();

        _store.append(Collections.singletonList(_candidate));
        _candidate = _candidate.add(BigInteger.ONE);
    }

    private void generateOnDisk() {
        if (_signal.pollCancelRequested())
            return;

        throw new UnsupportedOperationException("Trial division against primes held on disk is not supported, " +
                "cache is full at " + _cache.size() + " primes");
    }

    private void flush() throws IOException {
        int mySize = _cache.size();

        if (_firstUnstored < mySize) {
            _store.append(_cache.range(_firstUnstored, mySize));
            _firstUnstored = mySize;
        }
    }

    /**
     * Checks the cache holds every prime in the result files so new primes are written with the right ordinals.
     * Loading stops quietly at an empty file which would leave primes in later files unaccounted for.
     */
    private void checkResumable(GenerationState aState) throws IOException {
        SortedMap<Integer, File> myFiles = _store.listCheckpointFiles();
        int myIndex = aState.getNextFileIndex();

        int myAllocating = _store.nextFileIndex();

        if (myIndex != myAllocating)
            throw new StorageCorruptionException("Result files changed whilst loading, expected to resume in file " +
                    myIndex + " but the store would write to " + myAllocating, myAllocating,
                    myFiles.get(myAllocating));

        long myStored = (long) (myIndex - 1) * _store.getCapacity() +
                (myFiles.containsKey(myIndex) ? _store.count(myIndex) : 0);

        if (myStored != _cache.size())
            throw new StorageCorruptionException("Result files are not complete, they account for " + myStored +
                    " primes but " + _cache.size() + " were loaded", myIndex, myFiles.get(myIndex));
    }

    private GenerationException fail(Exception anE) {
        Phase myPhase = _phase.getAndSet(Phase.STOPPED);

        _logger.debug("Failed in " + myPhase + " at candidate " + _candidate, anE);

        return new GenerationException(_candidate, myPhase, anE);
    }

    private void transition(Phase aPhase) {
        _logger.debug(toString() + " " + _phase.get() + " -> " + aPhase);

        _phase.set(aPhase);
    }

    private void dispatch(GenerationEvent anEvent) {
        for (Listener myListener : _listeners)
            myListener.transition(anEvent);
    }

    public String toString() {
        return "GE [ " + _cache + ", " + _candidate + " ]";
    }
}
