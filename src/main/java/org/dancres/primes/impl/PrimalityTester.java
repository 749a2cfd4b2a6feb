package org.dancres.primes.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides primality by trial division against the primes found so far. Only primes whose square is below the
 * candidate are tried, and when there are enough of them they are split across a fixed pool of workers. The first
 * worker to find a factor raises a shared flag which the others check before each division so they stop early.
 */
public class PrimalityTester {
    private static final Logger _logger = LoggerFactory.getLogger(PrimalityTester.class);

    private final int _workerCount;
    private final int _minSlice;
    private final ExecutorService _workers;

    public PrimalityTester(int aWorkers) {
        this(aWorkers, Constants.MIN_SLICE);
    }

    /**
     * @param aWorkers the maximum number of threads dividing a single candidate
     * @param aMinSlice the minimum number of divisors a worker is given
     */
    public PrimalityTester(int aWorkers, int aMinSlice) {
        if (aWorkers < 1)
            throw new IllegalArgumentException("Need at least one worker: " + aWorkers);

        if (aMinSlice < 1)
            throw new IllegalArgumentException("Slice must hold at least one divisor: " + aMinSlice);

        _workerCount = aWorkers;
        _minSlice = aMinSlice;
        _workers = (aWorkers > 1) ? Executors.newFixedThreadPool(aWorkers, new WorkerFactory()) : null;
    }

    /**
     * @param aKnownPrimesAsc every prime up to the largest one listed, ascending. May only be empty for candidates
     *                        below 3 or even.
     * @param aCandidate the non-negative number to test
     * @throws IllegalArgumentException if there are no known primes to test an odd candidate above 2 against
     * @throws UnsupportedOperationException if the known primes don't reach the square root of the candidate
     */
    public boolean isPrime(List<BigInteger> aKnownPrimesAsc, BigInteger aCandidate) throws InterruptedException {
        if (aCandidate.signum() < 0)
            throw new IllegalArgumentException("Candidate must not be negative: " + aCandidate);

        if (aCandidate.compareTo(BigInteger.TWO) < 0)
            return false;

        if (aCandidate.equals(BigInteger.TWO))
            return true;

        if (! aCandidate.testBit(0))
            return false;

        if (aKnownPrimesAsc.isEmpty())
            throw new IllegalArgumentException("No known primes to test " + aCandidate + " against");

        // Find how many of the known primes have a square below the candidate
        //
        int myLower = 0;
        int myUpper = aKnownPrimesAsc.size();

        while (myLower < myUpper) {
            int myMiddle = (myLower + myUpper) >>> 1;
            BigInteger myPrime = aKnownPrimesAsc.get(myMiddle);
            int myComparison = myPrime.multiply(myPrime).compareTo(aCandidate);

            if (myComparison == 0)
                return false;
            else if (myComparison < 0)
                myLower = myMiddle + 1;
            else
                myUpper = myMiddle;
        }

        if (myLower == aKnownPrimesAsc.size())
            throw new UnsupportedOperationException("Known primes end at " + aKnownPrimesAsc.get(myLower - 1) +
                    " which is below the square root of " + aCandidate + ", disk-backed trial division is needed");

        return ! hasFactor(aKnownPrimesAsc.subList(0, myLower), aCandidate);
    }

    private boolean hasFactor(List<BigInteger> aDivisors, BigInteger aCandidate) throws InterruptedException {
        AtomicBoolean myFound = new AtomicBoolean(false);
        int mySlices = Math.min(_workerCount, aDivisors.size() / _minSlice);

        if ((_workers == null) || (mySlices < 2))
            return divide(aDivisors, aCandidate, myFound);

        int mySliceSize = (aDivisors.size() + mySlices - 1) / mySlices;
        List<Callable<Boolean>> myTasks = new ArrayList<>(mySlices);

        for (int myStart = 0; myStart < aDivisors.size(); myStart += mySliceSize) {
            List<BigInteger> mySlice = aDivisors.subList(myStart, Math.min(myStart + mySliceSize, aDivisors.size()));

            myTasks.add(() -> divide(mySlice, aCandidate, myFound));
        }

        for (Future<Boolean> myResult : _workers.invokeAll(myTasks)) {
            try {
                myResult.get();
            } catch (ExecutionException anEE) {
                throw new IllegalStateException("Trial division of " + aCandidate + " failed", anEE.getCause());
            }
        }

        return myFound.get();
    }

    /**
     * @return <code>true</code> if a factor has been found by this or any other worker
     */
    private static boolean divide(List<BigInteger> aDivisors, BigInteger aCandidate, AtomicBoolean aFound) {
        for (BigInteger myDivisor : aDivisors) {
            if (aFound.get())
                return true;

            if (aCandidate.mod(myDivisor).signum() == 0) {
                aFound.set(true);
                return true;
            }
        }

        return false;
    }

    public void close() {
        if (_workers != null) {
            _logger.debug("Shutting down " + _workerCount + " trial division workers");
            _workers.shutdownNow();
        }
    }

    private static class WorkerFactory implements ThreadFactory {
        private final AtomicInteger _count = new AtomicInteger(0);

        public Thread newThread(Runnable aRunnable) {
            Thread myThread = new Thread(aRunnable, "trial-division-" + _count.getAndIncrement());
            myThread.setDaemon(true);

            return myThread;
        }
    }
}
