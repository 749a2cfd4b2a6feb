package org.dancres.primes.impl;

import org.dancres.primes.CancellationSignal;
import org.dancres.primes.GenerationEvent;
import org.dancres.primes.Listener;
import org.dancres.primes.ResultStore;
import org.dancres.primes.StorageCorruptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Replays the trusted checkpoint files into a {@link PrimeCache} and works out where generation should resume.
 * Primality of the stored values isn't re-checked, only the structure of the files: line counts, ascending order
 * and that only the last file is partial.
 */
class ExistingStateLoader {
    private static final Logger _logger = LoggerFactory.getLogger(ExistingStateLoader.class);

    private final ResultStore _store;
    private final Listener _listener;
    private final CancellationSignal _signal;

    ExistingStateLoader(ResultStore aStore, Listener aListener, CancellationSignal aSignal) {
        _store = aStore;
        _listener = aListener;
        _signal = aSignal;
    }

    GenerationState load(PrimeCache aCache) throws IOException {
        _listener.transition(GenerationEvent.loadStarted());

        SortedMap<Integer, File> myFiles = _store.listCheckpointFiles();
        int myLastNonEmpty = findLastNonEmpty(myFiles);

        BigInteger myNextCandidate = Constants.FIRST_CANDIDATE;
        BigInteger myPrevious = null;
        boolean isMemoryLimitReached = false;
        boolean isAborted = false;
        int myFilesLoaded = 0;
        int myOrdinal = 0;

        for (Map.Entry<Integer, File> myFile : myFiles.entrySet()) {
            _listener.transition(GenerationEvent.loadProgress(++myOrdinal, myFiles.size()));

            List<BigInteger> myPrimes = _store.read(myFile.getKey());

            if (myPrimes.isEmpty()) {
                _logger.warn("Result file " + myFile.getKey() + " is empty, loading stops here: " + myFile.getValue());
                break;
            }

            validate(myFile.getKey(), myFile.getValue(), myPrimes, myPrevious, myLastNonEmpty);

            myPrevious = myPrimes.get(myPrimes.size() - 1);
            myNextCandidate = myPrevious.add(BigInteger.ONE);

            try {
                aCache.addAll(myPrimes);
            } catch (CacheFullException aCFE) {
                _logger.debug("Cache full whilst loading result file " + myFile.getKey(), aCFE);

                isMemoryLimitReached = true;
                myNextCandidate = recoverNextCandidate(myLastNonEmpty, myFiles.get(myLastNonEmpty), myNextCandidate);
                break;
            }

            myFilesLoaded++;

            if (_signal.pollCancelRequested()) {
                _logger.debug("Loading cancelled after result file " + myFile.getKey());

                isAborted = true;
                break;
            }
        }

        GenerationState myState = new GenerationState(myNextCandidate, isMemoryLimitReached,
                findNextFileIndex(myFiles), isAborted, myFilesLoaded);

        _logger.debug("Loaded: " + myState + ", " + aCache);

        _listener.transition(GenerationEvent.loadFinished(aCache.size(), myFilesLoaded));

        return myState;
    }

    private void validate(int anIndex, File aFile, List<BigInteger> aPrimes, BigInteger aPrevious,
                          int aLastNonEmpty) throws StorageCorruptionException {
        int myCapacity = _store.getCapacity();

        if (aPrimes.size() > myCapacity)
            throw new StorageCorruptionException("The result file with index '" + anIndex + "' contains " +
                    aPrimes.size() + " primes, more than the allowed " + myCapacity + ": " + aFile, anIndex, aFile);

        if ((aPrimes.size() < myCapacity) && (anIndex != aLastNonEmpty))
            throw new StorageCorruptionException("Result files are not complete, file with index '" + anIndex +
                    "' is partial but isn't the last: " + aFile, anIndex, aFile);

        BigInteger myPrevious = aPrevious;

        for (BigInteger myPrime : aPrimes) {
            if ((myPrevious != null) && (myPrime.compareTo(myPrevious) <= 0))
                throw new StorageCorruptionException("Result files are not sorted ascending, " + myPrime +
                        " follows " + myPrevious + " in file with index '" + anIndex + "': " + aFile, anIndex, aFile);

            myPrevious = myPrime;
        }
    }

    /**
     * The cache couldn't hold everything so the candidate is recovered from the last stored prime. It can't be
     * behind what was worked out from the files read so far.
     */
    private BigInteger recoverNextCandidate(int aLastNonEmpty, File aFile, BigInteger aSoFar) throws IOException {
        BigInteger myLast = _store.last(aLastNonEmpty);
        BigInteger myNextCandidate = myLast.add(BigInteger.ONE);

        if (myNextCandidate.compareTo(aSoFar) < 0)
            throw new StorageCorruptionException("Calculation indicates corrupted result files, last prime " + myLast +
                    " is behind " + aSoFar + ". Make sure all result files exist and that the primes within are " +
                    "sorted ascending.", aLastNonEmpty, aFile);

        return myNextCandidate;
    }

    /**
     * @return index of the highest file holding primes or -1 if there is none
     */
    private int findLastNonEmpty(SortedMap<Integer, File> aFiles) throws IOException {
        List<Integer> myIndices = new ArrayList<>(aFiles.keySet());

        for (int i = myIndices.size() - 1; i >= 0; i--) {
            if (_store.count(myIndices.get(i)) > 0)
                return myIndices.get(i);
        }

        return -1;
    }

    private int findNextFileIndex(SortedMap<Integer, File> aFiles) throws IOException {
        if (aFiles.isEmpty())
            return 1;

        int myHighest = aFiles.lastKey();

        return (_store.count(myHighest) < _store.getCapacity()) ? myHighest : myHighest + 1;
    }
}
