package org.dancres.primes.impl;

import java.math.BigInteger;

/**
 * Where generation resumes after replaying the checkpoint files. Never persisted, the files are the only durable
 * state.
 */
class GenerationState {
    private final BigInteger _nextCandidate;
    private final boolean _memoryLimitReached;
    private final int _nextFileIndex;
    private final boolean _aborted;
    private final int _filesLoaded;

    GenerationState(BigInteger aNextCandidate, boolean isMemoryLimitReached, int aNextFileIndex,
                    boolean isAborted, int aFilesLoaded) {
        _nextCandidate = aNextCandidate;
        _memoryLimitReached = isMemoryLimitReached;
        _nextFileIndex = aNextFileIndex;
        _aborted = isAborted;
        _filesLoaded = aFilesLoaded;
    }

    BigInteger getNextCandidate() {
        return _nextCandidate;
    }

    boolean isMemoryLimitReached() {
        return _memoryLimitReached;
    }

    /**
     * @return the index of the file with room for more primes. It may not exist yet.
     */
    int getNextFileIndex() {
        return _nextFileIndex;
    }

    /**
     * @return <code>true</code> if the user cancelled during loading, in which case generation must not proceed
     */
    boolean isAborted() {
        return _aborted;
    }

    int getFilesLoaded() {
        return _filesLoaded;
    }

    public String toString() {
        return "GenerationState: " + _nextCandidate + ", file " + _nextFileIndex +
                (_memoryLimitReached ? ", memory limit reached" : "") + (_aborted ? ", aborted" : "");
    }
}
