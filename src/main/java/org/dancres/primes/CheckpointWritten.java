package org.dancres.primes;

/**
 * Describes a completed write of primes into a single checkpoint file. Ordinals are global and 0-based, the first
 * prime ever found (2) being ordinal 0.
 */
public class CheckpointWritten {
    private final int _fileIndex;
    private final long _startOrdinal;
    private final long _endOrdinal;
    private final long _writeTime;
    private final long _elapsed;

    /**
     * @param aFileIndex the 1-based index of the file written to
     * @param aStartOrdinal ordinal of the first prime written
     * @param anEndOrdinal ordinal of the last prime written (inclusive)
     * @param aWriteTime wall clock time (ms) at which the write completed
     * @param anElapsed time (ms) since the previous write, or since generation started for the first write
     */
    public CheckpointWritten(int aFileIndex, long aStartOrdinal, long anEndOrdinal, long aWriteTime,
                             long anElapsed) {
        assert (aStartOrdinal <= anEndOrdinal);

        _fileIndex = aFileIndex;
        _startOrdinal = aStartOrdinal;
        _endOrdinal = anEndOrdinal;
        _writeTime = aWriteTime;
        _elapsed = anElapsed;
    }

    public int getFileIndex() {
        return _fileIndex;
    }

    public long getStartOrdinal() {
        return _startOrdinal;
    }

    public long getEndOrdinal() {
        return _endOrdinal;
    }

    public long getCount() {
        return _endOrdinal - _startOrdinal + 1;
    }

    public long getWriteTime() {
        return _writeTime;
    }

    public long getElapsed() {
        return _elapsed;
    }

    public boolean equals(Object anObject) {
        if (anObject instanceof CheckpointWritten) {
            CheckpointWritten myOther = (CheckpointWritten) anObject;

            return (myOther._fileIndex == _fileIndex) && (myOther._startOrdinal == _startOrdinal) &&
                    (myOther._endOrdinal == _endOrdinal) && (myOther._writeTime == _writeTime) &&
                    (myOther._elapsed == _elapsed);
        }

        return false;
    }

    public int hashCode() {
        return (int) (_fileIndex ^ _startOrdinal ^ _endOrdinal ^ _writeTime ^ _elapsed);
    }

    public String toString() {
        return "CheckpointWritten: " + _fileIndex + ", [" + _startOrdinal + ", " + _endOrdinal + "], " +
                _elapsed + "ms";
    }
}
