package org.dancres.primes;

/**
 * Progress updates for a generator run.
 */
public class GenerationEvent {
    public enum Reason {
        /**
         * The generator has started replaying existing checkpoint files.
         */
        LOAD_STARTED,

        /**
         * A checkpoint file is about to be loaded, see {@link #getFileOrdinal()} and {@link #getFileCount()}.
         */
        LOAD_PROGRESS,

        /**
         * Replay has finished, see {@link #getPrimeCount()} and {@link #getFileCount()}. Zero files means the
         * generator is starting from scratch.
         */
        LOAD_FINISHED,

        /**
         * Discovery of new primes has begun.
         */
        GENERATION_STARTED,

        /**
         * Primes have been durably written to a checkpoint file, see {@link #getCheckpoint()}.
         */
        CHECKPOINT_WRITTEN
    }

    private final Reason _reason;
    private final int _fileOrdinal;
    private final int _fileCount;
    private final long _primeCount;
    private final CheckpointWritten _checkpoint;

    private GenerationEvent(Reason aReason, int aFileOrdinal, int aFileCount, long aPrimeCount,
                            CheckpointWritten aCheckpoint) {
        _reason = aReason;
        _fileOrdinal = aFileOrdinal;
        _fileCount = aFileCount;
        _primeCount = aPrimeCount;
        _checkpoint = aCheckpoint;
    }

    public static GenerationEvent loadStarted() {
        return new GenerationEvent(Reason.LOAD_STARTED, 0, 0, 0, null);
    }

    /**
     * @param aFileOrdinal 1-based position of the file about to be loaded
     * @param aFileCount total number of files to load
     */
    public static GenerationEvent loadProgress(int aFileOrdinal, int aFileCount) {
        return new GenerationEvent(Reason.LOAD_PROGRESS, aFileOrdinal, aFileCount, 0, null);
    }

    public static GenerationEvent loadFinished(long aPrimeCount, int aFileCount) {
        return new GenerationEvent(Reason.LOAD_FINISHED, 0, aFileCount, aPrimeCount, null);
    }

    public static GenerationEvent generationStarted() {
        return new GenerationEvent(Reason.GENERATION_STARTED, 0, 0, 0, null);
    }

    public static GenerationEvent checkpointWritten(CheckpointWritten aCheckpoint) {
        assert (aCheckpoint != null);

        return new GenerationEvent(Reason.CHECKPOINT_WRITTEN, 0, 0, 0, aCheckpoint);
    }

    public Reason getReason() {
        return _reason;
    }

    public int getFileOrdinal() {
        return _fileOrdinal;
    }

    public int getFileCount() {
        return _fileCount;
    }

    public long getPrimeCount() {
        return _primeCount;
    }

    /**
     * @return the write details for <code>CHECKPOINT_WRITTEN</code>, <code>null</code> otherwise
     */
    public CheckpointWritten getCheckpoint() {
        return _checkpoint;
    }

    public String toString() {
        switch (_reason) {
            case LOAD_PROGRESS : return "GenerationEvent: " + _reason.name() + ", " + _fileOrdinal + "/" + _fileCount;
            case LOAD_FINISHED : return "GenerationEvent: " + _reason.name() + ", " + _primeCount + " primes in " +
                    _fileCount + " files";
            case CHECKPOINT_WRITTEN : return "GenerationEvent: " + _reason.name() + ", " + _checkpoint;
            default : return "GenerationEvent: " + _reason.name();
        }
    }
}
