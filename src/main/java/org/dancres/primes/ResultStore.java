package org.dancres.primes;

import java.io.File;
import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.SortedMap;

/**
 * Durable, ordered, chunked persistence of primes. Primes are held in a sequence of checkpoint files, each holding
 * at most {@link #getCapacity()} primes one per line. A file is complete when it holds exactly that many, only the
 * highest indexed file may be partial and files are only ever appended to.
 */
public interface ResultStore {
    interface WriteListener {
        /**
         * Called once the primes have been forced to disk.
         */
        void written(CheckpointWritten aWrite);
    }

    /**
     * @return the trusted checkpoint files keyed by index. Only the run of consecutive indices starting at 1 is
     * trusted, anything after a gap is ignored.
     */
    SortedMap<Integer, File> listCheckpointFiles();

    int getCapacity();

    /**
     * @return the primes held in the file with the specified index, in file order
     */
    List<BigInteger> read(int anIndex) throws IOException;

    /**
     * @return the number of primes held in the file with the specified index
     */
    int count(int anIndex) throws IOException;

    /**
     * @return the last prime held in the file with the specified index or <code>null</code> if it is empty
     */
    BigInteger last(int anIndex) throws IOException;

    /**
     * @return the index of the file the next append will start writing to
     */
    int nextFileIndex() throws IOException;

    /**
     * Marks the point from which the elapsed time of the first write is measured.
     *
     * @param aStartTime wall clock time in ms
     */
    void generationStarted(long aStartTime);

    /**
     * Appends primes to the highest indexed file, allocating new files as each fills up.
     *
     * @throws StorageCorruptionException if the current file holds more primes than the capacity
     * @throws StorageConflictException if a file to be allocated already holds data
     */
    void append(List<BigInteger> aPrimes) throws IOException;

    void add(WriteListener aListener);
}
