package org.dancres.primes;

import java.io.File;

/**
 * The checkpoint files on disk contradict themselves: a file holds more primes than its capacity, a line isn't a
 * number, or the sequence of primes isn't ascending and complete.
 */
public class StorageCorruptionException extends StorageException {
    private static final long serialVersionUID = -2387095563520219458L;

    public StorageCorruptionException(String aMessage, int aFileIndex, File aFile) {
        super(aMessage, aFileIndex, aFile);
    }

    public StorageCorruptionException(String aMessage, int aFileIndex, File aFile, Throwable aCause) {
        super(aMessage, aFileIndex, aFile, aCause);
    }
}
