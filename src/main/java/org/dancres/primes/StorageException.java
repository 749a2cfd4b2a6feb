package org.dancres.primes;

import java.io.File;
import java.io.IOException;

/**
 * Base for failures that leave the checkpoint files unusable for the current run. Carries enough context for an
 * operator to find and repair the offending file.
 */
public abstract class StorageException extends IOException {
    private static final long serialVersionUID = 3120574412306954713L;

    private final int _fileIndex;
    private final File _file;

    protected StorageException(String aMessage, int aFileIndex, File aFile) {
        this(aMessage, aFileIndex, aFile, null);
    }

    protected StorageException(String aMessage, int aFileIndex, File aFile, Throwable aCause) {
        super(aMessage, aCause);
        _fileIndex = aFileIndex;
        _file = aFile;
    }

    /**
     * @return the index of the offending file
     */
    public int getFileIndex() {
        return _fileIndex;
    }

    /**
     * @return the offending file or <code>null</code> if the failure couldn't be pinned to one
     */
    public File getFile() {
        return _file;
    }
}
