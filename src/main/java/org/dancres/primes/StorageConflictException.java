package org.dancres.primes;

import java.io.File;

/**
 * A write was about to damage existing data: a result file about to be allocated already has content.
 */
public class StorageConflictException extends StorageException {
    private static final long serialVersionUID = 8855273617023405152L;

    public StorageConflictException(String aMessage, int aFileIndex, File aFile) {
        super(aMessage, aFileIndex, aFile);
    }
}
