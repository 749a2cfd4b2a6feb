package org.dancres.primes;

/**
 * The states a generator moves through. A run always ends in <code>STOPPED</code>.
 */
public enum Phase {
    /**
     * Rebuilding the cache from existing checkpoint files.
     */
    LOADING,

    /**
     * Testing candidates against primes held in memory.
     */
    MEMORY_GENERATION,

    /**
     * The cache budget is exhausted, unsaved primes are being flushed to disk.
     */
    OVERFLOWING,

    /**
     * Testing candidates against primes held on disk.
     */
    DISK_GENERATION,

    STOPPED
}
