package org.dancres.primes;

import java.io.File;

/**
 * Settings for a generator run. Setters validate and return <code>this</code> so a configuration can be built up
 * in a single expression.
 */
public class Configuration {
    public static final int DEFAULT_CAPACITY_PER_FILE = 10000;
    public static final String DEFAULT_FILE_PREFIX = "PrimeNumbers";
    public static final String DEFAULT_FILE_EXTENSION = ".txt";
    public static final int DEFAULT_CACHE_LIMIT = 1 << 26;

    private int _capacityPerFile = DEFAULT_CAPACITY_PER_FILE;
    private String _filePrefix = DEFAULT_FILE_PREFIX;
    private String _fileExtension = DEFAULT_FILE_EXTENSION;
    private File _directory = new File(".");
    private int _cacheLimit = DEFAULT_CACHE_LIMIT;
    private int _workers = Runtime.getRuntime().availableProcessors();

    public Configuration() {
    }

    /**
     * @param aCapacity the number of primes a complete checkpoint file holds
     */
    public Configuration setCapacityPerFile(int aCapacity) {
        if (aCapacity < 1)
            throw new IllegalArgumentException("Capacity per file must be positive: " + aCapacity);

        _capacityPerFile = aCapacity;
        return this;
    }

    public Configuration setFilePrefix(String aPrefix) {
        if ((aPrefix == null) || (aPrefix.isEmpty()))
            throw new IllegalArgumentException("File prefix must not be empty");

        _filePrefix = aPrefix;
        return this;
    }

    /**
     * @param anExtension the file extension, with or without the leading dot
     */
    public Configuration setFileExtension(String anExtension) {
        if ((anExtension == null) || (anExtension.isEmpty()) || (anExtension.equals(".")))
            throw new IllegalArgumentException("File extension must not be empty");

        _fileExtension = anExtension.startsWith(".") ? anExtension : "." + anExtension;
        return this;
    }

    public Configuration setDirectory(File aDirectory) {
        if (aDirectory == null)
            throw new IllegalArgumentException("Directory must not be null");

        _directory = aDirectory;
        return this;
    }

    /**
     * @param aLimit the maximum number of primes held in memory before generation has to move to disk
     */
    public Configuration setCacheLimit(int aLimit) {
        if (aLimit < 1)
            throw new IllegalArgumentException("Cache limit must be positive: " + aLimit);

        _cacheLimit = aLimit;
        return this;
    }

    /**
     * @param aWorkers the number of threads used for trial division of a single candidate
     */
    public Configuration setWorkers(int aWorkers) {
        if (aWorkers < 1)
            throw new IllegalArgumentException("Worker count must be positive: " + aWorkers);

        _workers = aWorkers;
        return this;
    }

    public int getCapacityPerFile() {
        return _capacityPerFile;
    }

    public String getFilePrefix() {
        return _filePrefix;
    }

    public String getFileExtension() {
        return _fileExtension;
    }

    public File getDirectory() {
        return _directory;
    }

    public int getCacheLimit() {
        return _cacheLimit;
    }

    public int getWorkers() {
        return _workers;
    }

    public String toString() {
        return "Configuration: " + _directory + ", " + _filePrefix + "<n>" + _fileExtension + ", capacity " +
                _capacityPerFile + ", cache " + _cacheLimit + ", workers " + _workers;
    }
}
