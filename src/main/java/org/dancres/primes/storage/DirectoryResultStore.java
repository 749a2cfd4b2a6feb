package org.dancres.primes.storage;

import org.dancres.primes.CheckpointWritten;
import org.dancres.primes.Configuration;
import org.dancres.primes.ResultStore;
import org.dancres.primes.StorageConflictException;
import org.dancres.primes.StorageCorruptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps checkpoint files named <code>&lt;prefix&gt;&lt;index&gt;&lt;extension&gt;</code> in a single directory.
 * Assumes it is the only writer of that directory.
 */
public class DirectoryResultStore implements ResultStore {
    private static final Logger _logger = LoggerFactory.getLogger(DirectoryResultStore.class);

    private final File _dir;
    private final int _capacity;
    private final String _prefix;
    private final String _extension;
    private final TreeMap<Integer, File> _files;
    private final List<WriteListener> _listeners = new CopyOnWriteArrayList<>();
    private long _lastWrite = System.currentTimeMillis();

    public DirectoryResultStore(Configuration aConfig) throws IOException {
        _dir = aConfig.getDirectory();
        _capacity = aConfig.getCapacityPerFile();
        _prefix = aConfig.getFilePrefix();
        _extension = aConfig.getFileExtension();

        _dir.mkdirs();

        if (! _dir.isDirectory())
            throw new IOException("Not a usable directory: " + _dir);

        _files = getFiles();
    }

    public SortedMap<Integer, File> listCheckpointFiles() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(_files));
    }

    public int getCapacity() {
        return _capacity;
    }

    public List<BigInteger> read(int anIndex) throws IOException {
        File myFile = getFile(anIndex);
        List<BigInteger> myPrimes = new ArrayList<>();

        try (BufferedReader myReader = newReader(myFile)) {
            String myLine;

            while ((myLine = myReader.readLine()) != null)
                myPrimes.add(parse(anIndex, myFile, myLine, myPrimes.size()));
        }

        return myPrimes;
    }

    public int count(int anIndex) throws IOException {
        return countLines(getFile(anIndex));
    }

    public BigInteger last(int anIndex) throws IOException {
        File myFile = getFile(anIndex);
        String myLast = null;
        int myLineNumber = -1;

        try (BufferedReader myReader = newReader(myFile)) {
            String myLine;

            while ((myLine = myReader.readLine()) != null) {
                myLast = myLine;
                myLineNumber++;
            }
        }

        return (myLast == null) ? null : parse(anIndex, myFile, myLast, myLineNumber);
    }

    public int nextFileIndex() throws IOException {
        if (_files.isEmpty())
            return 1;

        Map.Entry<Integer, File> myLast = _files.lastEntry();

        return (countLines(myLast.getValue()) < _capacity) ? myLast.getKey() : myLast.getKey() + 1;
    }

    public void generationStarted(long aStartTime) {
        _lastWrite = aStartTime;
    }

    public void add(WriteListener aListener) {
        _listeners.add(aListener);
    }

    public void append(List<BigInteger> aPrimes) throws IOException {
        int myWritten = 0;

        while (myWritten < aPrimes.size()) {
            Map.Entry<Integer, File> myTarget = prepareFileForWriting();

            myWritten += write(myTarget.getKey(), myTarget.getValue(), aPrimes, myWritten);
        }
    }

    /**
     * Makes sure the highest indexed file has room, allocating the next one if it is full.
     */
    private Map.Entry<Integer, File> prepareFileForWriting() throws IOException {
        if (_files.isEmpty())
            return allocate(1);

        Map.Entry<Integer, File> myLast = _files.lastEntry();
        int myLines = countLines(myLast.getValue());

        if (myLines == _capacity)
            return allocate(myLast.getKey() + 1);
        else if (myLines > _capacity)
            throw overfilled(myLast.getKey(), myLast.getValue(), myLines);

        return myLast;
    }

    /**
     * @return the number of primes from <code>aPrimes</code> written into the file
     */
    private int write(int anIndex, File aFile, List<BigInteger> aPrimes, int aFrom) throws IOException {
        int myExisting = countLines(aFile);

        assert (myExisting < _capacity);

        int myCount = Math.min(_capacity - myExisting, aPrimes.size() - aFrom);
        long myStartOrdinal = (long) (anIndex - 1) * _capacity + myExisting;

        try (FileOutputStream myStream = new FileOutputStream(aFile, true);
             BufferedWriter myWriter = new BufferedWriter(new OutputStreamWriter(myStream, StandardCharsets.UTF_8))) {

            for (int i = aFrom; i < aFrom + myCount; i++) {
                myWriter.write(aPrimes.get(i).toString());
                myWriter.newLine();
            }

            myWriter.flush();
            myStream.getChannel().force(false);
        }

        long myNow = System.currentTimeMillis();
        long myElapsed = myNow - _lastWrite;
        _lastWrite = myNow;

        CheckpointWritten myWrite =
                new CheckpointWritten(anIndex, myStartOrdinal, myStartOrdinal + myCount - 1, myNow, myElapsed);

        _logger.debug("Written: " + myWrite);

        for (WriteListener myListener : _listeners)
            myListener.written(myWrite);

        return myCount;
    }

    /**
     * New files always start empty. An existing empty file under the same name is taken over, one holding data
     * (e.g. beyond a gap in the indices) is left alone for the operator to deal with.
     */
    private Map.Entry<Integer, File> allocate(int anIndex) throws IOException {
        File myFile = new File(_dir, _prefix + anIndex + _extension);

        if (myFile.exists()) {
            if (myFile.length() != 0)
                throw new StorageConflictException("Result file with index " + anIndex +
                        " was expected to be empty but contains data: " + myFile, anIndex, myFile);

            _logger.warn("Reusing empty result file " + myFile);
        } else {
            Files.createFile(myFile.toPath());
        }

        _files.put(anIndex, myFile);

        _logger.debug("Allocated result file " + anIndex + ": " + myFile);

        return new AbstractMap.SimpleImmutableEntry<>(anIndex, myFile);
    }

    private StorageCorruptionException overfilled(int anIndex, File aFile, int aLines) {
        return new StorageCorruptionException("The result file with index '" + anIndex + "' contains " + aLines +
                " primes, more than the allowed " + _capacity + ": " + aFile, anIndex, aFile);
    }

    private File getFile(int anIndex) {
        File myFile = _files.get(anIndex);

        if (myFile == null)
            throw new IllegalArgumentException("No trusted result file with index " + anIndex);

        return myFile;
    }

    private BigInteger parse(int anIndex, File aFile, String aLine, int aLineNumber)
            throws StorageCorruptionException {
        try {
            BigInteger myPrime = new BigInteger(aLine.trim());

            if (myPrime.signum() < 0)
                throw new NumberFormatException("Negative value");

            return myPrime;
        } catch (NumberFormatException anNFE) {
            throw new StorageCorruptionException("Line " + (aLineNumber + 1) + " of result file with index " +
                    anIndex + " is not a prime: '" + aLine + "'", anIndex, aFile, anNFE);
        }
    }

    private static BufferedReader newReader(File aFile) throws IOException {
        return new BufferedReader(new InputStreamReader(new FileInputStream(aFile), StandardCharsets.UTF_8));
    }

    private static int countLines(File aFile) throws IOException {
        if (! aFile.exists())
            return 0;

        int myLines = 0;

        try (BufferedReader myReader = newReader(aFile)) {
            while (myReader.readLine() != null)
                myLines++;
        }

        return myLines;
    }

    /**
     * @return the files forming the consecutive run of indices starting at 1
     */
    private TreeMap<Integer, File> getFiles() {
        File[] myCandidates = _dir.listFiles((File aDir, String aName) ->
                aName.startsWith(_prefix) && aName.endsWith(_extension) &&
                        aName.length() > _prefix.length() + _extension.length());

        assert (myCandidates != null);

        TreeMap<Integer, File> myIndexed = new TreeMap<>();

        for (File myFile : myCandidates) {
            if (! myFile.isFile())
                continue;

            String myName = myFile.getName();
            String myId = myName.substring(_prefix.length(), myName.length() - _extension.length());
            int myIndex = toIndex(myId);

            if (myIndex > 0)
                myIndexed.put(myIndex, myFile);
        }

        TreeMap<Integer, File> myTrusted = new TreeMap<>();
        int myExpected = 1;

        for (Map.Entry<Integer, File> myEntry : myIndexed.entrySet()) {
            if (myEntry.getKey() != myExpected) {
                _logger.warn("Ignoring result files from index " + myEntry.getKey() + ", index " + myExpected +
                        " is missing");
                break;
            }

            myTrusted.put(myEntry.getKey(), myEntry.getValue());
            myExpected++;
        }

        return myTrusted;
    }

    /**
     * @return the index or -1 if the id isn't a positive decimal integer in canonical form
     */
    private static int toIndex(String anId) {
        if (anId.isEmpty() || anId.charAt(0) == '0')
            return -1;

        for (int i = 0; i < anId.length(); i++) {
            char myDigit = anId.charAt(i);

            if ((myDigit < '0') || (myDigit > '9'))
                return -1;
        }

        try {
            return Integer.parseInt(anId);
        } catch (NumberFormatException anNFE) {
            _logger.debug("Result file index out of range: " + anId);
            return -1;
        }
    }

    public String toString() {
        return "DirectoryResultStore: " + _dir + ", " + _files.size() + " files";
    }
}
