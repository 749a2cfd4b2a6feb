package org.dancres.primes.impl;

import org.dancres.primes.*;
import org.dancres.primes.storage.DirectoryResultStore;
import org.dancres.primes.test.utils.Checkpoints;
import org.dancres.primes.test.utils.Primes;
import org.dancres.primes.test.utils.ResultFiles;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

public class GenerationEngineTest {
    @Rule
    public TemporaryFolder _folder = new TemporaryFolder();

    private File _dir;
    private final List<GenerationEngine> _engines = new ArrayList<>();

    @Before
    public void init() throws Exception {
        _dir = _folder.newFolder("results");
    }

    @After
    public void close() {
        for (GenerationEngine myEngine : _engines)
            myEngine.close();
    }

    private GenerationEngine newEngine(int aCapacity, int aCacheLimit, PrimalityTester aTester,
                                       CancellationSignal aSignal) throws Exception {
        ResultStore myStore = new DirectoryResultStore(new Configuration().setDirectory(_dir)
                .setCapacityPerFile(aCapacity));
        GenerationEngine myEngine = new GenerationEngine(myStore, aTester, aSignal, aCacheLimit);

        _engines.add(myEngine);

        return myEngine;
    }

    private GenerationEngine newEngine(int aCapacity, int aCacheLimit, CancellationSignal aSignal)
            throws Exception {
        return newEngine(aCapacity, aCacheLimit, new PrimalityTester(1), aSignal);
    }

    /**
     * Records events and requests cancellation once a given number of checkpoints have been written.
     */
    private static class StopAfterCheckpoints implements Listener, CancellationSignal {
        private final int _limit;
        private final List<GenerationEvent> _events = new ArrayList<>();
        private final AtomicBoolean _stop = new AtomicBoolean(false);

        StopAfterCheckpoints(int aLimit) {
            _limit = aLimit;
        }

        public void transition(GenerationEvent anEvent) {
            _events.add(anEvent);

            if (getCheckpoints().size() >= _limit)
                _stop.set(true);
        }

        public boolean pollCancelRequested() {
            return _stop.get();
        }

        List<GenerationEvent.Reason> getReasons() {
            List<GenerationEvent.Reason> myReasons = new ArrayList<>();

            for (GenerationEvent myEvent : _events)
                myReasons.add(myEvent.getReason());

            return myReasons;
        }

        List<CheckpointWritten> getCheckpoints() {
            List<CheckpointWritten> myWrites = new ArrayList<>();

            for (GenerationEvent myEvent : _events)
                if (myEvent.getReason() == GenerationEvent.Reason.CHECKPOINT_WRITTEN)
                    myWrites.add(myEvent.getCheckpoint());

            return myWrites;
        }
    }

    /**
     * Lets loading finish and cancels as soon as generation begins.
     */
    private static class StopAtGeneration implements Listener, CancellationSignal {
        private final AtomicBoolean _stop = new AtomicBoolean(false);

        public void transition(GenerationEvent anEvent) {
            if (anEvent.getReason() == GenerationEvent.Reason.GENERATION_STARTED)
                _stop.set(true);
        }

        public boolean pollCancelRequested() {
            return _stop.get();
        }
    }

    @Test
    public void stopsAfterFirstCheckpoint() throws Exception {
        StopAfterCheckpoints myControl = new StopAfterCheckpoints(1);
        GenerationEngine myEngine = newEngine(5, 100, myControl);
        myEngine.add(myControl);

        myEngine.run();

        Assert.assertEquals(Phase.STOPPED, myEngine.getPhase());
        Assert.assertEquals(Primes.first(5), ResultFiles.read(_dir, 1));
        Assert.assertFalse(ResultFiles.file(_dir, 2).exists());
        Assert.assertEquals(Primes.first(5), myEngine.getCachedPrimes());
        Assert.assertEquals(BigInteger.valueOf(12), myEngine.getCandidate());

        Assert.assertEquals(Arrays.asList(GenerationEvent.Reason.LOAD_STARTED,
                GenerationEvent.Reason.LOAD_FINISHED,
                GenerationEvent.Reason.GENERATION_STARTED,
                GenerationEvent.Reason.CHECKPOINT_WRITTEN), myControl.getReasons());
        Assert.assertEquals(Arrays.asList("1:0-4"), Checkpoints.ranges(myControl.getCheckpoints()));
    }

    @Test
    public void cancelBeforeCheckpointLeavesPrimesInMemoryOnly() throws Exception {
        List<GenerationEngine> myHolder = new ArrayList<>();
        GenerationEngine myEngine = newEngine(5, 100, () -> myHolder.get(0).getCachedPrimes().size() >= 3);
        myHolder.add(myEngine);

        myEngine.run();

        Assert.assertEquals(Primes.first(3), myEngine.getCachedPrimes());
        Assert.assertEquals(BigInteger.valueOf(6), myEngine.getCandidate());
        Assert.assertFalse(ResultFiles.file(_dir, 1).exists());
    }

    @Test
    public void reloadsWhatWasWritten() throws Exception {
        StopAfterCheckpoints myWriter = new StopAfterCheckpoints(3);
        GenerationEngine myFirst = newEngine(10, 1000, myWriter);
        myFirst.add(myWriter);
        myFirst.run();

        Assert.assertEquals(Primes.first(30), ResultFiles.readAll(_dir));

        StopAtGeneration myStopper = new StopAtGeneration();
        GenerationEngine mySecond = newEngine(10, 1000, myStopper);
        mySecond.add(myStopper);
        mySecond.run();

        Assert.assertEquals(Primes.first(30), mySecond.getCachedPrimes());
        Assert.assertEquals(BigInteger.valueOf(114), mySecond.getCandidate());
    }

    @Test
    public void resumeContinuesTheSequence() throws Exception {
        StopAfterCheckpoints myFirstControl = new StopAfterCheckpoints(1);
        GenerationEngine myFirst = newEngine(5, 100, myFirstControl);
        myFirst.add(myFirstControl);
        myFirst.run();

        StopAfterCheckpoints mySecondControl = new StopAfterCheckpoints(2);
        GenerationEngine mySecond = newEngine(5, 100, mySecondControl);
        mySecond.add(mySecondControl);
        mySecond.run();

        Assert.assertEquals(Primes.first(15), ResultFiles.readAll(_dir));
        Assert.assertEquals(Arrays.asList("2:5-9", "3:10-14"), Checkpoints.ranges(mySecondControl.getCheckpoints()));
    }

    @Test
    public void resumeTopsUpPartialFile() throws Exception {
        ResultFiles.write(_dir, 1, 2, 3, 5, 7, 11);
        ResultFiles.write(_dir, 2, 13, 17);

        StopAfterCheckpoints myControl = new StopAfterCheckpoints(1);
        GenerationEngine myEngine = newEngine(5, 100, myControl);
        myEngine.add(myControl);
        myEngine.run();

        Assert.assertEquals(Primes.of(13, 17, 19, 23, 29), ResultFiles.read(_dir, 2));
        Assert.assertEquals(Arrays.asList("2:7-9"), Checkpoints.ranges(myControl.getCheckpoints()));
        Assert.assertEquals(GenerationEvent.Reason.LOAD_FINISHED, myControl._events.get(3).getReason());
        Assert.assertEquals(7, myControl._events.get(3).getPrimeCount());
    }

    @Test
    public void overflowPersistsEverythingThenNeedsDisk() throws Exception {
        StopAfterCheckpoints myControl = new StopAfterCheckpoints(Integer.MAX_VALUE);
        GenerationEngine myEngine = newEngine(5, 7, myControl);
        myEngine.add(myControl);

        try {
            myEngine.run();
            Assert.fail();
        } catch (GenerationException aGE) {
            Assert.assertTrue(aGE.getCause() instanceof UnsupportedOperationException);
            Assert.assertEquals(Phase.DISK_GENERATION, aGE.getPhase());
            Assert.assertEquals(BigInteger.valueOf(20), aGE.getCandidate());
        }

        Assert.assertEquals(Phase.STOPPED, myEngine.getPhase());
        Assert.assertEquals(Primes.first(5), ResultFiles.read(_dir, 1));
        Assert.assertEquals(Primes.of(13, 17, 19), ResultFiles.read(_dir, 2));
        Assert.assertEquals(Arrays.asList("1:0-4", "2:5-6", "2:7-7"), Checkpoints.ranges(myControl.getCheckpoints()));

        for (BigInteger myPrime : ResultFiles.readAll(_dir))
            Assert.assertTrue(Primes.isPrime(myPrime));
    }

    @Test
    public void reloadBeyondCacheLimitGoesStraightToDisk() throws Exception {
        ResultFiles.write(_dir, 1, 2, 3, 5, 7, 11);
        ResultFiles.write(_dir, 2, 13, 17, 19);

        GenerationEngine myEngine = newEngine(5, 7, CancellationSignal.NEVER);

        try {
            myEngine.run();
            Assert.fail();
        } catch (GenerationException aGE) {
            Assert.assertTrue(aGE.getCause() instanceof UnsupportedOperationException);
            Assert.assertEquals(Phase.DISK_GENERATION, aGE.getPhase());
            Assert.assertEquals(BigInteger.valueOf(20), aGE.getCandidate());
        }

        Assert.assertEquals(Primes.first(5), myEngine.getCachedPrimes());
        Assert.assertEquals(Primes.of(13, 17, 19), ResultFiles.read(_dir, 2));
    }

    @Test
    public void cancelDuringLoadStopsWithoutGenerating() throws Exception {
        ResultFiles.write(_dir, 1, 2, 3, 5, 7, 11);
        ResultFiles.write(_dir, 2, 13, 17);

        List<GenerationEvent.Reason> myReasons = new ArrayList<>();
        GenerationEngine myEngine = newEngine(5, 100, () -> true);
        myEngine.add((GenerationEvent anEvent) -> myReasons.add(anEvent.getReason()));

        myEngine.run();

        Assert.assertEquals(Phase.STOPPED, myEngine.getPhase());
        Assert.assertFalse(myReasons.contains(GenerationEvent.Reason.GENERATION_STARTED));
        Assert.assertEquals(GenerationEvent.Reason.LOAD_FINISHED, myReasons.get(myReasons.size() - 1));
        Assert.assertEquals(Primes.of(13, 17), ResultFiles.read(_dir, 2));
    }

    @Test
    public void corruptionDuringLoadFails() throws Exception {
        ResultFiles.write(_dir, 1, 2, 3, 5, 7, 11, 13);

        GenerationEngine myEngine = newEngine(5, 100, CancellationSignal.NEVER);

        try {
            myEngine.run();
            Assert.fail();
        } catch (GenerationException aGE) {
            Assert.assertTrue(aGE.getCause() instanceof StorageCorruptionException);
            Assert.assertEquals(Phase.LOADING, aGE.getPhase());
            Assert.assertEquals(BigInteger.TWO, aGE.getCandidate());
        }

        Assert.assertEquals(Phase.STOPPED, myEngine.getPhase());
    }

    @Test
    public void primesHiddenBehindAnEmptyFileAreCorruption() throws Exception {
        ResultFiles.write(_dir, 1, 2, 3, 5, 7, 11);
        ResultFiles.write(_dir, 2);
        ResultFiles.write(_dir, 3, 31, 37, 41, 43, 47);

        GenerationEngine myEngine = newEngine(5, 100, CancellationSignal.NEVER);

        try {
            myEngine.run();
            Assert.fail();
        } catch (GenerationException aGE) {
            Assert.assertTrue(aGE.getCause() instanceof StorageCorruptionException);
        }

        Assert.assertEquals(0, ResultFiles.read(_dir, 2).size());
    }

    @Test
    public void refusesToOverwriteDataBeyondAGap() throws Exception {
        ResultFiles.write(_dir, 1, 2, 3, 5, 7, 11);
        ResultFiles.write(_dir, 3, 999, 1001);

        GenerationEngine myEngine = newEngine(5, 100, CancellationSignal.NEVER);

        try {
            myEngine.run();
            Assert.fail();
        } catch (GenerationException aGE) {
            Assert.assertTrue(aGE.getCause() instanceof StorageConflictException);
            Assert.assertEquals(Phase.MEMORY_GENERATION, aGE.getPhase());
            Assert.assertEquals(3, ((StorageConflictException) aGE.getCause()).getFileIndex());
        }

        Assert.assertEquals(Primes.of(13, 17, 19, 23, 29), ResultFiles.read(_dir, 2));
        Assert.assertEquals(Primes.of(999, 1001), ResultFiles.read(_dir, 3));
    }

    @Test
    public void storeDisagreeingOnNextFileIsCorruption() throws Exception {
        ResultFiles.write(_dir, 1, 2, 3, 5, 7, 11);

        ResultStore myStore = new DirectoryResultStore(new Configuration().setDirectory(_dir).setCapacityPerFile(5)) {
            public int nextFileIndex() throws IOException {
                return super.nextFileIndex() + 1;
            }
        };

        GenerationEngine myEngine =
                new GenerationEngine(myStore, new PrimalityTester(1), CancellationSignal.NEVER, 100);
        _engines.add(myEngine);

        try {
            myEngine.run();
            Assert.fail();
        } catch (GenerationException aGE) {
            Assert.assertTrue(aGE.getCause() instanceof StorageCorruptionException);
            Assert.assertEquals(3, ((StorageCorruptionException) aGE.getCause()).getFileIndex());
        }

        Assert.assertFalse(ResultFiles.file(_dir, 2).exists());
    }

    @Test(expected = IllegalStateException.class)
    public void runsOnlyOnce() throws Exception {
        GenerationEngine myEngine = newEngine(5, 100, () -> true);

        myEngine.run();
        myEngine.run();
    }

    @Test
    public void parallelWorkersFindTheSamePrimes() throws Exception {
        StopAfterCheckpoints myControl = new StopAfterCheckpoints(5);
        GenerationEngine myEngine = newEngine(100, 10000, new PrimalityTester(4, 2), myControl);
        myEngine.add(myControl);

        myEngine.run();

        Assert.assertEquals(Primes.first(500), ResultFiles.readAll(_dir));
    }

    @Test
    public void factoryBuildsARunnableGenerator() throws Exception {
        Configuration myConfig = new Configuration().setDirectory(_dir).setCapacityPerFile(5).setWorkers(2);
        StopAfterCheckpoints myControl = new StopAfterCheckpoints(2);
        Generator myGenerator = GeneratorFactory.init(myConfig, myControl);

        try {
            myGenerator.add(myControl);
            myGenerator.run();
        } finally {
            myGenerator.close();
        }

        Assert.assertEquals(Primes.first(10), ResultFiles.readAll(_dir));
        Assert.assertEquals(Phase.STOPPED, myGenerator.getPhase());
    }
}
