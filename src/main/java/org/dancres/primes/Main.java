package org.dancres.primes;

import com.lexicalscope.jewel.cli.ArgumentValidationException;
import com.lexicalscope.jewel.cli.CliFactory;
import com.lexicalscope.jewel.cli.Option;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Date;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Console front end. Runs a generator against result files in a directory until the user enters ESC or q.
 * Failures are written to the failure log (see logback.xml) together with the candidate being tested.
 */
public class Main {
    private static final Logger _logger = LoggerFactory.getLogger(Main.class);
    private static final Logger _failures = LoggerFactory.getLogger("org.dancres.primes.Failure");

    private static final int ESCAPE = 27;

    interface Args {
        @Option(defaultValue = ".", description = "Directory holding the result files")
        String getDirectory();

        @Option(defaultValue = "10000", description = "Number of primes in a complete result file")
        int getCapacity();

        @Option(defaultValue = Configuration.DEFAULT_FILE_PREFIX, description = "Result file name prefix")
        String getPrefix();

        @Option(defaultValue = Configuration.DEFAULT_FILE_EXTENSION, description = "Result file extension")
        String getExtension();

        @Option(defaultValue = "67108864", description = "Maximum number of primes held in memory")
        int getCacheLimit();

        @Option(defaultValue = "0", description = "Trial division threads, 0 for one per processor")
        int getWorkers();

        @Option(helpRequest = true, description = "Show this help")
        boolean getHelp();
    }

    /**
     * Non-blocking check of the console, a terminal in line mode only hands over input once Enter is pressed.
     */
    private static class ConsoleSignal implements CancellationSignal {
        private final AtomicBoolean _cancelled = new AtomicBoolean(false);
        private final AtomicBoolean _usable = new AtomicBoolean(true);

        public boolean pollCancelRequested() {
            if (_cancelled.get() || (! _usable.get()))
                return _cancelled.get();

            try {
                while (System.in.available() > 0) {
                    int myKey = System.in.read();

                    if ((myKey == ESCAPE) || (myKey == 'q') || (myKey == 'Q'))
                        _cancelled.set(true);
                }
            } catch (IOException anIOE) {
                _logger.warn("Console input unavailable, generation can no longer be stopped from the keyboard",
                        anIOE);
                _usable.set(false);
            }

            return _cancelled.get();
        }
    }

    private static class ConsoleListener implements Listener {
        public void transition(GenerationEvent anEvent) {
            switch (anEvent.getReason()) {
                case LOAD_STARTED : {
                    _logger.info("Loading existing primes...");
                    break;
                }

                case LOAD_PROGRESS : {
                    _logger.info("Loading result file " + anEvent.getFileOrdinal() + " of " +
                            anEvent.getFileCount());
                    break;
                }

                case LOAD_FINISHED : {
                    if (anEvent.getFileCount() == 0)
                        _logger.info("No existing primes found, starting from scratch");
                    else
                        _logger.info("Loaded " + anEvent.getPrimeCount() + " primes from " +
                                anEvent.getFileCount() + " result files");
                    break;
                }

                case GENERATION_STARTED : {
                    _logger.info("Generating prime numbers...");
                    break;
                }

                case CHECKPOINT_WRITTEN : {
                    CheckpointWritten myWrite = anEvent.getCheckpoint();

                    _logger.info(myWrite.getFileIndex() + ". Wrote primes #" + (myWrite.getStartOrdinal() + 1) +
                            " to #" + (myWrite.getEndOrdinal() + 1) + " to file at " +
                            new Date(myWrite.getWriteTime()) + " (generation time: " +
                            (myWrite.getElapsed() / 1000.0) + " sec).");
                    break;
                }
            }
        }
    }

    public static void main(String[] anArgs) throws Exception {
        Args myArgs;

        try {
            myArgs = CliFactory.parseArguments(Args.class, anArgs);
        } catch (ArgumentValidationException anAVE) {
            System.err.println(anAVE.getMessage());
            return;
        }

        Configuration myConfig = new Configuration()
                .setDirectory(new File(myArgs.getDirectory()))
                .setCapacityPerFile(myArgs.getCapacity())
                .setFilePrefix(myArgs.getPrefix())
                .setFileExtension(myArgs.getExtension())
                .setCacheLimit(myArgs.getCacheLimit());

        if (myArgs.getWorkers() > 0)
            myConfig.setWorkers(myArgs.getWorkers());

        _logger.debug(myConfig.toString());

        Generator myGenerator = GeneratorFactory.init(myConfig, new ConsoleSignal());
        myGenerator.add(new ConsoleListener());

        _logger.info("Press ESC or q (then Enter) to stop.");

        boolean isFailed = false;

        try {
            myGenerator.run();
            _logger.info("Stopped with " + myGenerator.getCachedPrimes().size() + " primes in memory");
        } catch (GenerationException aGE) {
            _failures.error("Generation failed in " + aGE.getPhase() + ", current number to check: " +
                    aGE.getCandidate(), aGE.getCause());
            _logger.error("Generation failed, see the failure log: " + aGE.getCause());
            isFailed = true;
        } finally {
            myGenerator.close();
        }

        if (isFailed)
            System.exit(1);
    }
}
