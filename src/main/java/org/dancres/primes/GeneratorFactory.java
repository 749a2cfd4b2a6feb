package org.dancres.primes;

import org.dancres.primes.impl.GenerationEngine;
import org.dancres.primes.impl.PrimalityTester;
import org.dancres.primes.storage.DirectoryResultStore;

import java.io.IOException;

public class GeneratorFactory {
    /**
     * @param aConfig is the location and shape of the result files together with memory and thread budgets
     * @param aSignal is polled to discover the user wants the run to stop
     *
     * @throws IOException if the result file directory can't be used
     */
    public static Generator init(Configuration aConfig, CancellationSignal aSignal) throws IOException {
        return new GenerationEngine(new DirectoryResultStore(aConfig), new PrimalityTester(aConfig.getWorkers()),
                aSignal, aConfig.getCacheLimit());
    }
}
