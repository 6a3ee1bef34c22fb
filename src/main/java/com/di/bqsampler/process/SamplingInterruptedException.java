package com.di.bqsampler.process;

/**
 * Raised by START when the sampling lock object is present. Signals a deliberate pause,
 * not a failure.
 */
public class SamplingInterruptedException extends RuntimeException {

    public SamplingInterruptedException(String lockUri) {
        super("Sampling interrupted by presence of " + lockUri + ". Remove to re-enable sampling.");
    }
}
