package com.di.bqsampler.process;

import java.util.Collections;
import java.util.List;

/**
 * Raised after every table under a policy prefix was attempted and at least one failed.
 * Commands already published for the other tables stay published.
 */
public class PolicyPrefixFailedException extends RuntimeException {

    private final List<String> failures;

    public PolicyPrefixFailedException(String prefix, List<String> failures) {
        super(String.format("Could not process %d table(s) under prefix %s. Error(s): %s",
                failures.size(), prefix, failures));
        this.failures = Collections.unmodifiableList(failures);
    }

    public List<String> getFailures() {
        return failures;
    }
}
