package com.vidnyan.wdllint.application.port.out;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Port for running ShellCheck on a shell script.
 * Implementations: ProcessShellChecker (external binary).
 */
public interface ShellChecker {

    /**
     * Whether the checker can be run at all. Callers skip checking entirely when it cannot.
     */
    boolean isAvailable();

    /**
     * Check a script and return the raw JSON report.
     *
     * @param script          script file to check
     * @param suppressedCodes ShellCheck codes to exclude
     * @throws IOException if the checker could not be started or its output read
     */
    ShellCheckOutput check(Path script, Set<Integer> suppressedCodes) throws IOException, InterruptedException;

    /**
     * A checker that is never available.
     */
    static ShellChecker unavailable() {
        return new ShellChecker() {
            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public ShellCheckOutput check(Path script, Set<Integer> suppressedCodes) {
                throw new IllegalStateException("ShellCheck is not available");
            }
        };
    }

    /**
     * Exit status and standard output of one run. ShellCheck exits 0 when clean and 1 when it
     * reports findings; anything else is a failure.
     */
    record ShellCheckOutput(int exitCode, String stdout) {

        public boolean completed() {
            return exitCode == 0 || exitCode == 1;
        }
    }
}
