package com.omotes.worker;

/**
 * Lets a running task report how far it is.
 */
@FunctionalInterface
public interface ProgressReporter {

    /**
     * @param fraction progress between 0.0 and 1.0
     * @param message  what the task is doing
     */
    void updateProgress(double fraction, String message);
}
