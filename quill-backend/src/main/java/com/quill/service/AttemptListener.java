package com.quill.service;

/**
 * Notified before the executor asks for a corrected statement.
 */
@FunctionalInterface
public interface AttemptListener {

    AttemptListener NONE = (nextAttempt, error) -> {
    };

    /**
     * @param nextAttempt number of the attempt about to be made (2 for the first correction)
     * @param error engine error of the attempt that just failed
     */
    void beforeCorrection(int nextAttempt, String error);
}
