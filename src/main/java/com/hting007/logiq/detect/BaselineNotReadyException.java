package com.hting007.logiq.detect;

/**
 * Thrown when a threshold is requested before the learning phase is complete.
 */
public class BaselineNotReadyException extends IllegalStateException {

    public BaselineNotReadyException(int learned, int required) {
        super("Baseline still learning: " + learned + "/" + required + " non-empty windows observed");
    }
}
