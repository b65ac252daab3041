package com.hting007.logiq.io;

/**
 * A failure of the event source or anomaly sink that may succeed when retried.
 */
public class TransientIoException extends Exception {

    public TransientIoException(String message) {
        super(message);
    }

    public TransientIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
