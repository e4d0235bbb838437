package com.sensorstream.service.sink;

/**
 * A write to the storage sink failed.
 */
public class SinkException extends RuntimeException {

    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
