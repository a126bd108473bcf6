package org.streamhttp;

/**
 * A malformed or out-of-sequence HTTP frame. Fatal to the connection it was
 * received on.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
