package org.streamhttp;

// handler threw, failed asynchronously or returned something that is not a response
public class HandlerException extends RuntimeException {

    public HandlerException(String message) {
        super(message);
    }

    public HandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
