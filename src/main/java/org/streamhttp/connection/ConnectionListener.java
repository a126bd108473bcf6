package org.streamhttp.connection;

import io.netty.handler.timeout.ReadTimeoutException;

/**
 * Receives the events of one connection, always on that connection's event loop.
 */
public interface ConnectionListener {

    void onData(Object message);

    void onError(Throwable cause);

    void onClose();

    /**
     * Nothing was read for longer than the configured idle timeout.
     */
    default void onIdle() {
        onError(ReadTimeoutException.INSTANCE);
    }
}
