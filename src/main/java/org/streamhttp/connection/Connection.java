package org.streamhttp.connection;

import io.netty.channel.ChannelFuture;
import io.netty.handler.codec.http.HttpObject;

import java.net.SocketAddress;

/**
 * Handle on one client connection, passed to everything that writes to it,
 * throttles it or closes it.
 */
public interface Connection {

    /**
     * Writes and flushes a message. May be called from any thread; Netty keeps
     * the call order.
     */
    ChannelFuture write(HttpObject message);

    /**
     * Turns reading from the socket on or off (backpressure).
     */
    void setReadable(boolean readable);

    /**
     * Closes the connection. Closing twice is harmless.
     */
    ChannelFuture close();

    boolean isOpen();

    SocketAddress remoteAddress();
}
