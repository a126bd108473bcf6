package org.streamhttp.https;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;

/**
 * Produces the handler doing the TLS handshake for a freshly accepted connection.
 */
@FunctionalInterface
public interface SecureChannelFactory {

    ChannelHandler newHandler(Channel channel);
}
