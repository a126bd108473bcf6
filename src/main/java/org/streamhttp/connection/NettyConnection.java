package org.streamhttp.connection;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.handler.codec.http.HttpObject;

import java.net.SocketAddress;

public class NettyConnection implements Connection {

    private final Channel channel;

    public NettyConnection(Channel channel) {
        this.channel = channel;
    }

    @Override
    public ChannelFuture write(HttpObject message) {
        return channel.writeAndFlush(message);
    }

    @Override
    public void setReadable(boolean readable) {
        channel.config().setAutoRead(readable);
    }

    @Override
    public ChannelFuture close() {
        return channel.close();
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public SocketAddress remoteAddress() {
        return channel.remoteAddress();
    }

    @Override
    public String toString() {
        return "NettyConnection[" + channel.remoteAddress() + "]";
    }
}
