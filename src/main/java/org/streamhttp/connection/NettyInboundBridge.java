package org.streamhttp.connection;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import java.util.function.Function;

/**
 * Last handler of a child pipeline. Creates the {@link ConnectionListener} of
 * its channel and forwards the channel's events to it.
 */
public class NettyInboundBridge extends ChannelInboundHandlerAdapter {

    private final Function<Connection, ConnectionListener> listenerFactory;
    private ConnectionListener listener;

    public NettyInboundBridge(Function<Connection, ConnectionListener> listenerFactory) {
        this.listenerFactory = listenerFactory;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        listener = listenerFactory.apply(new NettyConnection(ctx.channel()));
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        listener.onData(msg);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        listener.onError(cause);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        listener.onClose();
        super.channelInactive(ctx);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent && ((IdleStateEvent) evt).state() == IdleState.READER_IDLE) {
            listener.onIdle();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    public ConnectionListener listener() {
        return listener;
    }
}
