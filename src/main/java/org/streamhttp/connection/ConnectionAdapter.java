package org.streamhttp.connection;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.util.ReferenceCountUtil;
import org.streamhttp.ProtocolException;
import org.streamhttp.Request;
import org.streamhttp.body.BodyChannel;
import org.streamhttp.handler.ContinueNegotiator;
import org.streamhttp.handler.HandlerInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Executor;

/**
 * Per-connection engine: turns decoded HTTP objects into a {@link Request}
 * whose body streams through a {@link BodyChannel}, hands it to the
 * {@link HandlerInvoker} as soon as the head is in, and tears everything down
 * when the connection fails or closes.
 *
 * <p>Reads are paused while the request body channel is full and resumed once
 * the handler took from it.
 */
public class ConnectionAdapter implements ConnectionListener {

    private static final Logger log = LoggerFactory.getLogger(ConnectionAdapter.class);

    private final Connection connection;
    private final HandlerInvoker invoker;
    private final Executor executor;
    private final int inbuf;
    private final boolean closeAfterResponse;
    private final ConnectionState state = new ConnectionState();
    private boolean skipEmptyLast;

    public ConnectionAdapter(Connection connection, HandlerInvoker invoker, Executor executor, int inbuf) {
        this(connection, invoker, executor, inbuf, true);
    }

    /**
     * @param inbuf capacity of request body channels
     * @param closeAfterResponse close after each response even if the client asked for keep-alive
     */
    public ConnectionAdapter(Connection connection, HandlerInvoker invoker, Executor executor, int inbuf,
                             boolean closeAfterResponse) {
        this.connection = connection;
        this.invoker = invoker;
        this.executor = executor;
        this.inbuf = inbuf;
        this.closeAfterResponse = closeAfterResponse;
    }

    @Override
    public void onData(Object message) {
        if (state.phase() == ConnectionState.Phase.CLOSED) {
            ReferenceCountUtil.release(message);
            return;
        }
        if (message instanceof HttpRequest) {
            onHead((HttpRequest) message);
            if (message instanceof HttpContent && state.phase() != ConnectionState.Phase.CLOSED) {
                onContent((HttpContent) message);
            }
        } else if (message instanceof HttpContent) {
            onContent((HttpContent) message);
        } else {
            protocolError(new ProtocolException("unhandled message: " + message.getClass().getName()), message);
        }
    }

    private void onHead(HttpRequest head) {
        if (head.decoderResult().isFailure()) {
            protocolError(new ProtocolException("malformed request head", head.decoderResult().cause()), head);
            return;
        }
        if (state.phase() != ConnectionState.Phase.IDLE) {
            protocolError(new ProtocolException("request head received while " + state.request() + " is in flight"),
                    head);
            return;
        }

        ContinueNegotiator negotiator = new ContinueNegotiator(connection, head);
        BodyChannel body = new BodyChannel(inbuf, paused -> connection.setReadable(!paused));
        Request request = Request.fromHead(head, body, negotiator, connection.remoteAddress());
        boolean keepAlive = !closeAfterResponse && HttpUtil.isKeepAlive(head);
        ResponseWriter writer = new ResponseWriter(connection, head.protocolVersion(), executor, keepAlive,
                new ResponseWriter.ExchangeListener() {
                    @Override
                    public void headWritten() {
                        if (state.request() == request) {
                            state.responseStarted();
                        }
                    }

                    @Override
                    public void completed() {
                        exchangeCompleted(request);
                    }
                }, negotiator);

        state.begin(request, body, writer, negotiator);
        if (!hasBody(head)) {
            body.close();
            state.bodyCompleted();
            skipEmptyLast = true;
        }
        log.debug("{} on {}", request, connection);
        invoker.invoke(request, writer);
    }

    private void onContent(HttpContent content) {
        if (content.decoderResult().isFailure()) {
            protocolError(new ProtocolException("malformed request body", content.decoderResult().cause()), content);
            return;
        }
        if (skipEmptyLast && content instanceof LastHttpContent && !content.content().isReadable()) {
            // the codec still ends a bodyless request with an empty last frame
            skipEmptyLast = false;
            content.release();
            return;
        }
        if (!state.isBodyOpen()) {
            protocolError(new ProtocolException("body content without an open request"), content);
            return;
        }

        BodyChannel body = state.body();
        state.continueNegotiator().disarm();
        ByteBuf chunk = content.content();
        if (chunk.isReadable()) {
            body.push(chunk);
        } else {
            content.release();
        }
        if (content instanceof LastHttpContent) {
            body.close();
            state.bodyCompleted();
        }
    }

    private static boolean hasBody(HttpRequest head) {
        return HttpUtil.getContentLength(head, 0L) > 0 || HttpUtil.isTransferEncodingChunked(head);
    }

    // keep-alive only: runs on the event loop once the terminal frame went out
    private void exchangeCompleted(Request request) {
        if (state.request() != request) {
            return;
        }
        if (!state.isBodyComplete()) {
            log.debug("Request body of {} still arriving, closing {}", request, connection);
            state.body().abort();
            connection.close();
            return;
        }
        state.body().abort();
        connection.setReadable(true);
        state.reset();
    }

    @Override
    public void onError(Throwable cause) {
        if (cause instanceof IOException || cause instanceof ReadTimeoutException) {
            log.debug("Transport error on {}: {}", connection, cause.toString());
        } else {
            log.warn("Transport error on {}", connection, cause);
        }
        teardown(cause);
        connection.close();
    }

    /**
     * Only a connection we are waiting on times out: idle between requests, or
     * with a request body still due and room to take it. A paused body or a
     * long response is not a stall.
     */
    @Override
    public void onIdle() {
        if (state.phase() == ConnectionState.Phase.IDLE
                || (state.isBodyOpen() && state.body().size() < inbuf)) {
            onError(ReadTimeoutException.INSTANCE);
        }
    }

    @Override
    public void onClose() {
        teardown(null);
        state.closed();
    }

    private void protocolError(ProtocolException error, Object message) {
        log.warn("Protocol error on {}: {}", connection, error.getMessage());
        ReferenceCountUtil.release(message);
        boolean idle = state.phase() == ConnectionState.Phase.IDLE;
        teardown(error);
        state.closed();
        if (idle) {
            connection.write(badRequest()).addListener(ChannelFutureListener.CLOSE);
        } else {
            connection.close();
        }
    }

    private void teardown(Throwable cause) {
        BodyChannel body = state.body();
        if (body != null) {
            body.abort();
        }
        ResponseWriter writer = state.writer();
        if (writer != null) {
            writer.abort(cause);
        }
    }

    private static FullHttpResponse badRequest() {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1,
                HttpResponseStatus.BAD_REQUEST, Unpooled.EMPTY_BUFFER);
        HttpUtil.setContentLength(response, 0);
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        return response;
    }

    public ConnectionState state() {
        return state;
    }
}
