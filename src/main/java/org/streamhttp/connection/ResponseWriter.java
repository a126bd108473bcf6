package org.streamhttp.connection;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFuture;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.DefaultLastHttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.util.concurrent.Future;
import org.streamhttp.Response;
import org.streamhttp.body.BodyChannel;
import org.streamhttp.handler.ContinueNegotiator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Writes one response: the head, then the body according to its type, then
 * exactly one terminal frame, then exactly one close (or, on a kept-alive
 * connection, one completion notice).
 *
 * <p>A {@link BodyChannel} body is drained by a task on the worker pool that
 * takes one chunk, writes it, and is resubmitted when that write completed.
 * A failed write ends the loop, aborts the body channel and closes the
 * connection.
 */
public class ResponseWriter {

    private static final Logger log = LoggerFactory.getLogger(ResponseWriter.class);

    public enum State {
        IDLE,
        HEAD_WRITTEN,
        DRAINING,
        DONE,
        CLOSED
    }

    /**
     * Progress notices, delivered on the connection's event loop.
     */
    public interface ExchangeListener {

        ExchangeListener NONE = new ExchangeListener() {
        };

        default void headWritten() {
        }

        /**
         * The terminal frame went out and the connection stays open.
         */
        default void completed() {
        }
    }

    private final Connection connection;
    private final HttpVersion version;
    private final Executor executor;
    private final boolean keepAlive;
    private final ExchangeListener listener;
    private final ContinueNegotiator continueNegotiator;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile BodyChannel body;

    public ResponseWriter(Connection connection, HttpVersion version, Executor executor) {
        this(connection, version, executor, false, ExchangeListener.NONE, null);
    }

    /**
     * @param keepAlive whether the connection stays open after the response
     * @param continueNegotiator disarmed once the head goes out, may be null
     */
    public ResponseWriter(Connection connection, HttpVersion version, Executor executor, boolean keepAlive,
                          ExchangeListener listener, ContinueNegotiator continueNegotiator) {
        this.connection = connection;
        this.version = version;
        this.executor = executor;
        this.keepAlive = keepAlive;
        this.listener = listener;
        this.continueNegotiator = continueNegotiator;
    }

    public void write(Response response) {
        write(response, false);
    }

    /**
     * Writes the response and closes the connection afterwards even if it
     * would otherwise be kept alive.
     */
    public void writeAndClose(Response response) {
        write(response, true);
    }

    private void write(Response response, boolean forceClose) {
        if (!response.markConsumed()) {
            throw new IllegalStateException("response already written: " + response);
        }
        if (!state.compareAndSet(State.IDLE, State.HEAD_WRITTEN)) {
            response.discard();
            if (state.get() == State.CLOSED) {
                log.debug("Connection {} went away, dropping {}", connection, response);
                return;
            }
            throw new IllegalStateException("a response was already written on " + connection);
        }
        if (continueNegotiator != null) {
            continueNegotiator.disarm();
        }

        boolean close = forceClose || !keepAlive || isCloseDelimited(response);
        ChannelFuture headWrite = connection.write(head(response, close));

        switch (response.bodyType()) {
            case BUFFER:
                headWrite.addListener(f -> {
                    if (!f.isSuccess()) {
                        response.buffer().release();
                        fail(f.cause());
                        return;
                    }
                    listener.headWritten();
                    connection.write(new DefaultLastHttpContent(response.buffer()))
                            .addListener(written -> finish(written, close));
                });
                break;
            case CHANNEL:
                body = response.channel();
                headWrite.addListener(f -> {
                    if (!f.isSuccess()) {
                        fail(f.cause());
                        return;
                    }
                    listener.headWritten();
                    if (state.compareAndSet(State.HEAD_WRITTEN, State.DRAINING)) {
                        drainNext(response.channel(), close);
                    } else {
                        response.channel().abort();
                    }
                });
                break;
            default:
                headWrite.addListener(f -> {
                    if (!f.isSuccess()) {
                        fail(f.cause());
                        return;
                    }
                    listener.headWritten();
                    connection.write(LastHttpContent.EMPTY_LAST_CONTENT)
                            .addListener(written -> finish(written, close));
                });
        }
    }

    private void drainNext(BodyChannel channel, boolean close) {
        try {
            executor.execute(() -> drainOnce(channel, close));
        } catch (RejectedExecutionException e) {
            fail(e);
        }
    }

    private void drainOnce(BodyChannel channel, boolean close) {
        if (state.get() != State.DRAINING) {
            channel.abort();
            return;
        }
        ByteBuf chunk;
        try {
            chunk = channel.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(e);
            return;
        }
        if (state.get() != State.DRAINING) {
            // aborted while we were waiting
            if (chunk != null) {
                chunk.release();
            }
            channel.abort();
            return;
        }
        if (chunk == null) {
            connection.write(LastHttpContent.EMPTY_LAST_CONTENT).addListener(f -> finish(f, close));
            return;
        }
        connection.write(new DefaultHttpContent(chunk)).addListener(f -> {
            if (f.isSuccess()) {
                drainNext(channel, close);
            } else {
                fail(f.cause());
            }
        });
    }

    private void finish(Future<?> terminalWrite, boolean close) {
        if (!terminalWrite.isSuccess()) {
            fail(terminalWrite.cause());
            return;
        }
        State previous = state.getAndUpdate(s -> s == State.CLOSED ? s : State.DONE);
        if (close || previous == State.CLOSED) {
            closeConnection();
        } else {
            listener.completed();
        }
    }

    private void fail(Throwable cause) {
        log.debug("Response write failed on {}", connection, cause);
        abort(cause);
    }

    /**
     * Stops the response: no more frames are written, a body channel being
     * drained is aborted so a worker blocked on it returns, and the connection
     * is closed. Safe to call more than once and from any thread.
     */
    public void abort(Throwable cause) {
        state.set(State.CLOSED);
        BodyChannel channel = body;
        if (channel != null) {
            channel.abort();
        }
        if (cause != null && !closed.get()) {
            log.debug("Closing {} after {}", connection, cause.toString());
        }
        closeConnection();
    }

    private void closeConnection() {
        if (closed.compareAndSet(false, true)) {
            connection.close();
        }
    }

    public State state() {
        return state.get();
    }

    public boolean isIdle() {
        return state.get() == State.IDLE;
    }

    private HttpResponse head(Response response, boolean close) {
        HttpResponse head = new DefaultHttpResponse(version, HttpResponseStatus.valueOf(response.status()));
        HttpHeaders headers = head.headers();
        headers.set(response.headers());

        boolean framed = headers.contains(HttpHeaderNames.CONTENT_LENGTH) || HttpUtil.isTransferEncodingChunked(head);
        if (!framed) {
            switch (response.bodyType()) {
                case BUFFER:
                    HttpUtil.setContentLength(head, response.buffer().readableBytes());
                    break;
                case CHANNEL:
                    if (version.equals(HttpVersion.HTTP_1_1)) {
                        HttpUtil.setTransferEncodingChunked(head, true);
                    }
                    break;
                default:
                    if (hasContent(response.status())) {
                        HttpUtil.setContentLength(head, 0);
                    }
            }
        }

        if (close) {
            headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        } else if (!version.isKeepAliveDefault()) {
            headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        }
        return head;
    }

    // a streamed body with no length on HTTP/1.0 ends when the connection does
    private boolean isCloseDelimited(Response response) {
        return response.bodyType() == Response.BodyType.CHANNEL
                && !version.equals(HttpVersion.HTTP_1_1)
                && !response.headers().contains(HttpHeaderNames.CONTENT_LENGTH);
    }

    private static boolean hasContent(int status) {
        return status >= 200 && status != 204 && status != 304;
    }
}
