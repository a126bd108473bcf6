package org.streamhttp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import org.streamhttp.body.BodyChannel;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A response produced by a handler: status, headers and a body which is
 * absent, one buffer, or a {@link BodyChannel} streaming further buffers.
 * A response is written once.
 */
public class Response {

    public enum BodyType {
        NONE,
        BUFFER,
        CHANNEL
    }

    private final int status;
    private final HttpHeaders headers = new DefaultHttpHeaders();
    private final BodyType bodyType;
    private final ByteBuf buffer;
    private final BodyChannel channel;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    private Response(int status, BodyType bodyType, ByteBuf buffer, BodyChannel channel) {
        if (status < 100 || status > 999) {
            throw new IllegalArgumentException("invalid status code: " + status);
        }
        this.status = status;
        this.bodyType = bodyType;
        this.buffer = buffer;
        this.channel = channel;
    }

    public static Response of(int status) {
        return new Response(status, BodyType.NONE, null, null);
    }

    public static Response of(int status, String body) {
        if (body == null) {
            return of(status);
        }
        return of(status, Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
    }

    public static Response of(int status, byte[] body) {
        if (body == null) {
            return of(status);
        }
        return of(status, Unpooled.wrappedBuffer(body));
    }

    public static Response of(int status, ByteBuf body) {
        if (body == null) {
            return of(status);
        }
        return new Response(status, BodyType.BUFFER, body, null);
    }

    public static Response of(int status, BodyChannel body) {
        if (body == null) {
            return of(status);
        }
        return new Response(status, BodyType.CHANNEL, null, body);
    }

    public Response header(String name, Object value) {
        headers.set(name, value);
        return this;
    }

    public Response headers(Map<String, ?> values) {
        values.forEach(headers::set);
        return this;
    }

    public Response contentType(String contentType) {
        return header(HttpHeaderNames.CONTENT_TYPE.toString(), contentType);
    }

    public int status() {
        return status;
    }

    public HttpHeaders headers() {
        return headers;
    }

    public BodyType bodyType() {
        return bodyType;
    }

    public ByteBuf buffer() {
        return buffer;
    }

    public BodyChannel channel() {
        return channel;
    }

    /**
     * @return true the first time only
     */
    public boolean markConsumed() {
        return consumed.compareAndSet(false, true);
    }

    /**
     * Gives the body resources back when the response is never going to be written.
     */
    public void discard() {
        if (buffer != null && buffer.refCnt() > 0) {
            buffer.release();
        }
        if (channel != null) {
            channel.abort();
        }
    }

    @Override
    public String toString() {
        return "Response[" + status + ", " + bodyType + "]";
    }
}
