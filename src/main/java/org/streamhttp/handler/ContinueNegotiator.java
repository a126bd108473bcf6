package org.streamhttp.handler;

import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import org.streamhttp.connection.Connection;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sends the interim {@code 100 Continue} response for a request carrying
 * {@code Expect: 100-continue}. One shot: only the first call counts, and
 * nothing is sent once body content arrived or the final response started.
 */
public class ContinueNegotiator {

    private final Connection connection;
    private final HttpVersion version;
    private final boolean expected;
    private final AtomicBoolean spent = new AtomicBoolean(false);

    public ContinueNegotiator(Connection connection, HttpRequest head) {
        this.connection = connection;
        this.version = head.protocolVersion();
        this.expected = HttpUtil.is100ContinueExpected(head);
    }

    public boolean isExpected() {
        return expected;
    }

    /**
     * @return true if this call wrote the interim response
     */
    public boolean sendContinue() {
        if (!expected || !spent.compareAndSet(false, true)) {
            return false;
        }
        connection.write(new DefaultFullHttpResponse(version, HttpResponseStatus.CONTINUE));
        return true;
    }

    /**
     * The body started streaming or the final response is on its way, later
     * {@link #sendContinue()} calls do nothing.
     */
    public void disarm() {
        spent.set(true);
    }
}
