package org.streamhttp.handler;

import io.netty.handler.codec.http.DefaultHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;
import org.streamhttp.connection.RecordingConnection;

import static org.assertj.core.api.Assertions.assertThat;

final class ContinueNegotiatorTest {

    private final RecordingConnection connection = new RecordingConnection();

    @Test
    void writesContinueAtMostOnce() {
        ContinueNegotiator testee = new ContinueNegotiator(connection, head(true));

        assertThat(testee.isExpected()).isTrue();
        assertThat(testee.sendContinue()).isTrue();
        assertThat(testee.sendContinue()).isFalse();

        assertThat(connection.written()).hasSize(1);
        HttpResponse interim = (HttpResponse) connection.written().get(0);
        assertThat(interim.status()).isEqualTo(HttpResponseStatus.CONTINUE);
        assertThat(interim.protocolVersion()).isEqualTo(HttpVersion.HTTP_1_1);
    }

    @Test
    void nothingToSendWithoutExpectation() {
        ContinueNegotiator testee = new ContinueNegotiator(connection, head(false));

        assertThat(testee.isExpected()).isFalse();
        assertThat(testee.sendContinue()).isFalse();
        assertThat(connection.written()).isEmpty();
    }

    @Test
    void disarmedOnceBodyArrived() {
        ContinueNegotiator testee = new ContinueNegotiator(connection, head(true));

        testee.disarm();

        assertThat(testee.sendContinue()).isFalse();
        assertThat(connection.written()).isEmpty();
    }

    private static HttpRequest head(boolean expectContinue) {
        HttpRequest head = new DefaultHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, "/upload");
        head.headers().set(HttpHeaderNames.CONTENT_LENGTH, 10);
        if (expectContinue) {
            head.headers().set(HttpHeaderNames.EXPECT, "100-continue");
        }
        return head;
    }
}
