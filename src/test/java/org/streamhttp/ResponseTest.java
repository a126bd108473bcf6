package org.streamhttp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;
import org.streamhttp.body.BodyChannel;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class ResponseTest {

    @Test
    void bodyTypeFollowsTheFactory() {
        assertThat(Response.of(204).bodyType()).isEqualTo(Response.BodyType.NONE);
        assertThat(Response.of(200, (String) null).bodyType()).isEqualTo(Response.BodyType.NONE);
        assertThat(Response.of(200, "héllo").buffer().readableBytes()).isEqualTo(6);
        assertThat(Response.of(200, new byte[] {1, 2}).bodyType()).isEqualTo(Response.BodyType.BUFFER);
        assertThat(Response.of(200, new BodyChannel()).bodyType()).isEqualTo(Response.BodyType.CHANNEL);
    }

    @Test
    void headersAreCaseInsensitive() {
        Response response = Response.of(200)
                .contentType("text/plain")
                .headers(Map.of("X-Request-Id", "42"));

        assertThat(response.headers().get("content-type")).isEqualTo("text/plain");
        assertThat(response.headers().get("x-request-id")).isEqualTo("42");
    }

    @Test
    void rejectsInvalidStatus() {
        assertThatThrownBy(() -> Response.of(42)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Response.of(1000)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void consumedOnce() {
        Response response = Response.of(200);

        assertThat(response.markConsumed()).isTrue();
        assertThat(response.markConsumed()).isFalse();
    }

    @Test
    void discardGivesResourcesBack() {
        ByteBuf buffer = Unpooled.copiedBuffer("x", StandardCharsets.UTF_8);
        Response.of(200, buffer).discard();
        BodyChannel channel = new BodyChannel();
        Response.of(200, channel).discard();

        assertThat(buffer.refCnt()).isZero();
        assertThat(channel.isClosed()).isTrue();
    }
}
