package org.streamhttp;

import io.netty.handler.logging.LogLevel;
import org.junit.jupiter.api.Test;
import org.streamhttp.https.MaterialSource;
import org.streamhttp.https.TlsConfig;

import java.nio.file.Paths;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class ServerConfigTest {

    @Test
    void defaults() {
        ServerConfig config = ServerConfig.defaults();

        assertThat(config.host()).isEqualTo("127.0.0.1");
        assertThat(config.port()).isEqualTo(8080);
        assertThat(config.chunkSize()).isEqualTo(16 * 1024 * 1024);
        assertThat(config.inbuf()).isEqualTo(100);
        assertThat(config.soBacklog()).isEqualTo(1024);
        assertThat(config.aggregateLength()).isEqualTo(1024 * 1024);
        assertThat(config.workerThreads()).isEqualTo(10);
        assertThat(config.executor()).isNull();
        assertThat(config.closeAfterResponse()).isTrue();
        assertThat(config.readIdleTimeoutMillis()).isZero();
        assertThat(config.responseTimeoutMillis()).isZero();
        assertThat(config.wireLogLevel()).isNull();
        assertThat(config.tls()).isNull();
    }

    @Test
    void loadsClasspathResource() {
        ServerConfig config = ServerConfig.load("streamhttp-test.properties");

        assertThat(config.host()).isEqualTo("0.0.0.0");
        assertThat(config.port()).isZero();
        assertThat(config.inbuf()).isEqualTo(8);
        assertThat(config.workerThreads()).isEqualTo(3);
        assertThat(config.closeAfterResponse()).isFalse();
        assertThat(config.readIdleTimeoutMillis()).isEqualTo(30000);
        assertThat(config.wireLogLevel()).isEqualTo(LogLevel.DEBUG);
    }

    @Test
    void missingResourceGivesDefaults() {
        assertThat(ServerConfig.load("nothing-here.properties").port()).isEqualTo(ServerConfig.DEFAULT_PORT);
    }

    @Test
    void rejectsOutOfRangePort() {
        assertThatThrownBy(() -> ServerConfig.builder().port(65536).build())
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("65536");
        assertThatThrownBy(() -> ServerConfig.builder().port(-1).build()).isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsNonPositiveSizes() {
        assertThatThrownBy(() -> ServerConfig.builder().inbuf(0).build()).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> ServerConfig.builder().chunkSize(-5).build()).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> ServerConfig.builder().workerThreads(0).build()).isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsUnparsableProperties() {
        Properties props = new Properties();
        props.setProperty("port", "eighty");

        assertThatThrownBy(() -> ServerConfig.fromProperties(props))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("port");
    }

    @Test
    void rejectsUnknownWireLogLevel() {
        Properties props = new Properties();
        props.setProperty("wire-log-level", "loud");

        assertThatThrownBy(() -> ServerConfig.fromProperties(props)).isInstanceOf(ConfigException.class);
    }

    @Test
    void tlsAndCustomFactoryAreExclusive() {
        TlsConfig tls = TlsConfig.builder()
                .cert(MaterialSource.of(Paths.get("server.crt")))
                .key(MaterialSource.of(Paths.get("server.key")))
                .build();

        assertThatThrownBy(() -> ServerConfig.builder()
                .tls(tls)
                .secureChannelFactory(channel -> null)
                .build())
                .isInstanceOf(ConfigException.class);
    }
}
