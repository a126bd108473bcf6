package org.streamhttp.https;

import io.netty.handler.ssl.ClientAuth;
import org.junit.jupiter.api.Test;
import org.streamhttp.ConfigException;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class TlsConfigTest {

    @Test
    void absentWithoutCertificateOrKey() {
        assertThat(TlsConfig.fromProperties(new Properties())).isNull();
    }

    @Test
    void readsAllKeys() {
        Properties props = new Properties();
        props.setProperty("tls.cert", TlsFixtures.certPath().toString());
        props.setProperty("tls.key", TlsFixtures.keyPath().toString());
        props.setProperty("tls.ca-cert", TlsFixtures.certPath().toString());
        props.setProperty("tls.auth-mode", "auth-mode-optional");
        props.setProperty("tls.ciphers", "TLS_AES_128_GCM_SHA256, TLS_AES_256_GCM_SHA384,");
        props.setProperty("tls.session-cache-size", "512");
        props.setProperty("tls.session-timeout", "300");

        TlsConfig config = TlsConfig.fromProperties(props);

        assertThat(config.cert().isFile()).isTrue();
        assertThat(config.caCert()).isNotNull();
        assertThat(config.clientAuth()).isEqualTo(ClientAuth.OPTIONAL);
        assertThat(config.ciphers()).containsExactly("TLS_AES_128_GCM_SHA256", "TLS_AES_256_GCM_SHA384");
        assertThat(config.sessionCacheSize()).isEqualTo(512);
        assertThat(config.sessionTimeout()).isEqualTo(300);
    }

    @Test
    void certificateWithoutKeyIsAConfigError() {
        Properties props = new Properties();
        props.setProperty("tls.cert", TlsFixtures.certPath().toString());

        assertThatThrownBy(() -> TlsConfig.fromProperties(props))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("private key");
    }

    @Test
    void parsesClientAuthModes() {
        assertThat(TlsConfig.parseClientAuth(null)).isEqualTo(ClientAuth.NONE);
        assertThat(TlsConfig.parseClientAuth("none")).isEqualTo(ClientAuth.NONE);
        assertThat(TlsConfig.parseClientAuth("REQUIRE")).isEqualTo(ClientAuth.REQUIRE);
        assertThat(TlsConfig.parseClientAuth("auth-mode-require")).isEqualTo(ClientAuth.REQUIRE);
        assertThatThrownBy(() -> TlsConfig.parseClientAuth("sometimes"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("sometimes");
    }

    @Test
    void negativeSessionSettingsAreRejected() {
        TlsConfig.Builder builder = TlsConfig.builder()
                .cert(MaterialSource.of(TlsFixtures.certPath()))
                .key(MaterialSource.of(TlsFixtures.keyPath()))
                .sessionTimeout(-1);

        assertThatThrownBy(builder::build).isInstanceOf(ConfigException.class);
    }
}
