package org.streamhttp.https;

import io.netty.handler.ssl.ClientAuth;
import org.streamhttp.ConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Inputs of the server TLS context.
 */
public final class TlsConfig {

    private final MaterialSource cert;
    private final MaterialSource key;
    private final String keyPassword;
    private final MaterialSource caCert;
    private final ClientAuth clientAuth;
    private final List<String> ciphers;
    private final long sessionCacheSize;
    private final long sessionTimeout;

    private TlsConfig(Builder builder) {
        this.cert = builder.cert;
        this.key = builder.key;
        this.keyPassword = builder.keyPassword;
        this.caCert = builder.caCert;
        this.clientAuth = builder.clientAuth;
        this.ciphers = builder.ciphers == null ? null : Collections.unmodifiableList(new ArrayList<>(builder.ciphers));
        this.sessionCacheSize = builder.sessionCacheSize;
        this.sessionTimeout = builder.sessionTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the {@code tls.*} keys. Returns null when neither {@code tls.cert} nor {@code tls.key} is set.
     */
    public static TlsConfig fromProperties(Properties props) {
        String cert = props.getProperty("tls.cert");
        String key = props.getProperty("tls.key");
        if (cert == null && key == null) {
            return null;
        }
        StorageMode storage = StorageMode.parse(props.getProperty("tls.storage"));
        Builder builder = builder()
                .keyPassword(props.getProperty("tls.password"))
                .clientAuth(props.getProperty("tls.auth-mode"));
        if (cert != null) {
            builder.cert(MaterialSource.of(cert, storage));
        }
        if (key != null) {
            builder.key(MaterialSource.of(key, storage));
        }
        String caCert = props.getProperty("tls.ca-cert");
        if (caCert != null) {
            builder.caCert(MaterialSource.of(caCert, storage));
        }
        String ciphers = props.getProperty("tls.ciphers");
        if (ciphers != null && !ciphers.isBlank()) {
            List<String> list = new ArrayList<>();
            for (String cipher : ciphers.split(",")) {
                if (!cipher.isBlank()) {
                    list.add(cipher.trim());
                }
            }
            builder.ciphers(list);
        }
        String cacheSize = props.getProperty("tls.session-cache-size");
        if (cacheSize != null) {
            builder.sessionCacheSize(parseLong("tls.session-cache-size", cacheSize));
        }
        String timeout = props.getProperty("tls.session-timeout");
        if (timeout != null) {
            builder.sessionTimeout(parseLong("tls.session-timeout", timeout));
        }
        return builder.build();
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("invalid " + name + ": " + value, e);
        }
    }

    /**
     * Maps {@code none}, {@code optional} and {@code require} (optionally
     * prefixed with {@code auth-mode-}) to Netty's client auth modes.
     */
    public static ClientAuth parseClientAuth(String mode) {
        if (mode == null) {
            return ClientAuth.NONE;
        }
        String normalized = mode.trim().toLowerCase();
        if (normalized.startsWith("auth-mode-")) {
            normalized = normalized.substring("auth-mode-".length());
        }
        switch (normalized) {
            case "none": return ClientAuth.NONE;
            case "optional": return ClientAuth.OPTIONAL;
            case "require": return ClientAuth.REQUIRE;
            default: throw new ConfigException("invalid client auth mode: " + mode);
        }
    }

    public MaterialSource cert() {
        return cert;
    }

    public MaterialSource key() {
        return key;
    }

    public String keyPassword() {
        return keyPassword;
    }

    public MaterialSource caCert() {
        return caCert;
    }

    public ClientAuth clientAuth() {
        return clientAuth;
    }

    public List<String> ciphers() {
        return ciphers;
    }

    public long sessionCacheSize() {
        return sessionCacheSize;
    }

    public long sessionTimeout() {
        return sessionTimeout;
    }

    public static final class Builder {
        private MaterialSource cert;
        private MaterialSource key;
        private String keyPassword;
        private MaterialSource caCert;
        private ClientAuth clientAuth = ClientAuth.NONE;
        private List<String> ciphers;
        private long sessionCacheSize;
        private long sessionTimeout;

        private Builder() {
        }

        public Builder cert(MaterialSource cert) {
            this.cert = cert;
            return this;
        }

        public Builder key(MaterialSource key) {
            this.key = key;
            return this;
        }

        public Builder keyPassword(String keyPassword) {
            this.keyPassword = keyPassword;
            return this;
        }

        public Builder caCert(MaterialSource caCert) {
            this.caCert = caCert;
            return this;
        }

        public Builder clientAuth(ClientAuth clientAuth) {
            this.clientAuth = clientAuth;
            return this;
        }

        public Builder clientAuth(String mode) {
            this.clientAuth = parseClientAuth(mode);
            return this;
        }

        public Builder ciphers(List<String> ciphers) {
            this.ciphers = ciphers;
            return this;
        }

        public Builder sessionCacheSize(long sessionCacheSize) {
            this.sessionCacheSize = sessionCacheSize;
            return this;
        }

        /**
         * @param sessionTimeout seconds
         */
        public Builder sessionTimeout(long sessionTimeout) {
            this.sessionTimeout = sessionTimeout;
            return this;
        }

        public TlsConfig build() {
            if (cert == null || key == null) {
                throw new ConfigException("TLS needs both a certificate and a private key");
            }
            if (sessionCacheSize < 0 || sessionTimeout < 0) {
                throw new ConfigException("TLS session cache size and timeout must not be negative");
            }
            return new TlsConfig(this);
        }
    }
}
