package org.streamhttp.https;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.streamhttp.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * {@link SecureChannelFactory} backed by a Netty {@link SslContext}. The
 * context is built up front so broken material stops the server from
 * starting instead of failing handshakes one by one.
 */
public class TlsChannelFactory implements SecureChannelFactory {

    private static final Logger log = LoggerFactory.getLogger(TlsChannelFactory.class);

    private final SslContext sslContext;

    public TlsChannelFactory(SslContext sslContext) {
        this.sslContext = sslContext;
    }

    public static TlsChannelFactory create(TlsConfig config) {
        return new TlsChannelFactory(buildContext(config));
    }

    public static SslContext buildContext(TlsConfig config) {
        try (InputStream cert = config.cert().open(); InputStream key = config.key().open()) {
            SslContextBuilder builder = SslContextBuilder.forServer(cert, key, config.keyPassword());
            if (config.caCert() != null) {
                try (InputStream ca = config.caCert().open()) {
                    builder.trustManager(ca);
                }
            }
            if (config.ciphers() != null) {
                builder.ciphers(config.ciphers());
            }
            if (config.sessionCacheSize() > 0) {
                builder.sessionCacheSize(config.sessionCacheSize());
            }
            if (config.sessionTimeout() > 0) {
                builder.sessionTimeout(config.sessionTimeout());
            }
            builder.clientAuth(config.clientAuth());

            SslContext context = builder.build();
            log.info("TLS enabled with certificate {}, client auth {}", config.cert(), config.clientAuth());
            return context;
        } catch (ConfigException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigException("cannot build TLS context from " + config.cert() + " and " + config.key(), e);
        }
    }

    @Override
    public ChannelHandler newHandler(Channel channel) {
        return sslContext.newHandler(channel.alloc());
    }

    public SslContext sslContext() {
        return sslContext;
    }
}
