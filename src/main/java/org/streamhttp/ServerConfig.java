package org.streamhttp;

import io.netty.handler.logging.LogLevel;
import org.streamhttp.body.BodyChannel;
import org.streamhttp.https.SecureChannelFactory;
import org.streamhttp.https.TlsConfig;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.concurrent.ExecutorService;

/**
 * Server options. Built with {@link #builder()} or read from properties using
 * the option names below; {@link Builder#build()} rejects invalid values with
 * a {@link ConfigException}.
 *
 * <pre>
 * host                  bind address, 127.0.0.1
 * port                  listen port, 8080 (0 picks a free one)
 * chunk-size            largest body chunk the codec emits, 16 MiB
 * inbuf                 request body channel capacity, 100
 * so-backlog            listen backlog, 1024
 * aggregate-length      reserved, 1 MiB
 * worker-threads        size of the default worker pool, 10
 * disable-epoll         use NIO even where epoll is available, false
 * loop-thread-count     event loop threads, 0 for Netty's default
 * close-after-response  close every connection after its response, true
 * read-idle-timeout-ms  close connections idle that long while waiting on the client, 0 = never
 * response-timeout-ms   fail asynchronous responses slower than that, 0 = never
 * wire-log-level        log server channel events at this level, off by default
 * tls.*                 see {@link TlsConfig#fromProperties(Properties)}
 * </pre>
 */
public final class ServerConfig {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_CHUNK_SIZE = 16 * 1024 * 1024;
    public static final int DEFAULT_INBUF = BodyChannel.DEFAULT_CAPACITY;
    public static final int DEFAULT_SO_BACKLOG = 1024;
    public static final int DEFAULT_AGGREGATE_LENGTH = 1024 * 1024;
    public static final int DEFAULT_WORKER_THREADS = 10;

    private final String host;
    private final int port;
    private final int chunkSize;
    private final int inbuf;
    private final int soBacklog;
    private final int aggregateLength;
    private final ExecutorService executor;
    private final int workerThreads;
    private final boolean disableEpoll;
    private final int loopThreadCount;
    private final boolean closeAfterResponse;
    private final long readIdleTimeoutMillis;
    private final long responseTimeoutMillis;
    private final LogLevel wireLogLevel;
    private final TlsConfig tls;
    private final SecureChannelFactory secureChannelFactory;

    private ServerConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.chunkSize = builder.chunkSize;
        this.inbuf = builder.inbuf;
        this.soBacklog = builder.soBacklog;
        this.aggregateLength = builder.aggregateLength;
        this.executor = builder.executor;
        this.workerThreads = builder.workerThreads;
        this.disableEpoll = builder.disableEpoll;
        this.loopThreadCount = builder.loopThreadCount;
        this.closeAfterResponse = builder.closeAfterResponse;
        this.readIdleTimeoutMillis = builder.readIdleTimeoutMillis;
        this.responseTimeoutMillis = builder.responseTimeoutMillis;
        this.wireLogLevel = builder.wireLogLevel;
        this.tls = builder.tls;
        this.secureChannelFactory = builder.secureChannelFactory;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ServerConfig defaults() {
        return builder().build();
    }

    /**
     * Loads a properties file from the classpath. A missing resource gives the defaults.
     */
    public static ServerConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                return defaults();
            }
            props.load(in);
        } catch (IOException e) {
            throw new ConfigException("cannot read " + resource, e);
        }
        return fromProperties(props);
    }

    public static ServerConfig fromProperties(Properties props) {
        Builder builder = builder();
        String host = props.getProperty("host");
        if (host != null) {
            builder.host(host.trim());
        }
        builder.port(intValue(props, "port", DEFAULT_PORT))
                .chunkSize(intValue(props, "chunk-size", DEFAULT_CHUNK_SIZE))
                .inbuf(intValue(props, "inbuf", DEFAULT_INBUF))
                .soBacklog(intValue(props, "so-backlog", DEFAULT_SO_BACKLOG))
                .aggregateLength(intValue(props, "aggregate-length", DEFAULT_AGGREGATE_LENGTH))
                .workerThreads(intValue(props, "worker-threads", DEFAULT_WORKER_THREADS))
                .disableEpoll(Boolean.parseBoolean(props.getProperty("disable-epoll", "false").trim()))
                .loopThreadCount(intValue(props, "loop-thread-count", 0))
                .closeAfterResponse(Boolean.parseBoolean(props.getProperty("close-after-response", "true").trim()))
                .readIdleTimeoutMillis(longValue(props, "read-idle-timeout-ms"))
                .responseTimeoutMillis(longValue(props, "response-timeout-ms"));
        String level = props.getProperty("wire-log-level");
        if (level != null && !level.isBlank()) {
            try {
                builder.wireLogLevel(LogLevel.valueOf(level.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("invalid wire-log-level: " + level, e);
            }
        }
        builder.tls(TlsConfig.fromProperties(props));
        return builder.build();
    }

    private static int intValue(Properties props, String name, int defaultValue) {
        String value = props.getProperty(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("invalid " + name + ": " + value, e);
        }
    }

    private static long longValue(Properties props, String name) {
        String value = props.getProperty(name);
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("invalid " + name + ": " + value, e);
        }
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int inbuf() {
        return inbuf;
    }

    public int soBacklog() {
        return soBacklog;
    }

    /**
     * Not used by the streaming path.
     */
    public int aggregateLength() {
        return aggregateLength;
    }

    /**
     * The worker pool given by the application, or null to let the server create one.
     */
    public ExecutorService executor() {
        return executor;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public boolean disableEpoll() {
        return disableEpoll;
    }

    public int loopThreadCount() {
        return loopThreadCount;
    }

    public boolean closeAfterResponse() {
        return closeAfterResponse;
    }

    public long readIdleTimeoutMillis() {
        return readIdleTimeoutMillis;
    }

    public long responseTimeoutMillis() {
        return responseTimeoutMillis;
    }

    public LogLevel wireLogLevel() {
        return wireLogLevel;
    }

    public TlsConfig tls() {
        return tls;
    }

    public SecureChannelFactory secureChannelFactory() {
        return secureChannelFactory;
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int inbuf = DEFAULT_INBUF;
        private int soBacklog = DEFAULT_SO_BACKLOG;
        private int aggregateLength = DEFAULT_AGGREGATE_LENGTH;
        private ExecutorService executor;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private boolean disableEpoll;
        private int loopThreadCount;
        private boolean closeAfterResponse = true;
        private long readIdleTimeoutMillis;
        private long responseTimeoutMillis;
        private LogLevel wireLogLevel;
        private TlsConfig tls;
        private SecureChannelFactory secureChannelFactory;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder inbuf(int inbuf) {
            this.inbuf = inbuf;
            return this;
        }

        public Builder soBacklog(int soBacklog) {
            this.soBacklog = soBacklog;
            return this;
        }

        public Builder aggregateLength(int aggregateLength) {
            this.aggregateLength = aggregateLength;
            return this;
        }

        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder disableEpoll(boolean disableEpoll) {
            this.disableEpoll = disableEpoll;
            return this;
        }

        public Builder loopThreadCount(int loopThreadCount) {
            this.loopThreadCount = loopThreadCount;
            return this;
        }

        public Builder closeAfterResponse(boolean closeAfterResponse) {
            this.closeAfterResponse = closeAfterResponse;
            return this;
        }

        public Builder readIdleTimeoutMillis(long readIdleTimeoutMillis) {
            this.readIdleTimeoutMillis = readIdleTimeoutMillis;
            return this;
        }

        public Builder responseTimeoutMillis(long responseTimeoutMillis) {
            this.responseTimeoutMillis = responseTimeoutMillis;
            return this;
        }

        public Builder wireLogLevel(LogLevel wireLogLevel) {
            this.wireLogLevel = wireLogLevel;
            return this;
        }

        public Builder tls(TlsConfig tls) {
            this.tls = tls;
            return this;
        }

        public Builder secureChannelFactory(SecureChannelFactory secureChannelFactory) {
            this.secureChannelFactory = secureChannelFactory;
            return this;
        }

        public ServerConfig build() {
            if (host == null || host.isBlank()) {
                throw new ConfigException("host must not be empty");
            }
            if (port < 0 || port > 65535) {
                throw new ConfigException("port out of range: " + port);
            }
            positive("chunk-size", chunkSize);
            positive("inbuf", inbuf);
            positive("so-backlog", soBacklog);
            positive("aggregate-length", aggregateLength);
            positive("worker-threads", workerThreads);
            if (loopThreadCount < 0) {
                throw new ConfigException("loop-thread-count must not be negative: " + loopThreadCount);
            }
            if (readIdleTimeoutMillis < 0 || responseTimeoutMillis < 0) {
                throw new ConfigException("timeouts must not be negative");
            }
            if (tls != null && secureChannelFactory != null) {
                throw new ConfigException("set either tls or a secure channel factory, not both");
            }
            return new ServerConfig(this);
        }

        private static void positive(String name, int value) {
            if (value <= 0) {
                throw new ConfigException(name + " must be positive: " + value);
            }
        }
    }
}
