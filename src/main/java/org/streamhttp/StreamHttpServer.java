package org.streamhttp;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelException;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.streamhttp.connection.ConnectionAdapter;
import org.streamhttp.connection.NettyInboundBridge;
import org.streamhttp.handler.Handler;
import org.streamhttp.handler.HandlerInvoker;
import org.streamhttp.https.SecureChannelFactory;
import org.streamhttp.https.TlsChannelFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * HTTP/1.1 server streaming request and response bodies through
 * {@link org.streamhttp.body.BodyChannel}s.
 *
 * <pre>
 * StreamHttpServer server = StreamHttpServer.run(ServerConfig.builder().port(8080).build(),
 *         request -> Response.of(200, "ok"));
 * ...
 * server.stop();
 * </pre>
 */
public class StreamHttpServer {

    private static final Logger log = LoggerFactory.getLogger(StreamHttpServer.class);

    static final int MAX_INITIAL_LINE_LENGTH = 4096;
    static final int MAX_HEADER_SIZE = 8192;

    private final ServerConfig config;
    private final Handler handler;
    private final SecureChannelFactory secureChannelFactory;

    private ExecutorService executor;
    private boolean ownsExecutor;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile boolean isRunning;

    /**
     * @throws ConfigException if the TLS settings cannot be turned into a context
     */
    public StreamHttpServer(ServerConfig config, Handler handler) {
        this.config = config;
        this.handler = handler;
        if (config.secureChannelFactory() != null) {
            this.secureChannelFactory = config.secureChannelFactory();
        } else if (config.tls() != null) {
            this.secureChannelFactory = TlsChannelFactory.create(config.tls());
        } else {
            this.secureChannelFactory = null;
        }
    }

    public static StreamHttpServer run(ServerConfig config, Handler handler) throws InterruptedException {
        StreamHttpServer server = new StreamHttpServer(config, handler);
        server.start();
        return server;
    }

    public synchronized void start() throws InterruptedException {
        if (isRunning) {
            throw new IllegalStateException("server already started");
        }

        boolean epoll = !config.disableEpoll() && Epoll.isAvailable();
        Class<? extends ServerChannel> channelClass;
        if (epoll) {
            bossGroup = new EpollEventLoopGroup(1, new DefaultThreadFactory("streamhttp-boss"));
            workerGroup = new EpollEventLoopGroup(config.loopThreadCount(), new DefaultThreadFactory("streamhttp-loop"));
            channelClass = EpollServerSocketChannel.class;
        } else {
            bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("streamhttp-boss"));
            workerGroup = new NioEventLoopGroup(config.loopThreadCount(), new DefaultThreadFactory("streamhttp-loop"));
            channelClass = NioServerSocketChannel.class;
        }

        if (config.executor() != null) {
            executor = config.executor();
            ownsExecutor = false;
        } else {
            int threads = config.workerThreads();
            executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(), new DefaultThreadFactory("streamhttp-worker"));
            ownsExecutor = true;
        }
        HandlerInvoker invoker = new HandlerInvoker(handler, executor, config.responseTimeoutMillis());

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(channelClass)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (secureChannelFactory != null) {
                            p.addLast("ssl", secureChannelFactory.newHandler(ch));
                        }
                        if (config.readIdleTimeoutMillis() > 0) {
                            p.addLast("idle", new IdleStateHandler(config.readIdleTimeoutMillis(), 0, 0,
                                    TimeUnit.MILLISECONDS));
                        }
                        p.addLast("codec", new HttpServerCodec(MAX_INITIAL_LINE_LENGTH, MAX_HEADER_SIZE,
                                config.chunkSize()));
                        p.addLast("stream", new NettyInboundBridge(connection -> new ConnectionAdapter(
                                connection, invoker, executor, config.inbuf(), config.closeAfterResponse())));
                    }
                })
                .option(ChannelOption.SO_BACKLOG, config.soBacklog())
                .childOption(ChannelOption.SO_KEEPALIVE, true);
        if (config.wireLogLevel() != null) {
            b.handler(new LoggingHandler(StreamHttpServer.class, config.wireLogLevel()));
        }

        ChannelFuture f = b.bind(config.host(), config.port());
        try {
            f.await();
        } catch (InterruptedException e) {
            release();
            throw e;
        }
        if (!f.isSuccess()) {
            release();
            throw new ChannelException("cannot bind " + config.host() + ":" + config.port(), f.cause());
        }
        serverChannel = f.channel();
        isRunning = true;
        log.info("Listening on {} ({}{})", serverChannel.localAddress(), epoll ? "epoll" : "nio",
                secureChannelFactory != null ? ", tls" : "");
    }

    /**
     * Closes the listening socket and shuts the event loops down. Connections
     * still open are closed with them, which aborts their body channels.
     */
    public synchronized void stop() {
        if (!isRunning) {
            return;
        }
        isRunning = false;
        log.info("Stopping server on {}", serverChannel.localAddress());
        serverChannel.close().syncUninterruptibly();
        release();
    }

    private void release() {
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    /**
     * Blocks until the server socket is closed.
     */
    public void awaitTermination() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public InetSocketAddress localAddress() {
        return serverChannel == null ? null : (InetSocketAddress) serverChannel.localAddress();
    }

    /**
     * The bound port, which differs from the configured one when that was 0.
     */
    public int port() {
        InetSocketAddress address = localAddress();
        return address == null ? -1 : address.getPort();
    }

    public boolean isRunning() {
        return isRunning;
    }

    public ServerConfig config() {
        return config;
    }
}
