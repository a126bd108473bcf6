package org.streamhttp;

import io.netty.buffer.Unpooled;
import org.streamhttp.body.BodyChannel;
import org.streamhttp.handler.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Sample server, configured from {@code streamhttp.properties} on the classpath.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws InterruptedException {
        ServerConfig config = ServerConfig.load("streamhttp.properties");
        StreamHttpServer server = StreamHttpServer.run(config, sampleHandler());

        log.info("Routes:");
        log.info("  - GET  http://{}:{}/", config.host(), server.port());
        log.info("  - POST http://{}:{}/echo (streams the body back)", config.host(), server.port());
        log.info("  - GET  http://{}:{}/chunks", config.host(), server.port());

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
        server.awaitTermination();
    }

    static Handler sampleHandler() {
        return request -> {
            if (request.isError()) {
                return Response.of(500, "internal error\n").contentType("text/plain");
            }
            switch (request.path()) {
                case "/":
                    return Response.of(200, "ok").contentType("text/plain");
                case "/echo":
                    if (request.isContinueExpected()) {
                        request.sendContinue();
                    }
                    return Response.of(200, request.body())
                            .contentType(request.headers().getOrDefault("Content-Type", "application/octet-stream"));
                case "/chunks":
                    return chunks();
                default:
                    return Response.of(404, "not found\n").contentType("text/plain");
            }
        };
    }

    private static Response chunks() {
        BodyChannel body = new BodyChannel(4);
        CompletableFuture.runAsync(() -> {
            try {
                for (int i = 1; i <= 3; i++) {
                    if (!body.put(Unpooled.copiedBuffer("Chunk" + i + "\n", StandardCharsets.UTF_8))) {
                        return;
                    }
                    Thread.sleep(500);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                body.close();
            }
        });
        return Response.of(200, body).contentType("text/plain");
    }
}
