package org.streamhttp.handler;

import org.streamhttp.HandlerException;
import org.streamhttp.Request;
import org.streamhttp.Response;
import org.streamhttp.connection.ResponseWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@link Handler} on the worker pool and forwards what it produces to
 * the {@link ResponseWriter} of the request.
 */
public class HandlerInvoker {

    private static final Logger log = LoggerFactory.getLogger(HandlerInvoker.class);

    private final Handler handler;
    private final Executor executor;
    private final long responseTimeoutMillis;

    public HandlerInvoker(Handler handler, Executor executor) {
        this(handler, executor, 0L);
    }

    /**
     * @param responseTimeoutMillis how long an asynchronous response may take, 0 for no limit
     */
    public HandlerInvoker(Handler handler, Executor executor, long responseTimeoutMillis) {
        this.handler = handler;
        this.executor = executor;
        this.responseTimeoutMillis = responseTimeoutMillis;
    }

    public void invoke(Request request, ResponseWriter writer) {
        try {
            executor.execute(() -> run(request, writer));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected {}, closing connection", request, e);
            writer.abort(e);
        }
    }

    private void run(Request request, ResponseWriter writer) {
        Object result;
        try {
            result = handler.handle(request);
        } catch (Throwable e) {
            fail(request, writer, new HandlerException("handler failed on " + request, e));
            return;
        }
        deliver(request, writer, result);
    }

    private void deliver(Request request, ResponseWriter writer, Object result) {
        if (result instanceof Response) {
            write(request, writer, (Response) result);
        } else if (result instanceof CompletionStage) {
            bounded((CompletionStage<?>) result).whenCompleteAsync((value, error) -> {
                if (error != null) {
                    fail(request, writer, new HandlerException("asynchronous response failed for " + request, unwrap(error)));
                } else if (value instanceof Response) {
                    write(request, writer, (Response) value);
                } else {
                    fail(request, writer, new HandlerException("unhandled response type: " + typeOf(value)));
                }
            }, executor);
        } else {
            fail(request, writer, new HandlerException("unhandled response type: " + typeOf(result)));
        }
    }

    // a Response handed out twice is rejected by the writer before anything goes out
    private void write(Request request, ResponseWriter writer, Response response) {
        try {
            writer.write(response);
        } catch (RuntimeException e) {
            fail(request, writer, new HandlerException("cannot write response for " + request, e));
        }
    }

    private CompletableFuture<Object> bounded(CompletionStage<?> stage) {
        CompletableFuture<Object> future = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error != null) {
                future.completeExceptionally(error);
            } else if (!future.complete(value) && value instanceof Response) {
                // came in after the timeout
                ((Response) value).discard();
            }
        });
        if (responseTimeoutMillis > 0) {
            future.orTimeout(responseTimeoutMillis, TimeUnit.MILLISECONDS);
        }
        return future;
    }

    /**
     * Reports the failure to the handler as an error request. Whatever happens,
     * the connection is closed afterwards.
     */
    private void fail(Request request, ResponseWriter writer, HandlerException error) {
        log.error("Handler error on {}", request, error);
        try {
            Object result = handler.handle(Request.error(error, request));
            if (result instanceof Response) {
                // the writer only takes it while nothing went out yet
                writer.writeAndClose((Response) result);
                return;
            }
        } catch (Throwable e) {
            log.error("Handler also failed on the error request for {}", request, e);
        }
        writer.abort(error);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
