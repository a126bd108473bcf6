package org.streamhttp.handler;

import org.streamhttp.Request;
import org.streamhttp.Response;

import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Application code answering requests.
 *
 * <p>{@link #handle(Request)} runs on the worker pool, so it may block, for
 * instance while taking chunks from the request body. It returns either a
 * {@link Response} or a {@link CompletionStage} that later yields exactly one
 * {@link Response}. Any other value is a handler error.
 *
 * <p>After a failure the handler is called once more with an error request
 * ({@link Request#isError()}); a {@link Response} returned from that call is
 * written if nothing was written yet.
 */
@FunctionalInterface
public interface Handler {

    Object handle(Request request) throws Exception;

    static Handler of(Function<Request, Response> function) {
        return function::apply;
    }

    static Handler async(Function<Request, ? extends CompletionStage<Response>> function) {
        return function::apply;
    }
}
