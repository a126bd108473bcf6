package org.streamhttp;

import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.streamhttp.body.BodyChannel;
import org.streamhttp.handler.ContinueNegotiator;

import java.net.SocketAddress;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * An HTTP request as handed to a {@link org.streamhttp.handler.Handler}.
 *
 * <p>The body, when present, is still arriving while the handler runs. Chunks
 * taken from it belong to the handler, which has to release them.
 *
 * <p>When a handler fails it is called once more with an error request
 * ({@link #isError()}), method {@value #ERROR_METHOD}, carrying the failure.
 */
public class Request {

    public static final String ERROR_METHOD = "error";

    private final String method;
    private final String uri;
    private final String path;
    private final HttpVersion version;
    private final Map<String, String> headers;
    private final Map<String, List<String>> queryParams;
    private final SocketAddress remoteAddress;
    private final BodyChannel body;
    private final ContinueNegotiator continueNegotiator;
    private final Throwable error;
    private final Request failedRequest;

    private Request(String method, String uri, HttpVersion version, Map<String, String> headers,
                    SocketAddress remoteAddress, BodyChannel body, ContinueNegotiator continueNegotiator,
                    Throwable error, Request failedRequest) {
        this.method = method;
        this.uri = uri;
        this.version = version;
        this.headers = headers;
        this.remoteAddress = remoteAddress;
        this.body = body;
        this.continueNegotiator = continueNegotiator;
        this.error = error;
        this.failedRequest = failedRequest;

        QueryStringDecoder decoder = new QueryStringDecoder(uri == null ? "" : uri);
        this.path = decoder.path();
        Map<String, List<String>> params = new LinkedHashMap<>();
        decoder.parameters().forEach((name, values) -> params.put(name, Collections.unmodifiableList(values)));
        this.queryParams = Collections.unmodifiableMap(params);
    }

    /**
     * Builds a request out of a decoded request head.
     */
    public static Request fromHead(HttpRequest head, BodyChannel body,
                                   ContinueNegotiator continueNegotiator, SocketAddress remoteAddress) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String name : head.headers().names()) {
            headers.put(name, String.join(",", head.headers().getAll(name)));
        }
        return new Request(head.method().name(), head.uri(), head.protocolVersion(),
                Collections.unmodifiableMap(headers), remoteAddress, body, continueNegotiator, null, null);
    }

    /**
     * The pseudo-request used to report a handler failure back to the handler.
     *
     * @param error what went wrong
     * @param failedRequest the request being handled, may be null
     */
    public static Request error(Throwable error, Request failedRequest) {
        HttpVersion version = failedRequest == null ? HttpVersion.HTTP_1_1 : failedRequest.version;
        String uri = failedRequest == null ? "" : failedRequest.uri;
        SocketAddress remote = failedRequest == null ? null : failedRequest.remoteAddress;
        return new Request(ERROR_METHOD, uri, version, Collections.emptyMap(), remote,
                null, null, error, failedRequest);
    }

    public String method() {
        return method;
    }

    public String uri() {
        return uri;
    }

    /**
     * Decoded path of the target, without the query string.
     */
    public String path() {
        return path;
    }

    public HttpVersion version() {
        return version;
    }

    /**
     * Request headers, keyed case-insensitively. Repeated headers are joined with a comma.
     */
    public Map<String, String> headers() {
        return headers;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public Map<String, List<String>> queryParams() {
        return queryParams;
    }

    public String queryParam(String name) {
        List<String> values = queryParams.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public SocketAddress remoteAddress() {
        return remoteAddress;
    }

    /**
     * The body stream, or null for error requests.
     */
    public BodyChannel body() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    public boolean isContinueExpected() {
        return continueNegotiator != null && continueNegotiator.isExpected();
    }

    /**
     * Tells the client to go on sending the body ({@code 100 Continue}). Only
     * the first call before any body content arrived has an effect.
     */
    public void sendContinue() {
        if (continueNegotiator != null) {
            continueNegotiator.sendContinue();
        }
    }

    public boolean isError() {
        return error != null;
    }

    public Throwable error() {
        return error;
    }

    /**
     * For error requests, the request whose handling failed.
     */
    public Request failedRequest() {
        return failedRequest;
    }

    @Override
    public String toString() {
        return method + " " + uri + " " + version;
    }
}
