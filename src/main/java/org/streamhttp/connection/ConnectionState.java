package org.streamhttp.connection;

import org.streamhttp.Request;
import org.streamhttp.body.BodyChannel;
import org.streamhttp.handler.ContinueNegotiator;

/**
 * What one connection is doing right now. Only touched from the connection's
 * event loop.
 */
public class ConnectionState {

    public enum Phase {
        IDLE,
        REQUEST_BUILDING,
        AWAITING_RESPONSE,
        WRITING,
        CLOSED
    }

    private Phase phase = Phase.IDLE;
    private Request request;
    private BodyChannel body;
    private ResponseWriter writer;
    private ContinueNegotiator continueNegotiator;
    private boolean bodyComplete;

    void begin(Request request, BodyChannel body, ResponseWriter writer, ContinueNegotiator continueNegotiator) {
        this.request = request;
        this.body = body;
        this.writer = writer;
        this.continueNegotiator = continueNegotiator;
        this.bodyComplete = false;
        this.phase = Phase.REQUEST_BUILDING;
    }

    void bodyCompleted() {
        bodyComplete = true;
        if (phase == Phase.REQUEST_BUILDING) {
            phase = Phase.AWAITING_RESPONSE;
        }
    }

    void responseStarted() {
        if (phase != Phase.CLOSED && phase != Phase.IDLE) {
            phase = Phase.WRITING;
        }
    }

    void reset() {
        request = null;
        body = null;
        writer = null;
        continueNegotiator = null;
        bodyComplete = false;
        phase = Phase.IDLE;
    }

    void closed() {
        phase = Phase.CLOSED;
    }

    boolean isBodyOpen() {
        return body != null && !bodyComplete;
    }

    public Phase phase() {
        return phase;
    }

    public Request request() {
        return request;
    }

    public BodyChannel body() {
        return body;
    }

    public ResponseWriter writer() {
        return writer;
    }

    public ContinueNegotiator continueNegotiator() {
        return continueNegotiator;
    }

    public boolean isBodyComplete() {
        return bodyComplete;
    }
}
