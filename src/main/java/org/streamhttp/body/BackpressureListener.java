package org.streamhttp.body;

@FunctionalInterface
public interface BackpressureListener {

    BackpressureListener NONE = paused -> { };

    /**
     * Called with {@code true} when the channel reached its capacity and the
     * producer should stop, and with {@code false} once a consumer made room.
     * May run on the producer's thread or on a consumer's thread, always while
     * the channel's lock is held: implementations must not block nor wait for
     * another thread that uses the same channel.
     */
    void onBackpressure(boolean paused);
}
