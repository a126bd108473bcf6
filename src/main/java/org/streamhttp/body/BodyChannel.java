package org.streamhttp.body;

import io.netty.buffer.ByteBuf;
import io.netty.util.ReferenceCountUtil;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, closable queue of body chunks between a producer and a consumer
 * running on different threads.
 *
 * <p>The network side feeds it with {@link #push(ByteBuf)}, which never blocks
 * and never drops a chunk: when the queue reaches its capacity the
 * {@link BackpressureListener} is told to pause the producer, and told to
 * resume once {@link #take()} brought the size back under the capacity.
 * Signals are delivered under the channel's lock, so the listener sees them
 * alternate and the last one always matches the channel's state.
 * Application threads producing a response body use {@link #put(ByteBuf)},
 * which waits for room instead.
 *
 * <p>Consumers own the chunks they take and must release them.
 */
public class BodyChannel {

    public static final int DEFAULT_CAPACITY = 100;

    public enum PushResult {
        OK,
        CLOSED
    }

    private final int capacity;
    private final Deque<ByteBuf> chunks = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private volatile BackpressureListener listener;
    private boolean closed;
    private boolean paused;

    public BodyChannel() {
        this(DEFAULT_CAPACITY);
    }

    public BodyChannel(int capacity) {
        this(capacity, BackpressureListener.NONE);
    }

    public BodyChannel(int capacity, BackpressureListener listener) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.listener = listener == null ? BackpressureListener.NONE : listener;
    }

    /**
     * Creates a channel holding the given chunks, already closed.
     */
    public static BodyChannel of(ByteBuf... content) {
        BodyChannel channel = new BodyChannel(Math.max(1, content.length));
        for (ByteBuf chunk : content) {
            channel.push(chunk);
        }
        channel.close();
        return channel;
    }

    public void setBackpressureListener(BackpressureListener listener) {
        this.listener = listener == null ? BackpressureListener.NONE : listener;
    }

    /**
     * Queues a chunk without blocking. A closed channel releases the chunk and
     * reports {@link PushResult#CLOSED}.
     */
    public PushResult push(ByteBuf chunk) {
        lock.lock();
        try {
            if (closed) {
                ReferenceCountUtil.release(chunk);
                return PushResult.CLOSED;
            }
            chunks.addLast(chunk);
            notEmpty.signal();
            if (!paused && chunks.size() >= capacity) {
                paused = true;
                listener.onBackpressure(true);
            }
        } finally {
            lock.unlock();
        }
        return PushResult.OK;
    }

    /**
     * Queues a chunk, waiting while the channel is full.
     *
     * @return false if the channel was closed, in which case the chunk is released
     * @throws InterruptedException if interrupted while waiting, the chunk is released as well
     */
    public boolean put(ByteBuf chunk) throws InterruptedException {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            ReferenceCountUtil.release(chunk);
            throw e;
        }
        try {
            while (!closed && chunks.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                ReferenceCountUtil.release(chunk);
                return false;
            }
            chunks.addLast(chunk);
            notEmpty.signal();
            return true;
        } catch (InterruptedException e) {
            ReferenceCountUtil.release(chunk);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next chunk, waiting until one is available.
     *
     * @return the next chunk, or null once the channel is closed and drained
     */
    public ByteBuf take() throws InterruptedException {
        ByteBuf chunk;
        lock.lockInterruptibly();
        try {
            while (chunks.isEmpty() && !closed) {
                notEmpty.await();
            }
            chunk = chunks.pollFirst();
            afterRemoval(chunk);
        } finally {
            lock.unlock();
        }
        return chunk;
    }

    /**
     * Same as {@link #take()} but gives up after the timeout.
     */
    public ByteBuf take(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        long nanos = unit.toNanos(timeout);
        ByteBuf chunk;
        lock.lockInterruptibly();
        try {
            while (chunks.isEmpty() && !closed) {
                if (nanos <= 0L) {
                    throw new TimeoutException("no body chunk within " + timeout + " " + unit);
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            chunk = chunks.pollFirst();
            afterRemoval(chunk);
        } finally {
            lock.unlock();
        }
        return chunk;
    }

    // lock held, so signals reach the listener in the order the state changed
    private void afterRemoval(ByteBuf chunk) {
        if (chunk == null) {
            return;
        }
        notFull.signal();
        if (paused && chunks.size() < capacity) {
            paused = false;
            listener.onBackpressure(false);
        }
    }

    /**
     * Marks the end of the body. Buffered chunks stay available, blocked
     * takers get end-of-stream once they are drained. Closing twice is a no-op.
     */
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel and releases whatever was not consumed yet. Used when
     * the connection goes away and nobody is going to read the rest.
     */
    public void abort() {
        lock.lock();
        try {
            closed = true;
            ByteBuf chunk;
            while ((chunk = chunks.pollFirst()) != null) {
                ReferenceCountUtil.release(chunk);
            }
            paused = false;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return chunks.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
