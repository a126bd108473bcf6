package org.streamhttp.body;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class BodyChannelTest {

    @Test
    void takesChunksInPushOrderThenEndOfStream() throws Exception {
        BodyChannel testee = new BodyChannel(10);
        testee.push(chunk("a"));
        testee.push(chunk("b"));
        testee.push(chunk("c"));
        testee.close();

        assertThat(takeAll(testee)).containsExactly("a", "b", "c");
        assertThat(testee.take()).isNull();
    }

    @Test
    void signalsBackpressureBeforeAnythingIsLost() throws Exception {
        List<Boolean> signals = new CopyOnWriteArrayList<>();
        BodyChannel testee = new BodyChannel(2, signals::add);

        assertThat(testee.push(chunk("1"))).isEqualTo(BodyChannel.PushResult.OK);
        assertThat(signals).isEmpty();
        testee.push(chunk("2"));
        assertThat(signals).containsExactly(true);

        // frames already decoded when reads were paused are still queued
        testee.push(chunk("3"));
        assertThat(testee.size()).isEqualTo(3);
        assertThat(signals).containsExactly(true);

        release(testee.take());
        assertThat(signals).containsExactly(true);
        release(testee.take());
        assertThat(signals).containsExactly(true, false);

        testee.close();
        assertThat(takeAll(testee)).containsExactly("3");
    }

    @Test
    void resumeFromAnotherThreadCannotOvertakeThePause() throws Exception {
        AtomicBoolean readable = new AtomicBoolean(true);
        BodyChannel[] testee = new BodyChannel[1];
        Thread[] consumer = new Thread[1];
        testee[0] = new BodyChannel(1, paused -> {
            if (paused && consumer[0] == null) {
                // a consumer races the pause while it is being applied
                consumer[0] = new Thread(() -> {
                    try {
                        release(testee[0].take());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
                consumer[0].start();
                try {
                    consumer[0].join(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            readable.set(!paused);
        });

        testee[0].push(chunk("1"));
        consumer[0].join(5_000);

        assertThat(consumer[0].isAlive()).isFalse();
        assertThat(testee[0].size()).isZero();
        assertThat(readable).isTrue();
    }

    @Test
    void concurrentProducerAndConsumerSeeAlternatingSignals() throws Exception {
        List<Boolean> signals = Collections.synchronizedList(new ArrayList<>());
        BodyChannel testee = new BodyChannel(4, signals::add);
        int total = 20_000;
        CompletableFuture<Integer> consumed = CompletableFuture.supplyAsync(() -> {
            int count = 0;
            try {
                ByteBuf chunk;
                while ((chunk = testee.take()) != null) {
                    chunk.release();
                    count++;
                }
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
            return count;
        });

        for (int i = 0; i < total; i++) {
            testee.push(Unpooled.buffer(1).writeByte(i));
        }
        testee.close();

        assertThat(consumed.get(10, TimeUnit.SECONDS)).isEqualTo(total);
        List<Boolean> seen;
        synchronized (signals) {
            seen = new ArrayList<>(signals);
        }
        for (int i = 0; i < seen.size(); i++) {
            assertThat(seen.get(i)).as("signal %d", i).isEqualTo(i % 2 == 0);
        }
        // drained, so the producer was last told to resume
        assertThat(seen.size() % 2).isZero();
    }

    @Test
    void closeIsIdempotentAndKeepsBufferedChunks() throws Exception {
        BodyChannel testee = new BodyChannel(4);
        testee.push(chunk("x"));
        testee.close();
        testee.close();

        assertThat(testee.isClosed()).isTrue();
        assertThat(takeAll(testee)).containsExactly("x");
        assertThat(testee.take()).isNull();
    }

    @Test
    void pushAfterCloseReleasesTheChunk() {
        BodyChannel testee = new BodyChannel(4);
        testee.close();
        ByteBuf late = chunk("late");

        assertThat(testee.push(late)).isEqualTo(BodyChannel.PushResult.CLOSED);
        assertThat(late.refCnt()).isZero();
    }

    @Test
    void closeWakesUpBlockedTaker() throws Exception {
        BodyChannel testee = new BodyChannel(4);
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<ByteBuf> taken = CompletableFuture.supplyAsync(() -> {
            started.countDown();
            try {
                return testee.take();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        started.await();
        Thread.sleep(50);
        testee.close();

        assertThat(taken.get(5, TimeUnit.SECONDS)).isNull();
    }

    @Test
    void abortReleasesBufferedChunks() throws Exception {
        BodyChannel testee = new BodyChannel(4);
        ByteBuf first = chunk("1");
        ByteBuf second = chunk("2");
        testee.push(first);
        testee.push(second);

        testee.abort();

        assertThat(first.refCnt()).isZero();
        assertThat(second.refCnt()).isZero();
        assertThat(testee.size()).isZero();
        assertThat(testee.take()).isNull();
    }

    @Test
    void putWaitsForRoom() throws Exception {
        BodyChannel testee = new BodyChannel(1);
        assertThat(testee.put(chunk("1"))).isTrue();

        CompletableFuture<Boolean> second = CompletableFuture.supplyAsync(() -> {
            try {
                return testee.put(chunk("2"));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        assertThat(second).isNotDone();

        release(testee.take());
        assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
        testee.close();
        assertThat(takeAll(testee)).containsExactly("2");
    }

    @Test
    void putOnClosedChannelReturnsFalse() throws Exception {
        BodyChannel testee = new BodyChannel(1);
        testee.close();
        ByteBuf chunk = chunk("x");

        assertThat(testee.put(chunk)).isFalse();
        assertThat(chunk.refCnt()).isZero();
    }

    @Test
    void takeWithTimeoutGivesUp() {
        BodyChannel testee = new BodyChannel(1);

        assertThatThrownBy(() -> testee.take(20, TimeUnit.MILLISECONDS))
                .isInstanceOf(TimeoutException.class);
    }

    @Test
    void ofCreatesClosedChannel() throws Exception {
        BodyChannel testee = BodyChannel.of(chunk("a"), chunk("b"));

        assertThat(testee.isClosed()).isTrue();
        assertThat(takeAll(testee)).containsExactly("a", "b");
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new BodyChannel(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static ByteBuf chunk(String text) {
        return Unpooled.copiedBuffer(text, StandardCharsets.UTF_8);
    }

    private static List<String> takeAll(BodyChannel channel) throws InterruptedException {
        List<String> result = new ArrayList<>();
        ByteBuf chunk;
        while ((chunk = channel.take()) != null) {
            result.add(chunk.toString(StandardCharsets.UTF_8));
            chunk.release();
        }
        return result;
    }

    private static void release(ByteBuf chunk) {
        if (chunk != null) {
            chunk.release();
        }
    }
}
