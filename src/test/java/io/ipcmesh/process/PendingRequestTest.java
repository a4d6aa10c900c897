package io.ipcmesh.process;

import com.fasterxml.jackson.databind.node.TextNode;
import io.ipcmesh.error.RequestTimeoutException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class PendingRequestTest {

    @Test
    void firstSettlementWins() throws Exception {
        PendingRequest pending = new PendingRequest("id-1", "echo");

        assertTrue(pending.resolve(TextNode.valueOf("ok")));
        assertFalse(pending.reject(new RequestTimeoutException("echo", Duration.ofMillis(10))));
        assertFalse(pending.resolve(TextNode.valueOf("again")));

        assertEquals(PendingRequest.State.RESOLVED, pending.state());
        assertEquals("ok", pending.future().get().asText());
    }

    @Test
    void settlingCancelsTheTimer() {
        PendingRequest pending = new PendingRequest("id-2", "echo");
        CompletableFuture<Void> timer = new CompletableFuture<>();
        pending.attachTimer(timer);

        pending.reject(new IllegalStateException("stopped"));

        assertTrue(timer.isCancelled());
        assertEquals(PendingRequest.State.REJECTED, pending.state());
    }

    @Test
    void timerAttachedAfterSettlementIsCancelledImmediately() {
        PendingRequest pending = new PendingRequest("id-3", "echo");
        pending.resolve(TextNode.valueOf("fast"));
        CompletableFuture<Void> timer = new CompletableFuture<>();

        pending.attachTimer(timer);

        assertTrue(timer.isCancelled());
    }

    @Test
    void racingSettlersProduceExactlyOneWinner() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int round = 0; round < 200; round++) {
                PendingRequest pending = new PendingRequest("id-" + round, "echo");
                CountDownLatch go = new CountDownLatch(1);
                AtomicInteger winners = new AtomicInteger();
                Future<?>[] settlers = new Future<?>[4];
                for (int i = 0; i < settlers.length; i++) {
                    boolean resolve = i % 2 == 0;
                    settlers[i] = pool.submit(() -> {
                        go.await();
                        boolean won = resolve
                                ? pending.resolve(TextNode.valueOf("r"))
                                : pending.reject(new IllegalStateException("x"));
                        if (won) {
                            winners.incrementAndGet();
                        }
                        return null;
                    });
                }
                go.countDown();
                for (Future<?> settler : settlers) {
                    settler.get(2, TimeUnit.SECONDS);
                }
                assertEquals(1, winners.get());
                assertTrue(pending.future().isDone());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
