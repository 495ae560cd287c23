package io.trello.client.association;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AssociationSlotTest {

    @Test
    public void testResolvesOnce() {
        AssociationSlot<String> slot = new AssociationSlot<>();
        AtomicInteger calls = new AtomicInteger();
        assertEquals(AssociationSlot.State.UNRESOLVED, slot.state());

        assertEquals("value", slot.get(() -> {
            calls.incrementAndGet();
            return "value";
        }));
        assertEquals("value", slot.get(() -> {
            calls.incrementAndGet();
            return "other";
        }));

        assertEquals(1, calls.get());
        assertEquals(AssociationSlot.State.RESOLVED, slot.state());
    }

    @Test
    public void testFailureIsRethrownUntilReset() {
        AssociationSlot<String> slot = new AssociationSlot<>();
        IllegalStateException failure = new IllegalStateException("boom");
        AtomicInteger calls = new AtomicInteger();

        assertSame(failure, assertThrows(IllegalStateException.class, () -> slot.get(() -> {
            calls.incrementAndGet();
            throw failure;
        })));
        assertEquals(AssociationSlot.State.FAILED, slot.state());
        assertSame(failure, assertThrows(IllegalStateException.class, () -> slot.get(() -> "value")));
        assertEquals(1, calls.get());

        slot.reset();

        assertEquals(AssociationSlot.State.UNRESOLVED, slot.state());
        assertEquals("value", slot.get(() -> "value"));
    }

    @Test
    public void testResetForcesResolution() {
        AssociationSlot<Integer> slot = new AssociationSlot<>();
        AtomicInteger calls = new AtomicInteger();

        slot.get(calls::incrementAndGet);
        slot.reset();

        assertEquals(2, slot.get(calls::incrementAndGet));
    }

    @Test
    public void testReentrantResolutionFails() {
        AssociationSlot<String> slot = new AssociationSlot<>();

        assertThrows(IllegalStateException.class, () -> slot.get(() -> slot.get(() -> "inner")));
        assertEquals(AssociationSlot.State.FAILED, slot.state());
    }

    @Test
    public void testConcurrentFirstAccessResolvesOnce() throws Exception {
        AssociationSlot<String> slot = new AssociationSlot<>();
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = executor.submit(() -> {
                    start.await();
                    return slot.get(() -> {
                        calls.incrementAndGet();
                        return "value";
                    });
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                assertEquals("value", future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, calls.get());
    }
}
