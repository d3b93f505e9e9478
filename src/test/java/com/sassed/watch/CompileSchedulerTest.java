package com.sassed.watch;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class CompileSchedulerTest {

    private static final Path A = Path.of("a.scss");
    private static final Path B = Path.of("b.scss");
    private static final Path C = Path.of("c.scss");

    @Test
    public void testBurstCoalescesIntoOneExtraCompile() throws InterruptedException {
        List<Set<Path>> batches = new CopyOnWriteArrayList<>();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(2);

        try (CompileScheduler scheduler = new CompileScheduler(batch -> {
            batches.add(Set.copyOf(batch));
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        }, Duration.ofSeconds(5))) {
            scheduler.submit(A);
            assertTrue(started.await(10, TimeUnit.SECONDS));
            scheduler.submit(B);
            scheduler.submit(C);
            scheduler.submit(B);
            release.countDown();
            assertTrue(done.await(10, TimeUnit.SECONDS));
        }

        assertEquals(2, batches.size());
        assertEquals(Set.of(A), batches.get(0));
        assertEquals(Set.of(B, C), batches.get(1));
    }

    @Test
    public void testFailingBatchDoesNotStopLaterOnes() throws InterruptedException {
        CountDownLatch second = new CountDownLatch(1);
        try (CompileScheduler scheduler = new CompileScheduler(batch -> {
            if (batch.contains(A)) {
                throw new IllegalStateException("boom");
            }
            second.countDown();
        }, Duration.ofSeconds(5))) {
            scheduler.submit(A);
            scheduler.submit(B);
            assertTrue(second.await(10, TimeUnit.SECONDS));
        }
    }

    @Test
    public void testSubmitAfterCloseIsDropped() {
        List<Set<Path>> batches = new CopyOnWriteArrayList<>();
        CompileScheduler scheduler = new CompileScheduler(batches::add, Duration.ofSeconds(5));
        scheduler.close();

        assertDoesNotThrow(() -> scheduler.submit(A));
        assertTrue(batches.isEmpty());
    }
}
