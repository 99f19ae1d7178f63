package dev.mars.syncore.scheduler;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.syncore.api.scheduler.AgentQuota;
import dev.mars.syncore.api.scheduler.ScheduledTask;
import dev.mars.syncore.api.scheduler.SchedulerStats;
import dev.mars.syncore.api.scheduler.TaskResult;
import dev.mars.syncore.config.SyncoreConfiguration;
import dev.mars.syncore.test.MutableClock;
import dev.mars.syncore.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ordering, aging and quota enforcement of the fairness scheduler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
@Tag(TestCategories.CORE)
class FairnessSchedulerTest {

    private MutableClock clock;
    private FairnessScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-10-19T09:00:00Z");
        scheduler = new FairnessScheduler(
            new SyncoreConfiguration.SchedulerConfig(Duration.ofMillis(1000), 1.0, true, true), clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("Tasks submitted with priorities [3,1,2] come out as [1,2,3]")
    void testFairnessOrdering() {
        assertTrue(scheduler.submit(ScheduledTask.of("t3", "agent", 3)));
        assertTrue(scheduler.submit(ScheduledTask.of("t1", "agent", 1)));
        assertTrue(scheduler.submit(ScheduledTask.of("t2", "agent", 2)));

        assertEquals(1, scheduler.next().orElseThrow().priority());
        assertEquals(2, scheduler.next().orElseThrow().priority());
        assertEquals(3, scheduler.next().orElseThrow().priority());
        assertTrue(scheduler.next().isEmpty());
    }

    @Test
    void testEqualPriorityIsFifo() {
        scheduler.submit(ScheduledTask.of("first", "a", 3));
        clock.advanceMillis(10);
        scheduler.submit(ScheduledTask.of("second", "b", 3));
        scheduler.submit(ScheduledTask.of("third", "c", 3));

        assertEquals("first", scheduler.next().orElseThrow().taskId());
        assertEquals("second", scheduler.next().orElseThrow().taskId());
        assertEquals("third", scheduler.next().orElseThrow().taskId());
    }

    @Test
    void testAgentWithFewerActiveTasksWinsTie() {
        scheduler.submit(ScheduledTask.of("busy-1", "busy", 1));
        scheduler.next();

        scheduler.submit(ScheduledTask.of("busy-2", "busy", 2));
        scheduler.submit(ScheduledTask.of("idle-1", "idle", 2));

        assertEquals("idle-1", scheduler.next().orElseThrow().taskId());
        assertEquals("busy-2", scheduler.next().orElseThrow().taskId());
    }

    @Test
    @DisplayName("maxConcurrent=1 rejects a second submission while the first is active")
    void testQuotaRejection() {
        scheduler.setAgentQuota(new AgentQuota("a", 1, 100, 1000));

        assertTrue(scheduler.submit(ScheduledTask.of("T1", "a", 3)));
        assertEquals("T1", scheduler.next().orElseThrow().taskId());

        assertFalse(scheduler.submit(ScheduledTask.of("T2", "a", 3)));
        assertEquals(1, scheduler.getStats().totalRejected());
        assertEquals(0, scheduler.getQueueLength());

        scheduler.complete(TaskResult.success("T1", "a", Duration.ofMillis(50)));
        assertTrue(scheduler.submit(ScheduledTask.of("T2", "a", 3)));
    }

    @Test
    void testActiveTasksNeverExceedMaxConcurrent() {
        scheduler.setAgentQuota(new AgentQuota("a", 2, 100, 1000));
        scheduler.submit(ScheduledTask.of("a1", "a", 2));
        scheduler.submit(ScheduledTask.of("a2", "a", 2));
        scheduler.submit(ScheduledTask.of("a3", "a", 2));
        scheduler.submit(ScheduledTask.of("b1", "b", 5));

        List<String> started = new ArrayList<>();
        Optional<ScheduledTask> next;
        while ((next = scheduler.next()).isPresent()) {
            started.add(next.get().taskId());
            assertTrue(scheduler.getActiveCount("a") <= 2);
        }

        assertEquals(List.of("a1", "a2", "b1"), started);
        assertEquals(1, scheduler.getQueueLength());

        scheduler.complete(TaskResult.success("a1", "a", null));
        assertEquals("a3", scheduler.next().orElseThrow().taskId());
    }

    @Test
    void testPerMinuteRateLimit() {
        scheduler.setAgentQuota(new AgentQuota("a", 10, 2, 1000));
        for (int i = 0; i < 2; i++) {
            assertTrue(scheduler.submit(ScheduledTask.of("t" + i, "a", 3)));
            scheduler.next();
            scheduler.complete(TaskResult.success("t" + i, "a", null));
        }

        assertFalse(scheduler.submit(ScheduledTask.of("t2", "a", 3)));

        clock.advance(Duration.ofSeconds(61));
        assertTrue(scheduler.submit(ScheduledTask.of("t2", "a", 3)));
    }

    @Test
    void testPerHourRateLimit() {
        scheduler.setAgentQuota(new AgentQuota("a", 10, 10, 3));
        for (int i = 0; i < 3; i++) {
            assertTrue(scheduler.submit(ScheduledTask.of("t" + i, "a", 3)));
            scheduler.next();
            scheduler.complete(TaskResult.success("t" + i, "a", null));
            clock.advance(Duration.ofMinutes(2));
        }

        assertFalse(scheduler.submit(ScheduledTask.of("t3", "a", 3)));

        clock.advance(Duration.ofMinutes(55));
        assertTrue(scheduler.submit(ScheduledTask.of("t3", "a", 3)));
    }

    @Test
    void testPendingSubmissionsDoNotCountTowardsRateLimit() {
        scheduler.setAgentQuota(new AgentQuota("a", 10, 1, 10));

        assertTrue(scheduler.submit(ScheduledTask.of("t1", "a", 3)));
        assertTrue(scheduler.submit(ScheduledTask.of("t2", "a", 3)));
        assertEquals(2, scheduler.getQueueLength());
    }

    @Test
    void testQuotasIgnoredWhenDisabled() {
        FairnessScheduler unlimited = new FairnessScheduler(
            new SyncoreConfiguration.SchedulerConfig(Duration.ofSeconds(10), 1.0, false, true), clock);
        unlimited.setAgentQuota(new AgentQuota("a", 0, 0, 0));

        assertTrue(unlimited.submit(ScheduledTask.of("t1", "a", 3)));
        assertTrue(unlimited.next().isPresent());
        unlimited.shutdown();
    }

    @Test
    @DisplayName("Priority 5 reaches 1 after 4000ms with factor 1 and interval 1000ms")
    void testAgingPromotion() {
        scheduler.submit(ScheduledTask.of("old", "a", 5));

        clock.advanceMillis(4000);
        scheduler.ageQueue();

        assertEquals(1.0, scheduler.getQueueSnapshot().get(0).effectivePriority());
    }

    @Test
    void testAgingOverFourTicks() {
        scheduler.submit(ScheduledTask.of("old", "a", 5));

        double[] expected = {4.0, 3.0, 2.0, 1.0, 1.0};
        for (double value : expected) {
            clock.advanceMillis(1000);
            scheduler.ageQueue();
            assertEquals(value, scheduler.getQueueSnapshot().get(0).effectivePriority());
        }
    }

    @Test
    void testRepeatedAgingIsIdempotent() {
        scheduler.submit(ScheduledTask.of("t", "a", 5));
        clock.advanceMillis(2500);

        scheduler.ageQueue();
        scheduler.ageQueue();
        scheduler.ageQueue();

        assertEquals(3.0, scheduler.getQueueSnapshot().get(0).effectivePriority());
    }

    @Test
    @DisplayName("A low priority task is not starved by a stream of newer higher priority work")
    void testNoStarvation() {
        scheduler.submit(ScheduledTask.of("low", "a", 5));

        for (int tick = 0; tick < 10; tick++) {
            clock.advanceMillis(1000);
            scheduler.submit(ScheduledTask.of("high-" + tick, "b", 2));
            scheduler.ageQueue();

            ScheduledTask next = scheduler.next().orElseThrow();
            scheduler.complete(TaskResult.success(next.taskId(), next.agentId(), null));
            if (next.taskId().equals("low")) {
                return;
            }
        }
        fail("Low priority task was never scheduled");
    }

    @Test
    void testDuplicateTaskIdRejected() {
        assertTrue(scheduler.submit(ScheduledTask.of("t1", "a", 3)));
        assertFalse(scheduler.submit(ScheduledTask.of("t1", "b", 1)));
        scheduler.next();
        assertFalse(scheduler.submit(ScheduledTask.of("t1", "a", 3)));
    }

    @Test
    void testCompleteUnknownTaskReturnsFalse() {
        assertFalse(scheduler.complete(TaskResult.success("ghost", "a", null)));
    }

    @Test
    void testFailedTaskIsNotRequeued() {
        scheduler.submit(ScheduledTask.of("t1", "a", 3));
        scheduler.next();

        assertTrue(scheduler.complete(TaskResult.failure("t1", "a", "boom")));

        assertEquals(0, scheduler.getQueueLength());
        assertEquals(0, scheduler.getActiveCount());
        assertEquals(1, scheduler.getStats().totalFailed());
    }

    @Test
    void testClearQueueDropsPendingOnly() {
        scheduler.submit(ScheduledTask.of("t1", "a", 3));
        scheduler.submit(ScheduledTask.of("t2", "a", 3));
        scheduler.submit(ScheduledTask.of("t3", "a", 3));
        scheduler.next();

        assertEquals(2, scheduler.clearQueue());
        assertEquals(0, scheduler.getQueueLength());
        assertEquals(1, scheduler.getActiveCount());
        assertEquals(0, scheduler.getStats().totalCompleted());
    }

    @Test
    void testCancelPendingTask() {
        scheduler.submit(ScheduledTask.of("t1", "a", 3));

        assertTrue(scheduler.cancel("t1"));
        assertFalse(scheduler.cancel("t1"));
        assertTrue(scheduler.next().isEmpty());
    }

    @Test
    void testStatistics() {
        scheduler.setAgentQuota(new AgentQuota("a", 1, 10, 10));
        scheduler.submit(ScheduledTask.of("t1", "a", 3));
        clock.advanceMillis(200);
        scheduler.next();
        scheduler.submit(ScheduledTask.of("t2", "a", 3));
        scheduler.complete(TaskResult.success("t1", "a", Duration.ofMillis(300)));
        scheduler.submit(ScheduledTask.of("t3", "b", 3));

        SchedulerStats stats = scheduler.getStats();
        assertEquals(2, stats.totalSubmitted());
        assertEquals(1, stats.totalRejected());
        assertEquals(1, stats.totalCompleted());
        assertEquals(200.0, stats.avgWaitTimeMs());
        assertEquals(300.0, stats.avgDurationMs());
        assertEquals(1, stats.queueLength());
        assertEquals(0, stats.activeTasksCount());
        assertEquals(1, stats.agentBreakdown().get("a").rejected());
        assertEquals(1, stats.agentBreakdown().get("b").submitted());
    }

    @Test
    void testSubmitAfterShutdownIsRejected() {
        scheduler.start();
        scheduler.shutdown();
        scheduler.shutdown();

        assertTrue(scheduler.isShutdown());
        assertFalse(scheduler.submit(ScheduledTask.of("late", "a", 3)));
    }

    @Test
    void testRateLimitHistoryIsCompacted() {
        scheduler.setAgentQuota(new AgentQuota("a", 10, 100, 1000));
        for (int i = 0; i < 5; i++) {
            scheduler.submit(ScheduledTask.of("t" + i, "a", 3));
            scheduler.next();
        }
        assertEquals(5, scheduler.retainedStartCount());

        clock.advance(Duration.ofMinutes(61));
        scheduler.ageQueue();

        assertEquals(0, scheduler.retainedStartCount());
    }

    @Test
    void testConcurrentSubmissionsRespectQuota() throws Exception {
        FairnessScheduler concurrent = new FairnessScheduler(
            new SyncoreConfiguration.SchedulerConfig(Duration.ofSeconds(10), 1.0, true, true));
        concurrent.setAgentQuota(new AgentQuota("a", 1, 100, 1000));
        concurrent.submit(ScheduledTask.of("seed", "a", 3));
        concurrent.next();

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        for (int i = 0; i < 50; i++) {
            String id = "t" + i;
            executor.submit(() -> {
                start.await();
                if (concurrent.submit(ScheduledTask.of(id, "a", 3))) {
                    accepted.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(0, accepted.get());
        assertEquals(50, concurrent.getStats().totalRejected());
        concurrent.shutdown();
    }
}
