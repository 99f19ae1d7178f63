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
import dev.mars.syncore.api.scheduler.AgentStats;
import dev.mars.syncore.api.scheduler.ScheduledTask;
import dev.mars.syncore.api.scheduler.SchedulerStats;
import dev.mars.syncore.api.scheduler.TaskResult;
import dev.mars.syncore.config.SyncoreConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority queue with priority aging and per-agent quotas.
 *
 * <p><strong>Admission.</strong> {@link #submit(ScheduledTask)} rejects a task when its agent has
 * a quota and already has {@code maxConcurrent} running tasks, or has started {@code maxPerMinute}
 * tasks in the trailing minute or {@code maxPerHour} in the trailing hour. Rate limits count only
 * started tasks. Quota check and insert happen under one lock.</p>
 *
 * <p><strong>Aging.</strong> Each aging pass sets a pending task's effective priority to
 * {@code max(1, base - floor(wait / agingInterval) * agingFactor)}. The value is derived from
 * the base priority, so repeated passes never over-promote, and a task reaches priority 1 after
 * at most {@code (base - 1) / agingFactor} intervals.</p>
 *
 * <p><strong>Ordering.</strong> Effective priority ascending, then (with fairness enabled) the
 * agent's running task count ascending, then submission time, then submission order.</p>
 *
 * <p>{@link #next()} skips tasks whose agent is at its concurrency limit so the running count of
 * an agent never exceeds {@code maxConcurrent}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class FairnessScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FairnessScheduler.class);

    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration HOUR = Duration.ofHours(1);

    private final SyncoreConfiguration.SchedulerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private final List<PendingEntry> queue = new ArrayList<>();
    private final Map<String, RunningEntry> activeTasks = new LinkedHashMap<>();
    private final Map<String, AgentQuota> quotas = new HashMap<>();
    private final Map<String, Deque<Instant>> startHistory = new HashMap<>();
    private final Map<String, AgentCounters> agentCounters = new HashMap<>();
    private long sequence;
    private long totalSubmitted;
    private long totalRejected;
    private long totalCompleted;
    private long totalFailed;
    private long totalStarted;
    private long totalWaitMillis;
    private long totalDurationMillis;
    private boolean shutdown;

    private ScheduledExecutorService agingExecutor;
    private ScheduledFuture<?> agingTask;

    public FairnessScheduler(SyncoreConfiguration.SchedulerConfig config) {
        this(config, Clock.systemUTC());
    }

    public FairnessScheduler(SyncoreConfiguration.SchedulerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        logger.info("Fairness scheduler created: agingInterval={}, agingFactor={}, quotas={}, fairness={}",
            config.getAgingInterval(), config.getAgingFactor(), config.isQuotaEnabled(), config.isFairnessEnabled());
    }

    /**
     * Starts the background aging timer. Calling it again while running has no effect.
     */
    public void start() {
        lock.lock();
        try {
            if (shutdown) {
                throw new IllegalStateException("Scheduler has been shut down");
            }
            if (agingTask != null) {
                logger.warn("Fairness scheduler aging is already running");
                return;
            }
            agingExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "syncore-scheduler-aging");
                t.setDaemon(true);
                return t;
            });
            long intervalMs = config.getAgingInterval().toMillis();
            agingTask = agingExecutor.scheduleAtFixedRate(this::agingTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            logger.info("Fairness scheduler aging started with interval: {}", config.getAgingInterval());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Admits a task.
     *
     * @return false if the task was rejected by a quota, is a duplicate, or the scheduler is shut down
     */
    public boolean submit(ScheduledTask task) {
        lock.lock();
        try {
            if (shutdown) {
                logger.warn("Rejecting task {} - scheduler is shut down", task.taskId());
                return false;
            }
            if (activeTasks.containsKey(task.taskId()) || findPending(task.taskId()) != null) {
                logger.warn("Rejecting duplicate task {} for agent {}", task.taskId(), task.agentId());
                return false;
            }

            Instant now = clock.instant();
            String violation = quotaViolation(task.agentId(), now);
            if (violation != null) {
                totalRejected++;
                counters(task.agentId()).rejected++;
                logger.warn("Quota exceeded for agent {} - task {} rejected: {}", task.agentId(), task.taskId(), violation);
                return false;
            }

            ScheduledTask stamped = task.submittedAt() == null ? task.withSubmittedAt(now) : task;
            queue.add(new PendingEntry(stamped, sequence++));
            totalSubmitted++;
            counters(task.agentId()).submitted++;
            sortQueue();

            logger.debug("Task {} submitted for agent {} with priority {} (queue length {})",
                task.taskId(), task.agentId(), task.priority(), queue.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the highest ordered task whose agent is below its concurrency limit and marks it running.
     */
    public Optional<ScheduledTask> next() {
        lock.lock();
        try {
            Instant now = clock.instant();
            Iterator<PendingEntry> it = queue.iterator();
            while (it.hasNext()) {
                PendingEntry entry = it.next();
                String agentId = entry.task.agentId();
                if (atConcurrencyLimit(agentId)) {
                    continue;
                }
                it.remove();

                activeTasks.put(entry.task.taskId(), new RunningEntry(entry.task, now));
                startHistory.computeIfAbsent(agentId, k -> new ArrayDeque<>()).addLast(now);

                long waitMillis = Math.max(0L, Duration.between(entry.task.submittedAt(), now).toMillis());
                totalWaitMillis += waitMillis;
                totalStarted++;
                AgentCounters counters = counters(agentId);
                counters.started++;
                counters.waitMillis += waitMillis;

                logger.debug("Task {} for agent {} started after {}ms (effective priority {})",
                    entry.task.taskId(), agentId, waitMillis, entry.effectivePriority);
                return Optional.of(entry.task);
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records completion of a running task. Does not re-queue failed tasks.
     *
     * @return false if the task was not running
     */
    public boolean complete(TaskResult result) {
        lock.lock();
        try {
            RunningEntry running = activeTasks.remove(result.taskId());
            if (running == null) {
                logger.debug("Ignoring completion for task {} - not active", result.taskId());
                return false;
            }
            Duration duration = result.duration() != null
                ? result.duration()
                : Duration.between(running.startedAt, clock.instant());
            totalDurationMillis += Math.max(0L, duration.toMillis());

            AgentCounters counters = counters(running.task.agentId());
            if (result.success()) {
                totalCompleted++;
                counters.completed++;
            } else {
                totalFailed++;
                counters.failed++;
                logger.debug("Task {} for agent {} failed: {}", result.taskId(), running.task.agentId(), result.error());
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a pending task without running it.
     *
     * @return true if the task was pending
     */
    public boolean cancel(String taskId) {
        lock.lock();
        try {
            PendingEntry entry = findPending(taskId);
            if (entry == null) {
                return false;
            }
            queue.remove(entry);
            logger.debug("Cancelled pending task {}", taskId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one aging pass now, then re-sorts the queue and compacts expired rate-limit entries.
     *
     * @return the number of tasks whose effective priority changed
     */
    public int ageQueue() {
        lock.lock();
        try {
            Instant now = clock.instant();
            long intervalMs = Math.max(1L, config.getAgingInterval().toMillis());
            int promoted = 0;
            for (PendingEntry entry : queue) {
                int base = entry.task.priority();
                if (base <= ScheduledTask.HIGHEST_PRIORITY) {
                    continue;
                }
                long waitMs = Math.max(0L, Duration.between(entry.task.submittedAt(), now).toMillis());
                long increments = waitMs / intervalMs;
                double aged = Math.max(ScheduledTask.HIGHEST_PRIORITY, base - increments * config.getAgingFactor());
                if (aged != entry.effectivePriority) {
                    entry.effectivePriority = aged;
                    promoted++;
                }
            }
            compactStartHistory(now);
            if (promoted > 0) {
                sortQueue();
                logger.debug("Aging pass promoted {} tasks", promoted);
            }
            return promoted;
        } finally {
            lock.unlock();
        }
    }

    public void setAgentQuota(AgentQuota quota) {
        lock.lock();
        try {
            quotas.put(quota.agentId(), quota);
            logger.info("Quota set for agent {}: maxConcurrent={}, maxPerMinute={}, maxPerHour={}",
                quota.agentId(), quota.maxConcurrent(), quota.maxPerMinute(), quota.maxPerHour());
        } finally {
            lock.unlock();
        }
    }

    public Optional<AgentQuota> getAgentQuota(String agentId) {
        lock.lock();
        try {
            return Optional.ofNullable(quotas.get(agentId));
        } finally {
            lock.unlock();
        }
    }

    public void removeAgentQuota(String agentId) {
        lock.lock();
        try {
            quotas.remove(agentId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Emergency drain. Drops every pending task without completing it.
     *
     * @return the number of tasks dropped
     */
    public int clearQueue() {
        lock.lock();
        try {
            int dropped = queue.size();
            queue.clear();
            logger.warn("Cleared scheduler queue, dropped {} pending tasks", dropped);
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public List<QueuedTask> getQueueSnapshot() {
        lock.lock();
        try {
            Instant now = clock.instant();
            return queue.stream()
                .map(e -> new QueuedTask(e.task, e.effectivePriority,
                    Duration.between(e.task.submittedAt(), now)))
                .toList();
        } finally {
            lock.unlock();
        }
    }

    public int getQueueLength() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int getActiveCount() {
        lock.lock();
        try {
            return activeTasks.size();
        } finally {
            lock.unlock();
        }
    }

    public int getActiveCount(String agentId) {
        lock.lock();
        try {
            return activeCountOf(agentId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of start timestamps retained for rate limiting, summed over all agents.
     */
    int retainedStartCount() {
        lock.lock();
        try {
            return startHistory.values().stream().mapToInt(Deque::size).sum();
        } finally {
            lock.unlock();
        }
    }

    public SchedulerStats getStats() {
        lock.lock();
        try {
            Map<String, AgentStats> breakdown = new HashMap<>();
            agentCounters.forEach((agentId, c) -> breakdown.put(agentId, new AgentStats(
                c.submitted, c.rejected, c.completed, c.failed, activeCountOf(agentId),
                c.started == 0 ? 0.0 : (double) c.waitMillis / c.started)));

            long finished = totalCompleted + totalFailed;
            return new SchedulerStats(
                totalSubmitted,
                totalRejected,
                totalCompleted,
                totalFailed,
                totalStarted == 0 ? 0.0 : (double) totalWaitMillis / totalStarted,
                finished == 0 ? 0.0 : (double) totalDurationMillis / finished,
                queue.size(),
                activeTasks.size(),
                breakdown);
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the aging timer. Pending tasks stay queued but no new submissions are accepted.
     * Safe to call more than once.
     */
    public void shutdown() {
        ScheduledExecutorService executor;
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            if (agingTask != null) {
                agingTask.cancel(false);
                agingTask = null;
            }
            executor = agingExecutor;
            agingExecutor = null;
        } finally {
            lock.unlock();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
        logger.info("Fairness scheduler stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    private void agingTick() {
        try {
            ageQueue();
        } catch (RuntimeException e) {
            logger.error("Scheduler aging pass failed", e);
        }
    }

    private String quotaViolation(String agentId, Instant now) {
        if (!config.isQuotaEnabled()) {
            return null;
        }
        AgentQuota quota = quotas.get(agentId);
        if (quota == null) {
            return null;
        }
        int active = activeCountOf(agentId);
        if (active >= quota.maxConcurrent()) {
            return "concurrent limit " + quota.maxConcurrent() + " reached";
        }
        Deque<Instant> starts = startHistory.getOrDefault(agentId, new ArrayDeque<>());
        pruneOlderThan(starts, now.minus(HOUR));
        Instant minuteAgo = now.minus(MINUTE);
        long lastMinute = starts.stream().filter(t -> t.isAfter(minuteAgo)).count();
        if (lastMinute >= quota.maxPerMinute()) {
            return "per-minute limit " + quota.maxPerMinute() + " reached";
        }
        if (starts.size() >= quota.maxPerHour()) {
            return "per-hour limit " + quota.maxPerHour() + " reached";
        }
        return null;
    }

    private boolean atConcurrencyLimit(String agentId) {
        if (!config.isQuotaEnabled()) {
            return false;
        }
        AgentQuota quota = quotas.get(agentId);
        return quota != null && activeCountOf(agentId) >= quota.maxConcurrent();
    }

    private void compactStartHistory(Instant now) {
        Instant hourAgo = now.minus(HOUR);
        Iterator<Map.Entry<String, Deque<Instant>>> it = startHistory.entrySet().iterator();
        while (it.hasNext()) {
            Deque<Instant> starts = it.next().getValue();
            pruneOlderThan(starts, hourAgo);
            if (starts.isEmpty()) {
                it.remove();
            }
        }
    }

    private static void pruneOlderThan(Deque<Instant> starts, Instant cutoff) {
        while (!starts.isEmpty() && !starts.peekFirst().isAfter(cutoff)) {
            starts.removeFirst();
        }
    }

    private void sortQueue() {
        Comparator<PendingEntry> order = Comparator.comparingDouble(e -> e.effectivePriority);
        if (config.isFairnessEnabled()) {
            order = order.thenComparingInt(e -> activeCountOf(e.task.agentId()));
        }
        order = order
            .thenComparing(e -> e.task.submittedAt())
            .thenComparingLong(e -> e.sequence);
        queue.sort(order);
    }

    private int activeCountOf(String agentId) {
        int count = 0;
        for (RunningEntry running : activeTasks.values()) {
            if (running.task.agentId().equals(agentId)) {
                count++;
            }
        }
        return count;
    }

    private PendingEntry findPending(String taskId) {
        for (PendingEntry entry : queue) {
            if (entry.task.taskId().equals(taskId)) {
                return entry;
            }
        }
        return null;
    }

    private AgentCounters counters(String agentId) {
        return agentCounters.computeIfAbsent(agentId, k -> new AgentCounters());
    }

    private static final class PendingEntry {
        private final ScheduledTask task;
        private final long sequence;
        private double effectivePriority;

        private PendingEntry(ScheduledTask task, long sequence) {
            this.task = task;
            this.sequence = sequence;
            this.effectivePriority = task.priority();
        }
    }

    private static final class RunningEntry {
        private final ScheduledTask task;
        private final Instant startedAt;

        private RunningEntry(ScheduledTask task, Instant startedAt) {
            this.task = task;
            this.startedAt = startedAt;
        }
    }

    private static final class AgentCounters {
        private long submitted;
        private long rejected;
        private long started;
        private long completed;
        private long failed;
        private long waitMillis;
    }
}
