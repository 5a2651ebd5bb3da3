package me.golemcore.monitor.poll;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.monitor.domain.exception.ConfigException;
import me.golemcore.monitor.domain.model.CycleReport;
import me.golemcore.monitor.domain.model.CycleTrigger;
import me.golemcore.monitor.domain.model.MonitorStatus;
import me.golemcore.monitor.domain.model.PollConfig;
import me.golemcore.monitor.domain.model.RunOnceResult;
import me.golemcore.monitor.domain.model.SchedulerState;
import me.golemcore.monitor.domain.service.DedupStore;
import me.golemcore.monitor.domain.service.ScanCycleService;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives evaluation cycles, either on a recurring timer or on demand.
 *
 * <p>
 * State machine: {@code IDLE -> RUNNING -> IDLE} via {@link #start} and
 * {@link #stop}; {@link #shutdown} moves to the terminal {@code STOPPED}
 * state. At most one cycle executes at a time: a timer tick that finds a
 * cycle in flight is skipped, a manual {@link #runOnce} returns
 * {@code ALREADY_RUNNING}.
 *
 * <p>
 * Stopping is cooperative. The timer is cancelled without interrupting, and
 * the in-flight cycle sees its cancellation token between messages.
 *
 * @see ScanCycleService
 */
@Component
@Slf4j
public class PollScheduler {

    private final ScanCycleService cycleService;
    private final DedupStore dedupStore;
    private final MonitorProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final Object quiescence = new Object();
    private final ScheduledExecutorService scheduler;

    private SchedulerState state = SchedulerState.IDLE;
    // last config accepted by start(); survives stop() for manual runs
    private PollConfig activeConfig;
    private ScheduledFuture<?> tickTask;
    private AtomicBoolean cancellation = new AtomicBoolean(false);
    private volatile CycleReport lastCycle;

    public PollScheduler(ScanCycleService cycleService, DedupStore dedupStore, MonitorProperties properties) {
        this.cycleService = cycleService;
        this.dedupStore = dedupStore;
        this.properties = properties;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "poll-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        if (!properties.isAutoStart()) {
            log.info("[Scheduler] Auto-start disabled, waiting for start request");
            return;
        }
        try {
            start(properties.toPollConfig());
            log.info("[Scheduler] Auto-started");
        } catch (ConfigException e) {
            log.error("[Scheduler] Auto-start skipped, invalid configuration: {}", e.getMessage());
        }
    }

    /**
     * Validate the settings, run a cycle immediately and then every
     * {@code intervalSeconds}.
     *
     * @throws ConfigException
     *             if the settings are invalid; the scheduler stays idle
     * @throws IllegalStateException
     *             if already running or shut down
     */
    public void start(PollConfig config) {
        PollConfig validated = (config != null ? config : properties.toPollConfig()).validate();
        synchronized (this) {
            if (state == SchedulerState.STOPPED) {
                throw new IllegalStateException("Scheduler is shut down");
            }
            if (state == SchedulerState.RUNNING) {
                throw new IllegalStateException("Scheduler is already running");
            }
            AtomicBoolean token = new AtomicBoolean(false);
            cancellation = token;
            activeConfig = validated;
            tickTask = scheduler.scheduleAtFixedRate(
                    () -> tick(validated, token),
                    0,
                    validated.intervalSeconds(),
                    TimeUnit.SECONDS);
            state = SchedulerState.RUNNING;
        }
        log.info("[Scheduler] Started: keyword '{}', lookback {}d, interval {}s",
                validated.keyword(), validated.lookbackDays(), validated.intervalSeconds());
    }

    /**
     * Cancel the timer and signal the in-flight cycle, if any, to wind down.
     * Does not wait; see {@link #awaitQuiescence}.
     *
     * @return false if the scheduler was not running
     */
    public synchronized boolean stop() {
        if (state != SchedulerState.RUNNING) {
            log.debug("[Scheduler] Stop ignored in state {}", state);
            return false;
        }
        cancelTimer();
        state = SchedulerState.IDLE;
        log.info("[Scheduler] Stopped");
        return true;
    }

    /**
     * Run one cycle on the calling thread unless another cycle is in flight.
     * The recurring timer, if armed, is not affected. Uses the settings of the
     * last {@link #start}, or the configured defaults if it was never started.
     *
     * @throws ConfigException
     *             if never started and the configured defaults are invalid
     * @throws IllegalStateException
     *             if shut down
     */
    public RunOnceResult runOnce() {
        PollConfig config;
        AtomicBoolean token;
        synchronized (this) {
            if (state == SchedulerState.STOPPED) {
                throw new IllegalStateException("Scheduler is shut down");
            }
            if (activeConfig != null) {
                config = activeConfig;
            } else {
                config = properties.toPollConfig().validate();
            }
            if (state != SchedulerState.RUNNING && cancellation.get()) {
                cancellation = new AtomicBoolean(false);
            }
            token = cancellation;
        }

        if (!executing.compareAndSet(false, true)) {
            log.info("[Scheduler] Manual run coalesced: a cycle is already in flight");
            return RunOnceResult.alreadyRunning();
        }
        return RunOnceResult.executed(execute(config, CycleTrigger.MANUAL, token));
    }

    public MonitorStatus getStatus() {
        SchedulerState currentState;
        PollConfig config;
        synchronized (this) {
            currentState = state;
            config = activeConfig != null ? activeConfig : properties.toPollConfig();
        }
        return MonitorStatus.builder()
                .state(currentState)
                .config(config)
                .cycleInFlight(executing.get())
                .lastCycle(lastCycle)
                .evaluatedCount(dedupStore.evaluatedCount())
                .matchCount(dedupStore.matchCount())
                .build();
    }

    public boolean isCycleInFlight() {
        return executing.get();
    }

    /**
     * Block until no cycle is executing.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitQuiescence(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (quiescence) {
            while (executing.get()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(quiescence, remaining);
            }
        }
        return true;
    }

    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            cancelTimer();
            state = SchedulerState.STOPPED;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Scheduler] Shut down");
    }

    void tick(PollConfig config, AtomicBoolean token) {
        try {
            if (token.get()) {
                return;
            }
            if (!executing.compareAndSet(false, true)) {
                log.debug("[Scheduler] Tick skipped: previous cycle still in progress");
                return;
            }
            execute(config, CycleTrigger.TIMER, token);
        } catch (Exception e) { // NOSONAR - a failed tick must not cancel the timer
            log.error("[Scheduler] Tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Caller must have acquired {@link #executing}.
     */
    private CycleReport execute(PollConfig config, CycleTrigger trigger, AtomicBoolean token) {
        try {
            CycleReport report = cycleService.runCycle(config, trigger, token::get);
            lastCycle = report;
            return report;
        } finally {
            executing.set(false);
            synchronized (quiescence) {
                quiescence.notifyAll();
            }
        }
    }

    private void cancelTimer() {
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        cancellation.set(true);
    }
}
