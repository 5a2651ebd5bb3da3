package me.golemcore.monitor.domain.service;

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

import me.golemcore.monitor.domain.exception.ConsistencyException;
import me.golemcore.monitor.domain.exception.FetchException;
import me.golemcore.monitor.domain.exception.FetchFailureKind;
import me.golemcore.monitor.domain.exception.StorageException;
import me.golemcore.monitor.domain.model.CycleReport;
import me.golemcore.monitor.domain.model.CycleTrigger;
import me.golemcore.monitor.domain.model.MailMessage;
import me.golemcore.monitor.domain.model.MatchRecord;
import me.golemcore.monitor.domain.model.PollConfig;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import me.golemcore.monitor.port.outbound.MailSourcePort;
import me.golemcore.monitor.port.outbound.NotificationPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Runs one evaluation cycle: fetch the lookback window, evaluate every message
 * not seen before, record each outcome, then notify about the new matches.
 *
 * <p>
 * Messages of a cycle are evaluated on a worker pool; outcomes are recorded
 * on the calling thread in fetch order. Cancellation is observed before each
 * message is evaluated, never in the middle of an extraction. Notifications
 * are sent only for records that reached the dedup store.
 *
 * <p>
 * Failures below the cycle level are logged and counted in the report; only
 * a fetch failure ends the cycle early, and it leaves the store untouched.
 */
@Service
@Slf4j
public class ScanCycleService {

    private final MailSourcePort mailSource;
    private final MessageEvaluator messageEvaluator;
    private final DedupStore dedupStore;
    private final NotificationPort notificationPort;
    private final Clock clock;
    private final Duration fetchTimeout;
    private final ExecutorService fetchExecutor;
    private final ExecutorService evaluationExecutor;

    public ScanCycleService(MailSourcePort mailSource, MessageEvaluator messageEvaluator, DedupStore dedupStore,
            NotificationPort notificationPort, Clock clock, MonitorProperties properties) {
        this.mailSource = mailSource;
        this.messageEvaluator = messageEvaluator;
        this.dedupStore = dedupStore;
        this.notificationPort = notificationPort;
        this.clock = clock;
        this.fetchTimeout = properties.getFetchTimeout();
        this.fetchExecutor = Executors.newCachedThreadPool(daemonThreads("monitor-fetch"));
        this.evaluationExecutor = Executors.newFixedThreadPool(
                Math.max(1, properties.getEvaluationThreads()), daemonThreads("monitor-eval"));
    }

    /**
     * Execute one cycle. Never throws for fetch, evaluation, storage or
     * notification failures; they end up in the returned report. An unreadable
     * dedup store ends the cycle before anything is evaluated.
     *
     * @param config
     *            validated poll settings
     * @param trigger
     *            what started the cycle
     * @param cancelled
     *            polled between messages; once true, remaining messages are
     *            left unevaluated for the next cycle
     */
    public CycleReport runCycle(PollConfig config, CycleTrigger trigger, BooleanSupplier cancelled) {
        Instant startedAt = clock.instant();
        Instant since = startedAt.minus(config.lookback());
        CycleReport.CycleReportBuilder report = CycleReport.builder()
                .trigger(trigger)
                .startedAt(startedAt);

        List<MailMessage> fetched;
        try {
            fetched = fetch(since);
        } catch (FetchException e) {
            log.warn("[Cycle] Fetch failed ({}), will retry next cycle: {}", e.getKind(), e.getMessage());
            return report.outcome(CycleReport.Outcome.FETCH_FAILED)
                    .failure(e.getKind() + ": " + e.getMessage())
                    .finishedAt(clock.instant())
                    .build();
        }

        int failed = 0;
        Map<String, MailMessage> unique = new LinkedHashMap<>();
        for (MailMessage message : fetched) {
            if (message.id() == null || message.id().isBlank()) {
                log.warn("[Cycle] Skipping message without id: '{}'", message.subject());
                failed++;
            } else if (unique.putIfAbsent(message.id(), message) != null) {
                log.debug("[Cycle] Duplicate message {} in fetch, keeping the first", message.id());
            }
        }

        List<MailMessage> pending = new ArrayList<>();
        int alreadyEvaluated = 0;
        try {
            for (MailMessage message : unique.values()) {
                if (dedupStore.hasEvaluated(message.id())) {
                    alreadyEvaluated++;
                } else {
                    pending.add(message);
                }
            }
        } catch (StorageException e) {
            log.error("[Cycle] Dedup store unavailable, nothing evaluated: {}", e.getMessage(), e);
            return report.outcome(CycleReport.Outcome.STORAGE_FAILED)
                    .fetched(fetched.size())
                    .failedMessages(failed)
                    .failure("STORAGE: " + e.getMessage())
                    .finishedAt(clock.instant())
                    .build();
        }
        log.info("[Cycle] {} cycle: fetched {}, already evaluated {}, to evaluate {}",
                trigger, fetched.size(), alreadyEvaluated, pending.size());

        List<Future<Evaluation>> futures = new ArrayList<>(pending.size());
        for (MailMessage message : pending) {
            futures.add(evaluationExecutor.submit(() -> evaluate(message, config.keyword(), cancelled)));
        }

        int evaluated = 0;
        int skipped = 0;
        List<MatchRecord> newMatches = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Evaluation evaluation;
            try {
                evaluation = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[Cycle] Interrupted, abandoning {} remaining messages", futures.size() - i);
                futures.subList(i, futures.size()).forEach(future -> future.cancel(false));
                skipped += futures.size() - i;
                break;
            } catch (ExecutionException e) {
                // evaluate() catches everything it can; this is an Error from the worker
                log.error("[Cycle] Evaluation of message {} aborted", pending.get(i).id(), e.getCause());
                failed++;
                continue;
            }
            if (evaluation.skipped()) {
                skipped++;
                continue;
            }

            evaluated++;
            if (evaluation.failed()) {
                failed++;
            }
            if (record(evaluation)) {
                evaluation.match().ifPresent(newMatches::add);
            } else {
                failed++;
            }
        }

        notifyMatches(newMatches, config.keyword());

        if (skipped > 0) {
            log.info("[Cycle] Cancelled, {} messages left for the next cycle", skipped);
        }
        CycleReport result = report
                .outcome(skipped > 0 ? CycleReport.Outcome.CANCELLED : CycleReport.Outcome.COMPLETED)
                .fetched(fetched.size())
                .alreadyEvaluated(alreadyEvaluated)
                .evaluated(evaluated)
                .newMatches(newMatches.size())
                .failedMessages(failed)
                .finishedAt(clock.instant())
                .build();
        log.info("[Cycle] {} in {} ms: evaluated {}, new matches {}, failed {}", result.outcome(),
                Duration.between(startedAt, result.finishedAt()).toMillis(), evaluated, newMatches.size(), failed);
        return result;
    }

    @PreDestroy
    public void shutdown() {
        fetchExecutor.shutdownNow();
        evaluationExecutor.shutdown();
        try {
            if (!evaluationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                evaluationExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            evaluationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private List<MailMessage> fetch(Instant since) {
        // a hung fetch keeps its thread; the next cycle gets a fresh one
        Future<List<MailMessage>> future = fetchExecutor.submit(() -> mailSource.fetchMessages(since));
        try {
            List<MailMessage> messages = future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return messages != null ? messages : List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FetchException(FetchFailureKind.NETWORK, "Fetch timed out after " + fetchTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new FetchException(FetchFailureKind.NETWORK, "Fetch interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchException fetchException) {
                throw fetchException;
            }
            throw new FetchException(FetchFailureKind.NETWORK, "Mail source failed: " + cause.getMessage(), cause);
        }
    }

    private Evaluation evaluate(MailMessage message, String keyword, BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            return Evaluation.notEvaluated(message);
        }
        try {
            return new Evaluation(message, messageEvaluator.evaluate(message, keyword), false, false);
        } catch (Exception e) { // NOSONAR - any failure of one message counts as no match
            log.error("[Cycle] Failed to evaluate message {}, treating as no match", message.id(), e);
            return new Evaluation(message, Optional.empty(), false, true);
        }
    }

    private boolean record(Evaluation evaluation) {
        String id = evaluation.message().id();
        try {
            dedupStore.recordEvaluated(id, evaluation.match());
            return true;
        } catch (ConsistencyException e) {
            log.error("[Cycle] Dedup store rejected outcome for message {}: {}", id, e.getMessage(), e);
        } catch (StorageException e) {
            log.error("[Cycle] Could not persist outcome for message {}, will retry next cycle", id, e);
        }
        return false;
    }

    private void notifyMatches(List<MatchRecord> matches, String keyword) {
        if (matches.isEmpty()) {
            return;
        }
        for (MatchRecord match : matches) {
            try {
                notificationPort.notify(match);
            } catch (RuntimeException e) {
                log.error("[Cycle] Notification for message {} failed: {}", match.messageId(), e.getMessage(), e);
            }
        }
        try {
            notificationPort.notifyCycleSummary(matches.size(), keyword);
        } catch (RuntimeException e) {
            log.error("[Cycle] Cycle summary notification failed: {}", e.getMessage(), e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Evaluation(MailMessage message, Optional<MatchRecord> match, boolean skipped, boolean failed) {

        static Evaluation notEvaluated(MailMessage message) {
            return new Evaluation(message, Optional.empty(), true, false);
        }
    }
}
