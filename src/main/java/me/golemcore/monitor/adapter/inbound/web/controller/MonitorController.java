package me.golemcore.monitor.adapter.inbound.web.controller;

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
import me.golemcore.monitor.domain.model.MatchRecord;
import me.golemcore.monitor.domain.model.MonitorStatus;
import me.golemcore.monitor.domain.model.PollConfig;
import me.golemcore.monitor.domain.model.RunOnceResult;
import me.golemcore.monitor.domain.service.DedupStore;
import me.golemcore.monitor.domain.service.SenderFormatter;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import me.golemcore.monitor.poll.PollScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;

/**
 * Monitor control and match browsing endpoints.
 */
@RestController
@RequestMapping("/api/monitor")
@RequiredArgsConstructor
public class MonitorController {

    private final PollScheduler pollScheduler;
    private final DedupStore dedupStore;
    private final MonitorProperties properties;

    @GetMapping("/status")
    public Mono<ResponseEntity<StatusResponse>> getStatus() {
        return Mono.just(ResponseEntity.ok(toStatusResponse(pollScheduler.getStatus())));
    }

    @PostMapping("/start")
    public Mono<ResponseEntity<StatusResponse>> start(@RequestBody(required = false) StartRequest request) {
        PollConfig config = toPollConfig(request);
        try {
            pollScheduler.start(config);
        } catch (ConfigException e) {
            throw badRequest(e.getMessage());
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        return Mono.just(ResponseEntity.ok(toStatusResponse(pollScheduler.getStatus())));
    }

    @PostMapping("/stop")
    public Mono<ResponseEntity<StopResponse>> stop() {
        boolean stopped = pollScheduler.stop();
        return Mono.just(ResponseEntity.ok(new StopResponse(stopped, pollScheduler.getStatus().state().name())));
    }

    @PostMapping("/run")
    public Mono<ResponseEntity<CycleDto>> runNow() {
        return Mono.fromCallable(this::runOnce)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/matches")
    public Mono<ResponseEntity<List<MatchDto>>> getMatches(@RequestParam(required = false) String filter) {
        List<MatchDto> matches = dedupStore.searchMatches(filter).stream()
                .map(MonitorController::toMatchDto)
                .toList();
        return Mono.just(ResponseEntity.ok(matches));
    }

    @GetMapping("/matches/{messageId}")
    public Mono<ResponseEntity<MatchDto>> getMatch(@PathVariable String messageId) {
        return Mono.just(dedupStore.findMatch(messageId)
                .map(match -> ResponseEntity.ok(toMatchDto(match)))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Match not found: " + messageId)));
    }

    private ResponseEntity<CycleDto> runOnce() {
        RunOnceResult result;
        try {
            result = pollScheduler.runOnce();
        } catch (ConfigException e) {
            throw badRequest(e.getMessage());
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        if (result.isAlreadyRunning()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "already running");
        }
        return ResponseEntity.ok(toCycleDto(result.report()));
    }

    private PollConfig toPollConfig(StartRequest request) {
        if (request == null) {
            return properties.toPollConfig();
        }
        return new PollConfig(
                request.keyword() != null ? request.keyword() : properties.getKeyword(),
                request.lookbackDays() != null ? request.lookbackDays() : properties.getLookbackDays(),
                request.intervalSeconds() != null ? request.intervalSeconds() : properties.getIntervalSeconds());
    }

    private static StatusResponse toStatusResponse(MonitorStatus status) {
        PollConfig config = status.config();
        return new StatusResponse(
                status.state().name(),
                config.keyword(),
                config.lookbackDays(),
                config.intervalSeconds(),
                status.cycleInFlight(),
                status.evaluatedCount(),
                status.matchCount(),
                status.lastCycle() != null ? toCycleDto(status.lastCycle()) : null);
    }

    private static CycleDto toCycleDto(CycleReport report) {
        return new CycleDto(
                report.trigger().name(),
                report.outcome().name(),
                report.startedAt(),
                report.finishedAt(),
                report.fetched(),
                report.alreadyEvaluated(),
                report.evaluated(),
                report.newMatches(),
                report.failedMessages(),
                report.failure());
    }

    private static MatchDto toMatchDto(MatchRecord match) {
        return new MatchDto(
                match.messageId(),
                match.sender(),
                SenderFormatter.displayName(match.sender()),
                match.subject(),
                match.receivedAt(),
                match.bodyPreview(),
                match.matchedFilenames());
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    record StartRequest(String keyword, Integer lookbackDays, Integer intervalSeconds) {
    }

    record StatusResponse(String state, String keyword, int lookbackDays, int intervalSeconds,
            boolean cycleInFlight, int evaluatedCount, int matchCount, CycleDto lastCycle) {
    }

    record StopResponse(boolean stopped, String state) {
    }

    record CycleDto(String trigger, String outcome, Instant startedAt, Instant finishedAt, int fetched,
            int alreadyEvaluated, int evaluated, int newMatches, int failedMessages, String failure) {
    }

    record MatchDto(String messageId, String sender, String senderName, String subject, Instant receivedAt,
            String bodyPreview, List<String> matchedFilenames) {
    }
}
