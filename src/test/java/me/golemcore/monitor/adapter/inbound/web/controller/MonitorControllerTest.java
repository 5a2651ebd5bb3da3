package me.golemcore.monitor.adapter.inbound.web.controller;

import me.golemcore.monitor.domain.exception.ConfigException;
import me.golemcore.monitor.domain.model.CycleReport;
import me.golemcore.monitor.domain.model.CycleTrigger;
import me.golemcore.monitor.domain.model.MatchRecord;
import me.golemcore.monitor.domain.model.MonitorStatus;
import me.golemcore.monitor.domain.model.PollConfig;
import me.golemcore.monitor.domain.model.RunOnceResult;
import me.golemcore.monitor.domain.model.SchedulerState;
import me.golemcore.monitor.domain.service.DedupStore;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import me.golemcore.monitor.poll.PollScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MonitorControllerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    private PollScheduler pollScheduler;
    private DedupStore dedupStore;
    private MonitorProperties properties;
    private MonitorController controller;

    @BeforeEach
    void setUp() {
        pollScheduler = mock(PollScheduler.class);
        dedupStore = mock(DedupStore.class);
        properties = new MonitorProperties();
        controller = new MonitorController(pollScheduler, dedupStore, properties);
        when(pollScheduler.getStatus()).thenReturn(status(SchedulerState.IDLE, null));
    }

    @Test
    void getStatusShouldExposeStateConfigAndLastCycle() {
        when(pollScheduler.getStatus()).thenReturn(status(SchedulerState.RUNNING, report(CycleTrigger.TIMER)));

        StepVerifier.create(controller.getStatus())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    MonitorController.StatusResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("RUNNING", body.state());
                    assertEquals("varun", body.keyword());
                    assertEquals(4, body.evaluatedCount());
                    assertEquals(1, body.matchCount());
                    assertEquals("TIMER", body.lastCycle().trigger());
                    assertEquals("COMPLETED", body.lastCycle().outcome());
                    assertEquals(1, body.lastCycle().newMatches());
                })
                .verifyComplete();
    }

    @Test
    void startWithoutBodyShouldUseConfiguredDefaults() {
        StepVerifier.create(controller.start(null))
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();

        verify(pollScheduler).start(new PollConfig("varun", 1, 300));
    }

    @Test
    void startShouldMergeRequestWithDefaults() {
        controller.start(new MonitorController.StartRequest("offer", null, 60)).block();

        verify(pollScheduler).start(new PollConfig("offer", 1, 60));
    }

    @Test
    void startShouldMapConfigErrorToBadRequest() {
        doThrow(new ConfigException("keyword must not be empty")).when(pollScheduler).start(any());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.start(new MonitorController.StartRequest("", null, null)));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertEquals("keyword must not be empty", ex.getReason());
    }

    @Test
    void startShouldMapSecondStartToConflict() {
        doThrow(new IllegalStateException("Scheduler is already running")).when(pollScheduler).start(any());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.start(null));

        assertEquals(HttpStatus.CONFLICT, ex.getStatusCode());
    }

    @Test
    void stopShouldReportWhetherSchedulerWasRunning() {
        when(pollScheduler.stop()).thenReturn(true);

        StepVerifier.create(controller.stop())
                .assertNext(response -> {
                    assertTrue(response.getBody().stopped());
                    assertEquals("IDLE", response.getBody().state());
                })
                .verifyComplete();
    }

    @Test
    void runNowShouldReturnCycleReport() {
        when(pollScheduler.runOnce()).thenReturn(RunOnceResult.executed(report(CycleTrigger.MANUAL)));

        StepVerifier.create(controller.runNow())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("MANUAL", response.getBody().trigger());
                    assertEquals(3, response.getBody().evaluated());
                })
                .verifyComplete();
    }

    @Test
    void runNowShouldReturnConflictWhenCycleInFlight() {
        when(pollScheduler.runOnce()).thenReturn(RunOnceResult.alreadyRunning());

        StepVerifier.create(controller.runNow())
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(ResponseStatusException.class, error);
                    assertEquals(HttpStatus.CONFLICT, ((ResponseStatusException) error).getStatusCode());
                    assertEquals("already running", ((ResponseStatusException) error).getReason());
                })
                .verify();
    }

    @Test
    void getMatchesShouldPassFilterAndResolveSenderName() {
        when(dedupStore.searchMatches("offer")).thenReturn(List.of(match("m1")));

        StepVerifier.create(controller.getMatches("offer"))
                .assertNext(response -> {
                    List<MonitorController.MatchDto> body = response.getBody();
                    assertEquals(1, body.size());
                    assertEquals("m1", body.get(0).messageId());
                    assertEquals("Varun K", body.get(0).senderName());
                    assertEquals(List.of("offer.txt"), body.get(0).matchedFilenames());
                })
                .verifyComplete();
    }

    @Test
    void getMatchShouldReturnNotFoundForUnknownId() {
        when(dedupStore.findMatch("nope")).thenReturn(Optional.empty());
        when(dedupStore.findMatch("m1")).thenReturn(Optional.of(match("m1")));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.getMatch("nope"));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());

        StepVerifier.create(controller.getMatch("m1"))
                .assertNext(response -> assertEquals("m1", response.getBody().messageId()))
                .verifyComplete();
    }

    private static MonitorStatus status(SchedulerState state, CycleReport lastCycle) {
        return MonitorStatus.builder()
                .state(state)
                .config(new PollConfig("varun", 1, 300))
                .cycleInFlight(false)
                .lastCycle(lastCycle)
                .evaluatedCount(4)
                .matchCount(1)
                .build();
    }

    private static CycleReport report(CycleTrigger trigger) {
        return CycleReport.builder()
                .trigger(trigger)
                .outcome(CycleReport.Outcome.COMPLETED)
                .startedAt(NOW)
                .finishedAt(NOW.plusSeconds(2))
                .fetched(3)
                .evaluated(3)
                .newMatches(1)
                .build();
    }

    private static MatchRecord match(String id) {
        return MatchRecord.builder()
                .messageId(id)
                .sender("Varun K <varun@example.com>")
                .subject("Offer")
                .receivedAt(NOW)
                .bodyPreview("Please find attached")
                .matchedFilenames(List.of("offer.txt"))
                .build();
    }
}
