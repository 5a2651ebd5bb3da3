package me.golemcore.monitor.domain.service;

import me.golemcore.monitor.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.monitor.domain.exception.ConsistencyException;
import me.golemcore.monitor.domain.exception.StorageException;
import me.golemcore.monitor.domain.model.MatchRecord;
import me.golemcore.monitor.infrastructure.config.MonitorConfiguration;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import me.golemcore.monitor.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DedupStoreTest {

    private static final Instant T1 = Instant.parse("2026-10-16T08:00:00Z");
    private static final Instant T2 = Instant.parse("2026-10-17T08:00:00Z");
    private static final Instant T3 = Instant.parse("2026-10-18T08:00:00Z");

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private LocalStorageAdapter storage;
    private DedupStore store;

    @BeforeEach
    void setUp() {
        MonitorProperties properties = new MonitorProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = MonitorConfiguration.objectMapper();
        store = new DedupStore(storage, objectMapper);
    }

    @Test
    void shouldRecordNonMatchAsEvaluatedOnly() {
        assertTrue(store.recordEvaluated("m1", Optional.empty()));

        assertTrue(store.hasEvaluated("m1"));
        assertFalse(store.contains("m1"));
        assertEquals(1, store.evaluatedCount());
        assertEquals(0, store.matchCount());
    }

    @Test
    void shouldRecordMatchAsEvaluatedAndMatched() {
        store.recordEvaluated("m1", Optional.of(match("m1", T1)));

        assertTrue(store.hasEvaluated("m1"));
        assertTrue(store.contains("m1"));
        assertEquals(match("m1", T1), store.findMatch("m1").orElseThrow());
    }

    @Test
    void shouldIgnoreRepeatedRecordingOfSameOutcome() {
        assertTrue(store.recordEvaluated("m1", Optional.of(match("m1", T1))));
        assertFalse(store.recordEvaluated("m1", Optional.of(match("m1", T1))));
        assertTrue(store.recordEvaluated("m2", Optional.empty()));
        assertFalse(store.recordEvaluated("m2", Optional.empty()));

        assertEquals(2, store.evaluatedCount());
        assertEquals(1, store.matchCount());
    }

    @Test
    void shouldRejectDifferentOutcomeForEvaluatedMessage() {
        store.recordEvaluated("m1", Optional.empty());

        assertThrows(ConsistencyException.class,
                () -> store.recordEvaluated("m1", Optional.of(match("m1", T1))));
        assertFalse(store.contains("m1"));
    }

    @Test
    void shouldRejectDifferentMatchForMatchedMessage() {
        store.recordEvaluated("m1", Optional.of(match("m1", T1)));

        assertThrows(ConsistencyException.class, () -> store.recordEvaluated("m1", Optional.empty()));
        MatchRecord different = MatchRecord.builder()
                .messageId("m1")
                .receivedAt(T1)
                .matchedFilenames(List.of("other.txt"))
                .build();
        assertThrows(ConsistencyException.class, () -> store.recordEvaluated("m1", Optional.of(different)));
        assertEquals(match("m1", T1), store.findMatch("m1").orElseThrow());
    }

    @Test
    void shouldRejectRecordFiledUnderAnotherId() {
        assertThrows(IllegalArgumentException.class,
                () -> store.recordEvaluated("m1", Optional.of(match("m2", T1))));
        assertFalse(store.hasEvaluated("m1"));
    }

    @Test
    void shouldListMatchesNewestFirst() {
        store.recordEvaluated("a", Optional.of(match("a", T2)));
        store.recordEvaluated("b", Optional.of(match("b", T1)));
        store.recordEvaluated("c", Optional.of(match("c", T3)));

        assertEquals(List.of("c", "a", "b"), ids(store.listMatches()));
    }

    @Test
    void shouldBreakTimestampTiesByMessageIdAndPutUndatedLast() {
        store.recordEvaluated("m-b", Optional.of(match("m-b", T2)));
        store.recordEvaluated("m-none", Optional.of(match("m-none", null)));
        store.recordEvaluated("m-a", Optional.of(match("m-a", T2)));

        assertEquals(List.of("m-a", "m-b", "m-none"), ids(store.listMatches()));
    }

    @Test
    void shouldSurviveRestart() {
        store.recordEvaluated("m1", Optional.of(match("m1", T1)));
        store.recordEvaluated("m2", Optional.empty());

        DedupStore reopened = new DedupStore(storage, objectMapper);

        assertTrue(reopened.hasEvaluated("m1"));
        assertTrue(reopened.hasEvaluated("m2"));
        assertTrue(reopened.contains("m1"));
        assertFalse(reopened.contains("m2"));
        assertEquals(match("m1", T1), reopened.findMatch("m1").orElseThrow());
        assertFalse(reopened.recordEvaluated("m1", Optional.of(match("m1", T1))));
    }

    @Test
    void shouldKeepBackupOfPreviousSnapshot() throws IOException {
        store.recordEvaluated("m1", Optional.empty());
        store.recordEvaluated("m2", Optional.empty());

        Path dedupDir = tempDir.resolve("dedup");
        assertEquals(List.of("m1", "m2"), objectMapper.readValue(
                Files.readString(dedupDir.resolve("state.json")), DedupStore.Snapshot.class).evaluatedIds());
        assertEquals(List.of("m1"), objectMapper.readValue(
                Files.readString(dedupDir.resolve("state.json.bak")), DedupStore.Snapshot.class).evaluatedIds());
    }

    @Test
    void shouldWriteCompactSnapshot() throws IOException {
        store.recordEvaluated("m1", Optional.of(match("m1", T1)));

        String json = Files.readString(tempDir.resolve("dedup").resolve("state.json"));

        assertFalse(json.contains("\n"));
        assertTrue(json.startsWith("{\"evaluatedIds\":[\"m1\"]"));
    }

    @Test
    void shouldRestoreMatchedIdMissingFromEvaluatedIds() throws IOException {
        Files.writeString(tempDir.resolve("dedup").resolve("state.json"), """
                {"evaluatedIds":[],"matches":[{"messageId":"m1","sender":"a@b","subject":"s",
                "receivedAt":"2026-10-16T08:00:00Z","bodyPreview":"","matchedFilenames":["x.txt"]}]}
                """);

        assertTrue(store.hasEvaluated("m1"));
        assertTrue(store.contains("m1"));
    }

    @Test
    void shouldFailLoudlyOnCorruptState() throws IOException {
        Files.writeString(tempDir.resolve("dedup").resolve("state.json"), "{not json");

        assertThrows(StorageException.class, () -> store.hasEvaluated("m1"));
    }

    @Test
    void shouldNotRecordWhenWriteFails() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(failing.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("disk full")));
        DedupStore failingStore = new DedupStore(failing, objectMapper);

        assertThrows(StorageException.class,
                () -> failingStore.recordEvaluated("m1", Optional.of(match("m1", T1))));
        assertFalse(failingStore.hasEvaluated("m1"));
        assertFalse(failingStore.contains("m1"));
    }

    @Test
    void shouldSearchSenderSubjectAndFilenamesIgnoringCase() {
        store.recordEvaluated("m1", Optional.of(MatchRecord.builder()
                .messageId("m1").sender("HR Team <hr@acme.com>").subject("Offer letter")
                .receivedAt(T1).matchedFilenames(List.of("offer.pdf")).build()));
        store.recordEvaluated("m2", Optional.of(MatchRecord.builder()
                .messageId("m2").sender("recruiter@other.org").subject("Interview")
                .receivedAt(T2).matchedFilenames(List.of("Schedule.XLSX")).build()));

        assertEquals(List.of("m1"), ids(store.searchMatches("acme")));
        assertEquals(List.of("m2"), ids(store.searchMatches("INTERVIEW")));
        assertEquals(List.of("m2"), ids(store.searchMatches("schedule.xlsx")));
        assertEquals(List.of("m2", "m1"), ids(store.searchMatches("  ")));
        assertEquals(List.of("m2", "m1"), ids(store.searchMatches(null)));
        assertTrue(store.searchMatches("nobody").isEmpty());
    }

    private static List<String> ids(List<MatchRecord> records) {
        return records.stream().map(MatchRecord::messageId).toList();
    }

    private static MatchRecord match(String id, Instant receivedAt) {
        return MatchRecord.builder()
                .messageId(id)
                .sender("Varun <varun@example.com>")
                .subject("Subject " + id)
                .receivedAt(receivedAt)
                .bodyPreview("preview")
                .matchedFilenames(List.of("offer.txt"))
                .build();
    }
}
