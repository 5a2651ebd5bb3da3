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
import me.golemcore.monitor.domain.exception.StorageException;
import me.golemcore.monitor.domain.model.MatchRecord;
import me.golemcore.monitor.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletionException;

/**
 * Durable record of which messages have been evaluated and which of them
 * matched. Persisted in {@code dedup/state.json} via {@link StoragePort}.
 *
 * <p>
 * Both sets only grow, and every matched id is also an evaluated id. A write
 * reaches disk before {@link #recordEvaluated} returns, so callers may notify
 * about a match as soon as the call succeeds.
 *
 * <p>
 * Every new outcome rewrites the whole snapshot as compact JSON, so the cost
 * of a write grows with the number of evaluated ids. At the volumes of one
 * mailbox (a few thousand ids per year) that is a few hundred kilobytes.
 */
@Service
@Slf4j
public class DedupStore {

    static final String DEDUP_DIR = "dedup";
    static final String STATE_FILE = "state.json";

    private static final Comparator<MatchRecord> NEWEST_FIRST = Comparator
            .comparing(MatchRecord::receivedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(MatchRecord::messageId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private Set<String> evaluatedIds;
    private Map<String, MatchRecord> matches;

    public DedupStore(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    public synchronized boolean hasEvaluated(String messageId) {
        ensureLoaded();
        return evaluatedIds.contains(messageId);
    }

    /**
     * Whether the message is a confirmed match.
     */
    public synchronized boolean contains(String messageId) {
        ensureLoaded();
        return matches.containsKey(messageId);
    }

    /**
     * Mark a message as evaluated, together with its match record when it
     * matched. Recording the same outcome again is a no-op.
     *
     * @return true if the message was not evaluated before
     * @throws ConsistencyException
     *             if a different outcome is already stored for the message
     * @throws StorageException
     *             if the state could not be written; nothing is recorded then
     */
    public synchronized boolean recordEvaluated(String messageId, Optional<MatchRecord> match) {
        Objects.requireNonNull(messageId, "messageId");
        if (match.isPresent() && !messageId.equals(match.get().messageId())) {
            throw new IllegalArgumentException(
                    "Match record for " + match.get().messageId() + " recorded under id " + messageId);
        }
        ensureLoaded();

        if (evaluatedIds.contains(messageId)) {
            Optional<MatchRecord> stored = Optional.ofNullable(matches.get(messageId));
            if (!stored.equals(match)) {
                throw new ConsistencyException("Message " + messageId + " already evaluated as "
                        + describe(stored) + ", refusing to overwrite with " + describe(match));
            }
            log.debug("[Dedup] Message {} already recorded with the same outcome", messageId);
            return false;
        }

        Set<String> nextEvaluated = new TreeSet<>(evaluatedIds);
        nextEvaluated.add(messageId);
        Map<String, MatchRecord> nextMatches = new LinkedHashMap<>(matches);
        match.ifPresent(record -> nextMatches.put(messageId, record));

        persist(nextEvaluated, nextMatches);
        evaluatedIds = nextEvaluated;
        matches = nextMatches;
        return true;
    }

    /**
     * All matches, newest first; equal timestamps are ordered by message id.
     */
    public synchronized List<MatchRecord> listMatches() {
        ensureLoaded();
        return matches.values().stream().sorted(NEWEST_FIRST).toList();
    }

    /**
     * Matches whose sender, subject or matched filenames contain the filter,
     * ignoring case, in {@link #listMatches()} order. A blank filter returns
     * everything.
     */
    public List<MatchRecord> searchMatches(String filter) {
        List<MatchRecord> all = listMatches();
        if (filter == null || filter.isBlank()) {
            return all;
        }
        String needle = filter.strip().toLowerCase(Locale.ROOT);
        return all.stream()
                .filter(record -> containsIgnoreCase(record.sender(), needle)
                        || containsIgnoreCase(record.subject(), needle)
                        || record.matchedFilenames().stream().anyMatch(name -> containsIgnoreCase(name, needle)))
                .toList();
    }

    public synchronized Optional<MatchRecord> findMatch(String messageId) {
        ensureLoaded();
        return Optional.ofNullable(matches.get(messageId));
    }

    public synchronized int evaluatedCount() {
        ensureLoaded();
        return evaluatedIds.size();
    }

    public synchronized int matchCount() {
        ensureLoaded();
        return matches.size();
    }

    private void ensureLoaded() {
        if (evaluatedIds != null) {
            return;
        }
        Snapshot snapshot = load();
        Set<String> loadedIds = new TreeSet<>(snapshot.evaluatedIds() != null ? snapshot.evaluatedIds() : List.of());
        Map<String, MatchRecord> loadedMatches = new LinkedHashMap<>();
        if (snapshot.matches() != null) {
            for (MatchRecord record : snapshot.matches()) {
                loadedMatches.put(record.messageId(), record);
                if (loadedIds.add(record.messageId())) {
                    log.warn("[Dedup] Matched message {} was missing from evaluated ids, restored",
                            record.messageId());
                }
            }
        }
        evaluatedIds = loadedIds;
        matches = loadedMatches;
        log.info("[Dedup] Loaded {} evaluated messages, {} matches", evaluatedIds.size(), matches.size());
    }

    private Snapshot load() {
        String json;
        try {
            json = storagePort.getText(DEDUP_DIR, STATE_FILE).join();
        } catch (CompletionException e) {
            throw new StorageException("Failed to read dedup state", e.getCause());
        }
        if (json == null || json.isBlank()) {
            return new Snapshot(List.of(), List.of());
        }
        try {
            return objectMapper.readValue(json, Snapshot.class);
        } catch (JsonProcessingException e) {
            throw new StorageException("Dedup state is corrupt: " + DEDUP_DIR + "/" + STATE_FILE, e);
        }
    }

    private void persist(Set<String> ids, Map<String, MatchRecord> records) {
        try {
            String json = objectMapper.writeValueAsString(
                    new Snapshot(new ArrayList<>(ids), new ArrayList<>(records.values())));
            storagePort.putTextAtomic(DEDUP_DIR, STATE_FILE, json, true).join();
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize dedup state", e);
        } catch (CompletionException e) {
            throw new StorageException("Failed to write dedup state", e.getCause());
        }
    }

    private static boolean containsIgnoreCase(String value, String lowerNeedle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }

    private static String describe(Optional<MatchRecord> outcome) {
        return outcome.map(record -> "match " + record.matchedFilenames()).orElse("no match");
    }

    /**
     * On-disk layout of the store.
     */
    public record Snapshot(List<String> evaluatedIds, List<MatchRecord> matches) {
    }
}
