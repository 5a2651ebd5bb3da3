package me.golemcore.monitor.domain.model;

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

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * A message whose attachments contained the keyword. Created once, when the
 * message first evaluates as matched, and persisted by the dedup store.
 */
@Builder
public record MatchRecord(String messageId, String sender, String subject, Instant receivedAt, String bodyPreview,
        List<String> matchedFilenames) {

    public MatchRecord {
        matchedFilenames = matchedFilenames != null ? List.copyOf(matchedFilenames) : List.of();
    }
}
