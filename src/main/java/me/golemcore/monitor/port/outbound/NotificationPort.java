package me.golemcore.monitor.port.outbound;

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

import me.golemcore.monitor.domain.model.MatchRecord;

/**
 * Sink for newly confirmed matches. Fire-and-forget: delivery failures are the
 * sink's concern and are not retried by the engine.
 */
public interface NotificationPort {

    /**
     * Called exactly once per match record, after the record is persisted.
     */
    void notify(MatchRecord match);

    /**
     * Called once at the end of a cycle that produced at least one new match.
     */
    default void notifyCycleSummary(int newMatches, String keyword) {
    }
}
