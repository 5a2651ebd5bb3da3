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

import me.golemcore.monitor.domain.exception.ConfigException;

import java.time.Duration;

/**
 * Polling settings supplied by the surrounding application. Read-only for the
 * duration of a cycle. The keyword is stored without surrounding whitespace.
 */
public record PollConfig(String keyword, int lookbackDays, int intervalSeconds) {

    public PollConfig {
        keyword = keyword != null ? keyword.strip() : null;
    }

    /**
     * Checks the settings and returns this instance.
     *
     * @throws ConfigException
     *             if the keyword is blank, the lookback is negative or the
     *             interval is below one second
     */
    public PollConfig validate() {
        if (keyword == null || keyword.isBlank()) {
            throw new ConfigException("keyword must not be empty");
        }
        if (lookbackDays < 0) {
            throw new ConfigException("lookbackDays must be >= 0, got " + lookbackDays);
        }
        if (intervalSeconds < 1) {
            throw new ConfigException("intervalSeconds must be >= 1, got " + intervalSeconds);
        }
        return this;
    }

    public Duration lookback() {
        return Duration.ofDays(lookbackDays);
    }
}
