package me.golemcore.monitor.domain.exception;

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

import lombok.Getter;

/**
 * The mail source could not deliver messages. Always retryable on the next
 * cycle; the engine does not retry within a cycle.
 */
@Getter
public class FetchException extends MonitorException {

    private static final long serialVersionUID = 1L;

    private final FetchFailureKind kind;

    public FetchException(FetchFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FetchException(FetchFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
