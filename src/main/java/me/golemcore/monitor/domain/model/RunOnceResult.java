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

/**
 * Result of a manual "check now" request. When another cycle is in flight the
 * request is coalesced and no report is produced.
 */
public record RunOnceResult(Status status, CycleReport report) {

    public enum Status {
        EXECUTED, ALREADY_RUNNING
    }

    public static RunOnceResult executed(CycleReport report) {
        return new RunOnceResult(Status.EXECUTED, report);
    }

    public static RunOnceResult alreadyRunning() {
        return new RunOnceResult(Status.ALREADY_RUNNING, null);
    }

    public boolean isAlreadyRunning() {
        return status == Status.ALREADY_RUNNING;
    }
}
