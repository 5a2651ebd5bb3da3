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

import me.golemcore.monitor.domain.exception.FetchException;
import me.golemcore.monitor.domain.model.MailMessage;

import java.time.Instant;
import java.util.List;

/**
 * Port for the mailbox the monitor watches. Implementations own the transport,
 * credentials and paging; the engine only asks for the messages received since
 * a point in time.
 */
public interface MailSourcePort {

    /**
     * Fetch all messages received at or after {@code since}, including their
     * attachment bytes.
     *
     * @param since
     *            lower bound of the lookback window
     * @return messages in the window, in any order
     * @throws FetchException
     *             on authentication, network or rate-limit failures
     */
    List<MailMessage> fetchMessages(Instant since);
}
