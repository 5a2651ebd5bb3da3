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
 * A message as supplied by the mail source for one poll. The id is assigned by
 * the source and unique within the mailbox.
 */
@Builder
public record MailMessage(String id, String sender, String subject, Instant receivedAt, String bodyPreview,
        List<Attachment> attachments) {

    public MailMessage {
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
    }

    public boolean hasAttachments() {
        return !attachments.isEmpty();
    }
}
