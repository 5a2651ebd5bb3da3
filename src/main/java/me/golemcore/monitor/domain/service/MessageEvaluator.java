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

import me.golemcore.monitor.domain.model.Attachment;
import me.golemcore.monitor.domain.model.AttachmentMatch;
import me.golemcore.monitor.domain.model.MailMessage;
import me.golemcore.monitor.domain.model.MatchRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifies every attachment of a message and turns a message with at least
 * one matching attachment into a {@link MatchRecord}. Matched filenames keep
 * the attachment order of the message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageEvaluator {

    private final AttachmentClassifier classifier;

    public Optional<MatchRecord> evaluate(MailMessage message, String keyword) {
        if (!message.hasAttachments()) {
            return Optional.empty();
        }

        List<String> matchedFilenames = new ArrayList<>();
        for (Attachment attachment : message.attachments()) {
            AttachmentMatch match = classifier.classify(attachment, keyword);
            if (match.isDecodeError()) {
                log.warn("[Evaluate] Could not read attachment '{}' of message {}: {}",
                        match.filename(), message.id(), match.failureReason());
            }
            if (match.matched()) {
                matchedFilenames.add(match.filename());
            }
        }

        if (matchedFilenames.isEmpty()) {
            return Optional.empty();
        }

        log.info("[Evaluate] Keyword '{}' found in message {}: {}", keyword, message.id(), matchedFilenames);
        return Optional.of(MatchRecord.builder()
                .messageId(message.id())
                .sender(message.sender())
                .subject(message.subject())
                .receivedAt(message.receivedAt())
                .bodyPreview(message.bodyPreview())
                .matchedFilenames(matchedFilenames)
                .build());
    }
}
