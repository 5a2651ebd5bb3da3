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

import me.golemcore.monitor.domain.extract.AttachmentExtractor;
import me.golemcore.monitor.domain.extract.AttachmentFormat;
import me.golemcore.monitor.domain.model.Attachment;
import me.golemcore.monitor.domain.model.AttachmentMatch;
import me.golemcore.monitor.domain.model.ExtractionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the extractor for an attachment and checks whether the extracted text
 * contains the keyword, ignoring case.
 *
 * <p>
 * Unsupported and undecodable attachments never match. Exceptions escaping an
 * extractor are not caught here; the cycle treats them as a failure of the
 * whole message.
 */
@Service
@Slf4j
public class AttachmentClassifier {

    private final Map<AttachmentFormat, AttachmentExtractor> extractors = new EnumMap<>(AttachmentFormat.class);

    public AttachmentClassifier(List<AttachmentExtractor> extractors) {
        for (AttachmentExtractor extractor : extractors) {
            this.extractors.put(extractor.format(), extractor);
        }
    }

    public AttachmentMatch classify(Attachment attachment, String keyword) {
        AttachmentFormat format = AttachmentFormat.detect(attachment);
        AttachmentExtractor extractor = extractors.get(format);
        if (extractor == null) {
            log.debug("[Classify] Unsupported attachment: {} ({})", attachment.filename(), attachment.mimeHint());
            return AttachmentMatch.of(attachment.filename(), ExtractionResult.unsupported(), false);
        }

        ExtractionResult result = extractor.extract(attachment);
        boolean matched = result.isText() && containsIgnoreCase(result.text(), keyword);
        if (matched && result.listingOnly()) {
            log.debug("[Classify] Keyword found in archive listing of {}", attachment.filename());
        }
        return AttachmentMatch.of(attachment.filename(), result, matched);
    }

    static boolean containsIgnoreCase(String text, String keyword) {
        if (keyword == null || keyword.isEmpty()) {
            return false;
        }
        return text.toLowerCase(Locale.ROOT).contains(keyword.toLowerCase(Locale.ROOT));
    }
}
