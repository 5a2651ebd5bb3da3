package me.golemcore.monitor.domain.extract;

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
import me.golemcore.monitor.domain.model.ExtractionResult;
import org.springframework.stereotype.Component;

@Component
public class PlainTextExtractor implements AttachmentExtractor {

    @Override
    public AttachmentFormat format() {
        return AttachmentFormat.PLAIN_TEXT;
    }

    @Override
    public ExtractionResult extract(Attachment attachment) {
        return TextDecoding.decode(attachment.rawBytes())
                .map(ExtractionResult::text)
                .orElseGet(() -> ExtractionResult.decodeError("binary content in text attachment"));
    }
}
