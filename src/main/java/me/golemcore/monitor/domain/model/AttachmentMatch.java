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
 * Keyword verdict for a single attachment. {@code listingOnly} marks a verdict
 * reached against an archive's entry names rather than its content;
 * {@code failureReason} is set only when the attachment could not be decoded.
 */
public record AttachmentMatch(String filename, boolean matched, ExtractionResult.Kind extraction,
        boolean listingOnly, String failureReason) {

    public static AttachmentMatch of(String filename, ExtractionResult result, boolean matched) {
        return new AttachmentMatch(filename, matched, result.kind(), result.listingOnly(), result.reason());
    }

    public boolean isDecodeError() {
        return extraction == ExtractionResult.Kind.DECODE_ERROR;
    }
}
