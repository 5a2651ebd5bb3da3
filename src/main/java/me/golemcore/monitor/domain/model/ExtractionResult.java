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
 * Outcome of converting one attachment to text.
 *
 * <p>
 * {@link Kind#TEXT} results flagged {@code listingOnly} hold an archive's
 * entry names rather than document content. A keyword found there is a match
 * on the names only, and is reported as such.
 */
public record ExtractionResult(Kind kind, String text, String reason, boolean listingOnly) {

    public enum Kind {
        TEXT, UNSUPPORTED, DECODE_ERROR
    }

    private static final ExtractionResult UNSUPPORTED = new ExtractionResult(Kind.UNSUPPORTED, null, null, false);

    public static ExtractionResult text(String text) {
        return new ExtractionResult(Kind.TEXT, text != null ? text : "", null, false);
    }

    public static ExtractionResult listing(String listing) {
        return new ExtractionResult(Kind.TEXT, listing != null ? listing : "", null, true);
    }

    public static ExtractionResult unsupported() {
        return UNSUPPORTED;
    }

    public static ExtractionResult decodeError(String reason) {
        return new ExtractionResult(Kind.DECODE_ERROR, null, reason != null ? reason : "unknown", false);
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public boolean isDecodeError() {
        return kind == Kind.DECODE_ERROR;
    }
}
