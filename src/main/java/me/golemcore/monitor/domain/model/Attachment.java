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

import java.util.Locale;

/**
 * One attachment of a fetched message. Raw bytes live only for the duration of
 * an evaluation and are never persisted.
 */
@Builder
public record Attachment(String filename, String mimeHint, byte[] rawBytes) {

    public Attachment {
        filename = filename != null ? filename : "";
        mimeHint = mimeHint != null ? mimeHint : "";
        rawBytes = rawBytes != null ? rawBytes : new byte[0];
    }

    /**
     * Lower-case file extension without the dot, or an empty string when the
     * filename has none.
     */
    public String extension() {
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String name = filename.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * MIME type without parameters, lower-cased.
     */
    public String baseMimeType() {
        int semicolon = mimeHint.indexOf(';');
        String base = semicolon >= 0 ? mimeHint.substring(0, semicolon) : mimeHint;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    public int size() {
        return rawBytes.length;
    }
}
