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

import java.util.Set;

/**
 * Attachment encodings the monitor can read, with the extensions and MIME
 * types that select them.
 *
 * <p>
 * The extension decides. The MIME type is consulted only when the filename
 * has no extension or a generic one ({@code bin}, {@code dat}, {@code tmp}).
 * Anything else resolves to {@link #UNKNOWN}.
 */
public enum AttachmentFormat {

    PLAIN_TEXT(Set.of("txt", "text", "log"), Set.of("text/plain")),

    CSV(Set.of("csv"), Set.of("text/csv", "application/csv", "text/comma-separated-values")),

    PDF(Set.of("pdf"), Set.of("application/pdf", "application/x-pdf")),

    DOCX(Set.of("docx"), Set.of("application/vnd.openxmlformats-officedocument.wordprocessingml.document")),

    XLSX(Set.of("xlsx"), Set.of("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet")),

    ZIP(Set.of("zip"), Set.of("application/zip", "application/x-zip-compressed", "application/x-zip")),

    UNKNOWN(Set.of(), Set.of());

    private static final Set<String> GENERIC_EXTENSIONS = Set.of("bin", "dat", "tmp");

    private final Set<String> extensions;
    private final Set<String> mimeTypes;

    AttachmentFormat(Set<String> extensions, Set<String> mimeTypes) {
        this.extensions = extensions;
        this.mimeTypes = mimeTypes;
    }

    public static AttachmentFormat detect(Attachment attachment) {
        String extension = attachment.extension();
        if (!extension.isEmpty() && !GENERIC_EXTENSIONS.contains(extension)) {
            return byExtension(extension);
        }
        return byMimeType(attachment.baseMimeType());
    }

    static AttachmentFormat byExtension(String extension) {
        for (AttachmentFormat format : values()) {
            if (format.extensions.contains(extension)) {
                return format;
            }
        }
        return UNKNOWN;
    }

    static AttachmentFormat byMimeType(String mimeType) {
        for (AttachmentFormat format : values()) {
            if (format.mimeTypes.contains(mimeType)) {
                return format;
            }
        }
        return UNKNOWN;
    }
}
