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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Lists the entry names of a generic ZIP archive. Entry contents are never
 * read, so the result is tagged as a listing.
 */
@Component
public class ZipListingExtractor implements AttachmentExtractor {

    @Override
    public AttachmentFormat format() {
        return AttachmentFormat.ZIP;
    }

    @Override
    public ExtractionResult extract(Attachment attachment) {
        byte[] bytes = attachment.rawBytes();
        StringBuilder sb = new StringBuilder();
        int entries = 0;

        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                sb.append(entry.getName()).append('\n');
                entries++;
            }
        } catch (IOException | IllegalArgumentException e) {
            return ExtractionResult.decodeError("unreadable ZIP: " + e.getMessage());
        }

        if (entries == 0 && !hasZipSignature(bytes)) {
            return ExtractionResult.decodeError("not a ZIP archive");
        }
        return ExtractionResult.listing(sb.toString());
    }

    private static boolean hasZipSignature(byte[] bytes) {
        return bytes.length >= 4 && bytes[0] == 'P' && bytes[1] == 'K'
                && (bytes[2] == 3 || bytes[2] == 5) && (bytes[3] == 4 || bytes[3] == 6);
    }
}
