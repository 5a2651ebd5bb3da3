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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads comma-separated values. Quoted cells may contain separators, escaped
 * quotes and line breaks; the output is one line per record with cells joined
 * by single spaces.
 */
@Component
public class CsvExtractor implements AttachmentExtractor {

    private static final char SEPARATOR = ',';
    private static final char QUOTE = '"';

    @Override
    public AttachmentFormat format() {
        return AttachmentFormat.CSV;
    }

    @Override
    public ExtractionResult extract(Attachment attachment) {
        Optional<String> decoded = TextDecoding.decode(attachment.rawBytes());
        if (decoded.isEmpty()) {
            return ExtractionResult.decodeError("binary content in CSV attachment");
        }

        StringBuilder sb = new StringBuilder();
        for (List<String> row : parse(decoded.get())) {
            String line = String.join(" ", row).strip();
            if (!line.isEmpty()) {
                sb.append(line).append('\n');
            }
        }
        return ExtractionResult.text(sb.toString());
    }

    static List<List<String>> parse(String content) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean inQuotes = false;

        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (inQuotes) {
                if (c == QUOTE) {
                    if (i + 1 < content.length() && content.charAt(i + 1) == QUOTE) {
                        cell.append(QUOTE);
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    cell.append(c);
                }
            } else if (c == QUOTE) {
                inQuotes = true;
            } else if (c == SEPARATOR) {
                row.add(cell.toString());
                cell.setLength(0);
            } else if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') {
                    i++;
                }
                row.add(cell.toString());
                cell.setLength(0);
                rows.add(row);
                row = new ArrayList<>();
            } else {
                cell.append(c);
            }
            i++;
        }

        // Unterminated quotes keep whatever was read so far.
        if (cell.length() > 0 || !row.isEmpty()) {
            row.add(cell.toString());
            rows.add(row);
        }
        return rows;
    }
}
