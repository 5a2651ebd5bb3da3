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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Decodes attachment bytes with a fallback chain: UTF-16 when a byte order mark
 * says so, then strict UTF-8, strict windows-1252 and finally ISO-8859-1, which
 * accepts any byte. Content with NUL bytes and no UTF-16 mark is binary and
 * not decoded.
 */
public final class TextDecoding {

    private static final int BINARY_SCAN_LENGTH = 8192;
    private static final List<Charset> STRICT_CHAIN = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("windows-1252"));

    private TextDecoding() {
    }

    public static Optional<String> decode(byte[] bytes) {
        if (bytes.length == 0) {
            return Optional.of("");
        }
        if (hasUtf16Bom(bytes)) {
            return Optional.of(new String(bytes, StandardCharsets.UTF_16));
        }
        if (looksBinary(bytes)) {
            return Optional.empty();
        }

        int offset = hasUtf8Bom(bytes) ? 3 : 0;
        ByteBuffer content = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
        for (Charset charset : STRICT_CHAIN) {
            try {
                return Optional.of(charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(content.duplicate())
                        .toString());
            } catch (CharacterCodingException e) {
                // next charset
            }
        }
        return Optional.of(new String(bytes, offset, bytes.length - offset, StandardCharsets.ISO_8859_1));
    }

    private static boolean hasUtf16Bom(byte[] bytes) {
        return bytes.length >= 2
                && ((bytes[0] == (byte) 0xFE && bytes[1] == (byte) 0xFF)
                        || (bytes[0] == (byte) 0xFF && bytes[1] == (byte) 0xFE));
    }

    private static boolean hasUtf8Bom(byte[] bytes) {
        return bytes.length >= 3
                && bytes[0] == (byte) 0xEF && bytes[1] == (byte) 0xBB && bytes[2] == (byte) 0xBF;
    }

    private static boolean looksBinary(byte[] bytes) {
        int limit = Math.min(bytes.length, BINARY_SCAN_LENGTH);
        for (int i = 0; i < limit; i++) {
            if (bytes[i] == 0) {
                return true;
            }
        }
        return false;
    }
}
