package me.golemcore.monitor.adapter.outbound.mail;

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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an HTML mail body into plain text for the body preview. Drops script
 * and style blocks, converts block-level elements to newlines and decodes
 * common HTML entities.
 */
public final class HtmlSanitizer {

    private static final Pattern INVISIBLE_BLOCKS = Pattern.compile("<(script|style|head)[^>]*>.*?</\\1\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern BLOCK_TAGS = Pattern.compile("<(br|p|div|tr|li|h[1-6])[^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ALL_TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(x[0-9a-fA-F]+|[0-9]+);");
    private static final Pattern MULTI_NEWLINES = Pattern.compile("\n{3,}");
    private static final Pattern MULTI_SPACES = Pattern.compile("[ \t]{2,}");

    private HtmlSanitizer() {
    }

    /**
     * Strips HTML and returns plain text.
     *
     * @param html
     *            the HTML content
     * @return plain text with tags removed and entities decoded, never null
     */
    public static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }

        String result = INVISIBLE_BLOCKS.matcher(html).replaceAll("");
        result = BLOCK_TAGS.matcher(result).replaceAll("\n");
        result = ALL_TAGS.matcher(result).replaceAll("");
        result = decodeEntities(result);

        result = MULTI_NEWLINES.matcher(result).replaceAll("\n\n");
        result = MULTI_SPACES.matcher(result).replaceAll(" ");

        return result.strip();
    }

    private static String decodeEntities(String text) {
        String named = text
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&nbsp;", " ")
                .replace("&quot;", "\"")
                .replace("&apos;", "'");
        Matcher matcher = NUMERIC_ENTITY.matcher(named);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(decodeNumeric(matcher.group(1))));
        }
        matcher.appendTail(sb);
        // last, so "&amp;lt;" stays "&lt;"
        return sb.toString().replace("&amp;", "&");
    }

    private static String decodeNumeric(String value) {
        try {
            int codePoint = value.charAt(0) == 'x'
                    ? Integer.parseInt(value.substring(1), 16)
                    : Integer.parseInt(value);
            return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : "";
        } catch (NumberFormatException e) {
            return "";
        }
    }
}
