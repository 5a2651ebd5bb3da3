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

import java.util.Locale;

/**
 * Connection security modes for the IMAP mail source.
 */
public enum MailSecurity {

    /** Implicit SSL/TLS on a dedicated port (993). */
    SSL,

    /** STARTTLS upgrade on the plain-text port (143). */
    STARTTLS,

    /** No encryption (not recommended). */
    NONE;

    /**
     * Parses a security mode from a string value (case-insensitive). Blank
     * means {@link #SSL}.
     *
     * @throws IllegalArgumentException
     *             if the value is not recognized
     */
    public static MailSecurity fromString(String value) {
        if (value == null || value.isBlank()) {
            return SSL;
        }
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }

    /**
     * Jakarta Mail store protocol for this mode.
     */
    public String protocol() {
        return this == SSL ? "imaps" : "imap";
    }
}
