package me.golemcore.monitor.domain.service;

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

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;

/**
 * Display helpers for mail sender strings such as
 * {@code "Varun K" <varun@example.com>} or {@code varun@example.com (Varun K)}.
 */
public final class SenderFormatter {

    private SenderFormatter() {
    }

    /**
     * The human-readable part of a sender: the personal name when present,
     * otherwise the bare address. Unparseable values are returned as given.
     * Never null.
     */
    public static String displayName(String sender) {
        if (sender == null || sender.isBlank()) {
            return "";
        }
        String value = sender.strip();
        try {
            InternetAddress address = new InternetAddress(value, false);
            String personal = address.getPersonal();
            if (personal != null && !personal.isBlank()) {
                return personal.strip();
            }
            return address.getAddress() != null ? address.getAddress() : value;
        } catch (AddressException e) {
            return value;
        }
    }
}
