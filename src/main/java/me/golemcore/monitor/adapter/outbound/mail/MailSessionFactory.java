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

import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import jakarta.mail.Authenticator;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;

import java.util.Properties;

/**
 * Creates Jakarta Mail sessions for the IMAP mail source with the configured
 * security mode and timeouts.
 *
 * <p>
 * Not a Spring bean; used directly by {@link ImapMailSourceAdapter}.
 */
public final class MailSessionFactory {

    private static final String MAIL_PREFIX = "mail.";
    private static final String TRUE_VALUE = "true";

    private MailSessionFactory() {
    }

    /**
     * Creates a session configured for IMAP.
     *
     * @param imap
     *            connection settings; timeouts in milliseconds
     * @param security
     *            connection security mode
     * @return configured Mail Session
     */
    public static Session createImapSession(MonitorProperties.ImapProperties imap, MailSecurity security) {
        Properties props = new Properties();
        String protocol = security.protocol();
        String prefix = MAIL_PREFIX + protocol + ".";

        props.put("mail.store.protocol", protocol);
        props.put(prefix + "host", imap.getHost());
        props.put(prefix + "port", String.valueOf(imap.getPort()));
        props.put(prefix + "connectiontimeout", String.valueOf(imap.getConnectTimeout()));
        props.put(prefix + "timeout", String.valueOf(imap.getReadTimeout()));
        // attachments are read in full, partial fetch only adds round trips
        props.put(prefix + "partialfetch", "false");

        if (security == MailSecurity.SSL) {
            props.put(MAIL_PREFIX + "imaps.ssl.enable", TRUE_VALUE);
        } else if (security == MailSecurity.STARTTLS) {
            props.put(MAIL_PREFIX + "imap.starttls.enable", TRUE_VALUE);
            props.put(MAIL_PREFIX + "imap.starttls.required", TRUE_VALUE);
        }
        if (security != MailSecurity.NONE && imap.getSslTrust() != null && !imap.getSslTrust().isBlank()) {
            props.put(prefix + "ssl.trust", imap.getSslTrust());
        }

        return Session.getInstance(props, createAuthenticator(imap.getUsername(), imap.getPassword()));
    }

    private static Authenticator createAuthenticator(String username, String password) {
        return new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        };
    }
}
