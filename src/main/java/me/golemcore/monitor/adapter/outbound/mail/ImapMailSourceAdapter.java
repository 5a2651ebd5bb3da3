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

import me.golemcore.monitor.domain.exception.FetchException;
import me.golemcore.monitor.domain.exception.FetchFailureKind;
import me.golemcore.monitor.domain.model.Attachment;
import me.golemcore.monitor.domain.model.MailMessage;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import me.golemcore.monitor.port.outbound.MailSourcePort;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.BodyPart;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeUtility;
import jakarta.mail.internet.ParseException;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.ReceivedDateTerm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * Mail source backed by an IMAP folder (Jakarta Mail).
 *
 * <p>
 * Each fetch opens a fresh read-only connection, searches by received date and
 * downloads the newest {@code max-messages} hits including attachment bytes.
 * The message id is the {@code Message-ID} header, or the folder UID when the
 * header is missing.
 */
@Component
@Slf4j
public class ImapMailSourceAdapter implements MailSourcePort {

    private static final int MAX_MULTIPART_DEPTH = 10;
    private static final String HEADER_MESSAGE_ID = "Message-ID";

    private final MonitorProperties.ImapProperties config;
    private final MailSecurity security;
    private final int bodyPreviewLength;

    public ImapMailSourceAdapter(MonitorProperties properties) {
        this.config = properties.getImap();
        this.security = MailSecurity.fromString(config.getSecurity());
        this.bodyPreviewLength = properties.getBodyPreviewLength();
    }

    @Override
    public List<MailMessage> fetchMessages(Instant since) {
        if (!config.isEnabled()) {
            throw new FetchException(FetchFailureKind.NETWORK,
                    "IMAP mail source is disabled (monitor.imap.enabled=false)");
        }

        log.debug("[IMAP] Fetching {} since {}", config.getFolder(), since);
        try (Store store = connectStore()) {
            Folder folder = store.getFolder(config.getFolder());
            if (!folder.exists()) {
                throw new FetchException(FetchFailureKind.NETWORK, "Folder not found: " + config.getFolder());
            }
            folder.open(Folder.READ_ONLY);
            try {
                return readMessages(folder, since);
            } finally {
                folder.close(false);
            }
        } catch (AuthenticationFailedException e) {
            throw new FetchException(FetchFailureKind.AUTH, "IMAP authentication failed", e);
        } catch (MessagingException e) {
            FetchFailureKind kind = isRateLimited(e) ? FetchFailureKind.RATE_LIMITED : FetchFailureKind.NETWORK;
            throw new FetchException(kind, "IMAP error: " + sanitizeError(e.getMessage()), e);
        } catch (IOException e) {
            throw new FetchException(FetchFailureKind.NETWORK, "IMAP I/O error: " + sanitizeError(e.getMessage()), e);
        }
    }

    Store connectStore() throws MessagingException {
        Session session = MailSessionFactory.createImapSession(config, security);
        Store store = session.getStore(security.protocol());
        store.connect(config.getHost(), config.getPort(), config.getUsername(), config.getPassword());
        return store;
    }

    private List<MailMessage> readMessages(Folder folder, Instant since) throws MessagingException, IOException {
        // IMAP SINCE has day granularity, the exact bound is checked per message
        Message[] found = folder.search(new ReceivedDateTerm(ComparisonTerm.GE, Date.from(since)));
        int startIdx = Math.max(0, found.length - config.getMaxMessages());
        if (startIdx > 0) {
            log.warn("[IMAP] {} messages in window, reading the newest {}", found.length, config.getMaxMessages());
        }

        List<MailMessage> messages = new ArrayList<>(found.length - startIdx);
        for (int i = startIdx; i < found.length; i++) {
            Message msg = found[i];
            Instant receivedAt = receivedAt(msg);
            if (receivedAt != null && receivedAt.isBefore(since)) {
                continue;
            }
            messages.add(toMailMessage(folder, msg, receivedAt));
        }
        log.info("[IMAP] Fetched {} messages from {}", messages.size(), config.getFolder());
        return messages;
    }

    private MailMessage toMailMessage(Folder folder, Message msg, Instant receivedAt)
            throws MessagingException, IOException {
        PartContent content = new PartContent();
        walk(msg, content, 0);

        String body = content.plainText != null ? content.plainText
                : content.htmlText != null ? HtmlSanitizer.stripHtml(content.htmlText) : "";

        return MailMessage.builder()
                .id(messageId(folder, msg))
                .sender(formatAddress(msg.getFrom()))
                .subject(msg.getSubject() != null ? msg.getSubject() : "")
                .receivedAt(receivedAt)
                .bodyPreview(truncate(body.strip()))
                .attachments(content.attachments)
                .build();
    }

    private void walk(Part part, PartContent content, int depth) throws MessagingException, IOException {
        if (depth > MAX_MULTIPART_DEPTH) {
            log.debug("[IMAP] Content too deeply nested, ignoring remaining parts");
            return;
        }

        if (isAttachment(part)) {
            content.attachments.add(toAttachment(part));
            return;
        }

        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                walk(bodyPart, content, depth + 1);
            }
        } else if (part.isMimeType("text/plain") && content.plainText == null) {
            Object body = part.getContent();
            content.plainText = body != null ? body.toString() : "";
        } else if (part.isMimeType("text/html") && content.htmlText == null) {
            Object body = part.getContent();
            content.htmlText = body != null ? body.toString() : "";
        }
    }

    /**
     * Explicit attachment disposition, or any non-multipart part with a
     * filename. {@code getFileName()} also reads the Content-Type {@code name}
     * parameter, so parts without a disposition header are included.
     */
    private static boolean isAttachment(Part part) throws MessagingException {
        if (part.isMimeType("multipart/*")) {
            return false;
        }
        return Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition()) || part.getFileName() != null;
    }

    private static Attachment toAttachment(Part part) throws MessagingException, IOException {
        byte[] bytes;
        try (InputStream in = part.getInputStream()) {
            bytes = in.readAllBytes();
        }
        return Attachment.builder()
                .filename(decodeFilename(part.getFileName()))
                .mimeHint(baseType(part.getContentType()))
                .rawBytes(bytes)
                .build();
    }

    private String messageId(Folder folder, Message msg) throws MessagingException {
        String[] values = msg.getHeader(HEADER_MESSAGE_ID);
        if (values != null && values.length > 0 && values[0] != null && !values[0].isBlank()) {
            return values[0].strip();
        }
        if (folder instanceof UIDFolder uidFolder) {
            return folder.getFullName() + ":" + uidFolder.getUIDValidity() + ":" + uidFolder.getUID(msg);
        }
        return folder.getFullName() + "#" + msg.getMessageNumber();
    }

    private static Instant receivedAt(Message msg) throws MessagingException {
        Date date = msg.getReceivedDate();
        if (date == null) {
            date = msg.getSentDate();
        }
        return date != null ? date.toInstant() : null;
    }

    private static String formatAddress(jakarta.mail.Address[] addresses) {
        if (addresses == null || addresses.length == 0) {
            return "";
        }
        if (addresses[0] instanceof InternetAddress internetAddress) {
            return internetAddress.toUnicodeString();
        }
        return addresses[0].toString();
    }

    private static String decodeFilename(String fileName) {
        if (fileName == null) {
            return "";
        }
        try {
            return MimeUtility.decodeText(fileName);
        } catch (UnsupportedEncodingException e) {
            log.debug("[IMAP] Cannot decode filename {}: {}", fileName, e.getMessage());
            return fileName;
        }
    }

    private static String baseType(String contentType) {
        if (contentType == null) {
            return "";
        }
        try {
            return new ContentType(contentType).getBaseType().toLowerCase(Locale.ROOT);
        } catch (ParseException e) {
            log.debug("[IMAP] Malformed content type {}: {}", contentType, e.getMessage());
            return "";
        }
    }

    private String truncate(String text) {
        if (bodyPreviewLength <= 0 || text.length() <= bodyPreviewLength) {
            return text;
        }
        return text.substring(0, bodyPreviewLength);
    }

    static boolean isRateLimited(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("too many") || lower.contains("throttl") || lower.contains("rate limit")) {
                    return true;
                }
            }
        }
        return false;
    }

    String sanitizeError(String message) {
        if (message == null) {
            return "Unknown error";
        }
        String sanitized = message;
        if (config.getUsername() != null && !config.getUsername().isBlank()) {
            sanitized = sanitized.replace(config.getUsername(), "***");
        }
        if (config.getPassword() != null && !config.getPassword().isBlank()) {
            sanitized = sanitized.replace(config.getPassword(), "***");
        }
        return sanitized;
    }

    private static final class PartContent {
        private String plainText;
        private String htmlText;
        private final List<Attachment> attachments = new ArrayList<>();
    }
}
