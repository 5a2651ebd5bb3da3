package me.golemcore.monitor.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SenderFormatterTest {

    @Test
    void shouldReturnPersonalName() {
        assertEquals("Varun Kumar", SenderFormatter.displayName("Varun Kumar <varun@example.com>"));
    }

    @Test
    void shouldUnquotePersonalName() {
        assertEquals("Kumar, Varun", SenderFormatter.displayName("\"Kumar, Varun\" <varun@example.com>"));
    }

    @Test
    void shouldFallBackToAddressWithoutName() {
        assertEquals("varun@example.com", SenderFormatter.displayName("<varun@example.com>"));
        assertEquals("varun@example.com", SenderFormatter.displayName("varun@example.com"));
    }

    @Test
    void shouldHandleMissingSender() {
        assertEquals("", SenderFormatter.displayName(null));
        assertEquals("", SenderFormatter.displayName("  "));
    }

    @Test
    void shouldReadPersonalNameFromCommentForm() {
        assertEquals("Varun K", SenderFormatter.displayName("varun@example.com (Varun K)"));
    }

    @Test
    void shouldDecodeEncodedPersonalName() {
        assertEquals("Zoë", SenderFormatter.displayName("=?UTF-8?B?Wm/Dqw==?= <zoe@example.com>"));
    }

    @Test
    void shouldReturnUnparseableSenderAsGiven() {
        assertEquals("a@b, c@d", SenderFormatter.displayName("a@b, c@d"));
    }
}
