package com.mymemo.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FallbackTextIntelligenceTest {

    private final FallbackTextIntelligence intelligence = new FallbackTextIntelligence();

    @Test
    void summarize_WhenShort_ShouldReturnTextUnchanged() {
        assertEquals("Buy milk", intelligence.summarize("Buy milk").join());
    }

    @Test
    void summarize_WhenLong_ShouldTruncateTo80WithEllipsis() {
        String summary = intelligence.summarize("a".repeat(81)).join();

        assertEquals("a".repeat(80) + "...", summary);
    }

    @Test
    void summarize_WhenBlank_ShouldFail() {
        CompletionException e = assertThrows(CompletionException.class,
                () -> intelligence.summarize("  ").join());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void truncate_ShouldNotSplitSurrogatePair() {
        String text = "a".repeat(79) + "😀" + "tail";

        assertEquals("a".repeat(79) + "...", FallbackTextIntelligence.truncate(text));
    }

    @Test
    void classifyIntent_ShouldReportNotConfigured() {
        CompletionException e = assertThrows(CompletionException.class,
                () -> intelligence.classifyIntent("list reminders").join());
        assertInstanceOf(TextIntelligenceNotConfiguredException.class, e.getCause());
    }
}
