package com.mymemo.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BotConfigTest {

    @Test
    void constructor_WhenNothingSet_ShouldUseDefaults() {
        BotConfig config = new BotConfig(Map.of());

        assertEquals(8080, config.getPort());
        assertEquals(LocalTime.of(8, 0), config.getDispatchTime());
        assertEquals(Duration.ofHours(1), config.getDispatchSpacing());
        assertEquals(Duration.ofSeconds(10), config.getOpenAiClassifyTimeout());
        assertEquals(Duration.ofSeconds(15), config.getOpenAiSummarizeTimeout());
        assertEquals("gpt-4o-mini", config.getOpenAiModel());
        assertEquals("https://api.twilio.com", config.getTwilioApiBase());
        assertEquals(ZoneId.systemDefault(), config.getTimezone());
        assertNull(config.getTwilioAccountSid());
        assertFalse(config.isOpenAiConfigured());
    }

    @Test
    void constructor_WhenValuesGiven_ShouldOverrideDefaults() {
        BotConfig config = new BotConfig(Map.of(
                "PORT", "9090",
                "LOCAL_TIMEZONE", "Asia/Tokyo",
                "DISPATCH_TIME", "07:45",
                "DISPATCH_SPACING", "PT30M",
                "OPENAI_API_KEY", " sk-live "));

        assertEquals(9090, config.getPort());
        assertEquals(ZoneId.of("Asia/Tokyo"), config.getTimezone());
        assertEquals(LocalTime.of(7, 45), config.getDispatchTime());
        assertEquals(Duration.ofMinutes(30), config.getDispatchSpacing());
        assertTrue(config.isOpenAiConfigured());
        assertEquals("sk-live", config.getOpenAiApiKey());
    }

    @Test
    void getters_WhenValuesMalformed_ShouldFallBackToDefaults() {
        BotConfig config = new BotConfig(Map.of(
                "PORT", "eighty",
                "LOCAL_TIMEZONE", "Mars/Olympus",
                "DISPATCH_TIME", "8am",
                "DISPATCH_SPACING", "1h"));

        assertEquals(8080, config.getPort());
        assertEquals(ZoneId.systemDefault(), config.getTimezone());
        assertEquals(LocalTime.of(8, 0), config.getDispatchTime());
        assertEquals(Duration.ofHours(1), config.getDispatchSpacing());
    }

    @Test
    void isOpenAiConfigured_WhenKeyBlank_ShouldBeFalse() {
        assertFalse(new BotConfig(Map.of("OPENAI_API_KEY", "   ")).isOpenAiConfigured());
    }
}
