package com.mymemo.config;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

@Singleton
public class BotConfig {
    private static final Logger log = LoggerFactory.getLogger(BotConfig.class);

    private static final List<String> KEYS = List.of(
            "PORT",
            "LOCAL_TIMEZONE",
            "DISPATCH_TIME",
            "DISPATCH_SPACING",
            "DISPATCH_WORKERS",
            "SHUTDOWN_TIMEOUT",
            "WEBHOOK_TIMEOUT",
            "ENGINE_THREADS",
            "TWILIO_ACCOUNT_SID",
            "TWILIO_AUTH_TOKEN",
            "TWILIO_WHATSAPP_NUMBER",
            "TWILIO_API_BASE",
            "OPENAI_API_KEY",
            "OPENAI_MODEL",
            "OPENAI_API_BASE",
            "OPENAI_CLASSIFY_TIMEOUT",
            "OPENAI_SUMMARIZE_TIMEOUT"
    );

    private final Map<String, String> properties = new HashMap<>();

    public BotConfig() {
        loadFromEnvironment();
        loadFromPropertiesFile();
        setDefaults();
        logConfiguration();
    }

    public BotConfig(Map<String, String> values) {
        values.forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                properties.put(key, value.trim());
            }
        });
        setDefaults();
    }

    private void loadFromEnvironment() {
        for (String key : KEYS) {
            String value = Optional.ofNullable(System.getenv(key))
                    .or(() -> Optional.ofNullable(System.getProperty(key)))
                    .orElse(null);
            if (value != null && !value.trim().isEmpty()) {
                properties.put(key, value.trim());
            }
        }
    }

    private void loadFromPropertiesFile() {
        try (InputStream input = getClass().getClassLoader()
                .getResourceAsStream("mymemo.properties")) {
            if (input != null) {
                Properties fileProps = new Properties();
                fileProps.load(input);

                fileProps.forEach((key, value) -> {
                    String keyStr = key.toString();
                    if (!properties.containsKey(keyStr) && !value.toString().isBlank()) {
                        properties.put(keyStr, value.toString().trim());
                    }
                });
                log.info("Bot configuration loaded from file");
            }
        } catch (IOException e) {
            log.debug("mymemo.properties not found, using defaults");
        }
    }

    private void setDefaults() {
        properties.putIfAbsent("PORT", "8080");
        properties.putIfAbsent("LOCAL_TIMEZONE", ZoneId.systemDefault().getId());
        properties.putIfAbsent("DISPATCH_TIME", "08:00");
        properties.putIfAbsent("DISPATCH_SPACING", "PT1H");
        properties.putIfAbsent("DISPATCH_WORKERS", "4");
        properties.putIfAbsent("SHUTDOWN_TIMEOUT", "PT10S");
        properties.putIfAbsent("WEBHOOK_TIMEOUT", "PT30S");
        properties.putIfAbsent("ENGINE_THREADS", "8");
        properties.putIfAbsent("TWILIO_API_BASE", "https://api.twilio.com");
        properties.putIfAbsent("OPENAI_MODEL", "gpt-4o-mini");
        properties.putIfAbsent("OPENAI_API_BASE", "https://api.openai.com/v1");
        properties.putIfAbsent("OPENAI_CLASSIFY_TIMEOUT", "PT10S");
        properties.putIfAbsent("OPENAI_SUMMARIZE_TIMEOUT", "PT15S");
    }

    private void logConfiguration() {
        log.info("=== Bot Configuration ===");
        log.info("Port: {}", getPort());
        log.info("Timezone: {}", getTimezone());
        log.info("Daily dispatch at {} spaced by {}", getDispatchTime(), getDispatchSpacing());
        log.info("Twilio account: {}", mask(getTwilioAccountSid()));
        log.info("Twilio sender: {}", getTwilioWhatsAppNumber());
        log.info("OpenAI configured: {} (model {})", isOpenAiConfigured(), getOpenAiModel());
        log.info("=========================");
    }

    private static String mask(String value) {
        if (value == null || value.isEmpty()) {
            return "<not set>";
        }
        if (value.length() <= 4) {
            return "***";
        }
        return value.substring(0, 4) + "***";
    }

    public int getPort() {
        return parseInt("PORT", 8080);
    }

    public ZoneId getTimezone() {
        String zone = properties.get("LOCAL_TIMEZONE");
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("Invalid LOCAL_TIMEZONE '{}', defaulting to system zone", zone);
            return ZoneId.systemDefault();
        }
    }

    public LocalTime getDispatchTime() {
        String time = properties.get("DISPATCH_TIME");
        try {
            return LocalTime.parse(time);
        } catch (DateTimeParseException e) {
            log.warn("Invalid DISPATCH_TIME '{}', defaulting to 08:00", time);
            return LocalTime.of(8, 0);
        }
    }

    public Duration getDispatchSpacing() {
        return parseDuration("DISPATCH_SPACING", Duration.ofHours(1));
    }

    public int getDispatchWorkers() {
        return parseInt("DISPATCH_WORKERS", 4);
    }

    public Duration getShutdownTimeout() {
        return parseDuration("SHUTDOWN_TIMEOUT", Duration.ofSeconds(10));
    }

    public Duration getWebhookTimeout() {
        return parseDuration("WEBHOOK_TIMEOUT", Duration.ofSeconds(30));
    }

    public int getEngineThreads() {
        return parseInt("ENGINE_THREADS", 8);
    }

    public String getTwilioAccountSid() { return properties.get("TWILIO_ACCOUNT_SID"); }
    public String getTwilioAuthToken() { return properties.get("TWILIO_AUTH_TOKEN"); }
    public String getTwilioWhatsAppNumber() { return properties.get("TWILIO_WHATSAPP_NUMBER"); }
    public String getTwilioApiBase() { return properties.get("TWILIO_API_BASE"); }

    public String getOpenAiApiKey() { return properties.get("OPENAI_API_KEY"); }
    public String getOpenAiModel() { return properties.get("OPENAI_MODEL"); }
    public String getOpenAiApiBase() { return properties.get("OPENAI_API_BASE"); }

    public boolean isOpenAiConfigured() {
        String key = getOpenAiApiKey();
        return key != null && !key.isBlank();
    }

    public Duration getOpenAiClassifyTimeout() {
        return parseDuration("OPENAI_CLASSIFY_TIMEOUT", Duration.ofSeconds(10));
    }

    public Duration getOpenAiSummarizeTimeout() {
        return parseDuration("OPENAI_SUMMARIZE_TIMEOUT", Duration.ofSeconds(15));
    }

    private int parseInt(String key, int defaultValue) {
        try {
            return Integer.parseInt(properties.get(key));
        } catch (NumberFormatException e) {
            log.warn("Unable to parse {}='{}' as int, using {}", key, properties.get(key), defaultValue);
            return defaultValue;
        }
    }

    private Duration parseDuration(String key, Duration defaultValue) {
        try {
            return Duration.parse(properties.get(key));
        } catch (DateTimeParseException e) {
            log.warn("Unable to parse {}='{}' as ISO-8601 duration, using {}",
                    key, properties.get(key), defaultValue);
            return defaultValue;
        }
    }
}
