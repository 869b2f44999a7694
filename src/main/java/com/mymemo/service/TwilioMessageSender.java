package com.mymemo.service;

import com.mymemo.config.BotConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

@Singleton
public class TwilioMessageSender implements MessageSender {
    private static final Logger log = LoggerFactory.getLogger(TwilioMessageSender.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(20);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String accountSid;
    private final String authToken;
    private final String fromWhatsApp;
    private final String apiBase;

    @Inject
    public TwilioMessageSender(BotConfig config, HttpClient httpClient) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.accountSid = config.getTwilioAccountSid();
        this.authToken = config.getTwilioAuthToken();
        this.fromWhatsApp = config.getTwilioWhatsAppNumber();
        this.apiBase = config.getTwilioApiBase();
    }

    @Override
    public CompletableFuture<String> send(String userId, String text) {
        if (isBlank(accountSid) || isBlank(authToken)) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("twilio client not initialised"));
        }
        String sender = normalizeWhatsAppAddress(fromWhatsApp);
        if (sender.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("twilio sender WhatsApp number is not configured"));
        }
        String recipient = normalizeWhatsAppAddress(userId);
        if (recipient.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("recipient number missing or invalid"));
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("To", recipient);
        form.put("From", sender);
        form.put("Body", text);

        HttpRequest request = HttpRequest.newBuilder(messagesUri())
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", basicAuth())
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
                .build();

        log.info("Sending WhatsApp message to {} via {}", recipient, sender);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() / 100 != 2) {
                        throw new IllegalStateException("twilio send message error: status "
                                + response.statusCode() + " " + response.body());
                    }
                    String sid = extractSid(response.body());
                    log.info("Twilio message sent, SID: {}", sid);
                    return sid;
                });
    }

    URI messagesUri() {
        String base = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        return URI.create(base + "/2010-04-01/Accounts/" + accountSid + "/Messages.json");
    }

    private String basicAuth() {
        String credentials = accountSid + ":" + authToken;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private String extractSid(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            return root.path("sid").asText("");
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid Twilio response", e);
        }
    }

    static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    public static String normalizeWhatsAppAddress(String number) {
        if (number == null) {
            return "";
        }
        String trimmed = number.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        if (trimmed.startsWith("whatsapp:")) {
            return trimmed;
        }
        if (trimmed.startsWith("+")) {
            return "whatsapp:" + trimmed;
        }
        return "whatsapp:+" + trimmed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
