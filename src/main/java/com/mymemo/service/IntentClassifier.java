package com.mymemo.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

@Singleton
public class IntentClassifier {
    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private static final Set<String> CLEAR_PHRASES = Set.of(
            "clear all reminders",
            "clear reminders",
            "delete all reminders"
    );

    private static final Set<String> LIST_PHRASES = Set.of(
            "show my reminders",
            "list my reminders",
            "show reminders",
            "list reminders"
    );

    private final DeleteTargetParser deleteTargetParser;
    private final TextIntelligence textIntelligence;

    @Inject
    public IntentClassifier(DeleteTargetParser deleteTargetParser, TextIntelligence textIntelligence) {
        this.deleteTargetParser = deleteTargetParser;
        this.textIntelligence = textIntelligence;
    }

    public IntentResolution classify(String message) {
        String lower = message.trim().toLowerCase(Locale.ROOT);

        if (CLEAR_PHRASES.contains(lower)) {
            return IntentResolution.of(Intent.CLEAR_REMINDERS);
        }
        if (isListRequest(lower)) {
            return IntentResolution.of(Intent.LIST_REMINDERS);
        }
        String keyword = deleteTargetParser.extractDeleteKeyword(message);
        if (!keyword.isEmpty()) {
            return IntentResolution.delete(keyword);
        }

        return classifyWithModel(message);
    }

    private boolean isListRequest(String lower) {
        if (LIST_PHRASES.stream().anyMatch(lower::contains)) {
            return true;
        }
        return (lower.contains("list") || lower.contains("show")) && lower.contains("reminder");
    }

    private IntentResolution classifyWithModel(String message) {
        String label;
        try {
            label = textIntelligence.classifyIntent(message).get();
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (!(cause instanceof TextIntelligenceNotConfiguredException)) {
                log.warn("Intent classification failed, treating message as a new reminder: {}",
                        cause.toString());
            }
            return IntentResolution.of(Intent.ADD_REMINDER);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return IntentResolution.of(Intent.ADD_REMINDER);
        }

        Optional<Intent> intent = Intent.fromLabel(label);
        if (intent.isEmpty()) {
            return IntentResolution.of(Intent.ADD_REMINDER);
        }
        if (intent.get() == Intent.DELETE_REMINDER) {
            return IntentResolution.delete(deleteTargetParser.extractDeleteKeyword(message));
        }
        return IntentResolution.of(intent.get());
    }
}
