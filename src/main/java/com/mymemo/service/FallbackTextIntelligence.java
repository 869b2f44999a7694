package com.mymemo.service;

import com.google.inject.Singleton;

import java.util.concurrent.CompletableFuture;

@Singleton
public class FallbackTextIntelligence implements TextIntelligence {

    static final int SUMMARY_LIMIT = 80;

    @Override
    public CompletableFuture<String> classifyIntent(String text) {
        return CompletableFuture.failedFuture(new TextIntelligenceNotConfiguredException());
    }

    @Override
    public CompletableFuture<String> summarize(String text) {
        if (text == null || text.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("content cannot be empty"));
        }
        return CompletableFuture.completedFuture(truncate(text));
    }

    public static String truncate(String text) {
        if (text.length() <= SUMMARY_LIMIT) {
            return text;
        }
        int end = SUMMARY_LIMIT;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + "...";
    }
}
