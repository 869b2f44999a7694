package com.mymemo.service;

public record IntentResolution(Intent intent, String deleteKeyword) {

    public static IntentResolution of(Intent intent) {
        return new IntentResolution(intent, "");
    }

    public static IntentResolution delete(String keyword) {
        return new IntentResolution(Intent.DELETE_REMINDER, keyword == null ? "" : keyword);
    }
}
