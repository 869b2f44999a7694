package com.mymemo.service;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Intent {
    ADD_REMINDER("add_reminder"),
    LIST_REMINDERS("list_reminders"),
    DELETE_REMINDER("delete_reminder"),
    CLEAR_REMINDERS("clear_reminders"),
    HELP("help");

    private final String label;

    Intent(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<Intent> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(intent -> intent.label.equals(normalized))
                .findFirst();
    }
}
