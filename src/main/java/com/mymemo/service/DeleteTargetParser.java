package com.mymemo.service;

import com.google.inject.Singleton;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Singleton
public class DeleteTargetParser {

    private static final Pattern INDEX_LIST = Pattern.compile("^\\s*\\d+(?:[\\s,]+\\d+)*\\s*$");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");
    private static final Pattern DELETE_KEYWORD = Pattern.compile(
            "delete(?:\\s+reminders?(?:\\s+about)?)?\\s*(.*)",
            Pattern.CASE_INSENSITIVE);

    public List<Integer> parseIndices(String text) {
        if (text == null || !INDEX_LIST.matcher(text).matches()) {
            return List.of();
        }

        Set<Integer> indices = new LinkedHashSet<>();
        for (String part : SEPARATORS.split(text.trim())) {
            if (part.isEmpty()) {
                continue;
            }
            int value;
            try {
                value = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                return List.of();
            }
            if (value <= 0) {
                return List.of();
            }
            indices.add(value);
        }
        return new ArrayList<>(indices);
    }

    public String extractDeleteKeyword(String message) {
        if (message == null) {
            return "";
        }
        Matcher matcher = DELETE_KEYWORD.matcher(message);
        if (!matcher.find()) {
            return "";
        }
        return matcher.group(1).trim();
    }

    public String formatIndices(List<Integer> indices) {
        return indices.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
    }
}
