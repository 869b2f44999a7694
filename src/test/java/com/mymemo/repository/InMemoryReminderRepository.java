package com.mymemo.repository;

import com.mymemo.entity.Reminder;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Ordering and matching rules of {@link JpaReminderRepository} over a plain list. Set
 * {@link #failing} to make every call throw like a dropped database connection.
 */
public class InMemoryReminderRepository implements ReminderRepository {

    private static final Comparator<Reminder> LIST_ORDER = Comparator
            .comparingInt(Reminder::getPriority).reversed()
            .thenComparing(Reminder::getCreatedAt)
            .thenComparing(Reminder::getId);

    private final List<Reminder> reminders = new ArrayList<>();
    private LocalDateTime clock = LocalDateTime.of(2024, 1, 2, 15, 4);
    private long nextId = 1;
    public volatile boolean failing;

    @Override
    public synchronized long create(String userId, String content, int priority, String summary) {
        checkAvailable();
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content cannot be empty");
        }
        if (!Reminder.isValidPriority(priority)) {
            throw new IllegalArgumentException("priority must be between 1 and 5");
        }
        Reminder reminder = new Reminder(userId, content, priority, summary);
        reminder.setId(nextId++);
        reminder.setCreatedAt(clock);
        clock = clock.plusMinutes(1);
        reminders.add(reminder);
        return reminder.getId();
    }

    @Override
    public synchronized List<Reminder> listByUser(String userId) {
        checkAvailable();
        return reminders.stream()
                .filter(r -> r.getUserId().equals(userId))
                .sorted(LIST_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int deleteByUserAndIds(String userId, Collection<Long> ids) {
        checkAvailable();
        int before = reminders.size();
        reminders.removeIf(r -> r.getUserId().equals(userId) && ids.contains(r.getId()));
        return before - reminders.size();
    }

    @Override
    public synchronized int deleteByUserAndContentSubstring(String userId, String substring) {
        checkAvailable();
        String needle = substring.toLowerCase(Locale.ROOT);
        int before = reminders.size();
        reminders.removeIf(r -> r.getUserId().equals(userId)
                && r.getContent().toLowerCase(Locale.ROOT).contains(needle));
        return before - reminders.size();
    }

    @Override
    public synchronized int deleteAllByUser(String userId) {
        checkAvailable();
        int before = reminders.size();
        reminders.removeIf(r -> r.getUserId().equals(userId));
        return before - reminders.size();
    }

    @Override
    public synchronized List<String> distinctUserIds() {
        checkAvailable();
        return reminders.stream()
                .map(Reminder::getUserId)
                .distinct()
                .collect(Collectors.toList());
    }

    public synchronized int size() {
        return reminders.size();
    }

    private void checkAvailable() {
        if (failing) {
            throw new RepositoryException("database unavailable", new IllegalStateException("connection refused"));
        }
    }
}
