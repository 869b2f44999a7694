package com.mymemo.repository;

import com.mymemo.entity.Reminder;

import java.util.Collection;
import java.util.List;

/**
 * Reminder storage scoped by user. Every method may throw {@link RepositoryException}
 * when the backing store is unavailable.
 */
public interface ReminderRepository {

    long create(String userId, String content, int priority, String summary);

    /**
     * Reminders of one user, highest priority first, oldest first within a priority.
     */
    List<Reminder> listByUser(String userId);

    int deleteByUserAndIds(String userId, Collection<Long> ids);

    /**
     * Case-insensitive substring match on the reminder content.
     */
    int deleteByUserAndContentSubstring(String userId, String substring);

    int deleteAllByUser(String userId);

    List<String> distinctUserIds();
}
