package com.mymemo.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQueries;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "reminders")
@NamedQueries({
        @NamedQuery(name = "Reminder.findByUser",
                query = "SELECT r FROM Reminder r WHERE r.userId = :userId " +
                        "ORDER BY r.priority DESC, r.createdAt ASC, r.id ASC"),
        @NamedQuery(name = "Reminder.findDistinctUsers",
                query = "SELECT DISTINCT r.userId FROM Reminder r"),
        @NamedQuery(name = "Reminder.deleteByUserAndIds",
                query = "DELETE FROM Reminder r WHERE r.userId = :userId AND r.id IN :ids"),
        @NamedQuery(name = "Reminder.deleteByUserAndContent",
                query = "DELETE FROM Reminder r WHERE r.userId = :userId " +
                        "AND LOWER(r.content) LIKE :pattern ESCAPE '\\'"),
        @NamedQuery(name = "Reminder.deleteByUser",
                query = "DELETE FROM Reminder r WHERE r.userId = :userId")
})
public class Reminder {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(nullable = false)
    private int priority;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public Reminder() {}

    public Reminder(String userId, String content, int priority, String summary) {
        this.userId = userId;
        this.content = content;
        this.priority = priority;
        this.summary = summary;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    /**
     * Text shown to the user: the summary when there is one, the raw content otherwise.
     */
    public String getDisplayText() {
        if (summary == null || summary.isBlank()) {
            return content;
        }
        return summary;
    }

    public static boolean isValidPriority(int priority) {
        return priority >= MIN_PRIORITY && priority <= MAX_PRIORITY;
    }

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    @Override
    public String toString() {
        return "Reminder{id=" + id + ", userId='" + userId + "', priority=" + priority + "}";
    }
}
