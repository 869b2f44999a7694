package com.mymemo.service;

import com.mymemo.entity.Reminder;
import com.mymemo.repository.ReminderRepository;
import com.mymemo.repository.RepositoryException;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;

@Singleton
public class ConversationEngine {
    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    private static final String WHATSAPP_PREFIX = "whatsapp:";
    private static final Pattern PRIORITY = Pattern.compile("[+-]?[0-9]+");
    private static final DateTimeFormatter SAVED_AT = DateTimeFormatter.ofPattern("MMM dd HH:mm", Locale.ENGLISH);

    private final ConversationStateStore stateStore;
    private final IntentClassifier intentClassifier;
    private final DeleteTargetParser deleteTargetParser;
    private final ReminderRepository repository;
    private final TextIntelligence textIntelligence;
    private final MeterRegistry meterRegistry;
    private final Counter remindersCreated;

    @Inject
    public ConversationEngine(ConversationStateStore stateStore,
                              IntentClassifier intentClassifier,
                              DeleteTargetParser deleteTargetParser,
                              ReminderRepository repository,
                              TextIntelligence textIntelligence,
                              MeterRegistry meterRegistry) {
        this.stateStore = stateStore;
        this.intentClassifier = intentClassifier;
        this.deleteTargetParser = deleteTargetParser;
        this.repository = repository;
        this.textIntelligence = textIntelligence;
        this.meterRegistry = meterRegistry;
        this.remindersCreated = Counter.builder("mymemo.reminders.created")
                .description("Reminders saved through the add flow")
                .register(meterRegistry);
        Gauge.builder("mymemo.conversations.pending", stateStore, ConversationStateStore::pendingCount)
                .description("Users who sent a reminder but no priority yet")
                .register(meterRegistry);
    }

    public String handleMessage(String from, String body) {
        String userId = normalizeSender(from);
        String text = body == null ? "" : body.strip();
        if (userId.isEmpty() || text.isEmpty()) {
            return BotReplies.EMPTY_MESSAGE;
        }

        if (stateStore.isAwaitingPriority(userId)) {
            countMessage("priority");
            return handlePriorityResponse(userId, text);
        }

        IntentResolution resolution = intentClassifier.classify(text);
        countMessage(resolution.intent().getLabel());
        log.debug("User {} message resolved to {}", userId, resolution.intent());

        switch (resolution.intent()) {
            case LIST_REMINDERS:
                return listReminders(userId);
            case CLEAR_REMINDERS:
                return clearReminders(userId);
            case DELETE_REMINDER:
                if (resolution.deleteKeyword().isEmpty()) {
                    return BotReplies.ASK_DELETE_TARGET;
                }
                return deleteReminders(userId, resolution.deleteKeyword());
            case HELP:
                return BotReplies.HELP;
            case ADD_REMINDER:
            default:
                stateStore.setPendingMessage(userId, text);
                return BotReplies.ASK_PRIORITY;
        }
    }

    private String handlePriorityResponse(String userId, String text) {
        if (!PRIORITY.matcher(text).matches()) {
            return BotReplies.INVALID_PRIORITY;
        }
        int priority;
        try {
            priority = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return BotReplies.INVALID_PRIORITY;
        }
        if (!Reminder.isValidPriority(priority)) {
            return BotReplies.INVALID_PRIORITY;
        }

        Optional<String> pending = stateStore.popPendingMessage(userId);
        if (pending.isEmpty()) {
            return BotReplies.LOST_PENDING;
        }

        String content = pending.get();
        String summary = summarize(content);
        try {
            long id = repository.create(userId, content, priority, summary);
            remindersCreated.increment();
            log.info("Saved reminder {} for user {}", id, userId);
        } catch (RepositoryException | IllegalArgumentException e) {
            log.error("Failed to save reminder for user {}", userId, e);
            return BotReplies.SAVE_FAILED;
        }
        return String.format(BotReplies.SAVED, summary, priority);
    }

    private String summarize(String content) {
        try {
            String summary = textIntelligence.summarize(content).get();
            if (summary == null || summary.isBlank()) {
                return FallbackTextIntelligence.truncate(content);
            }
            return summary;
        } catch (ExecutionException e) {
            log.warn("Summarisation failed, truncating instead: {}", e.getCause().toString());
            return FallbackTextIntelligence.truncate(content);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FallbackTextIntelligence.truncate(content);
        }
    }

    private String listReminders(String userId) {
        List<Reminder> reminders;
        try {
            reminders = repository.listByUser(userId);
        } catch (RepositoryException e) {
            log.error("Failed to list reminders for user {}", userId, e);
            return BotReplies.LIST_FAILED;
        }
        if (reminders.isEmpty()) {
            return BotReplies.NO_REMINDERS;
        }

        StringBuilder sb = new StringBuilder(BotReplies.LIST_HEADER);
        for (int i = 0; i < reminders.size(); i++) {
            Reminder reminder = reminders.get(i);
            sb.append(i + 1).append(". [").append(reminder.getPriority()).append("] ")
                    .append(reminder.getDisplayText());
            if (reminder.getCreatedAt() != null) {
                sb.append(" - saved ").append(SAVED_AT.format(reminder.getCreatedAt()));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private String clearReminders(String userId) {
        try {
            if (repository.deleteAllByUser(userId) == 0) {
                throw new UserFacingException(BotReplies.NOTHING_TO_CLEAR);
            }
            return BotReplies.CLEARED;
        } catch (UserFacingException e) {
            return e.getMessage();
        } catch (RepositoryException e) {
            log.error("Failed to clear reminders for user {}", userId, e);
            return BotReplies.CLEAR_FAILED;
        }
    }

    private String deleteReminders(String userId, String keyword) {
        List<Integer> indices = deleteTargetParser.parseIndices(keyword);
        try {
            if (!indices.isEmpty()) {
                deleteByIndices(userId, indices);
                return String.format(BotReplies.DELETED_INDICES, deleteTargetParser.formatIndices(indices));
            }
            if (repository.deleteByUserAndContentSubstring(userId, keyword) == 0) {
                throw new UserFacingException(BotReplies.NO_MATCH);
            }
            return String.format(BotReplies.DELETED_MATCHING, keyword);
        } catch (UserFacingException e) {
            return e.getMessage();
        } catch (RepositoryException e) {
            log.error("Failed to delete reminders '{}' for user {}", keyword, userId, e);
            return BotReplies.DELETE_FAILED;
        }
    }

    // all positions are validated before anything is deleted
    private void deleteByIndices(String userId, List<Integer> indices) {
        List<Reminder> reminders = repository.listByUser(userId);
        if (reminders.isEmpty()) {
            throw new UserFacingException(BotReplies.NO_REMINDERS_TO_DELETE);
        }

        List<Long> ids = new ArrayList<>(indices.size());
        for (int index : indices) {
            if (index < 1 || index > reminders.size()) {
                throw new UserFacingException(
                        String.format(BotReplies.INDEX_OUT_OF_RANGE, index, reminders.size()));
            }
            ids.add(reminders.get(index - 1).getId());
        }

        if (repository.deleteByUserAndIds(userId, ids) == 0) {
            throw new UserFacingException(BotReplies.INDEX_DELETE_NOTHING);
        }
    }

    private void countMessage(String kind) {
        meterRegistry.counter("mymemo.messages.inbound", "kind", kind).increment();
    }

    public static String normalizeSender(String from) {
        if (from == null) {
            return "";
        }
        String trimmed = from.strip();
        if (trimmed.startsWith(WHATSAPP_PREFIX)) {
            return trimmed.substring(WHATSAPP_PREFIX.length());
        }
        return trimmed;
    }
}
