package com.mymemo.service;

import com.mymemo.config.BotConfig;
import com.mymemo.entity.Reminder;
import com.mymemo.repository.ReminderRepository;
import com.mymemo.repository.RepositoryException;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Singleton
public class ReminderDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReminderDispatcher.class);

    private final ReminderRepository repository;
    private final MessageSender messageSender;
    private final Duration spacing;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final Clock clock;
    private final Counter sent;
    private final Counter failed;
    private final AtomicLong cycleIds = new AtomicLong();
    private final Queue<DispatchCycle> activeCycles = new ConcurrentLinkedQueue<>();

    @Inject
    public ReminderDispatcher(ReminderRepository repository,
                              MessageSender messageSender,
                              BotConfig config,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this(repository, messageSender, config.getDispatchSpacing(),
                Executors.newFixedThreadPool(config.getDispatchWorkers()),
                createTimer(), clock, meterRegistry);
    }

    ReminderDispatcher(ReminderRepository repository,
                       MessageSender messageSender,
                       Duration spacing,
                       ExecutorService workers,
                       ScheduledExecutorService timer,
                       Clock clock,
                       MeterRegistry meterRegistry) {
        this.repository = repository;
        this.messageSender = messageSender;
        this.spacing = spacing;
        this.workers = workers;
        this.timer = timer;
        this.clock = clock;
        this.sent = Counter.builder("mymemo.dispatch.sends")
                .tag("outcome", "sent")
                .register(meterRegistry);
        this.failed = Counter.builder("mymemo.dispatch.sends")
                .tag("outcome", "failed")
                .register(meterRegistry);
    }

    private static ScheduledExecutorService createTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(2);
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    public DispatchCycle startCycle() {
        activeCycles.removeIf(DispatchCycle::isFinished);
        DispatchCycle cycle = new DispatchCycle(cycleIds.incrementAndGet(), clock.instant());

        List<String> users;
        try {
            users = repository.distinctUserIds();
        } catch (RepositoryException e) {
            log.error("Dispatch cycle {}: failed to fetch users", cycle.getId(), e);
            return cycle;
        }

        activeCycles.add(cycle);
        log.info("Dispatch cycle {} started for {} user(s)", cycle.getId(), users.size());
        for (String userId : users) {
            try {
                cycle.track(workers.submit(() -> dispatchUser(cycle, userId)));
            } catch (RejectedExecutionException e) {
                log.warn("Dispatch cycle {}: dispatcher is shutting down, user {} skipped",
                        cycle.getId(), userId);
            }
        }
        return cycle;
    }

    void dispatchUser(DispatchCycle cycle, String userId) {
        List<Reminder> reminders;
        try {
            reminders = repository.listByUser(userId);
        } catch (RepositoryException e) {
            log.error("Dispatch cycle {}: failed to load reminders of user {}", cycle.getId(), userId, e);
            return;
        }

        for (int i = 0; i < reminders.size(); i++) {
            Reminder reminder = reminders.get(i);
            String text = String.format(BotReplies.SCHEDULED_REMINDER,
                    reminder.getDisplayText(), reminder.getPriority());
            long delayMillis = spacing.multipliedBy(i).toMillis();
            try {
                cycle.track(timer.schedule(() -> deliver(userId, reminder.getId(), text),
                        delayMillis, TimeUnit.MILLISECONDS));
            } catch (RejectedExecutionException e) {
                log.warn("Dispatch cycle {}: timer stopped, {} reminder(s) of user {} not scheduled",
                        cycle.getId(), reminders.size() - i, userId);
                return;
            }
        }
        log.debug("Dispatch cycle {}: scheduled {} reminder(s) for user {}",
                cycle.getId(), reminders.size(), userId);
    }

    private void deliver(String userId, Long reminderId, String text) {
        try {
            messageSender.send(userId, text).whenComplete((sid, ex) -> {
                if (ex != null) {
                    failed.increment();
                    log.error("Failed to send reminder {} to user {}", reminderId, userId, ex);
                } else {
                    sent.increment();
                }
            });
        } catch (RuntimeException e) {
            failed.increment();
            log.error("Failed to send reminder {} to user {}", reminderId, userId, e);
        }
    }

    public int pendingSends() {
        return activeCycles.stream().mapToInt(DispatchCycle::pendingCount).sum();
    }

    @Override
    public void close() {
        int abandoned = 0;
        for (DispatchCycle cycle : activeCycles) {
            abandoned += cycle.cancel();
        }
        activeCycles.clear();
        workers.shutdownNow();
        timer.shutdownNow();
        if (abandoned > 0) {
            log.warn("Dispatcher stopped, abandoned {} pending reminder send(s)", abandoned);
        } else {
            log.info("Dispatcher stopped");
        }
    }
}
