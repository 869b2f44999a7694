package com.mymemo.service;

import com.mymemo.config.BotConfig;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Singleton
public class ReminderScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

    private final ReminderDispatcher dispatcher;
    private final LocalTime dispatchTime;
    private final ZoneId zone;
    private final Clock clock;
    private final ScheduledExecutorService executor;
    private volatile boolean running;
    private ZonedDateTime scheduledFor;
    private ScheduledFuture<?> nextRun;

    @Inject
    public ReminderScheduler(ReminderDispatcher dispatcher, BotConfig config, Clock clock) {
        this(dispatcher, config.getDispatchTime(), config.getTimezone(), clock,
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread thread = new Thread(r, "reminder-scheduler");
                    thread.setDaemon(true);
                    return thread;
                }));
    }

    ReminderScheduler(ReminderDispatcher dispatcher, LocalTime dispatchTime, ZoneId zone,
                      Clock clock, ScheduledExecutorService executor) {
        this.dispatcher = dispatcher;
        this.dispatchTime = dispatchTime;
        this.zone = zone;
        this.clock = clock;
        this.executor = executor;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scheduleNext();
        log.info("Reminder scheduler started, daily dispatch at {} {}", dispatchTime, zone);
    }

    private synchronized void scheduleNext() {
        if (!running) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);
        // a timer that fires a little early must not trigger the same day twice
        ZonedDateTime from = scheduledFor != null && scheduledFor.isAfter(now) ? scheduledFor : now;
        ZonedDateTime next = nextTrigger(from);
        long delayMillis = Duration.between(now, next).toMillis();
        nextRun = executor.schedule(this::runCycle, delayMillis, TimeUnit.MILLISECONDS);
        scheduledFor = next;
        log.info("Next reminder dispatch at {}", next);
    }

    void runCycle() {
        try {
            DispatchCycle cycle = dispatcher.startCycle();
            log.info("Dispatch cycle {} triggered", cycle.getId());
        } catch (RuntimeException e) {
            log.error("Dispatch cycle failed", e);
        } finally {
            scheduleNext();
        }
    }

    ZonedDateTime nextTrigger(ZonedDateTime now) {
        ZonedDateTime candidate = now.toLocalDate().atTime(dispatchTime).atZone(zone);
        if (!candidate.isAfter(now)) {
            candidate = now.toLocalDate().plusDays(1).atTime(dispatchTime).atZone(zone);
        }
        return candidate;
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        // a cycle already on the scheduler thread finishes; only the next trigger is dropped
        if (nextRun != null) {
            nextRun.cancel(false);
        }
        executor.shutdown();
        log.info("Reminder scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
