package com.mymemo.service;

import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Future;

public class DispatchCycle {

    private final long id;
    private final Instant startedAt;
    private final Queue<Future<?>> tasks = new ConcurrentLinkedQueue<>();
    private volatile boolean cancelled;

    public DispatchCycle(long id, Instant startedAt) {
        this.id = id;
        this.startedAt = startedAt;
    }

    public long getId() { return id; }
    public Instant getStartedAt() { return startedAt; }
    public boolean isCancelled() { return cancelled; }

    void track(Future<?> task) {
        tasks.add(task);
        if (cancelled) {
            task.cancel(false);
        }
    }

    public int pendingCount() {
        return (int) tasks.stream().filter(task -> !task.isDone()).count();
    }

    public boolean isFinished() {
        return tasks.stream().allMatch(Future::isDone);
    }

    public int cancel() {
        cancelled = true;
        int abandoned = 0;
        for (Future<?> task : tasks) {
            if (task.cancel(false)) {
                abandoned++;
            }
        }
        return abandoned;
    }
}
