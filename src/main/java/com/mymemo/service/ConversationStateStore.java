package com.mymemo.service;

import com.google.inject.Singleton;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Singleton
public class ConversationStateStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ConversationState> states = new HashMap<>();

    public void setPendingMessage(String userId, String message) {
        lock.writeLock().lock();
        try {
            states.put(userId, new ConversationState(true, message));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<String> popPendingMessage(String userId) {
        lock.writeLock().lock();
        try {
            ConversationState state = states.remove(userId);
            return state == null ? Optional.empty() : Optional.of(state.pendingMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isAwaitingPriority(String userId) {
        lock.readLock().lock();
        try {
            ConversationState state = states.get(userId);
            return state != null && state.awaitingPriority();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int pendingCount() {
        lock.readLock().lock();
        try {
            return states.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    record ConversationState(boolean awaitingPriority, String pendingMessage) {}
}
