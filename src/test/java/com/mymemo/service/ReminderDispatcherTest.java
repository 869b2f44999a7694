package com.mymemo.service;

import com.mymemo.repository.InMemoryReminderRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReminderDispatcherTest {

    @Mock
    private MessageSender messageSender;

    private InMemoryReminderRepository repository;
    private SimpleMeterRegistry meterRegistry;
    private ReminderDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        repository = new InMemoryReminderRepository();
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    private ReminderDispatcher dispatcher(Duration spacing) {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1);
        timer.setRemoveOnCancelPolicy(true);
        dispatcher = new ReminderDispatcher(repository, messageSender, spacing,
                new DirectExecutorService(), timer, Clock.systemUTC(), meterRegistry);
        return dispatcher;
    }

    private double sends(String outcome) {
        return meterRegistry.counter("mymemo.dispatch.sends", "outcome", outcome).count();
    }

    // counters are bumped after the send future completes, which can trail the sender call
    private void awaitSends(String outcome, double expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (sends(outcome) < expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(expected, sends(outcome));
    }

    @Test
    void startCycle_ShouldSendEachUsersRemindersByPriority() throws Exception {
        repository.create("+1", "low", 1, null);
        repository.create("+1", "urgent", 5, "Urgent thing");
        repository.create("+1", "normal", 3, null);
        repository.create("+2", "other", 2, null);

        List<String> delivered = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch latch = new CountDownLatch(4);
        when(messageSender.send(anyString(), anyString())).thenAnswer(invocation -> {
            delivered.add(invocation.getArgument(0) + " " + invocation.getArgument(1));
            latch.countDown();
            return CompletableFuture.completedFuture("SM1");
        });

        dispatcher(Duration.ofMillis(30)).startCycle();

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        List<String> firstUser = new ArrayList<>();
        for (String line : delivered) {
            if (line.startsWith("+1 ")) {
                firstUser.add(line);
            }
        }
        assertEquals(List.of(
                "+1 Reminder: Urgent thing (priority 5)",
                "+1 Reminder: normal (priority 3)",
                "+1 Reminder: low (priority 1)"), firstUser);
        assertTrue(delivered.contains("+2 Reminder: other (priority 2)"));
        awaitSends("sent", 4.0);
    }

    @Test
    void startCycle_WhenOneSendFails_ShouldKeepSendingTheRest() throws Exception {
        repository.create("+1", "first", 5, null);
        repository.create("+1", "second", 4, null);

        CountDownLatch latch = new CountDownLatch(2);
        when(messageSender.send("+1", "Reminder: first (priority 5)")).thenAnswer(invocation -> {
            latch.countDown();
            return CompletableFuture.failedFuture(new IllegalStateException("status 500"));
        });
        when(messageSender.send("+1", "Reminder: second (priority 4)")).thenAnswer(invocation -> {
            latch.countDown();
            return CompletableFuture.completedFuture("SM2");
        });

        dispatcher(Duration.ofMillis(10)).startCycle();

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        awaitSends("failed", 1.0);
        awaitSends("sent", 1.0);
    }

    @Test
    void startCycle_ShouldSpaceUserSendsBySpacingTimesPosition() {
        repository.create("+1", "rent", 5, null);
        repository.create("+1", "call mom", 3, null);
        repository.create("+1", "water plants", 3, null);
        repository.create("+2", "gym", 1, null);

        ScheduledExecutorService timer = mock(ScheduledExecutorService.class);
        doReturn(mock(ScheduledFuture.class))
                .when(timer).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        dispatcher = new ReminderDispatcher(repository, messageSender, Duration.ofHours(1),
                new DirectExecutorService(), timer, Clock.systemUTC(), meterRegistry);
        when(messageSender.send(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture("SM1"));

        dispatcher.startCycle();

        ArgumentCaptor<Runnable> sends = ArgumentCaptor.forClass(Runnable.class);
        ArgumentCaptor<Long> delays = ArgumentCaptor.forClass(Long.class);
        verify(timer, times(4)).schedule(sends.capture(), delays.capture(), eq(TimeUnit.MILLISECONDS));
        assertEquals(List.of(0L, 3_600_000L, 7_200_000L), delays.getAllValues().stream()
                .limit(3).collect(Collectors.toList()));
        // each user starts at zero
        assertEquals(0L, delays.getAllValues().get(3));

        sends.getAllValues().forEach(Runnable::run);
        InOrder order = inOrder(messageSender);
        order.verify(messageSender).send("+1", "Reminder: rent (priority 5)");
        order.verify(messageSender).send("+1", "Reminder: call mom (priority 3)");
        order.verify(messageSender).send("+1", "Reminder: water plants (priority 3)");
        order.verify(messageSender).send("+2", "Reminder: gym (priority 1)");
    }

    @Test
    void close_ShouldAbandonPendingDelayedSends() throws Exception {
        repository.create("+1", "first", 5, null);
        repository.create("+1", "second", 4, null);
        repository.create("+1", "third", 3, null);

        CountDownLatch firstSent = new CountDownLatch(1);
        when(messageSender.send(anyString(), anyString())).thenAnswer(invocation -> {
            firstSent.countDown();
            return CompletableFuture.completedFuture("SM1");
        });

        DispatchCycle cycle = dispatcher(Duration.ofHours(1)).startCycle();
        assertTrue(firstSent.await(5, TimeUnit.SECONDS));

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (dispatcher.pendingSends() > 2 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(2, dispatcher.pendingSends());
        dispatcher.close();

        assertTrue(cycle.isCancelled());
        assertEquals(0, dispatcher.pendingSends());
        verify(messageSender, after(100).times(1)).send(anyString(), anyString());
    }

    @Test
    void startCycle_WhenUsersCannotBeLoaded_ShouldSendNothing() {
        repository.failing = true;

        DispatchCycle cycle = dispatcher(Duration.ofMillis(10)).startCycle();

        assertEquals(0, cycle.pendingCount());
        verify(messageSender, never()).send(anyString(), anyString());
    }

    /**
     * Runs submitted work on the calling thread so the per-user fan-out finishes inside
     * {@code startCycle}.
     */
    private static class DirectExecutorService extends AbstractExecutorService {
        private volatile boolean shutdown;

        @Override
        public void execute(Runnable command) {
            command.run();
        }

        @Override
        public void shutdown() {
            shutdown = true;
        }

        @Override
        public List<Runnable> shutdownNow() {
            shutdown = true;
            return List.of();
        }

        @Override
        public boolean isShutdown() {
            return shutdown;
        }

        @Override
        public boolean isTerminated() {
            return shutdown;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }
    }
}
