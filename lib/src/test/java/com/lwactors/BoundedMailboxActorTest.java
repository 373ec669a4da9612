package com.lwactors;

import com.lwactors.mailbox.config.MailboxConfig;
import com.lwactors.mailbox.config.OverflowStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for actors whose mailbox has a fixed capacity.
 */
class BoundedMailboxActorTest {

    private ManualExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new ManualExecutor();
    }

    private ActorSender<Action<Integer, Integer, ActorException>, Integer, Integer, ActorException> spawn(
            MailboxConfig config) {
        return Actors.builder(0)
                .withName("bounded")
                .withExecutor(executor)
                .withMailboxConfig(config)
                .spawn(ActorErrorMapper.passthrough());
    }

    private static Action<Integer, Integer, ActorException> add(int amount) {
        return state -> Result.success(state.update(v -> v + amount));
    }

    @Test
    void testFailStrategyRejectsWhenFull() {
        var sender = spawn(MailboxConfig.bounded(2).setOverflowStrategy(OverflowStrategy.FAIL));

        Reply<Integer, ActorException> first = sender.invoke(add(1));
        Reply<Integer, ActorException> second = sender.invoke(add(2));
        Reply<Integer, ActorException> rejected = sender.invoke(add(4));

        assertTrue(rejected.isDone());
        assertTrue(rejected.await().getError().isSubmissionFailure());

        executor.runAll();
        assertEquals(1, first.get());
        assertEquals(3, second.get());

        // Space again once drained
        Reply<Integer, ActorException> accepted = sender.invoke(add(4));
        executor.runAll();
        assertEquals(7, accepted.get());
    }

    @Test
    void testBlockStrategyGivesUpAfterTimeout() {
        var sender = spawn(MailboxConfig.bounded(2)
                .setOverflowStrategy(OverflowStrategy.BLOCK)
                .setOfferTimeout(Duration.ofMillis(50)));
        sender.invoke(add(1));
        sender.invoke(add(1));

        long startNanos = System.nanoTime();
        Reply<Integer, ActorException> rejected = sender.invoke(add(1));
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        assertTrue(rejected.await().getError().isSubmissionFailure());
        assertTrue(waitedMillis >= 40, "Waited " + waitedMillis + "ms for space");
        assertEquals(2, sender.pendingCount());
    }

    @Test
    void testBlockStrategyWaitsForSpace() throws Exception {
        var sender = spawn(MailboxConfig.bounded(2)
                .setOverflowStrategy(OverflowStrategy.BLOCK)
                .setOfferTimeout(Duration.ofSeconds(5)));
        sender.invoke(add(1));
        sender.invoke(add(1));

        CountDownLatch blocked = new CountDownLatch(1);
        Thread drainer = new Thread(() -> {
            try {
                blocked.await();
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            executor.runNext();
        }, "drainer");
        drainer.start();

        blocked.countDown();
        Reply<Integer, ActorException> third = sender.invoke(add(1));
        drainer.join(5_000);

        executor.runAll();
        assertEquals(3, third.get(Duration.ofSeconds(1)));
    }

    @Test
    void testInterruptedWhileWaitingForSpace() {
        var sender = spawn(MailboxConfig.bounded(2).setOfferTimeout(Duration.ofSeconds(5)));
        sender.invoke(add(1));
        sender.invoke(add(1));

        Thread.currentThread().interrupt();
        try {
            Reply<Integer, ActorException> reply = sender.invoke(add(1));
            ActorException error = reply.await().getError();
            assertTrue(error.isSubmissionFailure());
            assertInstanceOf(InterruptedException.class, error.getCause());
            assertTrue(Thread.currentThread().isInterrupted(), "Interrupt flag is restored");
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testForeverTimeoutWaitsForSpace() throws Exception {
        var sender = spawn(MailboxConfig.bounded(2)
                .setOverflowStrategy(OverflowStrategy.BLOCK)
                .setOfferTimeout(ChronoUnit.FOREVER.getDuration()));
        sender.invoke(add(1));
        sender.invoke(add(1));

        Thread drainer = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            executor.runNext();
        }, "drainer");
        drainer.start();

        Reply<Integer, ActorException> third = sender.invoke(add(1));
        drainer.join(5_000);

        executor.runAll();
        assertEquals(3, third.get(Duration.ofSeconds(1)));
    }

    @Test
    void testConfigChangesAfterSpawnDoNotReachTheActor() {
        MailboxConfig config = MailboxConfig.bounded(2).setOverflowStrategy(OverflowStrategy.FAIL);
        var sender = spawn(config);
        config.setOverflowStrategy(OverflowStrategy.BLOCK).setOfferTimeout(Duration.ofSeconds(5));

        sender.invoke(add(1));
        sender.invoke(add(1));
        long startNanos = System.nanoTime();
        Reply<Integer, ActorException> rejected = sender.invoke(add(1));
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        assertTrue(rejected.isDone());
        assertTrue(rejected.await().getError().isSubmissionFailure());
        assertTrue(waitedMillis < 1_000, "Rejected without waiting, took " + waitedMillis + "ms");
    }
}
