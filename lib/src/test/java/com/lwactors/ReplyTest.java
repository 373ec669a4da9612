package com.lwactors;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ReplyTest {

    @Test
    void testCompletedReply() {
        Reply<String, String> reply = Reply.completed(Result.success("hi"));

        assertTrue(reply.isDone());
        assertEquals("hi", reply.get());
        assertEquals(Optional.of(Result.success("hi")), reply.poll());
    }

    @Test
    void testFailedReply() {
        Reply<String, String> reply = Reply.failed("down");

        assertEquals("down", reply.await().getError());
        ReplyException e = assertThrows(ReplyException.class, reply::get);
        assertEquals("down", e.getError());
    }

    @Test
    void testPollIsEmptyUntilComplete() {
        CompletableFuture<Result<Integer, String>> future = new CompletableFuture<>();
        Reply<Integer, String> reply = Reply.from(future);

        assertEquals(Optional.empty(), reply.poll());
        assertFalse(reply.isDone());

        future.complete(Result.success(1));
        assertEquals(Optional.of(Result.success(1)), reply.poll());
    }

    @Test
    void testAwaitWithTimeout() throws TimeoutException {
        CompletableFuture<Result<Integer, String>> future = new CompletableFuture<>();
        Reply<Integer, String> reply = Reply.from(future);

        assertThrows(TimeoutException.class, () -> reply.await(Duration.ofMillis(20)));
        assertThrows(TimeoutException.class, () -> reply.get(Duration.ofMillis(20)));

        future.complete(Result.success(9));
        assertEquals(9, reply.get(Duration.ofMillis(20)));
    }

    @Test
    void testExceptionalFutureSurfacesAsReplyException() {
        CompletableFuture<Result<Integer, String>> future = new CompletableFuture<>();
        IllegalStateException cause = new IllegalStateException("mapper failed");
        future.completeExceptionally(cause);
        Reply<Integer, String> reply = Reply.from(future);

        ReplyException fromAwait = assertThrows(ReplyException.class, reply::await);
        assertSame(cause, fromAwait.getCause());
        ReplyException fromTimedAwait = assertThrows(ReplyException.class,
                () -> reply.await(Duration.ofMillis(10)));
        assertSame(cause, fromTimedAwait.getCause());
    }

    @Test
    void testInterruptedTimedAwait() {
        Reply<Integer, String> reply = Reply.from(new CompletableFuture<>());
        Thread.currentThread().interrupt();
        try {
            assertThrows(ReplyException.class, () -> reply.await(Duration.ofSeconds(5)));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testMapTransformsValueOnly() {
        CompletableFuture<Result<Integer, String>> future = new CompletableFuture<>();
        Reply<String, String> mapped = Reply.from(future).map(v -> "#" + v);

        future.complete(Result.success(5));
        assertEquals("#5", mapped.get());

        Reply<String, String> failed = Reply.<Integer, String>failed("e").map(v -> "#" + v);
        assertEquals("e", failed.await().getError());
    }

    @Test
    void testOnCompleteRunsMatchingCallback() {
        AtomicReference<String> outcome = new AtomicReference<>();

        Reply.<Integer, String>completed(Result.success(1))
                .onComplete(v -> outcome.set("value " + v), e -> outcome.set("error " + e));
        assertEquals("value 1", outcome.get());

        Reply.<Integer, String>failed("oops")
                .onComplete(v -> outcome.set("value " + v), e -> outcome.set("error " + e));
        assertEquals("error oops", outcome.get());
    }

    @Test
    void testOnCompleteReportsReplyWithoutResult() {
        AtomicReference<String> outcome = new AtomicReference<>();
        CompletableFuture<Result<Integer, String>> broken = new CompletableFuture<>();
        Reply.from(broken).onComplete(v -> outcome.set("value " + v), e -> outcome.set("error " + e),
                t -> outcome.set("abandoned " + t.getMessage()));

        broken.completeExceptionally(new IllegalStateException("mapper failed"));
        assertEquals("abandoned mapper failed", outcome.get());

        CompletableFuture<Result<Integer, String>> cancelled = new CompletableFuture<>();
        AtomicReference<Throwable> seen = new AtomicReference<>();
        Reply.from(cancelled).onComplete(v -> fail("no value"), e -> fail("no error"), seen::set);
        cancelled.cancel(true);
        assertInstanceOf(CancellationException.class, seen.get());
    }

    @Test
    void testTwoCallbackOnCompleteSkipsReplyWithoutResult() {
        AtomicReference<String> outcome = new AtomicReference<>("untouched");
        CompletableFuture<Result<Integer, String>> broken = new CompletableFuture<>();
        Reply.from(broken).onComplete(v -> outcome.set("value"), e -> outcome.set("error"));

        broken.completeExceptionally(new IllegalStateException("mapper failed"));
        assertEquals("untouched", outcome.get());
    }

    @Test
    void testPollThrowsForReplyWithoutResult() {
        CompletableFuture<Result<Integer, String>> cancelled = new CompletableFuture<>();
        cancelled.cancel(true);
        ReplyException e = assertThrows(ReplyException.class, () -> Reply.from(cancelled).poll());
        assertEquals("Reply was cancelled", e.getMessage());

        CompletableFuture<Result<Integer, String>> broken = new CompletableFuture<>();
        IllegalStateException cause = new IllegalStateException("mapper failed");
        broken.completeExceptionally(cause);
        ReplyException fromPoll = assertThrows(ReplyException.class, () -> Reply.from(broken).poll());
        assertSame(cause, fromPoll.getCause());
    }
}
