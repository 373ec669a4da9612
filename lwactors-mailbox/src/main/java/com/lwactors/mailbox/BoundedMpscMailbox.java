package com.lwactors.mailbox;

import org.jctools.queues.MpscArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Bounded mailbox backed by a JCTools {@link MpscArrayQueue}.
 *
 * Producers never take a lock. When the queue is full, {@link #offer(Object)}
 * fails at once and {@link #offer(Object, long, TimeUnit)} spin-waits, then
 * parks in short slices, until space frees up or the timeout elapses.
 *
 * The requested capacity is rounded up to a power of two.
 *
 * @param <T> The type of messages
 */
public class BoundedMpscMailbox<T> implements Mailbox<T> {

    private static final int SPINS_BEFORE_PARK = 128;
    private static final long PARK_NANOS = TimeUnit.MICROSECONDS.toNanos(50);

    private final MpscArrayQueue<T> queue;
    private final int capacity;

    /**
     * Creates a bounded mailbox.
     *
     * @param capacity the requested capacity (must be positive)
     */
    public BoundedMpscMailbox(int capacity) {
        // MpscArrayQueue needs at least 2 slots
        this.capacity = Capacities.boundedCapacity(capacity);
        this.queue = new MpscArrayQueue<>(this.capacity);
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        return queue.offer(message);
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        if (queue.offer(message)) {
            return true;
        }
        // Elapsed-time comparison stays correct for timeouts up to Long.MAX_VALUE nanos
        long timeoutNanos = unit.toNanos(timeout);
        long start = System.nanoTime();
        int spins = 0;
        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while waiting for mailbox space");
            }
            if (queue.offer(message)) {
                return true;
            }
            long remaining = timeoutNanos - (System.nanoTime() - start);
            if (remaining <= 0) {
                return false;
            }
            if (spins < SPINS_BEFORE_PARK) {
                spins++;
                Thread.onSpinWait();
            } else {
                LockSupport.parkNanos(this, Math.min(remaining, PARK_NANOS));
            }
        }
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        if (maxElements <= 0) {
            return 0;
        }
        return queue.drain(collection::add, maxElements);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int remainingCapacity() {
        return Math.max(0, capacity - queue.size());
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public int capacity() {
        return capacity;
    }
}
