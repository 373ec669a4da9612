package com.lwactors.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded mailbox backed by a JCTools MPSC (Multi-Producer Single-Consumer) queue.
 *
 * This implementation provides:
 * - Lock-free, wait-free message enqueuing
 * - Minimal allocation overhead (array chunks linked on growth)
 * - No blocking on either side: the consumer is scheduled, never parked
 *
 * Offers only fail for null messages. This is the default actor mailbox.
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {

    public static final int DEFAULT_CHUNK_SIZE = 128;

    private final MpscUnboundedArrayQueue<T> queue;
    private final int chunkSize;

    /**
     * Creates an MPSC mailbox with the default chunk size (128).
     */
    public MpscMailbox() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * Creates an MPSC mailbox with the specified chunk size.
     *
     * The queue is unbounded; the chunk size is only the allocation step and
     * is rounded up to a power of two.
     *
     * @param chunkSize the chunk size
     */
    public MpscMailbox(int chunkSize) {
        // JCTools requires at least 2
        int safeChunkSize = Math.max(2, chunkSize);
        this.chunkSize = Capacities.nextPowerOfTwo(safeChunkSize);
        this.queue = new MpscUnboundedArrayQueue<>(this.chunkSize);
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        return queue.offer(message);
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) {
        // Never full, the timeout is irrelevant
        return offer(message);
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
        return Integer.MAX_VALUE;
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public int capacity() {
        return Integer.MAX_VALUE;
    }

    /**
     * Returns the allocation chunk size actually used.
     *
     * @return the chunk size, a power of two
     */
    public int getChunkSize() {
        return chunkSize;
    }
}
