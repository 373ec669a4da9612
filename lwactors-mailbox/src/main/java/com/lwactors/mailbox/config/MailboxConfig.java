package com.lwactors.mailbox.config;

import com.lwactors.mailbox.Capacities;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for an actor's mailbox.
 * The only capacity decision is made here, at creation time: unbounded, or
 * bounded with a fixed capacity.
 */
public class MailboxConfig {
    // Default values for mailbox configuration
    public static final MailboxType DEFAULT_MAILBOX_TYPE = MailboxType.UNBOUNDED;
    public static final int DEFAULT_BOUNDED_CAPACITY = 1024;
    public static final int DEFAULT_CHUNK_SIZE = 128;
    public static final int DEFAULT_THROUGHPUT = 64;
    public static final OverflowStrategy DEFAULT_OVERFLOW_STRATEGY = OverflowStrategy.BLOCK;
    public static final Duration DEFAULT_OFFER_TIMEOUT = Duration.ofSeconds(5);

    private MailboxType mailboxType;
    private int capacity;
    private int chunkSize;
    private int throughput;
    private OverflowStrategy overflowStrategy;
    private Duration offerTimeout;

    /**
     * Creates a new MailboxConfig with default values (unbounded).
     */
    public MailboxConfig() {
        this.mailboxType = DEFAULT_MAILBOX_TYPE;
        this.capacity = DEFAULT_BOUNDED_CAPACITY;
        this.chunkSize = DEFAULT_CHUNK_SIZE;
        this.throughput = DEFAULT_THROUGHPUT;
        this.overflowStrategy = DEFAULT_OVERFLOW_STRATEGY;
        this.offerTimeout = DEFAULT_OFFER_TIMEOUT;
    }

    /**
     * Creates an unbounded configuration.
     *
     * @return a new MailboxConfig
     */
    public static MailboxConfig unbounded() {
        return new MailboxConfig();
    }

    /**
     * Creates a bounded configuration with the default capacity (1024).
     *
     * @return a new MailboxConfig
     */
    public static MailboxConfig bounded() {
        return bounded(DEFAULT_BOUNDED_CAPACITY);
    }

    /**
     * Creates a bounded configuration. The mailbox holds
     * {@link #getEffectiveCapacity()} actions: the requested capacity rounded
     * up to a power of 2, and at least 2. {@code bounded(1000)} holds 1024.
     *
     * @param capacity the requested maximum number of queued actions
     * @return a new MailboxConfig
     */
    public static MailboxConfig bounded(int capacity) {
        return new MailboxConfig()
                .setMailboxType(MailboxType.BOUNDED)
                .setCapacity(capacity);
    }

    /**
     * Sets the mailbox type.
     *
     * @param mailboxType The mailbox type
     * @return This MailboxConfig instance
     */
    public MailboxConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = Objects.requireNonNull(mailboxType, "mailboxType");
        return this;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    /**
     * Sets the capacity used by {@link MailboxType#BOUNDED} mailboxes.
     *
     * @param capacity The requested capacity (must be positive, at most 2^30)
     * @return This MailboxConfig instance
     */
    public MailboxConfig setCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got: " + capacity);
        }
        if (capacity > Capacities.MAX_POWER_OF_TWO) {
            throw new IllegalArgumentException("Capacity too large: " + capacity);
        }
        this.capacity = capacity;
        return this;
    }

    /**
     * @return the capacity as requested
     */
    public int getCapacity() {
        return capacity;
    }

    /**
     * The number of actions a bounded mailbox built from this configuration
     * really holds.
     *
     * @return the requested capacity rounded up to a power of 2, at least 2
     */
    public int getEffectiveCapacity() {
        return Capacities.boundedCapacity(capacity);
    }

    /**
     * Sets the allocation chunk size of {@link MailboxType#UNBOUNDED} mailboxes.
     *
     * @param chunkSize The chunk size, rounded up to a power of 2
     * @return This MailboxConfig instance
     */
    public MailboxConfig setChunkSize(int chunkSize) {
        this.chunkSize = Math.max(2, chunkSize);
        return this;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Sets the throughput (batch size): how many actions the runner applies
     * per activation before yielding the executor thread.
     *
     * @param throughput The throughput (values below 1 are raised to 1)
     * @return This MailboxConfig instance
     */
    public MailboxConfig setThroughput(int throughput) {
        this.throughput = Math.max(1, throughput);
        return this;
    }

    public int getThroughput() {
        return throughput;
    }

    /**
     * Sets the overflow strategy for bounded mailboxes.
     *
     * @param overflowStrategy The overflow strategy (BLOCK or FAIL)
     * @return This MailboxConfig instance
     */
    public MailboxConfig setOverflowStrategy(OverflowStrategy overflowStrategy) {
        this.overflowStrategy = Objects.requireNonNull(overflowStrategy, "overflowStrategy");
        return this;
    }

    public OverflowStrategy getOverflowStrategy() {
        return overflowStrategy;
    }

    /**
     * Sets how long a {@link OverflowStrategy#BLOCK} submission waits for space.
     *
     * @param offerTimeout The timeout (must not be negative)
     * @return This MailboxConfig instance
     */
    public MailboxConfig setOfferTimeout(Duration offerTimeout) {
        Objects.requireNonNull(offerTimeout, "offerTimeout");
        if (offerTimeout.isNegative()) {
            throw new IllegalArgumentException("Offer timeout must not be negative: " + offerTimeout);
        }
        this.offerTimeout = offerTimeout;
        return this;
    }

    public Duration getOfferTimeout() {
        return offerTimeout;
    }

    /**
     * The offer timeout in nanoseconds, saturated at {@link Long#MAX_VALUE}
     * for durations too long to express, such as
     * {@code ChronoUnit.FOREVER.getDuration()}.
     *
     * @return the timeout in nanoseconds
     */
    public long getOfferTimeoutNanos() {
        try {
            return offerTimeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Determines if this configuration produces a bounded mailbox.
     *
     * @return true for {@link MailboxType#BOUNDED}
     */
    public boolean isBounded() {
        return mailboxType == MailboxType.BOUNDED;
    }

    @Override
    public String toString() {
        return "MailboxConfig{" +
                "type=" + mailboxType +
                ", capacity=" + (isBounded() ? String.valueOf(getEffectiveCapacity()) : "unbounded") +
                ", throughput=" + throughput +
                ", overflow=" + overflowStrategy +
                ", offerTimeout=" + offerTimeout +
                '}';
    }
}
