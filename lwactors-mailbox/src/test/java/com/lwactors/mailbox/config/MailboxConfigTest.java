package com.lwactors.mailbox.config;

import com.lwactors.mailbox.Mailbox;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

class MailboxConfigTest {

    @Test
    void testDefaults() {
        MailboxConfig config = new MailboxConfig();

        assertEquals(MailboxType.UNBOUNDED, config.getMailboxType());
        assertFalse(config.isBounded());
        assertEquals(MailboxConfig.DEFAULT_BOUNDED_CAPACITY, config.getCapacity());
        assertEquals(64, config.getThroughput());
        assertEquals(OverflowStrategy.BLOCK, config.getOverflowStrategy());
        assertEquals(Duration.ofSeconds(5), config.getOfferTimeout());
    }

    @Test
    void testBoundedFactory() {
        MailboxConfig config = MailboxConfig.bounded();

        assertTrue(config.isBounded());
        assertEquals(1024, config.getCapacity());
        assertEquals(10, MailboxConfig.bounded(10).getCapacity());
    }

    @Test
    void testEffectiveCapacityIsTheRealBound() {
        assertEquals(2, MailboxConfig.bounded(1).getEffectiveCapacity());
        assertEquals(1024, MailboxConfig.bounded(1000).getEffectiveCapacity());
        assertEquals(1000, MailboxConfig.bounded(1000).getCapacity());

        MailboxConfig config = MailboxConfig.bounded(100);
        Mailbox<String> mailbox = new DefaultMailboxProvider<String>().createMailbox(config);
        assertEquals(config.getEffectiveCapacity(), mailbox.capacity());
        assertTrue(config.toString().contains("capacity=128"), config.toString());
    }

    @Test
    void testOversizedCapacityRejectedUpFront() {
        assertThrows(IllegalArgumentException.class, () -> MailboxConfig.bounded(Integer.MAX_VALUE));
    }

    @Test
    void testUnrepresentableTimeoutSaturates() {
        MailboxConfig config = new MailboxConfig().setOfferTimeout(ChronoUnit.FOREVER.getDuration());

        assertEquals(Long.MAX_VALUE, config.getOfferTimeoutNanos());
        assertEquals(5_000_000_000L, new MailboxConfig().getOfferTimeoutNanos());
    }

    @Test
    void testThroughputIsAtLeastOne() {
        assertEquals(1, new MailboxConfig().setThroughput(0).getThroughput());
        assertEquals(1, new MailboxConfig().setThroughput(-5).getThroughput());
    }

    @Test
    void testInvalidValuesAreRejected() {
        MailboxConfig config = new MailboxConfig();

        assertThrows(IllegalArgumentException.class, () -> config.setCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> config.setOfferTimeout(Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> config.setOverflowStrategy(null));
        assertThrows(NullPointerException.class, () -> config.setMailboxType(null));
    }
}
