package com.intention.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    @Test
    void testExtendToLaterDeadline() {
        Deadline shortDeadline = Deadline.after(Duration.ofMillis(10));
        Deadline longDeadline = Deadline.after(Duration.ofMinutes(5));

        assertTrue(shortDeadline.extendTo(longDeadline));
        assertTrue(shortDeadline.remaining().compareTo(Duration.ofMinutes(4)) > 0);
        assertEquals(Duration.ofMillis(10), shortDeadline.getTimeout());
    }

    @Test
    void testNeverMovesEarlier() {
        Deadline longDeadline = Deadline.after(Duration.ofMinutes(5));
        Deadline expired = Deadline.after(Duration.ZERO);

        assertFalse(longDeadline.extendTo(expired));
        assertFalse(longDeadline.isExpired());
        assertTrue(expired.isExpired());
        assertEquals(Duration.ZERO, expired.remaining());
    }

    @Test
    void testNegativeTimeoutRejected() {
        assertThrows(IllegalArgumentException.class, () -> Deadline.after(Duration.ofSeconds(-1)));
    }
}
