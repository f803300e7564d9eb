package com.dealrelay.core.service;

import com.dealrelay.core.util.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunBudgetTest {

    @Test
    void postsBudget() {
        var budget = new RunBudget(2, Duration.ZERO, new MutableClock(Instant.EPOCH));
        assertTrue(budget.hasRoom());
        budget.onPosted();
        budget.onPosted();
        assertFalse(budget.hasRoom());
        assertTrue(budget.postsExhausted());
        assertEquals(0, budget.remaining());
    }

    @Test
    void timeBudget() {
        var clock = new MutableClock(Instant.EPOCH);
        var budget = new RunBudget(10, Duration.ofMinutes(5), clock);
        clock.advance(Duration.ofMinutes(4));
        assertTrue(budget.hasRoom());
        clock.advance(Duration.ofMinutes(1));
        assertTrue(budget.timeExhausted());
        assertFalse(budget.hasRoom());
    }

    @Test
    void zeroRunTimeMeansNoDeadline() {
        var clock = new MutableClock(Instant.EPOCH);
        var budget = new RunBudget(0, null, clock);
        clock.advance(Duration.ofDays(1));
        assertFalse(budget.timeExhausted());
        assertEquals(1, budget.remaining());
    }
}
