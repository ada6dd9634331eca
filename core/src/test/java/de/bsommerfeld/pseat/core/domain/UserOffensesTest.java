package de.bsommerfeld.pseat.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UserOffensesTest {

    @Test
    void empty_shouldStartWithZeroCounters() {
        var user = UserOffenses.empty(1L, 2L, 3L);

        assertEquals(1L, user.guildId());
        assertEquals(2L, user.channelId());
        assertEquals(3L, user.userId());
        assertEquals(0L, user.currentOffenses());
        assertEquals(0L, user.totalOffenses());
        assertEquals(0L, user.lastOffense());
    }

    @Test
    void recordOffense_shouldIncrementBothCountersAndStampTime() {
        var user = UserOffenses.empty(1L, 2L, 3L)
                .recordOffense(100L)
                .recordOffense(200L);

        assertEquals(2L, user.currentOffenses());
        assertEquals(2L, user.totalOffenses());
        assertEquals(200L, user.lastOffense());
    }

    @Test
    void resetCurrentOffenses_shouldKeepTotalAndLastOffense() {
        var user = UserOffenses.empty(1L, 2L, 3L)
                .recordOffense(100L)
                .recordOffense(200L)
                .resetCurrentOffenses();

        assertEquals(0L, user.currentOffenses());
        assertEquals(2L, user.totalOffenses());
        assertEquals(200L, user.lastOffense());
    }

    @Test
    void totalOffenses_shouldNeverDecreaseAcrossResets() {
        var user = UserOffenses.empty(1L, 2L, 3L);
        long previousTotal = user.totalOffenses();

        for (int i = 0; i < 5; i++) {
            user = user.recordOffense(i);
            assertTrue(user.totalOffenses() >= previousTotal);
            previousTotal = user.totalOffenses();
            if (i % 2 == 0) {
                user = user.resetCurrentOffenses();
                assertEquals(previousTotal, user.totalOffenses());
            }
        }
        assertEquals(5L, user.totalOffenses());
    }

    @Test
    void withMethods_shouldProduceIndependentCopies() {
        var original = new UserOffenses(1L, 2L, 3L, 1L, 4L, 50L);
        var changed = original.withCurrentOffenses(2L).withTotalOffenses(9L).withLastOffense(60L);

        assertEquals(new UserOffenses(1L, 2L, 3L, 2L, 9L, 60L), changed);
        assertEquals(new UserOffenses(1L, 2L, 3L, 1L, 4L, 50L), original);
    }

    @Test
    void equality_shouldDifferOnKey() {
        var a = new UserOffenses(1L, 2L, 3L, 0L, 0L, 0L);
        var b = new UserOffenses(1L, 2L, 4L, 0L, 0L, 0L);

        assertNotEquals(a, b);
    }
}
