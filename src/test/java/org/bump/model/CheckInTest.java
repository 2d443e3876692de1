package org.bump.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CheckInTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    @Test
    void isActiveAt_shouldTreatMissingExpiryAsActiveForever() {
        CheckIn c = new CheckIn();
        c.setExpiresAt(null);

        assertThat(c.isActiveAt(NOW)).isTrue();
        assertThat(c.isActiveAt(NOW.plusSeconds(365L * 24 * 3600))).isTrue();
    }

    @Test
    void isActiveAt_shouldBeFalseOnceExpiryIsReached() {
        CheckIn c = new CheckIn();
        c.setExpiresAt(NOW);

        assertThat(c.isActiveAt(NOW.minusMillis(1))).isTrue();
        assertThat(c.isActiveAt(NOW)).isFalse();
    }

    @Test
    void expire_shouldNeverPushAnExpiredCheckInForward() {
        CheckIn c = new CheckIn();
        c.setExpiresAt(NOW.minusSeconds(60));

        c.expire(NOW);

        assertThat(c.getExpiresAt()).isEqualTo(NOW.minusSeconds(60));
    }
}
