package com.neurasense.jitai.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TierTest {

    @Test
    void testRanksOrderMostUrgentFirst() {
        assertThat(Tier.CRISIS.rank()).isLessThan(Tier.ACUTE.rank());
        assertThat(Tier.ACUTE.rank()).isLessThan(Tier.PREVENTIVE.rank());
        assertThat(Tier.PREVENTIVE.rank()).isLessThan(Tier.MAINTENANCE.rank());
        assertThat(Tier.MAINTENANCE.rank()).isLessThan(Tier.DEFAULT.rank());
    }

    @Test
    void testFromStringIsCaseInsensitive() {
        assertThat(Tier.fromString("acute")).contains(Tier.ACUTE);
        assertThat(Tier.fromString(" Crisis ")).contains(Tier.CRISIS);
    }

    @Test
    void testFromStringUnknown() {
        assertThat(Tier.fromString("URGENT")).isEmpty();
        assertThat(Tier.fromString("")).isEmpty();
        assertThat(Tier.fromString(null)).isEmpty();
    }
}
