package com.entityradar.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreMathTest {

    @Test
    @DisplayName("rounds half up on the printed decimal value")
    void roundHalfUp() {
        assertThat(ScoreMath.round(0.125, 2)).isEqualTo(0.13);
        assertThat(ScoreMath.round(0.175, 2)).isEqualTo(0.18);
        assertThat(ScoreMath.ratio(2.0 / 3)).isEqualTo(0.667);
        assertThat(ScoreMath.money(1.23456)).isEqualTo(1.2346);
    }

    @Test
    @DisplayName("score clamps to [0,1] and maps NaN and infinity to zero")
    void scoreClamps() {
        assertThat(ScoreMath.score(1.3)).isEqualTo(1.0);
        assertThat(ScoreMath.score(-0.2)).isEqualTo(0.0);
        assertThat(ScoreMath.score(Double.NaN)).isEqualTo(0.0);
        assertThat(ScoreMath.round(Double.POSITIVE_INFINITY, 2)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("difference is exact: 0.8 - 0.7 is 0.1")
    void exactDifference() {
        assertThat(0.8 - 0.7).isNotEqualTo(0.1);
        assertThat(ScoreMath.difference(0.8, 0.7)).isEqualByComparingTo("0.1");
        assertThat(ScoreMath.atMost(ScoreMath.difference(0.8, 0.7), 0.10)).isTrue();
        assertThat(ScoreMath.atMost(ScoreMath.difference(0.8001, 0.7), 0.10)).isFalse();
    }

    @Test
    @DisplayName("atLeast compares decimal values, boundary included")
    void atLeastBoundary() {
        assertThat(ScoreMath.atLeast(0.6, 0.6)).isTrue();
        assertThat(ScoreMath.atLeast(0.59, 0.6)).isFalse();
        assertThat(ScoreMath.atLeast(ScoreMath.difference(0.95, 0.75), 0.2)).isTrue();
    }
}
