package com.campusevents.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeRangeTest {

    private static final Instant NINE = Instant.parse("2026-05-01T09:00:00Z");
    private static final Instant TEN = Instant.parse("2026-05-01T10:00:00Z");
    private static final Instant ELEVEN = Instant.parse("2026-05-01T11:00:00Z");
    private static final Instant NOON = Instant.parse("2026-05-01T12:00:00Z");

    @Test
    void overlaps_PartialOverlapIsDetectedBothWays() {
        TimeRange a = TimeRange.of(NINE, ELEVEN);
        TimeRange b = TimeRange.of(TEN, NOON);

        assertThat(a.overlaps(b)).isTrue();
        assertThat(b.overlaps(a)).isTrue();
    }

    @Test
    void overlaps_BackToBackRangesDoNotOverlap() {
        assertThat(TimeRange.overlaps(NINE, TEN, TEN, ELEVEN)).isFalse();
        assertThat(TimeRange.overlaps(TEN, ELEVEN, NINE, TEN)).isFalse();
    }

    @Test
    void overlaps_ContainedRangeOverlaps() {
        assertThat(TimeRange.of(NINE, NOON).overlaps(TimeRange.of(TEN, ELEVEN))).isTrue();
    }

    @Test
    void within_NullBoundsAreOpen() {
        TimeRange range = TimeRange.of(TEN, ELEVEN);

        assertThat(range.within(null, null)).isTrue();
        assertThat(range.within(NINE, null)).isTrue();
        assertThat(range.within(null, TEN)).isFalse();
    }

    @Test
    void within_EndOnWindowEdgeIsInside() {
        assertThat(TimeRange.of(TEN, ELEVEN).within(TEN, ELEVEN)).isTrue();
        assertThat(TimeRange.of(NINE, ELEVEN).within(TEN, NOON)).isFalse();
    }

    @Test
    void duration_SpansStartToEnd() {
        assertThat(TimeRange.of(TEN, ELEVEN).duration()).isEqualTo(Duration.ofHours(1));
        assertThat(TimeRange.of(NINE, TEN).duration().plus(TimeRange.of(TEN, NOON).duration()))
                .isEqualTo(TimeRange.of(NINE, NOON).duration());
    }
}
