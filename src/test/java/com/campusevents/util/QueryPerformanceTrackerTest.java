package com.campusevents.util;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryPerformanceTrackerTest {

    private SimpleMeterRegistry meterRegistry;
    private QueryPerformanceTracker tracker;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        tracker = new QueryPerformanceTracker(meterRegistry);
    }

    @Test
    void trackQuery_ReturnsResultAndRecordsTimer() {
        String result = tracker.trackQuery("findRoom", "CampusTable", () -> "room");

        assertThat(result).isEqualTo("room");
        Timer timer = meterRegistry.find("dynamodb.query.duration")
                .tag("operation", "findRoom")
                .tag("table", "CampusTable")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
    }

    @Test
    void trackQuery_FailureIsRethrownAndStillTimed() {
        assertThatThrownBy(() -> tracker.trackQuery("findRoom", "CampusTable", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(meterRegistry.find("dynamodb.query.duration").timer().count()).isEqualTo(1);
    }
}
