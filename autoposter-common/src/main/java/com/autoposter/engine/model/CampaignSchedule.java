package com.autoposter.engine.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class CampaignSchedule {

    @Column(name = "window_start")
    private Instant startTime;

    @Column(name = "window_end")
    private Instant endTime;

    // Jitter added on top of the evenly spaced slot, in seconds
    @Column(name = "delay_min_seconds")
    private long delayMinSeconds;

    @Column(name = "delay_max_seconds")
    private long delayMaxSeconds;

    public Duration windowLength() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(startTime) && !instant.isAfter(endTime);
    }
}
