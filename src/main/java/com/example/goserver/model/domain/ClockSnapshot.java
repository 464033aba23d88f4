package com.example.goserver.model.domain;

/**
 * Read-only view of a {@link PlayerClock}, either committed or projected to the current instant.
 */
public record ClockSnapshot(ClockPhase phase,
                            long mainTimeRemainingMs,
                            boolean inByoYomi,
                            int byoYomiPeriodsLeft,
                            long byoYomiTimeLeftMs) {
}
