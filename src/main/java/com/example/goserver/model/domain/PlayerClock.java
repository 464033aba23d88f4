package com.example.goserver.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Authoritative clock of one player. Only TimeControlStateMachine changes it; clients receive
 * {@link ClockSnapshot} projections. In blitz mode {@code mainTimeRemainingMs} holds the per-move
 * countdown.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerClock {

    private ClockPhase phase;
    private long mainTimeRemainingMs;
    private int byoYomiPeriodsLeft;
    private long byoYomiTimeLeftMs;

    public boolean isInByoYomi() {
        return phase == ClockPhase.BYO_YOMI;
    }

    public boolean isTimedOut() {
        return phase == ClockPhase.TIMEOUT;
    }

    public ClockSnapshot snapshot() {
        return new ClockSnapshot(phase, mainTimeRemainingMs, isInByoYomi(), byoYomiPeriodsLeft, byoYomiTimeLeftMs);
    }
}
