package com.example.goserver.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Time settings shared by both players. Durations are whole seconds as configured by clients;
 * clock arithmetic runs in milliseconds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimeControl {

    private TimeControlMode mode = TimeControlMode.STANDARD;
    private int mainTimeSeconds;
    private int byoYomiPeriods;
    private int byoYomiSeconds;
    private int timePerMoveSeconds;      // blitz only
    private int fischerIncrementSeconds; // standard only, 0 = off

    public static TimeControl standard(int mainTimeSeconds, int byoYomiPeriods, int byoYomiSeconds) {
        return new TimeControl(TimeControlMode.STANDARD, mainTimeSeconds, byoYomiPeriods, byoYomiSeconds, 0, 0);
    }

    public static TimeControl blitz(int timePerMoveSeconds) {
        return new TimeControl(TimeControlMode.BLITZ, 0, 0, 0, timePerMoveSeconds, 0);
    }

    public TimeControl withFischerIncrement(int seconds) {
        TimeControl copy = copy();
        copy.setFischerIncrementSeconds(seconds);
        return copy;
    }

    public boolean blitz() {
        return mode == TimeControlMode.BLITZ;
    }

    /** No main time and no byo-yomi: the clock never runs out. */
    public boolean unlimited() {
        return !blitz() && mainTimeSeconds == 0 && byoYomiPeriods == 0;
    }

    public long mainTimeMs() {
        return mainTimeSeconds * 1000L;
    }

    public long byoYomiMs() {
        return byoYomiSeconds * 1000L;
    }

    public long timePerMoveMs() {
        return timePerMoveSeconds * 1000L;
    }

    public long fischerIncrementMs() {
        return fischerIncrementSeconds * 1000L;
    }

    public TimeControl copy() {
        return new TimeControl(mode, mainTimeSeconds, byoYomiPeriods, byoYomiSeconds,
                timePerMoveSeconds, fischerIncrementSeconds);
    }
}
