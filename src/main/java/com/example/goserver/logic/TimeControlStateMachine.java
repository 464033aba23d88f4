package com.example.goserver.logic;

import com.example.goserver.model.domain.ClockPhase;
import com.example.goserver.model.domain.ClockSnapshot;
import com.example.goserver.model.domain.PlayerClock;
import com.example.goserver.model.domain.TimeControl;

/**
 * Per-player clock transitions.
 *
 * <p>Standard clocks move {@code MAIN_TIME -> BYO_YOMI -> TIMEOUT}; byo-yomi loops on itself while
 * periods remain. Blitz clocks stay in {@code PER_MOVE} until a single move overruns the allotment.
 * {@link #chargeElapsed} is called once per completed move; {@link #tick} is called from the
 * background ticker and only commits when a period boundary has been crossed without a move.
 * Both paths share the same consumption arithmetic so they always agree on when a timeout happens.
 *
 * <p>Stateless and thread-safe; all times are milliseconds.
 */
public class TimeControlStateMachine {

    public PlayerClock initialClock(TimeControl tc) {
        if (tc.blitz()) {
            return new PlayerClock(ClockPhase.PER_MOVE, tc.timePerMoveMs(), 0, 0);
        }
        if (tc.getMainTimeSeconds() == 0 && tc.getByoYomiPeriods() > 0) {
            return new PlayerClock(ClockPhase.BYO_YOMI, 0, tc.getByoYomiPeriods(), tc.byoYomiMs());
        }
        return new PlayerClock(ClockPhase.MAIN_TIME, tc.mainTimeMs(), tc.getByoYomiPeriods(), tc.byoYomiMs());
    }

    /**
     * Charges the time a player spent on the move they just completed.
     */
    public ClockTransition chargeElapsed(PlayerClock clock, TimeControl tc, long elapsedMs) {
        long elapsed = Math.max(0, elapsedMs);
        switch (clock.getPhase()) {
            case PER_MOVE:
                return chargePerMove(clock, tc, elapsed);
            case MAIN_TIME:
                return chargeMainTime(clock, tc, elapsed);
            case BYO_YOMI:
                return chargeByoYomi(clock, tc, elapsed);
            case TIMEOUT:
            default:
                return ClockTransition.TIMEOUT;
        }
    }

    /**
     * Fischer bonus for a completed move. Only credited while still in main time.
     */
    public void applyIncrement(PlayerClock clock, TimeControl tc) {
        if (tc.blitz() || tc.unlimited() || tc.getFischerIncrementSeconds() <= 0) {
            return;
        }
        if (clock.getPhase() == ClockPhase.MAIN_TIME) {
            clock.setMainTimeRemainingMs(clock.getMainTimeRemainingMs() + tc.fischerIncrementMs());
        }
    }

    /**
     * Recomputes the live countdown of the player on move. Commits only when wall-clock time alone
     * has crossed the end of main time or of the current byo-yomi period.
     */
    public TickResult tick(PlayerClock clock, TimeControl tc, long elapsedMs) {
        long elapsed = Math.max(0, elapsedMs);
        switch (clock.getPhase()) {
            case PER_MOVE:
                if (elapsed > tc.timePerMoveMs()) {
                    return new TickResult(clock.snapshot(), timeout(clock));
                }
                break;
            case MAIN_TIME:
                if (!tc.unlimited() && clock.getMainTimeRemainingMs() - elapsed <= 0) {
                    ClockTransition t = chargeMainTime(clock, tc, elapsed);
                    return new TickResult(clock.snapshot(), t);
                }
                break;
            case BYO_YOMI:
                if (elapsed > tc.byoYomiMs()) {
                    ClockTransition t = chargeByoYomi(clock, tc, elapsed);
                    return new TickResult(clock.snapshot(), t);
                }
                break;
            default:
                break;
        }
        return new TickResult(project(clock, tc, elapsed), ClockTransition.NONE);
    }

    /**
     * Display value of the clock {@code elapsedMs} after its baseline. Never mutates the clock.
     */
    public ClockSnapshot project(PlayerClock clock, TimeControl tc, long elapsedMs) {
        long elapsed = Math.max(0, elapsedMs);
        switch (clock.getPhase()) {
            case PER_MOVE:
                return new ClockSnapshot(ClockPhase.PER_MOVE, clampToZero(tc.timePerMoveMs() - elapsed),
                        false, 0, 0);
            case MAIN_TIME:
                if (tc.unlimited()) {
                    return clock.snapshot();
                }
                return new ClockSnapshot(ClockPhase.MAIN_TIME, clampToZero(clock.getMainTimeRemainingMs() - elapsed),
                        false, clock.getByoYomiPeriodsLeft(), clock.getByoYomiTimeLeftMs());
            case BYO_YOMI:
                return new ClockSnapshot(ClockPhase.BYO_YOMI, 0, true, clock.getByoYomiPeriodsLeft(),
                        clampToZero(clock.getByoYomiTimeLeftMs() - elapsed));
            default:
                return clock.snapshot();
        }
    }

    private ClockTransition chargePerMove(PlayerClock clock, TimeControl tc, long elapsed) {
        if (elapsed > tc.timePerMoveMs()) {
            return timeout(clock);
        }
        clock.setMainTimeRemainingMs(tc.timePerMoveMs());
        return ClockTransition.PER_MOVE_RESET;
    }

    private ClockTransition chargeMainTime(PlayerClock clock, TimeControl tc, long elapsed) {
        if (tc.unlimited()) {
            return ClockTransition.MAIN_TIME_RUNNING;
        }
        long before = clock.getMainTimeRemainingMs();
        long remaining = before - elapsed;
        if (remaining > 0) {
            clock.setMainTimeRemainingMs(remaining);
            return ClockTransition.MAIN_TIME_RUNNING;
        }
        clock.setMainTimeRemainingMs(0);
        if (tc.getByoYomiPeriods() > 0) {
            long overage = elapsed - before;
            long left = tc.getByoYomiPeriods() - periodsConsumed(overage, tc.byoYomiMs());
            if (left > 0) {
                clock.setPhase(ClockPhase.BYO_YOMI);
                clock.setByoYomiPeriodsLeft((int) left);
                clock.setByoYomiTimeLeftMs(tc.byoYomiMs());
                return ClockTransition.ENTERED_BYO_YOMI;
            }
        }
        return timeout(clock);
    }

    private ClockTransition chargeByoYomi(PlayerClock clock, TimeControl tc, long elapsed) {
        long period = tc.byoYomiMs();
        if (period > 0 && elapsed <= period) {
            clock.setByoYomiTimeLeftMs(period);
            return ClockTransition.BYO_YOMI_RESET;
        }
        long left = clock.getByoYomiPeriodsLeft() - periodsConsumed(elapsed, period);
        if (left > 0) {
            clock.setByoYomiPeriodsLeft((int) left);
            clock.setByoYomiTimeLeftMs(period);
            return ClockTransition.PERIODS_CONSUMED;
        }
        return timeout(clock);
    }

    private long periodsConsumed(long time, long period) {
        if (period <= 0) {
            return Integer.MAX_VALUE;
        }
        return time / period;
    }

    private ClockTransition timeout(PlayerClock clock) {
        clock.setPhase(ClockPhase.TIMEOUT);
        clock.setMainTimeRemainingMs(0);
        clock.setByoYomiPeriodsLeft(0);
        clock.setByoYomiTimeLeftMs(0);
        return ClockTransition.TIMEOUT;
    }

    private long clampToZero(long value) {
        return Math.max(0, value);
    }
}
