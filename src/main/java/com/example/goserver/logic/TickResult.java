package com.example.goserver.logic;

import com.example.goserver.model.domain.ClockSnapshot;

/**
 * Result of a clock tick. {@code committed} means the clock baseline moved and the caller must
 * restart its elapsed-time reference.
 */
public record TickResult(ClockSnapshot projection, ClockTransition transition) {

    public boolean committed() {
        return transition != ClockTransition.NONE;
    }

    public boolean timedOut() {
        return transition == ClockTransition.TIMEOUT;
    }
}
