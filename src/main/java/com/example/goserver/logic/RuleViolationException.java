package com.example.goserver.logic;

/**
 * A placement the rules forbid. Thrown before any board state is changed.
 */
public class RuleViolationException extends IllegalStateException {

    public enum Reason {
        OUT_OF_BOUNDS("Position is outside the board"),
        OCCUPIED("Position is already occupied"),
        KO("Ko rule violation"),
        SUICIDE("Suicide move is not allowed");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Reason reason;

    public RuleViolationException(Reason reason) {
        super(reason.message());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
