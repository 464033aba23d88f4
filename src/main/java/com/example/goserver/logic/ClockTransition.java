package com.example.goserver.logic;

public enum ClockTransition {
    NONE,               // tick projection only, nothing committed
    MAIN_TIME_RUNNING,  // charge stayed inside main time (or unlimited)
    PER_MOVE_RESET,     // blitz allotment refilled
    ENTERED_BYO_YOMI,
    BYO_YOMI_RESET,     // move made inside the period, period returned
    PERIODS_CONSUMED,   // one or more periods used up, still alive
    TIMEOUT;

    /** Transitions clients announce as a byo-yomi reset. */
    public boolean isByoYomiEvent() {
        return this == ENTERED_BYO_YOMI || this == BYO_YOMI_RESET || this == PERIODS_CONSUMED;
    }
}
