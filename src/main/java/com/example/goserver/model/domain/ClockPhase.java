package com.example.goserver.model.domain;

public enum ClockPhase {
    MAIN_TIME,
    BYO_YOMI,
    PER_MOVE,  // blitz
    TIMEOUT
}
