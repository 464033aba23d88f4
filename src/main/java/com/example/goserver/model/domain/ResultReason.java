package com.example.goserver.model.domain;

public enum ResultReason {
    RESIGNATION,
    TIMEOUT,
    SCORE
}
