package com.example.goserver.model.domain;

public enum TimeControlMode {
    STANDARD,
    BLITZ
}
