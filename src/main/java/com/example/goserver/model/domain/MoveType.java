package com.example.goserver.model.domain;

public enum MoveType {
    PLACEMENT,
    PASS
}
