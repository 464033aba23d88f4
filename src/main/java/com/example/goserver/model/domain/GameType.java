package com.example.goserver.model.domain;

public enum GameType {
    EVEN,
    HANDICAP,
    TEACHING,
    BLITZ
}
