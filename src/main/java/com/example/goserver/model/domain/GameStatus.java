package com.example.goserver.model.domain;

public enum GameStatus {
    WAITING,   // host seated, waiting for an opponent
    PLAYING,
    SCORING,   // both players passed, marking dead stones
    FINISHED
}
