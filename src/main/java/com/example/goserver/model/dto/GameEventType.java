package com.example.goserver.model.dto;

public enum GameEventType {
    GAME_STATE,
    MOVE_MADE,
    TIME_UPDATE,
    BYO_YOMI_RESET,
    PLAYER_TIMEOUT,
    PLAYER_JOINED,
    SCORING_PHASE_STARTED,
    DEAD_STONES_UPDATED,
    SCORE_CONFIRMATION_UPDATE,
    SCORING_CANCELED,
    GAME_FINISHED,
    UNDO_REQUESTED,
    UNDO_RESOLVED,
    PLAY_AGAIN_REQUESTED,
    PLAY_AGAIN_DECLINED,
    NEW_GAME
}
