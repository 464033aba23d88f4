package com.example.goserver.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for everything broadcast on {@code /topic/game/{gameId}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameEvent {
    private GameEventType type;
    private String gameId;
    private Object payload;
    private long serverTime;
}
