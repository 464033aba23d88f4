package com.example.goserver.model.dto;

import com.example.goserver.model.domain.StoneColor;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to create and join: who the caller is in the game. {@code color} is null for spectators.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeatResponse {
    private String gameId;
    private String code;
    private String playerId;
    private StoneColor color;
}
