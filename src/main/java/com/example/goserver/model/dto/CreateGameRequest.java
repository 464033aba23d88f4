package com.example.goserver.model.dto;

import com.example.goserver.model.domain.GameConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateGameRequest {
    private String playerId; // generated when absent
    private String username;
    private GameConfig config = new GameConfig();
}
