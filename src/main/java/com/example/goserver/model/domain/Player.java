package com.example.goserver.model.domain;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class Player {
    private String id;
    private String username;
    private StoneColor color;
    private boolean ai;
    private PlayerClock clock;

    public Player(String id, String username, StoneColor color, boolean ai) {
        this.id = id;
        this.username = username;
        this.color = color;
        this.ai = ai;
    }
}
