package com.example.goserver.service;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Advances every live clock, whether or not moves arrive.
 */
@Component
public class GameClockTicker {

    private final GameService gameService;

    public GameClockTicker(GameService gameService) {
        this.gameService = gameService;
    }

    @Scheduled(fixedRateString = "${goserver.clock.tick-interval-ms:1000}")
    public void tick() {
        gameService.tickAll();
    }
}
