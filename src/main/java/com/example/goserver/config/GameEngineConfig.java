package com.example.goserver.config;

import com.example.goserver.logic.BoardEngine;
import com.example.goserver.logic.GameEngine;
import com.example.goserver.logic.GameEventPublisher;
import com.example.goserver.logic.GameSetup;
import com.example.goserver.logic.ScoringEngine;
import com.example.goserver.logic.SgfExporter;
import com.example.goserver.logic.TimeControlStateMachine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the plain rule classes, which carry no Spring annotations of their own.
 */
@Configuration
public class GameEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BoardEngine boardEngine() {
        return new BoardEngine();
    }

    @Bean
    public ScoringEngine scoringEngine(BoardEngine boardEngine, GoServerProperties properties) {
        return new ScoringEngine(boardEngine, properties.getScoring().isAutoDetectDeadGroups());
    }

    @Bean
    public TimeControlStateMachine timeControlStateMachine() {
        return new TimeControlStateMachine();
    }

    @Bean
    public GameSetup gameSetup(TimeControlStateMachine timeControl, Clock clock) {
        return new GameSetup(timeControl, clock);
    }

    @Bean
    public GameEngine gameEngine(BoardEngine boardEngine,
                                 ScoringEngine scoringEngine,
                                 TimeControlStateMachine timeControl,
                                 GameSetup gameSetup,
                                 GameEventPublisher publisher,
                                 Clock clock) {
        return new GameEngine(boardEngine, scoringEngine, timeControl, gameSetup, publisher, clock);
    }

    @Bean
    public SgfExporter sgfExporter() {
        return new SgfExporter();
    }
}
