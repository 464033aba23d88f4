package com.example.goserver.service;

import com.example.goserver.logic.GameEventPublisher;
import com.example.goserver.model.domain.GameSession;
import com.example.goserver.model.dto.GameEvent;
import com.example.goserver.model.dto.GameEventType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Broadcasts session events to every subscriber of {@code /topic/game/{gameId}}.
 */
@Component
public class StompGameEventPublisher implements GameEventPublisher {

    static final String TOPIC_PREFIX = "/topic/game/";

    private final SimpMessagingTemplate messagingTemplate;
    private final GameStateMapper mapper;
    private final Clock clock;

    public StompGameEventPublisher(SimpMessagingTemplate messagingTemplate, GameStateMapper mapper, Clock clock) {
        this.messagingTemplate = messagingTemplate;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public void publish(GameSession session, GameEventType type, Object payload) {
        GameEvent event = new GameEvent(type, session.getId(), payload, clock.millis());
        messagingTemplate.convertAndSend(TOPIC_PREFIX + session.getId(), event);
    }

    @Override
    public void publishState(GameSession session) {
        publish(session, GameEventType.GAME_STATE, mapper.toDTO(session));
    }
}
