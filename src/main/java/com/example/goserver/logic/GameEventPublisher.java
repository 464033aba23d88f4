package com.example.goserver.logic;

import com.example.goserver.model.domain.GameSession;
import com.example.goserver.model.dto.GameEventType;

/**
 * Outbound channel for session events. Called while the session lock is held.
 */
public interface GameEventPublisher {

    void publish(GameSession session, GameEventType type, Object payload);

    /** Broadcasts a full snapshot of the session. */
    void publishState(GameSession session);
}
