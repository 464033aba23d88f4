package com.example.goserver.repository;

import com.example.goserver.model.domain.GameSession;

import java.util.Collection;
import java.util.Optional;

/**
 * Live game sessions by id. Sessions are independent; the registry only tracks membership.
 */
public interface SessionRegistry {

    GameSession insert(GameSession session);

    Optional<GameSession> lookup(String sessionId);

    Optional<GameSession> lookupByCode(String code);

    Optional<GameSession> remove(String sessionId);

    /** Point-in-time copy, safe to iterate while sessions come and go. */
    Collection<GameSession> snapshot();
}
