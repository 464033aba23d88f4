package com.example.goserver.repository;

import com.example.goserver.model.domain.GameSession;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemorySessionRegistry implements SessionRegistry {

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    @Override
    public GameSession insert(GameSession session) {
        GameSession existing = sessions.putIfAbsent(session.getId(), session);
        if (existing != null && existing != session) {
            throw new IllegalStateException("Session " + session.getId() + " already registered");
        }
        return session;
    }

    @Override
    public Optional<GameSession> lookup(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Optional<GameSession> lookupByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return sessions.values().stream()
                .filter(s -> code.equalsIgnoreCase(s.getCode()))
                .findFirst();
    }

    @Override
    public Optional<GameSession> remove(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.remove(sessionId));
    }

    @Override
    public Collection<GameSession> snapshot() {
        return new ArrayList<>(sessions.values());
    }
}
