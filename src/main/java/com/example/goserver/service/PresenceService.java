package com.example.goserver.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which game each STOMP connection is in and who it speaks for. A game whose last
 * connection goes away is evicted after the grace period unless someone comes back.
 */
@Slf4j
@Service
public class PresenceService {

    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();
    private final GameService gameService;

    public PresenceService(GameService gameService) {
        this.gameService = gameService;
    }

    public record Binding(String gameId, String playerId) {
    }

    public void bind(String connectionId, String gameId, String playerId) {
        Binding previous = bindings.put(connectionId, new Binding(gameId, playerId));
        if (previous != null && !previous.gameId().equals(gameId)) {
            armIfAbandoned(previous.gameId());
        }
        gameService.cancelEviction(gameId);
    }

    /**
     * @return the player id this connection joined {@code gameId} as
     * @throws IllegalStateException when the connection has not joined that game
     */
    public String requirePlayer(String connectionId, String gameId) {
        Binding binding = bindings.get(connectionId);
        if (binding == null || !binding.gameId().equals(gameId)) {
            throw new IllegalStateException("Join the game before sending commands");
        }
        return binding.playerId();
    }

    /**
     * Explicit leave. The game is evicted right away when nobody is left.
     */
    public void leave(String connectionId, String gameId) {
        Binding binding = bindings.get(connectionId);
        if (binding == null || !binding.gameId().equals(gameId)) {
            return;
        }
        bindings.remove(connectionId);
        log.info("Player {} left game {}", binding.playerId(), gameId);
        if (!hasConnections(gameId)) {
            gameService.evict(gameId);
        }
    }

    /**
     * Moves every connection of {@code fromGameId} over to its successor.
     */
    public void follow(String fromGameId, String toGameId) {
        bindings.replaceAll((id, b) -> b.gameId().equals(fromGameId) ? new Binding(toGameId, b.playerId()) : b);
        if (hasConnections(toGameId)) {
            gameService.cancelEviction(toGameId);
        }
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        Binding binding = bindings.remove(event.getSessionId());
        if (binding == null) {
            return;
        }
        log.info("Connection {} of player {} dropped from game {}", event.getSessionId(), binding.playerId(),
                binding.gameId());
        armIfAbandoned(binding.gameId());
    }

    public boolean hasConnections(String gameId) {
        return bindings.values().stream().anyMatch(b -> b.gameId().equals(gameId));
    }

    private void armIfAbandoned(String gameId) {
        if (hasConnections(gameId)) {
            return;
        }
        gameService.scheduleEviction(gameId, () -> {
            if (!hasConnections(gameId)) {
                gameService.evict(gameId);
            }
        });
    }
}
