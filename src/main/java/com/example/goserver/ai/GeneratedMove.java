package com.example.goserver.ai;

import com.example.goserver.model.domain.Position;

/**
 * Engine answer to {@code genmove}, with the wall-clock time the engine spent on it.
 */
public record GeneratedMove(Type type, Position position, long thinkingTimeMs) {

    public enum Type {
        PLACE,
        PASS,
        RESIGN
    }

    public static GeneratedMove parse(String reply, int boardSize, long thinkingTimeMs) {
        String vertex = reply == null ? "" : reply.trim();
        if (vertex.equalsIgnoreCase("resign")) {
            return new GeneratedMove(Type.RESIGN, null, thinkingTimeMs);
        }
        Position position = GtpVertex.decode(vertex, boardSize);
        if (position == null) {
            return new GeneratedMove(Type.PASS, null, thinkingTimeMs);
        }
        return new GeneratedMove(Type.PLACE, position, thinkingTimeMs);
    }
}
