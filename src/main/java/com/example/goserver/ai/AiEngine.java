package com.example.goserver.ai;

import com.example.goserver.model.domain.StoneColor;

/**
 * An external Go engine owned by one game session. Acquired when the session is created
 * and closed when the session is evicted or replaced.
 *
 * <p>Calls block while the engine thinks and must not be made while holding a session lock.
 */
public interface AiEngine extends AutoCloseable {

    /**
     * Brings the engine to {@code position} and asks it for a move for {@code color}.
     *
     * @throws AiUnresponsiveException when the engine keeps failing after restarts
     */
    GeneratedMove generateMove(AiPosition position, StoneColor color);

    /**
     * The engine's own estimate of the result, e.g. {@code "B+3.5"}. Advisory only.
     */
    String finalScore(AiPosition position);

    @Override
    void close();
}
