package com.example.goserver.ai;

import com.example.goserver.model.domain.AiLevel;

public interface AiEngineFactory {

    /**
     * Spawns a new engine. The caller owns it and must close it.
     *
     * @throws AiUnavailableException when the engine cannot be started
     */
    AiEngine acquire(AiLevel level);
}
