package com.example.goserver.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings chosen at creation time. A session keeps its config for life and hands an
 * identical copy to its successor on play-again.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GameConfig {
    private int boardSize = 19;
    private Ruleset ruleset = Ruleset.JAPANESE;
    private Double komi; // null = ruleset default
    private int handicap;
    private GameType gameType = GameType.EVEN;
    private TimeControl timeControl; // null = preset for board size and game type
    private ColorPreference colorPreference = ColorPreference.BLACK;
    private boolean vsAi;
    private AiLevel aiLevel = AiLevel.NORMAL;

    public GameConfig copy() {
        GameConfig copy = new GameConfig();
        copy.setBoardSize(boardSize);
        copy.setRuleset(ruleset);
        copy.setKomi(komi);
        copy.setHandicap(handicap);
        copy.setGameType(gameType);
        copy.setTimeControl(timeControl == null ? null : timeControl.copy());
        copy.setColorPreference(colorPreference);
        copy.setVsAi(vsAi);
        copy.setAiLevel(aiLevel);
        return copy;
    }
}
