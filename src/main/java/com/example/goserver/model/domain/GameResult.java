package com.example.goserver.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameResult {
    private String code;        // "B+R", "W+T", "B+3.5", "Draw"
    private StoneColor winner;  // null on a draw
    private ResultReason reason;
    private ScoreResult score;  // only for scored games

    public static GameResult resignation(StoneColor winner) {
        return new GameResult(winner.code() + "+R", winner, ResultReason.RESIGNATION, null);
    }

    public static GameResult timeout(StoneColor winner) {
        return new GameResult(winner.code() + "+T", winner, ResultReason.TIMEOUT, null);
    }

    public static GameResult scored(ScoreResult score) {
        return new GameResult(score.getResultCode(), score.getWinner(), ResultReason.SCORE, score);
    }
}
