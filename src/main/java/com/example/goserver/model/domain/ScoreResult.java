package com.example.goserver.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreResult {
    private Ruleset ruleset;
    private List<Position> blackTerritory;
    private List<Position> whiteTerritory;
    private List<Position> neutralPoints;
    private ScoreBreakdown black;
    private ScoreBreakdown white;
    private StoneColor winner; // null on a draw
    private String resultCode;
}
