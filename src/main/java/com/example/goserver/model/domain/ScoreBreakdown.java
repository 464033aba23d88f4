package com.example.goserver.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBreakdown {
    private int territory;
    private int stones;   // live stones counted under area rules, 0 otherwise
    private int captures; // prisoners counted under the ruleset, 0 when not counted
    private double komi;
    private double total;
}
