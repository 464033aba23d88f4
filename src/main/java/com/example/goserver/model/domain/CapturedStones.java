package com.example.goserver.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Prisoners taken by each color. Counts only ever grow.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CapturedStones {
    private int black;
    private int white;

    public int get(StoneColor capturer) {
        return capturer == StoneColor.BLACK ? black : white;
    }

    public void add(StoneColor capturer, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Capture count cannot be negative");
        }
        if (capturer == StoneColor.BLACK) {
            black += count;
        } else {
            white += count;
        }
    }

    public CapturedStones copy() {
        return new CapturedStones(black, white);
    }
}
