package com.example.goserver.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoveRecord {
    private MoveType type;
    private StoneColor color;
    private Position position; // null for a pass
    private String playerId;
    private long timestamp;
    private long timeSpentMs;
    private int capturedCount;
    private ClockSnapshot clock; // mover's clock after the charge

    public static MoveRecord placement(Position position, StoneColor color, String playerId, long timestamp,
                                       long timeSpentMs, int capturedCount, ClockSnapshot clock) {
        return new MoveRecord(MoveType.PLACEMENT, color, position, playerId, timestamp, timeSpentMs, capturedCount, clock);
    }

    public static MoveRecord pass(StoneColor color, String playerId, long timestamp, long timeSpentMs, ClockSnapshot clock) {
        return new MoveRecord(MoveType.PASS, color, null, playerId, timestamp, timeSpentMs, 0, clock);
    }

    public boolean isPass() {
        return type == MoveType.PASS;
    }
}
