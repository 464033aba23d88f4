package com.example.goserver.model.dto;

import com.example.goserver.model.domain.Position;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoveRequest {
    private int x;
    private int y;

    public Position toPosition() {
        return new Position(x, y);
    }
}
