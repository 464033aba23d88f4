package com.example.goserver.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of the undo and play-again destinations. {@code moveIndex} is the number of history
 * entries to keep; {@code accepted} is the answer to a pending request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UndoCommand {
    private int moveIndex;
    private boolean accepted;
}
