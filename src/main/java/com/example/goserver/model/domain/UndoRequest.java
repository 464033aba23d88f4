package com.example.goserver.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UndoRequest {
    private String requestedBy;
    private int moveIndex; // number of history entries to keep
}
