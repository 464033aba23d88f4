package com.example.goserver.model.domain;

/**
 * Board coordinate, 0-indexed. {@code x} is the column, {@code y} the row.
 */
public record Position(int x, int y) {
}
