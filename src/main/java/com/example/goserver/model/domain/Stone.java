package com.example.goserver.model.domain;

public record Stone(Position position, StoneColor color) {
}
