package com.example.goserver.model.domain;

public enum Ruleset {
    CHINESE(7.5),
    JAPANESE(6.5),
    KOREAN(6.5),
    AGA(7.5),
    ING(8.0);

    private final double defaultKomi;

    Ruleset(double defaultKomi) {
        this.defaultKomi = defaultKomi;
    }

    public double defaultKomi() {
        return defaultKomi;
    }
}
