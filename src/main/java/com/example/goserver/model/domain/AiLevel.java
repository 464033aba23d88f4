package com.example.goserver.model.domain;

/**
 * Strength presets handed to the external engine as search limits.
 */
public enum AiLevel {
    EASY(50, 1.0, 1),
    NORMAL(100, 3.0, 1),
    HARD(200, 5.0, 2),
    PRO(400, 8.0, 2);

    private final int maxVisits;
    private final double maxTimeSeconds;
    private final int searchThreads;

    AiLevel(int maxVisits, double maxTimeSeconds, int searchThreads) {
        this.maxVisits = maxVisits;
        this.maxTimeSeconds = maxTimeSeconds;
        this.searchThreads = searchThreads;
    }

    public int maxVisits() {
        return maxVisits;
    }

    public double maxTimeSeconds() {
        return maxTimeSeconds;
    }

    public int searchThreads() {
        return searchThreads;
    }

    public String displayName() {
        return "KataGo (" + name().toLowerCase() + ")";
    }
}
