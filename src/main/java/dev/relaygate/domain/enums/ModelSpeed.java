package dev.relaygate.domain.enums;

public enum ModelSpeed {
    FAST(100), MEDIUM(75), SLOW(50);

    private final int score;
    ModelSpeed(int score) { this.score = score; }

    public int score() { return score; }
}
