package dev.relaygate.domain.enums;

/**
 * Weights the optimizer applies when it has to pick an alternative model.
 * Order of weights: accuracy, speed, reliability, cost headroom.
 */
public enum OptimizationStrategy {
    AGGRESSIVE(0.15, 0.15, 0.20, 0.50),
    BALANCED(0.30, 0.20, 0.25, 0.25),
    QUALITY_FIRST(0.50, 0.10, 0.30, 0.10);

    private final double accuracyWeight;
    private final double speedWeight;
    private final double reliabilityWeight;
    private final double costWeight;

    OptimizationStrategy(double accuracyWeight, double speedWeight, double reliabilityWeight, double costWeight) {
        this.accuracyWeight = accuracyWeight;
        this.speedWeight = speedWeight;
        this.reliabilityWeight = reliabilityWeight;
        this.costWeight = costWeight;
    }

    public double accuracyWeight() { return accuracyWeight; }
    public double speedWeight() { return speedWeight; }
    public double reliabilityWeight() { return reliabilityWeight; }
    public double costWeight() { return costWeight; }
}
