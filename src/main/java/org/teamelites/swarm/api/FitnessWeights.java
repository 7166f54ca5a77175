package org.teamelites.swarm.api;

import com.typesafe.config.Config;

/**
 * Weights of the five fitness components in the composite score.
 */
public record FitnessWeights(
        double taskCompletion,
        double reviewScore,
        double reasoningDepth,
        double consensusSpeed,
        double costEfficiency) {

    /** Default weights; they sum to 1. */
    public static final FitnessWeights DEFAULT = new FitnessWeights(0.35, 0.25, 0.15, 0.10, 0.15);

    public FitnessWeights {
        requireNonNegative("taskCompletion", taskCompletion);
        requireNonNegative("reviewScore", reviewScore);
        requireNonNegative("reasoningDepth", reasoningDepth);
        requireNonNegative("consensusSpeed", consensusSpeed);
        requireNonNegative("costEfficiency", costEfficiency);
    }

    /**
     * Reads weights from a config block with keys {@code task-completion}, {@code review-score},
     * {@code reasoning-depth}, {@code consensus-speed} and {@code cost-efficiency}. Missing keys
     * fall back to {@link #DEFAULT}.
     *
     * @param config the weights block.
     * @return the weights.
     * @throws IllegalArgumentException if any weight is negative.
     */
    public static FitnessWeights fromConfig(Config config) {
        return new FitnessWeights(
                getOrDefault(config, "task-completion", DEFAULT.taskCompletion),
                getOrDefault(config, "review-score", DEFAULT.reviewScore),
                getOrDefault(config, "reasoning-depth", DEFAULT.reasoningDepth),
                getOrDefault(config, "consensus-speed", DEFAULT.consensusSpeed),
                getOrDefault(config, "cost-efficiency", DEFAULT.costEfficiency));
    }

    private static double getOrDefault(Config config, String path, double fallback) {
        return config.hasPath(path) ? config.getDouble(path) : fallback;
    }

    private static void requireNonNegative(String name, double value) {
        if (value < 0.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " weight must be non-negative, got: " + value);
        }
    }
}
