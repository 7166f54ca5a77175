package org.teamelites.swarm.api;

/**
 * Raw, unclamped fitness components as measured by an evaluator.
 */
public record FitnessInput(
        double taskCompletion,
        double reviewScore,
        double reasoningDepth,
        double consensusSpeed,
        double costEfficiency) {
}
