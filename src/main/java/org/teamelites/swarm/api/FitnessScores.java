package org.teamelites.swarm.api;

/**
 * Fitness of a blueprint. Every component and the composite lie in [0, 1].
 *
 * @param composite      weighted sum of the five components, used for elite comparison.
 * @param taskCompletion fraction of probe tasks completed.
 * @param reviewScore    normalized review verdict.
 * @param reasoningDepth depth of the team's reasoning.
 * @param consensusSpeed how quickly the team converged.
 * @param costEfficiency inverse of the relative cost; tie-breaker for equal composites.
 */
public record FitnessScores(
        double composite,
        double taskCompletion,
        double reviewScore,
        double reasoningDepth,
        double consensusSpeed,
        double costEfficiency) {

    /** Fitness of an unevaluated (genesis) blueprint. */
    public static final FitnessScores ZERO = new FitnessScores(0, 0, 0, 0, 0, 0);
}
