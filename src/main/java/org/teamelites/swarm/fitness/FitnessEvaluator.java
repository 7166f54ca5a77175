package org.teamelites.swarm.fitness;

import org.teamelites.swarm.api.FitnessInput;
import org.teamelites.swarm.api.FitnessScores;
import org.teamelites.swarm.api.FitnessWeights;
import org.teamelites.swarm.api.ReviewVerdict;

/**
 * Composite fitness scoring and the elite replacement rule.
 * <p>
 * The composite is the weighted sum of five components, each clamped to [0, 1] before weighting;
 * the sum itself is clamped to [0, 1] as well so that weights summing to more than one cannot
 * escape the range.
 */
public final class FitnessEvaluator {

    private FitnessEvaluator() {
    }

    /**
     * Computes fitness with {@link FitnessWeights#DEFAULT}.
     */
    public static FitnessScores computeFitness(FitnessInput input) {
        return computeFitness(input, FitnessWeights.DEFAULT);
    }

    /**
     * Computes fitness.
     *
     * @param input   raw components; out-of-range values are clamped.
     * @param weights component weights.
     * @return clamped components and their composite.
     */
    public static FitnessScores computeFitness(FitnessInput input, FitnessWeights weights) {
        double tc = clamp(input.taskCompletion());
        double rs = clamp(input.reviewScore());
        double rd = clamp(input.reasoningDepth());
        double cs = clamp(input.consensusSpeed());
        double ce = clamp(input.costEfficiency());

        double composite = clamp(
                weights.taskCompletion() * tc
                        + weights.reviewScore() * rs
                        + weights.reasoningDepth() * rd
                        + weights.consensusSpeed() * cs
                        + weights.costEfficiency() * ce);

        return new FitnessScores(composite, tc, rs, rd, cs, ce);
    }

    /**
     * Decides whether a candidate displaces the current elite.
     * <p>
     * A strictly higher composite wins; on an equal composite a strictly higher cost efficiency
     * wins. Exact ties keep the incumbent.
     *
     * @param candidate the candidate's fitness.
     * @param current   the elite's fitness.
     * @return true if the candidate should replace the elite.
     */
    public static boolean isEliteReplacement(FitnessScores candidate, FitnessScores current) {
        if (candidate.composite() > current.composite()) {
            return true;
        }
        if (candidate.composite() < current.composite()) {
            return false;
        }
        return candidate.costEfficiency() > current.costEfficiency();
    }

    /**
     * Maps a review verdict to a score: approve 1.0, comment 0.5, request-changes 0.0.
     */
    public static double normalizeReviewScore(ReviewVerdict verdict) {
        return switch (verdict) {
            case APPROVE -> 1.0;
            case COMMENT -> 0.5;
            case REQUEST_CHANGES -> 0.0;
        };
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
