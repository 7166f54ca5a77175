package org.teamelites.swarm.spi;

import org.teamelites.swarm.api.FitnessScores;
import org.teamelites.swarm.api.TeamBlueprint;

/**
 * Measures the fitness of a candidate blueprint.
 * <p>
 * Implementations must not mutate the archive. They may run in parallel for different
 * candidates.
 */
@FunctionalInterface
public interface IBlueprintEvaluator {

    /**
     * @param blueprint the candidate.
     * @return fitness with every component in [0, 1].
     * @throws CollaboratorException if a collaborator used for evaluation fails.
     */
    FitnessScores evaluate(TeamBlueprint blueprint) throws CollaboratorException;
}
