package org.teamelites.swarm.api;

import java.util.List;
import java.util.Objects;

/**
 * An immutable team configuration: the unit of evolution.
 * <p>
 * Invariants maintained by the variation operators: {@code 1 <= agents.size() <= 5}, at most one
 * {@link AgentRole#COORDINATOR}, {@code parentIds.size()} is 0 (genesis), 1 (mutation) or
 * 2 (crossover), and {@code generation} is one more than the largest parent generation.
 *
 * @param id                   unique blueprint id.
 * @param name                 display name.
 * @param generation           lineage depth.
 * @param parentIds            ids of the parents.
 * @param agents               agent slots; the first slot is the primary agent.
 * @param coordinationStrategy how the team cooperates.
 * @param niche                the niche this blueprint competes in.
 * @param fitness              last evaluated fitness.
 * @param hubRefs              hub records for archived blueprints.
 */
public record TeamBlueprint(
        String id,
        String name,
        int generation,
        List<String> parentIds,
        List<SwarmAgentConfig> agents,
        CoordinationStrategy coordinationStrategy,
        NicheDescriptor niche,
        FitnessScores fitness,
        HubRefs hubRefs) {

    /** Smallest legal team. */
    public static final int MIN_AGENTS = 1;
    /** Largest legal team. */
    public static final int MAX_AGENTS = 5;

    public TeamBlueprint {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(niche, "niche");
        parentIds = parentIds == null ? List.of() : List.copyOf(parentIds);
        agents = agents == null ? List.of() : List.copyOf(agents);
        if (coordinationStrategy == null) {
            coordinationStrategy = CoordinationStrategy.SEQUENTIAL;
        }
        if (fitness == null) {
            fitness = FitnessScores.ZERO;
        }
        if (hubRefs == null) {
            hubRefs = HubRefs.EMPTY;
        }
    }

    /**
     * Returns a copy with new identity and lineage.
     */
    public TeamBlueprint withLineage(String newId, int newGeneration, List<String> newParentIds) {
        return new TeamBlueprint(newId, name, newGeneration, newParentIds, agents, coordinationStrategy,
                niche, fitness, hubRefs);
    }

    public TeamBlueprint withAgents(List<SwarmAgentConfig> newAgents) {
        return new TeamBlueprint(id, name, generation, parentIds, newAgents, coordinationStrategy,
                niche, fitness, hubRefs);
    }

    public TeamBlueprint withCoordinationStrategy(CoordinationStrategy strategy) {
        return new TeamBlueprint(id, name, generation, parentIds, agents, strategy, niche, fitness, hubRefs);
    }

    public TeamBlueprint withNiche(NicheDescriptor newNiche) {
        return new TeamBlueprint(id, name, generation, parentIds, agents, coordinationStrategy,
                newNiche, fitness, hubRefs);
    }

    public TeamBlueprint withFitness(FitnessScores newFitness) {
        return new TeamBlueprint(id, name, generation, parentIds, agents, coordinationStrategy,
                niche, newFitness, hubRefs);
    }

    public TeamBlueprint withHubRefs(HubRefs refs) {
        return new TeamBlueprint(id, name, generation, parentIds, agents, coordinationStrategy,
                niche, fitness, refs);
    }

    /**
     * @return the number of slots holding the coordinator role.
     */
    public long coordinatorCount() {
        return agents.stream().filter(a -> a.role() == AgentRole.COORDINATOR).count();
    }
}
