package org.teamelites.swarm.evolution;

import java.util.List;

import org.teamelites.swarm.api.AgentRole;
import org.teamelites.swarm.api.CoordinationStrategy;
import org.teamelites.swarm.api.FitnessScores;
import org.teamelites.swarm.api.HubRefs;
import org.teamelites.swarm.api.NicheDescriptor;
import org.teamelites.swarm.api.SkillsConfig;
import org.teamelites.swarm.api.SwarmAgentConfig;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.IRandomProvider;
import org.teamelites.swarm.variation.BlueprintIds;

/**
 * Seeds for empty niches.
 */
public final class GenesisBlueprints {

    private GenesisBlueprints() {
    }

    /**
     * Builds the generation-0 blueprint of a niche: a single coordinator on the genesis model,
     * sequential strategy, no skills, no memory, zero fitness.
     *
     * @param niche  the empty niche.
     * @param model  the genesis model.
     * @param random id source.
     * @return the genesis blueprint.
     */
    public static TeamBlueprint create(NicheDescriptor niche, String model, IRandomProvider random) {
        SwarmAgentConfig coordinator = new SwarmAgentConfig(
                AgentRole.COORDINATOR,
                model,
                defaultPrompt(niche),
                SkillsConfig.EMPTY,
                List.of());
        return new TeamBlueprint(
                BlueprintIds.next(random),
                "Random-" + niche.key(),
                0,
                List.of(),
                List.of(coordinator),
                CoordinationStrategy.SEQUENTIAL,
                niche,
                FitnessScores.ZERO,
                HubRefs.EMPTY);
    }

    /**
     * @return {@code You are a helpful assistant specialized in <domain> tasks on <channel>.}
     */
    public static String defaultPrompt(NicheDescriptor niche) {
        return "You are a helpful assistant specialized in " + niche.domain().id() + " tasks on "
                + niche.channel() + ".";
    }
}
