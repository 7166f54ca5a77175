package org.teamelites.swarm.evolution;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.teamelites.swarm.api.Domain;
import org.teamelites.swarm.api.FitnessWeights;
import org.teamelites.swarm.api.NicheDescriptor;

import com.typesafe.config.Config;

/**
 * Settings of the evolutionary loop.
 *
 * @param populationSize  upper bound of candidates per generation.
 * @param maxAgents       registry size at which provisioning for new niches stops.
 * @param genesisModel    model of genesis coordinators.
 * @param niches          niches that take part in evolution.
 * @param fitnessWeights  weights of the composite score.
 * @param interval        pause between generations when run as a service.
 * @param coordinatorName hub identity of the engine.
 * @param workspaceName   hub workspace holding the archive.
 */
public record EvolutionConfig(
        int populationSize,
        int maxAgents,
        String genesisModel,
        List<NicheDescriptor> niches,
        FitnessWeights fitnessWeights,
        Duration interval,
        String coordinatorName,
        String workspaceName) {

    public static final String DEFAULT_GENESIS_MODEL = "anthropic/claude-sonnet-4-5-20250929";

    public EvolutionConfig {
        if (populationSize < 1) {
            throw new IllegalArgumentException("population-size must be >= 1, got: " + populationSize);
        }
        if (maxAgents < 1) {
            throw new IllegalArgumentException("max-agents must be >= 1, got: " + maxAgents);
        }
        if (genesisModel == null || genesisModel.isBlank()) {
            throw new IllegalArgumentException("genesis-model must not be blank");
        }
        niches = List.copyOf(niches);
        Set<String> keys = new LinkedHashSet<>();
        for (NicheDescriptor niche : niches) {
            if (!keys.add(niche.key())) {
                throw new IllegalArgumentException("Duplicate niche: " + niche.key());
            }
        }
        if (fitnessWeights == null) {
            fitnessWeights = FitnessWeights.DEFAULT;
        }
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
    }

    /**
     * Reads the {@code evolution} block.
     * <p>
     * Keys: {@code population-size}, {@code max-agents}, {@code genesis-model}, {@code niches}
     * (list of {@code {channel, domain}} objects), {@code fitness-weights}, {@code interval},
     * {@code coordinator-name}, {@code workspace-name}.
     *
     * @param config the evolution block.
     * @return the settings.
     * @throws IllegalArgumentException if a value is out of range or a domain is unknown.
     */
    public static EvolutionConfig fromConfig(Config config) {
        List<NicheDescriptor> niches = new ArrayList<>();
        for (Config niche : config.getConfigList("niches")) {
            niches.add(NicheDescriptor.of(niche.getString("channel"), Domain.fromId(niche.getString("domain"))));
        }
        return new EvolutionConfig(
                config.getInt("population-size"),
                config.getInt("max-agents"),
                config.getString("genesis-model"),
                niches,
                FitnessWeights.fromConfig(config.getConfig("fitness-weights")),
                config.getDuration("interval"),
                config.getString("coordinator-name"),
                config.getString("workspace-name"));
    }

    /**
     * Settings for tests and embedding: default weights, genesis model and hub names.
     */
    public static EvolutionConfig of(int populationSize, int maxAgents, List<NicheDescriptor> niches) {
        return new EvolutionConfig(populationSize, maxAgents, DEFAULT_GENESIS_MODEL, niches,
                FitnessWeights.DEFAULT, Duration.ofHours(1), "TEAM-Elites-Coordinator", "team-elites-archive");
    }
}
