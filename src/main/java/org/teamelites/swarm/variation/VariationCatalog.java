package org.teamelites.swarm.variation;

import java.util.Arrays;
import java.util.List;

import org.teamelites.swarm.api.AgentRole;
import org.teamelites.swarm.api.CoordinationStrategy;

import com.typesafe.config.Config;

/**
 * The value catalogs the variation operators draw from.
 *
 * @param models             model tiers, e.g. {@code anthropic/claude-haiku-4-5-20251001}.
 * @param roles              assignable roles.
 * @param strategies         coordination strategies.
 * @param skillFlags         toggleable skill flags.
 * @param contributorPrompt  system prompt of agents added by team growth.
 */
public record VariationCatalog(
        List<String> models,
        List<AgentRole> roles,
        List<CoordinationStrategy> strategies,
        List<String> skillFlags,
        String contributorPrompt) {

    /** Catalog used when no configuration is supplied. */
    public static final VariationCatalog DEFAULT = new VariationCatalog(
            List.of(
                    "anthropic/claude-haiku-4-5-20251001",
                    "anthropic/claude-sonnet-4-5-20250929",
                    "anthropic/claude-opus-4-5-20251101",
                    "openai/gpt-5.2",
                    "google_ai/gemini-3-pro-preview",
                    "google_ai/gemini-3-flash-preview"),
            Arrays.asList(AgentRole.values()),
            Arrays.asList(CoordinationStrategy.values()),
            List.of("cronEnabled", "googleEnabled"),
            "You are a helpful team member.");

    public VariationCatalog {
        models = List.copyOf(models);
        roles = List.copyOf(roles);
        strategies = List.copyOf(strategies);
        skillFlags = List.copyOf(skillFlags);
        if (models.isEmpty()) {
            throw new IllegalArgumentException("At least one model is required");
        }
        if (strategies.size() < 2) {
            throw new IllegalArgumentException("At least two coordination strategies are required, got: " + strategies);
        }
        if (!roles.contains(AgentRole.COORDINATOR)) {
            throw new IllegalArgumentException("Role catalog must contain the coordinator role");
        }
    }

    /**
     * Reads the catalog from the {@code variation} config block ({@code models},
     * {@code skill-flags}, {@code contributor-prompt}). Roles and strategies always cover all
     * enum values.
     *
     * @param config the variation block.
     * @return the catalog.
     */
    public static VariationCatalog fromConfig(Config config) {
        List<String> models = config.hasPath("models") ? config.getStringList("models") : DEFAULT.models();
        List<String> flags = config.hasPath("skill-flags") ? config.getStringList("skill-flags") : DEFAULT.skillFlags();
        String prompt = config.hasPath("contributor-prompt")
                ? config.getString("contributor-prompt")
                : DEFAULT.contributorPrompt();
        return new VariationCatalog(models, DEFAULT.roles(), DEFAULT.strategies(), flags, prompt);
    }
}
