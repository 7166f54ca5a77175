package org.teamelites.swarm.spi;

import org.teamelites.swarm.api.TeamBlueprint;

/**
 * A single-parent variation operator.
 * <p>
 * Implementations are pure apart from the injected {@link IRandomProvider}: they never modify
 * the parent and always return a child with a fresh id, {@code generation = parent.generation + 1}
 * and {@code parentIds = [parent.id]}.
 * <p>
 * Implementations must provide a constructor with signature
 * {@code (IRandomProvider rng, VariationCatalog catalog)}.
 *
 * @see org.teamelites.swarm.variation.PromptCrossover for the two-parent operator
 */
public interface IVariationOperator {

    /**
     * @return operator name as recorded in swarm events, e.g. {@code skillMutation}.
     */
    String name();

    /**
     * Produces a mutated child.
     *
     * @param parent the parent blueprint; not modified.
     * @return the child.
     */
    TeamBlueprint apply(TeamBlueprint parent);
}
