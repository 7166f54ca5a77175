package org.teamelites.swarm.variation;

import java.util.List;
import java.util.Objects;

import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.IRandomProvider;
import org.teamelites.swarm.spi.IVariationOperator;

/**
 * Base class for single-parent operators. Subclasses implement {@link #mutate(TeamBlueprint)};
 * lineage (fresh id, generation + 1, single parent id) is stamped here so no operator can get
 * it wrong.
 */
public abstract class AbstractMutation implements IVariationOperator {

    protected final IRandomProvider random;
    protected final VariationCatalog catalog;

    protected AbstractMutation(IRandomProvider random, VariationCatalog catalog) {
        this.random = Objects.requireNonNull(random, "random");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    public final TeamBlueprint apply(TeamBlueprint parent) {
        TeamBlueprint mutated = mutate(parent);
        return mutated.withLineage(BlueprintIds.next(random), parent.generation() + 1, List.of(parent.id()));
    }

    /**
     * Applies the operator's change. Lineage fields of the returned blueprint are overwritten.
     *
     * @param parent the parent; must not be modified.
     * @return the changed blueprint.
     */
    protected abstract TeamBlueprint mutate(TeamBlueprint parent);

    protected int randomAgentIndex(TeamBlueprint blueprint) {
        return random.nextInt(blueprint.agents().size());
    }
}
