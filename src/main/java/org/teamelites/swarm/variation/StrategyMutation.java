package org.teamelites.swarm.variation;

import java.util.List;
import java.util.stream.Collectors;

import org.teamelites.swarm.api.CoordinationStrategy;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.IRandomProvider;

/**
 * Replaces the coordination strategy with a uniformly chosen different one.
 */
public class StrategyMutation extends AbstractMutation {

    public StrategyMutation(IRandomProvider random, VariationCatalog catalog) {
        super(random, catalog);
    }

    @Override
    public String name() {
        return "strategyMutation";
    }

    @Override
    protected TeamBlueprint mutate(TeamBlueprint parent) {
        List<CoordinationStrategy> others = catalog.strategies().stream()
                .filter(s -> s != parent.coordinationStrategy())
                .collect(Collectors.toList());
        return parent.withCoordinationStrategy(random.pick(others));
    }
}
