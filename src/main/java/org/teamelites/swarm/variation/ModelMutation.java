package org.teamelites.swarm.variation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.teamelites.swarm.api.SwarmAgentConfig;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.IRandomProvider;

/**
 * Moves one random agent slot to a uniformly chosen different model tier.
 */
public class ModelMutation extends AbstractMutation {

    public ModelMutation(IRandomProvider random, VariationCatalog catalog) {
        super(random, catalog);
    }

    @Override
    public String name() {
        return "modelMutation";
    }

    @Override
    protected TeamBlueprint mutate(TeamBlueprint parent) {
        if (parent.agents().isEmpty()) {
            return parent;
        }
        int index = randomAgentIndex(parent);
        SwarmAgentConfig agent = parent.agents().get(index);
        List<String> others = catalog.models().stream()
                .filter(m -> !m.equals(agent.model()))
                .collect(Collectors.toList());
        if (others.isEmpty()) {
            return parent;
        }
        List<SwarmAgentConfig> agents = new ArrayList<>(parent.agents());
        agents.set(index, agent.withModel(random.pick(others)));
        return parent.withAgents(agents);
    }
}
