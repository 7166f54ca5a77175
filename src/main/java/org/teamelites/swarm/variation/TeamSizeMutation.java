package org.teamelites.swarm.variation;

import java.util.ArrayList;
import java.util.List;

import org.teamelites.swarm.api.AgentRole;
import org.teamelites.swarm.api.SkillsConfig;
import org.teamelites.swarm.api.SwarmAgentConfig;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.IRandomProvider;

/**
 * Grows the team by one generic contributor or shrinks it by one non-coordinator agent,
 * keeping the size within [{@link TeamBlueprint#MIN_AGENTS}, {@link TeamBlueprint#MAX_AGENTS}].
 * At a boundary only the legal direction is taken; in between, both are equally likely.
 */
public class TeamSizeMutation extends AbstractMutation {

    public TeamSizeMutation(IRandomProvider random, VariationCatalog catalog) {
        super(random, catalog);
    }

    @Override
    public String name() {
        return "teamSizeMutation";
    }

    @Override
    protected TeamBlueprint mutate(TeamBlueprint parent) {
        List<SwarmAgentConfig> agents = new ArrayList<>(parent.agents());
        boolean canGrow = agents.size() < TeamBlueprint.MAX_AGENTS;
        boolean canShrink = agents.size() > TeamBlueprint.MIN_AGENTS;

        boolean grow;
        if (canGrow && canShrink) {
            grow = random.nextDouble() < 0.5;
        } else if (canGrow) {
            grow = true;
        } else if (canShrink) {
            grow = false;
        } else {
            return parent;
        }

        if (grow) {
            agents.add(new SwarmAgentConfig(
                    AgentRole.CONTRIBUTOR,
                    random.pick(catalog.models()),
                    catalog.contributorPrompt(),
                    SkillsConfig.EMPTY,
                    List.of()));
        } else {
            List<Integer> removable = new ArrayList<>();
            for (int i = 0; i < agents.size(); i++) {
                if (agents.get(i).role() != AgentRole.COORDINATOR) {
                    removable.add(i);
                }
            }
            if (!removable.isEmpty()) {
                agents.remove((int) random.pick(removable));
            }
        }
        return parent.withAgents(agents);
    }
}
