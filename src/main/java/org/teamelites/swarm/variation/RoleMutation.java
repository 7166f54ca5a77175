package org.teamelites.swarm.variation;

import java.util.ArrayList;
import java.util.List;

import org.teamelites.swarm.api.AgentRole;
import org.teamelites.swarm.api.SwarmAgentConfig;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.IRandomProvider;

/**
 * Reassigns the role of one random agent slot. When the new role is
 * {@link AgentRole#COORDINATOR}, every existing coordinator is demoted to
 * {@link AgentRole#CONTRIBUTOR} first, so a team never has two coordinators.
 */
public class RoleMutation extends AbstractMutation {

    public RoleMutation(IRandomProvider random, VariationCatalog catalog) {
        super(random, catalog);
    }

    @Override
    public String name() {
        return "roleMutation";
    }

    @Override
    protected TeamBlueprint mutate(TeamBlueprint parent) {
        if (parent.agents().isEmpty()) {
            return parent;
        }
        int index = randomAgentIndex(parent);
        AgentRole newRole = random.pick(catalog.roles());

        List<SwarmAgentConfig> agents = new ArrayList<>(parent.agents());
        if (newRole == AgentRole.COORDINATOR) {
            for (int i = 0; i < agents.size(); i++) {
                if (agents.get(i).role() == AgentRole.COORDINATOR) {
                    agents.set(i, agents.get(i).withRole(AgentRole.CONTRIBUTOR));
                }
            }
        }
        agents.set(index, agents.get(index).withRole(newRole));
        return parent.withAgents(agents);
    }
}
