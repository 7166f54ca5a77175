package org.teamelites.swarm.variation;

import java.util.ArrayList;
import java.util.List;

import org.teamelites.swarm.api.SkillsConfig;
import org.teamelites.swarm.api.SwarmAgentConfig;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds, removes or swaps one skill flag on a random agent slot and adjusts that slot's
 * free-form skill list by one entry.
 * <ul>
 *   <li><b>add</b>: enables a random flag and appends a new skill identifier.</li>
 *   <li><b>remove</b>: disables a random flag and drops the last skill identifier, if any.</li>
 *   <li><b>swap</b>: disables the chosen flag if enabled and enables another one (or enables it
 *       if it was disabled); replaces the last skill identifier with a new one.</li>
 * </ul>
 */
public class SkillMutation extends AbstractMutation {

    private static final Logger LOG = LoggerFactory.getLogger(SkillMutation.class);

    enum Action { ADD, REMOVE, SWAP }

    public SkillMutation(IRandomProvider random, VariationCatalog catalog) {
        super(random, catalog);
    }

    @Override
    public String name() {
        return "skillMutation";
    }

    @Override
    protected TeamBlueprint mutate(TeamBlueprint parent) {
        if (parent.agents().isEmpty()) {
            return parent;
        }
        int index = randomAgentIndex(parent);
        Action action = random.pick(List.of(Action.values()));
        SwarmAgentConfig agent = parent.agents().get(index);

        SkillsConfig skills = mutateFlags(agent.skills(), action);
        skills = skills.withAdditionalSkills(mutateAdditional(skills.additionalSkills(), action));

        List<SwarmAgentConfig> agents = new ArrayList<>(parent.agents());
        agents.set(index, agent.withSkills(skills));
        LOG.debug("Skill mutation {} on slot {} of {}", action, index, parent.id());
        return parent.withAgents(agents);
    }

    private SkillsConfig mutateFlags(SkillsConfig skills, Action action) {
        if (catalog.skillFlags().isEmpty()) {
            return skills;
        }
        String flag = random.pick(catalog.skillFlags());
        return switch (action) {
            case ADD -> skills.withFlag(flag, true);
            case REMOVE -> skills.withFlag(flag, false);
            case SWAP -> {
                if (!skills.isEnabled(flag)) {
                    yield skills.withFlag(flag, true);
                }
                List<String> disabled = new ArrayList<>();
                for (String candidate : catalog.skillFlags()) {
                    if (!skills.isEnabled(candidate)) {
                        disabled.add(candidate);
                    }
                }
                SkillsConfig swapped = skills.withFlag(flag, false);
                yield disabled.isEmpty() ? swapped : swapped.withFlag(random.pick(disabled), true);
            }
        };
    }

    private List<String> mutateAdditional(List<String> current, Action action) {
        List<String> next = new ArrayList<>(current);
        switch (action) {
            case ADD -> next.add(newSkillId());
            case REMOVE -> {
                if (!next.isEmpty()) {
                    next.remove(next.size() - 1);
                }
            }
            case SWAP -> {
                if (next.isEmpty()) {
                    next.add(newSkillId());
                } else {
                    next.set(next.size() - 1, newSkillId());
                }
            }
        }
        return next;
    }

    private String newSkillId() {
        return "skill-" + BlueprintIds.randomToken(random, 4);
    }
}
