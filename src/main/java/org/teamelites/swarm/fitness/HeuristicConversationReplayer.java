package org.teamelites.swarm.fitness;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.teamelites.swarm.api.AgentRole;
import org.teamelites.swarm.api.ReviewVerdict;
import org.teamelites.swarm.api.SwarmAgentConfig;
import org.teamelites.swarm.api.TeamBlueprint;

import com.typesafe.config.Config;

/**
 * Offline replayer that judges a team from its structure instead of running it.
 * <p>
 * <ul>
 *   <li>Completion: the team's prompts and skills cover at least the completion threshold of
 *       the probe's expected keywords.</li>
 *   <li>Verdict: approve when the task completes and a reviewer is on the team, comment when
 *       only one of the two holds, request-changes otherwise.</li>
 *   <li>Reasoning steps: team size times the strategy's depth (sequential and parallel 1,
 *       pipeline 2, debate 3).</li>
 *   <li>Turns to consensus: parallel 1, debate one more than the team size, sequential and
 *       pipeline the team size; a coordinator saves one turn on teams larger than one.</li>
 *   <li>Cost: sum of the configured per-model costs of all slots.</li>
 * </ul>
 * Deterministic: the same blueprint and probe always produce the same outcome.
 */
public class HeuristicConversationReplayer implements IConversationReplayer {

    private final Map<String, Double> modelCosts;
    private final double defaultModelCost;
    private final double completionThreshold;

    /**
     * Options: {@code model-costs} (list of {@code {model, cost}}), {@code default-model-cost},
     * {@code completion-threshold}.
     */
    public HeuristicConversationReplayer(Config options) {
        this(readModelCosts(options), options.getDouble("default-model-cost"),
                options.getDouble("completion-threshold"));
    }

    HeuristicConversationReplayer(Map<String, Double> modelCosts, double defaultModelCost,
                                  double completionThreshold) {
        if (defaultModelCost < 0.0) {
            throw new IllegalArgumentException("default-model-cost must be >= 0, got: " + defaultModelCost);
        }
        if (completionThreshold < 0.0 || completionThreshold > 1.0) {
            throw new IllegalArgumentException("completion-threshold must be in [0.0, 1.0], got: " + completionThreshold);
        }
        this.modelCosts = Map.copyOf(modelCosts);
        this.defaultModelCost = defaultModelCost;
        this.completionThreshold = completionThreshold;
    }

    @Override
    public ReplayOutcome replay(TeamBlueprint blueprint, ProbeConversation probe) {
        double coverage = keywordCoverage(blueprint, probe);
        boolean completed = coverage >= completionThreshold;
        boolean reviewed = blueprint.agents().stream().anyMatch(a -> a.role() == AgentRole.REVIEWER);

        ReviewVerdict verdict;
        if (completed && reviewed) {
            verdict = ReviewVerdict.APPROVE;
        } else if (completed || reviewed) {
            verdict = ReviewVerdict.COMMENT;
        } else {
            verdict = ReviewVerdict.REQUEST_CHANGES;
        }

        int size = blueprint.agents().size();
        int depth = switch (blueprint.coordinationStrategy()) {
            case SEQUENTIAL, PARALLEL -> 1;
            case PIPELINE -> 2;
            case DEBATE -> 3;
        };
        int turns = switch (blueprint.coordinationStrategy()) {
            case PARALLEL -> 1;
            case DEBATE -> size + 1;
            case SEQUENTIAL, PIPELINE -> size;
        };
        if (size > 1 && blueprint.coordinatorCount() > 0) {
            turns--;
        }

        double cost = 0.0;
        for (SwarmAgentConfig agent : blueprint.agents()) {
            cost += modelCosts.getOrDefault(agent.model(), defaultModelCost);
        }

        return new ReplayOutcome(completed, verdict, size * depth, turns, cost);
    }

    /**
     * @return fraction of the probe's expected keywords found in the team's prompts and skills;
     *         1.0 for a probe without keywords.
     */
    static double keywordCoverage(TeamBlueprint blueprint, ProbeConversation probe) {
        if (probe.expectedKeywords().isEmpty()) {
            return 1.0;
        }
        StringBuilder text = new StringBuilder();
        for (SwarmAgentConfig agent : blueprint.agents()) {
            text.append(agent.systemPrompt()).append(' ');
            agent.skills().additionalSkills().forEach(s -> text.append(s).append(' '));
            agent.memoryBlocks().forEach(m -> text.append(m.value()).append(' '));
        }
        String haystack = text.toString().toLowerCase(Locale.ROOT);
        long hits = probe.expectedKeywords().stream().filter(haystack::contains).count();
        return (double) hits / probe.expectedKeywords().size();
    }

    private static Map<String, Double> readModelCosts(Config options) {
        Map<String, Double> costs = new LinkedHashMap<>();
        if (options.hasPath("model-costs")) {
            for (Config entry : options.getConfigList("model-costs")) {
                costs.put(entry.getString("model"), entry.getDouble("cost"));
            }
        }
        return costs;
    }
}
