package org.teamelites.swarm.fitness;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.teamelites.swarm.api.Domain;
import org.teamelites.swarm.api.FitnessInput;
import org.teamelites.swarm.api.FitnessScores;
import org.teamelites.swarm.api.FitnessWeights;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.CollaboratorException;
import org.teamelites.swarm.spi.IBlueprintEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Scores a blueprint by replaying its niche's probe conversations.
 * <p>
 * Probes are configured per domain; a domain without probes uses the {@code general} probes.
 * The per-probe outcomes are aggregated into the five fitness components:
 * <ul>
 *   <li>task completion: fraction of completed probes,</li>
 *   <li>review score: mean normalized verdict,</li>
 *   <li>reasoning depth: mean of {@code min(1, steps / targetSteps)},</li>
 *   <li>consensus speed: mean of {@code 1 / turnsToConsensus},</li>
 *   <li>cost efficiency: {@code 1 - meanCost / costBudget}.</li>
 * </ul>
 */
public class ConversationReplayEvaluator implements IBlueprintEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConversationReplayEvaluator.class);

    private final IConversationReplayer replayer;
    private final Map<Domain, List<ProbeConversation>> probes;
    private final FitnessWeights weights;
    private final double costBudget;

    /**
     * Options: {@code cost-budget}, {@code probes.<domain>} (lists of probes).
     *
     * @param replayer the replay strategy.
     * @param weights  composite weights.
     * @param options  the evaluation block.
     */
    public ConversationReplayEvaluator(IConversationReplayer replayer, FitnessWeights weights, Config options) {
        this(replayer, readProbes(options.getConfig("probes")), weights, options.getDouble("cost-budget"));
    }

    ConversationReplayEvaluator(IConversationReplayer replayer, Map<Domain, List<ProbeConversation>> probes,
                                FitnessWeights weights, double costBudget) {
        if (costBudget <= 0.0) {
            throw new IllegalArgumentException("cost-budget must be positive, got: " + costBudget);
        }
        List<ProbeConversation> general = probes.get(Domain.GENERAL);
        if (general == null || general.isEmpty()) {
            throw new IllegalArgumentException("At least one general probe is required");
        }
        this.replayer = replayer;
        this.probes = new EnumMap<>(probes);
        this.weights = weights;
        this.costBudget = costBudget;
    }

    @Override
    public FitnessScores evaluate(TeamBlueprint blueprint) throws CollaboratorException {
        List<ProbeConversation> niche = probesFor(blueprint.niche().domain());

        int completed = 0;
        double review = 0.0;
        double depth = 0.0;
        double speed = 0.0;
        double cost = 0.0;
        for (ProbeConversation probe : niche) {
            ReplayOutcome outcome = replayer.replay(blueprint, probe);
            if (outcome.completed()) {
                completed++;
            }
            review += FitnessEvaluator.normalizeReviewScore(outcome.verdict());
            depth += Math.min(1.0, (double) outcome.reasoningSteps() / probe.targetSteps());
            speed += 1.0 / outcome.turnsToConsensus();
            cost += outcome.costUnits();
        }

        int n = niche.size();
        FitnessScores scores = FitnessEvaluator.computeFitness(new FitnessInput(
                (double) completed / n,
                review / n,
                depth / n,
                speed / n,
                1.0 - (cost / n) / costBudget), weights);
        log.debug("Evaluated {} on {} probes: composite {}", blueprint.id(), n, scores.composite());
        return scores;
    }

    /**
     * @return the probes replayed for a domain.
     */
    public List<ProbeConversation> probesFor(Domain domain) {
        List<ProbeConversation> own = probes.get(domain);
        return own == null || own.isEmpty() ? probes.get(Domain.GENERAL) : own;
    }

    private static Map<Domain, List<ProbeConversation>> readProbes(Config config) {
        Map<Domain, List<ProbeConversation>> probes = new EnumMap<>(Domain.class);
        for (Domain domain : Domain.values()) {
            if (config.hasPath(domain.id())) {
                List<ProbeConversation> list = new ArrayList<>();
                for (Config probe : config.getConfigList(domain.id())) {
                    list.add(ProbeConversation.fromConfig(probe));
                }
                probes.put(domain, List.copyOf(list));
            }
        }
        return probes;
    }
}
