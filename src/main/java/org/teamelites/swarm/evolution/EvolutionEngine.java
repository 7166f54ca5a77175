package org.teamelites.swarm.evolution;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.teamelites.swarm.api.FitnessScores;
import org.teamelites.swarm.api.HubRefs;
import org.teamelites.swarm.api.NicheDescriptor;
import org.teamelites.swarm.api.ReviewVerdict;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.fitness.FitnessEvaluator;
import org.teamelites.swarm.hub.IHubClient;
import org.teamelites.swarm.spi.CollaboratorException;
import org.teamelites.swarm.spi.IBlueprintEvaluator;
import org.teamelites.swarm.spi.IRandomProvider;
import org.teamelites.swarm.spi.ISwarmProvisioner;
import org.teamelites.swarm.store.SwarmStore;
import org.teamelites.swarm.telemetry.SwarmEventLog;
import org.teamelites.swarm.variation.VariationOperators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

/**
 * The MAP-Elites generation loop.
 * <p>
 * One generation runs {@code min(populationSize, niches)} candidates, one after the other. Each
 * candidate goes through:
 * <ol>
 *   <li>selection: a uniformly random niche, its elite as parent (or a genesis blueprint),</li>
 *   <li>variation: one to three operators, niche pinned to the selected niche,</li>
 *   <li>evaluation through the {@link IBlueprintEvaluator},</li>
 *   <li>submission: a claimed branch and a proposal on the niche's hub review channel,</li>
 *   <li>review and decision against the current elite,</li>
 *   <li>merge (archive update, generation clock, provisioning) or rejection.</li>
 * </ol>
 * A {@link CollaboratorException} aborts only the candidate in flight. Archive writes happen
 * after the hub merge succeeded, so an aborted candidate never touches the elite. Provisioning
 * failures are logged and never roll back a merge.
 */
public class EvolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(EvolutionEngine.class);

    static final String MERGE_COMMENT = "Fitness exceeds current elite";
    static final String REJECT_COMMENT = "Fitness below current elite";

    private final IHubClient hub;
    private final SwarmStore store;
    private final EvolutionConfig config;
    private final VariationOperators variation;
    private final IBlueprintEvaluator evaluator;
    private final ISwarmProvisioner provisioner;
    private final IRandomProvider random;
    private final SwarmEventLog events;
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    /**
     * @param hub         the archive hub.
     * @param store       the registry holding elites and hub identities.
     * @param config      loop settings.
     * @param variation   variation operators.
     * @param evaluator   fitness evaluation.
     * @param provisioner agent provisioning for merged elites, may be null to skip provisioning.
     * @param random      selection randomness.
     * @param events      swarm event sink.
     */
    public EvolutionEngine(IHubClient hub, SwarmStore store, EvolutionConfig config, VariationOperators variation,
                           IBlueprintEvaluator evaluator, ISwarmProvisioner provisioner, IRandomProvider random,
                           SwarmEventLog events) {
        this.hub = hub;
        this.store = store;
        this.config = config;
        this.variation = variation;
        this.evaluator = evaluator;
        this.provisioner = provisioner;
        this.random = random;
        this.events = events != null ? events : SwarmEventLog.loggingOnly();
    }

    /**
     * Makes sure the hub side of the archive exists: the coordinator identity, the archive
     * workspace and one review channel per niche. Identities are persisted in the registry and
     * only missing ones are created, so repeated calls are cheap and safe.
     *
     * @param niches niches that need a review channel.
     * @throws CollaboratorException if the hub fails; whatever was created so far is kept.
     */
    public void initializeArchive(List<NicheDescriptor> niches) throws CollaboratorException {
        if (store.getHubAgentId() == null) {
            store.setHubAgentId(hub.register(config.coordinatorName(), "coordinator"));
        }
        if (store.getHubWorkspaceId() == null) {
            store.setHubWorkspaceId(hub.createWorkspace(config.workspaceName(),
                    "MAP-Elites quality-diversity archive for team blueprints"));
        }
        for (NicheDescriptor niche : niches) {
            if (store.getNicheProblemId(niche.key()) == null) {
                String problemId = hub.createProblem(store.getHubWorkspaceId(),
                        "niche:" + niche.key(),
                        "Niche for " + niche.channel() + " " + niche.domain().id() + " tasks");
                store.setNicheProblemId(niche.key(), problemId);
                log.info("Created review channel {} for niche {}", problemId, niche.key());
            }
        }
    }

    /**
     * Picks a niche uniformly at random and the parent to vary.
     *
     * @param niches candidate niches, non-empty.
     * @return the niche with its elite, or with a fresh genesis blueprint if the niche is empty.
     */
    public Selection selectParents(List<NicheDescriptor> niches) {
        NicheDescriptor niche = random.pick(niches);
        TeamBlueprint elite = store.getElite(niche);
        if (elite != null) {
            return new Selection(niche, elite);
        }
        return new Selection(niche, GenesisBlueprints.create(niche, config.genesisModel(), random));
    }

    public TeamBlueprint variate(TeamBlueprint parent) {
        return variation.applyVariation(parent);
    }

    public FitnessScores evaluate(TeamBlueprint blueprint) throws CollaboratorException {
        return evaluator.evaluate(blueprint);
    }

    /**
     * Claims a branch on the niche's review channel and opens a proposal carrying the blueprint.
     *
     * @param blueprint the evaluated candidate.
     * @param problemId the niche's review channel.
     * @return the proposal id.
     */
    public String submit(TeamBlueprint blueprint, String problemId) throws CollaboratorException {
        String branchId = branchIdOf(blueprint);
        hub.claimProblem(problemId, branchId);

        JsonObject payload = new JsonObject();
        payload.add("blueprint", gson.toJsonTree(blueprint));
        payload.add("fitness", gson.toJsonTree(blueprint.fitness()));

        return hub.createProposal(problemId,
                "Gen-" + blueprint.generation() + ": " + blueprint.name(),
                branchId,
                gson.toJson(payload));
    }

    static String branchIdOf(TeamBlueprint blueprint) {
        String id = blueprint.id();
        return "gen" + blueprint.generation() + "-" + id.substring(0, Math.min(8, id.length()));
    }

    /**
     * Runs one generation over the given niches.
     *
     * @param niches niches taking part; an empty list runs nothing.
     * @return counts of merged, rejected and failed candidates.
     */
    public GenerationReport runGeneration(List<NicheDescriptor> niches) {
        int iterations = Math.min(config.populationSize(), niches.size());
        int merged = 0;
        int rejected = 0;
        int failed = 0;

        for (int i = 0; i < iterations; i++) {
            Selection selection = selectParents(niches);
            NicheDescriptor niche = selection.niche();
            String problemId = store.getNicheProblemId(niche.key());
            if (problemId == null) {
                log.warn("Niche {} has no review channel, skipping candidate", niche.key());
                failed++;
                continue;
            }

            TeamBlueprint child = variate(selection.parent()).withNiche(niche);
            try {
                if (runCandidate(child, problemId)) {
                    merged++;
                } else {
                    rejected++;
                }
            } catch (CollaboratorException e) {
                failed++;
                log.warn("Candidate {} for niche {} aborted: {}", child.id(), niche.key(), e.getMessage());
                Map<String, Object> data = candidateData(child);
                data.put("operation", e.getOperation());
                data.put("error", e.getMessage());
                events.record("evolution_candidate_failed", data);
            }
        }

        GenerationReport report = new GenerationReport(iterations, merged, rejected, failed);
        log.info("Generation finished: {} candidates, {} merged, {} rejected, {} failed",
                report.attempted(), report.merged(), report.rejected(), report.failed());
        return report;
    }

    private boolean runCandidate(TeamBlueprint candidate, String problemId) throws CollaboratorException {
        NicheDescriptor niche = candidate.niche();
        FitnessScores fitness = evaluate(candidate);
        TeamBlueprint child = candidate.withFitness(fitness);
        events.record("evolution_candidate_evaluated", candidateData(child));

        String proposalId = submit(child, problemId);

        TeamBlueprint elite = store.getElite(niche);
        boolean shouldMerge = elite == null || FitnessEvaluator.isEliteReplacement(fitness, elite.fitness());
        hub.reviewProposal(proposalId,
                shouldMerge ? ReviewVerdict.APPROVE : ReviewVerdict.REQUEST_CHANGES,
                shouldMerge ? MERGE_COMMENT : REJECT_COMMENT);

        if (!shouldMerge) {
            Map<String, Object> data = candidateData(child);
            data.put("eliteComposite", elite.fitness().composite());
            events.record("evolution_candidate_rejected", data);
            return false;
        }

        if (!hub.mergeProposal(proposalId)) {
            throw new CollaboratorException("merge_proposal", "hub declined to merge " + proposalId);
        }
        TeamBlueprint archived = child.withHubRefs(new HubRefs(store.getHubWorkspaceId(), problemId, proposalId, null));
        store.setBlueprint(archived);
        store.setGeneration(archived.generation());
        provision(archived);

        events.record("evolution_candidate_merged", candidateData(archived));
        return true;
    }

    private void provision(TeamBlueprint elite) {
        if (provisioner == null) {
            return;
        }
        NicheDescriptor niche = elite.niche();
        if (store.getAgentForNiche(niche) == null && store.getAgents().size() >= config.maxAgents()) {
            log.info("Not provisioning niche {}: registry already holds {} agents", niche.key(), config.maxAgents());
            Map<String, Object> data = candidateData(elite);
            data.put("maxAgents", config.maxAgents());
            events.record("provision_skipped_capacity", data);
            return;
        }
        try {
            String agentId = provisioner.provisionNicheAgent(elite);
            store.setAgentForNiche(agentId, elite.id(), niche.key());
            Map<String, Object> data = candidateData(elite);
            data.put("agentId", agentId);
            events.record("provision_merge_success", data);
        } catch (CollaboratorException e) {
            log.warn("Provisioning failed for niche {}: {}", niche.key(), e.getMessage());
            Map<String, Object> data = candidateData(elite);
            data.put("error", e.getMessage());
            events.record("provision_merge_failed", data);
        }
    }

    private static Map<String, Object> candidateData(TeamBlueprint blueprint) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("nicheKey", blueprint.niche().key());
        data.put("blueprintId", blueprint.id());
        data.put("generation", blueprint.generation());
        data.put("composite", blueprint.fitness().composite());
        return data;
    }

    /**
     * A selected niche and the parent chosen for it.
     */
    public record Selection(NicheDescriptor niche, TeamBlueprint parent) {
    }
}
