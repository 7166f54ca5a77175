package org.teamelites.swarm.config;

import java.nio.file.Path;

import org.teamelites.swarm.evolution.DefaultSwarmProvisioner;
import org.teamelites.swarm.evolution.EvolutionConfig;
import org.teamelites.swarm.evolution.EvolutionEngine;
import org.teamelites.swarm.evolution.EvolutionService;
import org.teamelites.swarm.fitness.ConversationReplayEvaluator;
import org.teamelites.swarm.fitness.HeuristicConversationReplayer;
import org.teamelites.swarm.hub.HubClient;
import org.teamelites.swarm.hub.IHubClient;
import org.teamelites.swarm.internal.services.SeededRandomProvider;
import org.teamelites.swarm.reasoning.GatewayClient;
import org.teamelites.swarm.reasoning.ReasoningBridge;
import org.teamelites.swarm.routing.SwarmManager;
import org.teamelites.swarm.spi.CollaboratorException;
import org.teamelites.swarm.spi.IAgentDirectory;
import org.teamelites.swarm.spi.IRandomProvider;
import org.teamelites.swarm.spi.ISwarmProvisioner;
import org.teamelites.swarm.store.SwarmStore;
import org.teamelites.swarm.telemetry.SwarmEventLog;
import org.teamelites.swarm.variation.VariationCatalog;
import org.teamelites.swarm.variation.VariationOperators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Wires the swarm from a resolved configuration.
 * <p>
 * Everything is read below {@value ConfigLoader#ROOT}. The hub client, evolution engine and
 * service are always built; the evolution service only runs when {@code evolution.enabled} is
 * set, and the reasoning bridge only exists when {@code reasoning.enabled} is set. Without an
 * {@link IAgentDirectory} merged elites are archived but no agents are provisioned.
 */
public final class SwarmBootstrap implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SwarmBootstrap.class);

    private final Config options;
    private final SwarmStore store;
    private final SwarmEventLog events;
    private final SwarmManager manager;
    private final IHubClient hub;
    private final EvolutionConfig evolutionConfig;
    private final EvolutionEngine engine;
    private final EvolutionService evolutionService;
    private final ReasoningBridge reasoningBridge;

    /**
     * @param root      the resolved root config, e.g. from {@link ConfigLoader#resolve}.
     * @param directory the agent execution service used for provisioning, may be null.
     */
    public SwarmBootstrap(Config root, IAgentDirectory directory) {
        this.options = root.getConfig(ConfigLoader.ROOT);

        this.store = new SwarmStore(options);
        this.events = options.getBoolean("events.enabled")
                ? new SwarmEventLog(Path.of(options.getString("data-dir")).resolve(SwarmEventLog.FILE_NAME))
                : SwarmEventLog.loggingOnly();
        this.manager = new SwarmManager(store, events, options.getConfig("routing"));
        this.hub = new HubClient(options.getConfig("hub"));

        IRandomProvider random = options.hasPath("random-seed")
                ? new SeededRandomProvider(options.getLong("random-seed"))
                : SeededRandomProvider.unseeded();
        this.evolutionConfig = EvolutionConfig.fromConfig(options.getConfig("evolution"));
        VariationOperators variation = new VariationOperators(random.deriveFor("variation", 0),
                VariationCatalog.fromConfig(options.getConfig("variation")));
        ConversationReplayEvaluator evaluator = new ConversationReplayEvaluator(
                new HeuristicConversationReplayer(options.getConfig("evaluation")),
                evolutionConfig.fitnessWeights(),
                options.getConfig("evaluation"));
        ISwarmProvisioner provisioner = directory == null
                ? null
                : new DefaultSwarmProvisioner(directory, events, options.getConfig("provisioner"));
        this.engine = new EvolutionEngine(hub, store, evolutionConfig, variation, evaluator, provisioner,
                random.deriveFor("selection", 0), events);
        this.evolutionService = new EvolutionService(engine, evolutionConfig);

        if (options.getBoolean("reasoning.enabled")) {
            this.reasoningBridge = new ReasoningBridge(new GatewayClient(options.getConfig("gateway")), hub, store,
                    options.getConfig("reasoning"));
            manager.setReasoningContextProvider(reasoningBridge);
        } else {
            this.reasoningBridge = null;
        }
        log.info("Swarm wired: data dir {}, mode {}, {} agents, {} elites", options.getString("data-dir"),
                store.getMode(), store.getAgents().size(), store.getBlueprints().size());
    }

    /**
     * Initializes the reasoning bridge (a failure leaves it inactive) and starts the evolution
     * service when enabled.
     */
    public void start() {
        if (reasoningBridge != null) {
            try {
                reasoningBridge.initialize(store.getAgents());
            } catch (CollaboratorException e) {
                log.warn("Reasoning bridge unavailable, continuing without shared reasoning: {}", e.getMessage());
            }
        }
        if (options.getBoolean("evolution.enabled")) {
            evolutionService.start();
        }
    }

    @Override
    public void close() {
        if (evolutionService.getCurrentState() == EvolutionService.State.RUNNING) {
            evolutionService.stop();
        }
        manager.close();
    }

    public SwarmStore getStore() {
        return store;
    }

    public SwarmManager getManager() {
        return manager;
    }

    public EvolutionEngine getEngine() {
        return engine;
    }

    public EvolutionConfig getEvolutionConfig() {
        return evolutionConfig;
    }

    public EvolutionService getEvolutionService() {
        return evolutionService;
    }

    /**
     * @return the reasoning bridge, or null when reasoning is disabled.
     */
    public ReasoningBridge getReasoningBridge() {
        return reasoningBridge;
    }

    public SwarmEventLog getEvents() {
        return events;
    }
}
