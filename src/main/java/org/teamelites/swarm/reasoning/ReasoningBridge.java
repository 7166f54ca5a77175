package org.teamelites.swarm.reasoning;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.teamelites.swarm.api.SwarmAgentEntry;
import org.teamelites.swarm.hub.IHubClient;
import org.teamelites.swarm.spi.CollaboratorException;
import org.teamelites.swarm.store.SwarmStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Shared reasoning memory for swarm agents.
 * <p>
 * Each niche agent logs its exchanges to its own branch (named after the niche key) of one
 * reasoning session; before processing a message an agent reads the most recent thoughts of the
 * other agents' branches plus the decisions posted to a shared hub channel.
 * <p>
 * Only {@link #initialize(List)} reports failures. Everything that runs on the message path
 * ({@link #gatherContext}, {@link #logReasoning}, {@link #logDecision}) degrades to an empty
 * result or a dropped entry, and does nothing until initialization has succeeded.
 * <p>
 * <strong>Thread Safety:</strong> thread-safe after initialization.
 */
public class ReasoningBridge implements IReasoningContextProvider {

    private static final Logger log = LoggerFactory.getLogger(ReasoningBridge.class);

    static final String COORDINATOR_NAME = "swarm-coordinator";
    private static final int EXCHANGE_EXCERPT_LENGTH = 100;

    private final IReasoningGateway gateway;
    private final IHubClient hub;
    private final SwarmStore store;
    private final int maxContextThoughts;
    private final int maxThoughtLength;
    private final String sessionTitle;
    private final String workspaceName;
    private final String problemTitle;

    /** Niche keys whose branch already forked from the main chain. */
    private final Map<String, Boolean> branchInitialized = new ConcurrentHashMap<>();
    private volatile Integer mainChainHead;
    private volatile boolean initialized;

    /**
     * Creates a bridge from configuration.
     * <p>
     * Options: {@code max-context-thoughts}, {@code max-thought-length}, {@code session-title},
     * {@code workspace-name}, {@code problem-title}.
     */
    public ReasoningBridge(IReasoningGateway gateway, IHubClient hub, SwarmStore store, Config options) {
        this(gateway, hub, store,
                options.getInt("max-context-thoughts"),
                options.getInt("max-thought-length"),
                options.getString("session-title"),
                options.getString("workspace-name"),
                options.getString("problem-title"));
    }

    ReasoningBridge(IReasoningGateway gateway, IHubClient hub, SwarmStore store,
                    int maxContextThoughts, int maxThoughtLength) {
        this(gateway, hub, store, maxContextThoughts, maxThoughtLength,
                "team-elites-swarm-reasoning", "team-elites-swarm", "shared-reasoning");
    }

    private ReasoningBridge(IReasoningGateway gateway, IHubClient hub, SwarmStore store,
                            int maxContextThoughts, int maxThoughtLength,
                            String sessionTitle, String workspaceName, String problemTitle) {
        if (maxContextThoughts < 1) {
            throw new IllegalArgumentException("max-context-thoughts must be >= 1, got: " + maxContextThoughts);
        }
        if (maxThoughtLength < 4) {
            throw new IllegalArgumentException("max-thought-length must be >= 4, got: " + maxThoughtLength);
        }
        this.gateway = gateway;
        this.hub = hub;
        this.store = store;
        this.maxContextThoughts = maxContextThoughts;
        this.maxThoughtLength = maxThoughtLength;
        this.sessionTitle = sessionTitle;
        this.workspaceName = workspaceName;
        this.problemTitle = problemTitle;
    }

    /**
     * Starts or resumes the reasoning session, registers the coordinator and every agent with
     * the hub, creates the shared decision channel and posts the initial main-chain thought.
     * Identities already in the registry are reused. Calling it again after success is a no-op.
     *
     * @param agents the agents currently serving niches.
     * @throws CollaboratorException if the gateway or hub fails; the bridge stays inactive.
     */
    public synchronized void initialize(List<SwarmAgentEntry> agents) throws CollaboratorException {
        if (initialized) {
            return;
        }

        String sessionId = store.getReasoningSessionId();
        if (sessionId != null) {
            gateway.loadContext(sessionId);
        } else {
            store.setReasoningSessionId(gateway.startNew(sessionTitle, List.of("swarm", "reasoning")));
        }
        gateway.cipher();

        if (store.getHubAgentId() == null) {
            store.setHubAgentId(hub.register(COORDINATOR_NAME, "coordinator"));
        }
        if (store.getReasoningWorkspaceId() == null) {
            store.setReasoningWorkspaceId(hub.createWorkspace(workspaceName,
                    "Shared reasoning workspace for swarm agents"));
        }
        if (store.getReasoningProblemId() == null) {
            store.setReasoningProblemId(hub.createProblem(store.getReasoningWorkspaceId(), problemTitle,
                    "Cross-agent reasoning and shared decisions"));
        }
        for (SwarmAgentEntry agent : agents) {
            if (store.getAgentHubId(agent.agentId()) == null) {
                store.setAgentHubId(agent.agentId(), hub.register("agent-" + agent.nicheKey(), "contributor"));
            }
        }

        String niches = agents.stream().map(SwarmAgentEntry::nicheKey).collect(Collectors.joining(", "));
        ThoughtResult head = gateway.thought(ThoughtInput.onMainChain(
                "Swarm reasoning session initialized with " + agents.size() + " agents: " + niches,
                "initialization"));
        mainChainHead = head.thoughtNumber();
        initialized = true;
        log.info("Reasoning bridge initialized for {} agents (session {})", agents.size(),
                store.getReasoningSessionId());
    }

    @Override
    public ReasoningContext gatherContext(String agentId, String nicheKey) {
        if (!initialized) {
            return ReasoningContext.EMPTY;
        }
        try {
            List<SwarmAgentEntry> others = store.getAgents().stream()
                    .filter(a -> !a.agentId().equals(agentId))
                    .collect(Collectors.toList());
            if (others.isEmpty()) {
                return ReasoningContext.EMPTY;
            }

            List<AttributedThought> thoughts = new ArrayList<>();
            for (SwarmAgentEntry other : others) {
                for (ThoughtEntry thought : readBranch(other.nicheKey())) {
                    thoughts.add(new AttributedThought(other.nicheKey(), thought));
                }
            }
            List<AttributedThought> recent = thoughts.stream()
                    .sorted(Comparator.comparingInt((AttributedThought t) -> t.entry().thoughtNumber()).reversed())
                    .limit(maxContextThoughts)
                    .collect(Collectors.toList());

            List<String> decisions = readDecisions();
            List<String> recentDecisions = decisions.subList(Math.max(0, decisions.size() - maxContextThoughts),
                    decisions.size());

            if (recent.isEmpty() && recentDecisions.isEmpty()) {
                return ReasoningContext.EMPTY;
            }
            return new ReasoningContext(buildContextXml(recent, recentDecisions), recent.size(),
                    recentDecisions.size());
        } catch (RuntimeException e) {
            log.debug("Failed to gather reasoning context for {}", agentId, e);
            return ReasoningContext.EMPTY;
        }
    }

    private List<ThoughtEntry> readBranch(String branchId) {
        try {
            return gateway.readThoughts(branchId, maxContextThoughts);
        } catch (CollaboratorException e) {
            log.debug("Failed to read reasoning branch {}: {}", branchId, e.getMessage());
            return List.of();
        }
    }

    private List<String> readDecisions() {
        try {
            return hub.readChannel(store.getReasoningWorkspaceId(), store.getReasoningProblemId());
        } catch (CollaboratorException e) {
            log.debug("Failed to read shared decisions: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public void logReasoning(String agentId, String nicheKey, ReasoningEntry entry) {
        if (!initialized || nicheKey == null) {
            return;
        }
        try {
            String text = "[" + entry.channel() + "] Q: " + truncate(entry.inboundMessage(), EXCHANGE_EXCERPT_LENGTH)
                    + " → A: " + truncate(entry.response(), EXCHANGE_EXCERPT_LENGTH);

            // The first thought on a branch forks it from the main chain.
            Integer branchFrom = null;
            if (mainChainHead != null && branchInitialized.putIfAbsent(nicheKey, Boolean.TRUE) == null) {
                branchFrom = mainChainHead;
            }
            gateway.thought(new ThoughtInput(text, "reasoning", nicheKey, branchFrom, store.getAgentHubId(agentId)));
        } catch (CollaboratorException | RuntimeException e) {
            log.warn("Failed to log reasoning for {}: {}", nicheKey, e.getMessage());
        }
    }

    /**
     * Posts a decision to the shared hub channel, labelled with the agent's niche key.
     *
     * @param agentId the deciding agent.
     * @param summary the decision.
     */
    public void logDecision(String agentId, String summary) {
        if (!initialized) {
            return;
        }
        try {
            String label = store.getAgents().stream()
                    .filter(a -> a.agentId().equals(agentId))
                    .map(SwarmAgentEntry::nicheKey)
                    .findFirst()
                    .orElse(agentId);
            hub.postMessage(store.getReasoningWorkspaceId(), store.getReasoningProblemId(),
                    "[" + label + "] " + summary);
        } catch (CollaboratorException | RuntimeException e) {
            log.warn("Failed to log decision for {}: {}", agentId, e.getMessage());
        }
    }

    private String buildContextXml(List<AttributedThought> thoughts, List<String> decisions) {
        List<String> parts = new ArrayList<>();
        parts.add("<swarm-context>");
        if (!thoughts.isEmpty()) {
            parts.add("  <recent-thoughts count=\"" + thoughts.size() + "\">");
            for (AttributedThought t : thoughts) {
                parts.add("    <thought agent=\"agent-" + escape(t.nicheKey()) + "\" branch=\"" + escape(t.nicheKey())
                        + "\" t=\"" + t.entry().thoughtNumber() + "\">");
                parts.add("      " + escape(truncate(t.entry().thought(), maxThoughtLength)));
                parts.add("    </thought>");
            }
            parts.add("  </recent-thoughts>");
        }
        if (!decisions.isEmpty()) {
            parts.add("  <shared-decisions count=\"" + decisions.size() + "\">");
            for (String decision : decisions) {
                parts.add("    <decision>" + escape(truncate(decision, maxThoughtLength)) + "</decision>");
            }
            parts.add("  </shared-decisions>");
        }
        parts.add("</swarm-context>");
        return String.join("\n", parts);
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    public boolean isInitialized() {
        return initialized;
    }

    private record AttributedThought(String nicheKey, ThoughtEntry entry) {
    }
}
