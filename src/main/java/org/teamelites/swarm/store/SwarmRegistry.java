package org.teamelites.swarm.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.teamelites.swarm.api.SwarmAgentEntry;
import org.teamelites.swarm.api.SwarmMode;
import org.teamelites.swarm.api.TeamBlueprint;

/**
 * Root document persisted by {@link SwarmStore}. Mutable, Gson-mapped, and never handed out of
 * the store.
 */
final class SwarmRegistry {

    int schemaVersion = SwarmStore.SCHEMA_VERSION;
    SwarmMode mode = SwarmMode.SINGLE;
    List<SwarmAgentEntry> agents = new ArrayList<>();
    List<TeamBlueprint> blueprints = new ArrayList<>();
    int generation;

    // Routing telemetry
    long routeSuccessCount;
    long routeFallbackCount;
    Map<String, Long> routeSuccessByNiche = new LinkedHashMap<>();
    Map<String, Long> routeFallbackByNiche = new LinkedHashMap<>();
    Map<String, Long> unservedNicheCounts = new LinkedHashMap<>();
    Map<String, String> lastUnservedAt = new LinkedHashMap<>();

    // Hub archive identity
    String hubAgentId;
    String hubWorkspaceId;
    Map<String, String> nicheProblemIds = new LinkedHashMap<>();

    // Reasoning bridge identity
    String reasoningSessionId;
    String reasoningWorkspaceId;
    String reasoningProblemId;
    Map<String, String> agentHubIds = new LinkedHashMap<>();

    // Single-mode fields, mirroring the legacy single-agent document
    String agentId;
    String conversationId;
    String baseUrl;
    String createdAt;
    String lastUsedAt;

    SwarmRegistry() {
    }

    /**
     * Replaces collections a hand-edited or older document left out with empty ones.
     */
    SwarmRegistry normalize() {
        if (mode == null) {
            mode = SwarmMode.SINGLE;
        }
        if (agents == null) {
            agents = new ArrayList<>();
        }
        if (blueprints == null) {
            blueprints = new ArrayList<>();
        }
        if (routeSuccessByNiche == null) {
            routeSuccessByNiche = new LinkedHashMap<>();
        }
        if (routeFallbackByNiche == null) {
            routeFallbackByNiche = new LinkedHashMap<>();
        }
        if (unservedNicheCounts == null) {
            unservedNicheCounts = new LinkedHashMap<>();
        }
        if (lastUnservedAt == null) {
            lastUnservedAt = new LinkedHashMap<>();
        }
        if (nicheProblemIds == null) {
            nicheProblemIds = new LinkedHashMap<>();
        }
        if (agentHubIds == null) {
            agentHubIds = new LinkedHashMap<>();
        }
        agents = new ArrayList<>(agents);
        blueprints = new ArrayList<>(blueprints);
        schemaVersion = SwarmStore.SCHEMA_VERSION;
        return this;
    }
}
