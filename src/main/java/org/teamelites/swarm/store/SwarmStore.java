package org.teamelites.swarm.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import org.teamelites.swarm.api.NicheDescriptor;
import org.teamelites.swarm.api.RouteStats;
import org.teamelites.swarm.api.SwarmAgentEntry;
import org.teamelites.swarm.api.SwarmMode;
import org.teamelites.swarm.api.TeamBlueprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.typesafe.config.Config;

/**
 * Durable registry of the swarm: routing mode, agent directory, the MAP-Elites archive (one
 * elite blueprint per niche key), routing telemetry and hub identities.
 * <p>
 * Persistence model: one pretty-printed JSON document, {@value #REGISTRY_FILE}, in the data
 * directory. Every mutator updates the in-memory document and then rewrites the whole file
 * (temp file, then atomic move) before returning. Nothing here throws on I/O problems:
 * <ul>
 *   <li>a missing or corrupt registry degrades to migration from the legacy single-agent
 *       document {@value #LEGACY_FILE}, or to an empty registry, with a WARN;</li>
 *   <li>a failed save is logged and the in-memory state stays authoritative for the life of
 *       the process.</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> all methods synchronize on the store, so a mutation and its
 * write are never interleaved with another in-process mutation. There is no cross-process
 * locking: one process owns one data directory.
 */
public class SwarmStore {

    private static final Logger log = LoggerFactory.getLogger(SwarmStore.class);

    static final String REGISTRY_FILE = "swarm-registry.json";
    static final String LEGACY_FILE = "lettabot-agent.json";
    static final int SCHEMA_VERSION = 1;

    private final Path registryPath;
    private final Path legacyPath;
    private final String defaultAgentId;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private SwarmRegistry data;

    /**
     * Creates a store from configuration.
     * <p>
     * Options: {@code data-dir} (required), {@code default-agent-id} (optional, used in single
     * mode when the registry holds no agent id).
     *
     * @param options the store configuration.
     */
    public SwarmStore(Config options) {
        this(Path.of(options.getString("data-dir")),
                options.hasPath("default-agent-id") ? options.getString("default-agent-id") : null);
    }

    public SwarmStore(Path dataDir) {
        this(dataDir, null);
    }

    /**
     * @param dataDir        directory holding the registry.
     * @param defaultAgentId single-mode agent id used when none is stored; may be null.
     */
    public SwarmStore(Path dataDir, String defaultAgentId) {
        this.registryPath = dataDir.resolve(REGISTRY_FILE);
        this.legacyPath = dataDir.resolve(LEGACY_FILE);
        this.defaultAgentId = defaultAgentId == null || defaultAgentId.isBlank() ? null : defaultAgentId;
        this.data = load();
    }

    // ========== Loading & saving ==========

    private SwarmRegistry load() {
        if (Files.exists(registryPath)) {
            try {
                SwarmRegistry loaded = gson.fromJson(Files.readString(registryPath, StandardCharsets.UTF_8),
                        SwarmRegistry.class);
                if (loaded != null) {
                    log.debug("Loaded swarm registry from {}", registryPath);
                    return loaded.normalize();
                }
                log.warn("Swarm registry {} is empty, starting from defaults", registryPath);
            } catch (IOException | JsonParseException e) {
                log.warn("Failed to load swarm registry {}: {}", registryPath, e.getMessage());
            }
        }

        if (Files.exists(legacyPath)) {
            try {
                LegacyAgentDocument legacy = gson.fromJson(Files.readString(legacyPath, StandardCharsets.UTF_8),
                        LegacyAgentDocument.class);
                if (legacy != null) {
                    SwarmRegistry migrated = new SwarmRegistry();
                    migrated.mode = SwarmMode.SINGLE;
                    migrated.agentId = blankToNull(legacy.agentId());
                    migrated.conversationId = blankToNull(legacy.conversationId());
                    migrated.baseUrl = legacy.baseUrl();
                    migrated.createdAt = legacy.createdAt();
                    migrated.lastUsedAt = legacy.lastUsedAt();
                    log.info("Migrated legacy agent document {} into swarm registry", legacyPath);
                    this.data = migrated;
                    save();
                    return migrated;
                }
            } catch (IOException | JsonParseException e) {
                log.warn("Failed to migrate legacy agent document {}: {}", legacyPath, e.getMessage());
            }
        }

        return new SwarmRegistry();
    }

    private void save() {
        Path tempFile = null;
        try {
            Path parent = registryPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            tempFile = registryPath.resolveSibling(REGISTRY_FILE + "." + UUID.randomUUID() + ".tmp");
            Files.writeString(tempFile, gson.toJson(data), StandardCharsets.UTF_8);
            try {
                Files.move(tempFile, registryPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, registryPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.warn("Failed to save swarm registry {}: {}", registryPath, e.getMessage());
            deleteQuietly(tempFile);
        }
    }

    private static void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException cleanupEx) {
            log.warn("Failed to clean up temp file after save failure: {}", tempFile, cleanupEx);
        }
    }

    // ========== Mode ==========

    public synchronized SwarmMode getMode() {
        return data.mode;
    }

    public synchronized void setMode(SwarmMode mode) {
        data.mode = mode;
        save();
    }

    // ========== Single mode ==========

    /**
     * @return the single-mode agent id, falling back to the configured default; null if neither.
     */
    public synchronized String getAgentId() {
        return data.agentId != null ? data.agentId : defaultAgentId;
    }

    public synchronized void setAgentId(String agentId) {
        String now = Instant.now().toString();
        data.agentId = agentId;
        data.lastUsedAt = now;
        if (agentId != null && data.createdAt == null) {
            data.createdAt = now;
        }
        save();
    }

    public synchronized String getConversationId() {
        return data.conversationId;
    }

    public synchronized void setConversationId(String conversationId) {
        data.conversationId = conversationId;
        save();
    }

    public synchronized String getBaseUrl() {
        return data.baseUrl;
    }

    public synchronized void setBaseUrl(String baseUrl) {
        data.baseUrl = baseUrl;
        save();
    }

    public synchronized String getCreatedAt() {
        return data.createdAt;
    }

    public synchronized String getLastUsedAt() {
        return data.lastUsedAt;
    }

    // ========== Agent directory ==========

    public synchronized List<SwarmAgentEntry> getAgents() {
        return List.copyOf(data.agents);
    }

    public synchronized void addAgent(SwarmAgentEntry entry) {
        data.agents.add(entry);
        save();
    }

    public synchronized void removeAgent(String agentId) {
        data.agents.removeIf(a -> a.agentId().equals(agentId));
        save();
    }

    /**
     * Looks up the agent serving a niche by exact key. There is no fallback to a related niche.
     *
     * @param niche the niche.
     * @return the bound agent, or null.
     */
    public synchronized SwarmAgentEntry getAgentForNiche(NicheDescriptor niche) {
        return findAgentIndex(niche.key()).map(data.agents::get).orElse(null);
    }

    /**
     * Binds an agent to a niche, replacing any existing binding for the key. An existing
     * binding's {@code createdAt} and {@code conversationId} are carried over.
     *
     * @param agentId     the live agent.
     * @param blueprintId the blueprint it was provisioned from.
     * @param nicheKey    the niche key.
     */
    public synchronized void setAgentForNiche(String agentId, String blueprintId, String nicheKey) {
        Optional<Integer> existing = findAgentIndex(nicheKey);
        if (existing.isPresent()) {
            SwarmAgentEntry previous = data.agents.get(existing.get());
            data.agents.set(existing.get(), new SwarmAgentEntry(
                    agentId, blueprintId, nicheKey, previous.conversationId(), previous.createdAt()));
        } else {
            data.agents.add(new SwarmAgentEntry(agentId, blueprintId, nicheKey, null, Instant.now().toString()));
        }
        save();
    }

    private Optional<Integer> findAgentIndex(String nicheKey) {
        for (int i = 0; i < data.agents.size(); i++) {
            if (data.agents.get(i).nicheKey().equals(nicheKey)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    // ========== Archive ==========

    public synchronized List<TeamBlueprint> getBlueprints() {
        return List.copyOf(data.blueprints);
    }

    /**
     * Stores a blueprint as the elite of its niche, replacing the previous elite. The archive
     * keeps no history.
     *
     * @param blueprint the new elite.
     */
    public synchronized void setBlueprint(TeamBlueprint blueprint) {
        String key = blueprint.niche().key();
        boolean replaced = false;
        for (int i = 0; i < data.blueprints.size(); i++) {
            if (data.blueprints.get(i).niche().key().equals(key)) {
                data.blueprints.set(i, blueprint);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            data.blueprints.add(blueprint);
        }
        save();
    }

    /**
     * @param niche the niche.
     * @return the niche's elite, or null if the niche is empty.
     */
    public synchronized TeamBlueprint getElite(NicheDescriptor niche) {
        for (TeamBlueprint blueprint : data.blueprints) {
            if (blueprint.niche().key().equals(niche.key())) {
                return blueprint;
            }
        }
        return null;
    }

    public synchronized int getGeneration() {
        return data.generation;
    }

    public synchronized void setGeneration(int generation) {
        data.generation = generation;
        save();
    }

    // ========== Routing telemetry ==========

    public synchronized void incrementRouteSuccess(String nicheKey) {
        data.routeSuccessCount++;
        data.routeSuccessByNiche.merge(nicheKey, 1L, Long::sum);
        save();
    }

    public synchronized void incrementRouteFallback(String nicheKey) {
        data.routeFallbackCount++;
        data.routeFallbackByNiche.merge(nicheKey, 1L, Long::sum);
        save();
    }

    public synchronized void incrementUnservedNiche(String nicheKey) {
        data.unservedNicheCounts.merge(nicheKey, 1L, Long::sum);
        data.lastUnservedAt.put(nicheKey, Instant.now().toString());
        save();
    }

    public synchronized RouteStats getRouteStats() {
        return new RouteStats(
                data.routeSuccessCount,
                data.routeFallbackCount,
                data.routeSuccessByNiche,
                data.routeFallbackByNiche,
                data.unservedNicheCounts);
    }

    public synchronized long getUnservedNicheCount(String nicheKey) {
        return data.unservedNicheCounts.getOrDefault(nicheKey, 0L);
    }

    /**
     * @param nicheKey niche key.
     * @return ISO-8601 time of the last unserved message, or null.
     */
    public synchronized String getLastUnservedAt(String nicheKey) {
        return data.lastUnservedAt.get(nicheKey);
    }

    /**
     * Finds niches that keep receiving messages without an agent to serve them.
     *
     * @param threshold minimum unserved count.
     * @return unbound niche keys with at least {@code threshold} unserved messages, most
     *         unserved first.
     */
    public synchronized List<String> getChronicallyUnservedNiches(long threshold) {
        return data.unservedNicheCounts.entrySet().stream()
                .filter(e -> e.getValue() >= threshold)
                .filter(e -> findAgentIndex(e.getKey()).isEmpty())
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    // ========== Hub identity ==========

    public synchronized String getHubAgentId() {
        return data.hubAgentId;
    }

    public synchronized void setHubAgentId(String hubAgentId) {
        data.hubAgentId = hubAgentId;
        save();
    }

    public synchronized String getHubWorkspaceId() {
        return data.hubWorkspaceId;
    }

    public synchronized void setHubWorkspaceId(String hubWorkspaceId) {
        data.hubWorkspaceId = hubWorkspaceId;
        save();
    }

    /**
     * @param nicheKey niche key.
     * @return the niche's review channel (hub problem) id, or null.
     */
    public synchronized String getNicheProblemId(String nicheKey) {
        return data.nicheProblemIds.get(nicheKey);
    }

    public synchronized void setNicheProblemId(String nicheKey, String problemId) {
        data.nicheProblemIds.put(nicheKey, problemId);
        save();
    }

    // ========== Reasoning identity ==========

    public synchronized String getReasoningSessionId() {
        return data.reasoningSessionId;
    }

    public synchronized void setReasoningSessionId(String sessionId) {
        data.reasoningSessionId = sessionId;
        save();
    }

    public synchronized String getReasoningWorkspaceId() {
        return data.reasoningWorkspaceId;
    }

    public synchronized void setReasoningWorkspaceId(String workspaceId) {
        data.reasoningWorkspaceId = workspaceId;
        save();
    }

    public synchronized String getReasoningProblemId() {
        return data.reasoningProblemId;
    }

    public synchronized void setReasoningProblemId(String problemId) {
        data.reasoningProblemId = problemId;
        save();
    }

    public synchronized String getAgentHubId(String agentId) {
        return data.agentHubIds.get(agentId);
    }

    public synchronized void setAgentHubId(String agentId, String hubId) {
        data.agentHubIds.put(agentId, hubId);
        save();
    }

    /**
     * @return the registry file path.
     */
    public Path getRegistryPath() {
        return registryPath;
    }

    /**
     * @return niche keys that currently have an elite.
     */
    public synchronized List<String> getArchivedNicheKeys() {
        List<String> keys = new ArrayList<>(data.blueprints.size());
        for (TeamBlueprint blueprint : data.blueprints) {
            keys.add(blueprint.niche().key());
        }
        return keys;
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
