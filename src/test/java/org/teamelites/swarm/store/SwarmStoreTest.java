package org.teamelites.swarm.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.teamelites.junit.extensions.logging.ExpectLog;
import org.teamelites.junit.extensions.logging.LogLevel;
import org.teamelites.junit.extensions.logging.LogWatchExtension;
import org.teamelites.swarm.TestBlueprints;
import org.teamelites.swarm.api.Domain;
import org.teamelites.swarm.api.NicheDescriptor;
import org.teamelites.swarm.api.RouteStats;
import org.teamelites.swarm.api.SwarmAgentEntry;
import org.teamelites.swarm.api.SwarmMode;
import org.teamelites.swarm.api.TeamBlueprint;

import com.typesafe.config.ConfigFactory;

/**
 * File-backed tests for {@link SwarmStore}: persistence across instances, legacy migration,
 * recovery from damaged files and the registry's upsert and counter semantics.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class SwarmStoreTest {

    private static final NicheDescriptor TELEGRAM_CODING = NicheDescriptor.of("telegram", Domain.CODING);
    private static final NicheDescriptor DISCORD_RESEARCH = NicheDescriptor.of("discord", Domain.RESEARCH);

    @TempDir
    Path dataDir;

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        void freshDirectoryStartsInSingleModeWithoutAgents() {
            SwarmStore store = new SwarmStore(dataDir);

            assertThat(store.getMode()).isEqualTo(SwarmMode.SINGLE);
            assertThat(store.getAgents()).isEmpty();
            assertThat(store.getBlueprints()).isEmpty();
            assertThat(store.getGeneration()).isZero();
            assertThat(Files.exists(store.getRegistryPath())).isFalse();
        }

        @Test
        void defaultAgentIdComesFromConfig() {
            SwarmStore store = new SwarmStore(ConfigFactory.parseString(
                    "data-dir = \"" + dataDir.toString().replace("\\", "\\\\") + "\"\n"
                            + "default-agent-id = agent-from-env"));

            assertThat(store.getAgentId()).isEqualTo("agent-from-env");

            store.setAgentId("agent-stored");
            assertThat(store.getAgentId()).isEqualTo("agent-stored");
        }

        @Test
        void stateSurvivesReload() {
            SwarmStore store = new SwarmStore(dataDir);
            store.setMode(SwarmMode.SWARM);
            store.setAgentForNiche("agent-1", "bp-1", TELEGRAM_CODING.key());
            store.setBlueprint(TestBlueprints.coordinatorOnly("bp-1", TELEGRAM_CODING).withFitness(TestBlueprints.scores(0.7, 0.5)));
            store.setGeneration(4);
            store.setNicheProblemId(TELEGRAM_CODING.key(), "problem-1");

            SwarmStore reloaded = new SwarmStore(dataDir);

            assertThat(reloaded.getMode()).isEqualTo(SwarmMode.SWARM);
            assertThat(reloaded.getAgentForNiche(TELEGRAM_CODING).agentId()).isEqualTo("agent-1");
            TeamBlueprint elite = reloaded.getElite(TELEGRAM_CODING);
            assertThat(elite.id()).isEqualTo("bp-1");
            assertThat(elite.fitness().composite()).isEqualTo(0.7);
            assertThat(elite.agents()).hasSize(1);
            assertThat(reloaded.getGeneration()).isEqualTo(4);
            assertThat(reloaded.getNicheProblemId(TELEGRAM_CODING.key())).isEqualTo("problem-1");
        }

        @Test
        void registryUsesLowerCaseWireNames() throws IOException {
            SwarmStore store = new SwarmStore(dataDir);
            store.setMode(SwarmMode.SWARM);
            store.setBlueprint(TestBlueprints.coordinatorOnly("bp-1", TELEGRAM_CODING));

            String json = Files.readString(store.getRegistryPath());

            assertThat(json).contains("\"mode\": \"swarm\"")
                    .contains("\"role\": \"coordinator\"")
                    .contains("\"coordinationStrategy\": \"sequential\"")
                    .contains("\"domain\": \"coding\"");
        }

        @Test
        void saveLeavesNoTempFiles() throws IOException {
            SwarmStore store = new SwarmStore(dataDir);
            store.setMode(SwarmMode.SWARM);
            store.setGeneration(1);

            try (Stream<Path> files = Files.list(dataDir)) {
                assertThat(files.map(p -> p.getFileName().toString())).containsExactly(SwarmStore.REGISTRY_FILE);
            }
        }

        @Test
        @ExpectLog(level = LogLevel.WARN, messagePattern = "Failed to load swarm registry .*")
        void corruptRegistryFallsBackToDefaults() throws IOException {
            Files.writeString(dataDir.resolve(SwarmStore.REGISTRY_FILE), "{ this is not json");

            SwarmStore store = new SwarmStore(dataDir);

            assertThat(store.getMode()).isEqualTo(SwarmMode.SINGLE);
            assertThat(store.getAgents()).isEmpty();
        }

        @Test
        @ExpectLog(level = LogLevel.WARN, messagePattern = "Swarm registry .* is empty.*")
        void emptyRegistryFallsBackToDefaults() throws IOException {
            Files.writeString(dataDir.resolve(SwarmStore.REGISTRY_FILE), "");

            SwarmStore store = new SwarmStore(dataDir);

            assertThat(store.getMode()).isEqualTo(SwarmMode.SINGLE);
        }

        @Test
        void partialRegistryIsNormalized() throws IOException {
            Files.writeString(dataDir.resolve(SwarmStore.REGISTRY_FILE), "{\"generation\": 3}");

            SwarmStore store = new SwarmStore(dataDir);

            assertThat(store.getGeneration()).isEqualTo(3);
            assertThat(store.getMode()).isEqualTo(SwarmMode.SINGLE);
            assertThat(store.getRouteStats().unservedByNiche()).isEmpty();
            store.incrementUnservedNiche("telegram-general");
            assertThat(store.getUnservedNicheCount("telegram-general")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Legacy migration")
    class Migration {

        @Test
        void legacyDocumentIsMigratedIntoSingleMode() throws IOException {
            Files.writeString(dataDir.resolve(SwarmStore.LEGACY_FILE), "{"
                    + "\"agentId\": \"agent-legacy\","
                    + "\"conversationId\": \"conv-7\","
                    + "\"baseUrl\": \"http://localhost:8283\","
                    + "\"createdAt\": \"2025-01-01T00:00:00Z\","
                    + "\"lastUsedAt\": \"2025-02-01T00:00:00Z\"}");

            SwarmStore store = new SwarmStore(dataDir);

            assertThat(store.getMode()).isEqualTo(SwarmMode.SINGLE);
            assertThat(store.getAgentId()).isEqualTo("agent-legacy");
            assertThat(store.getConversationId()).isEqualTo("conv-7");
            assertThat(store.getBaseUrl()).isEqualTo("http://localhost:8283");
            assertThat(store.getCreatedAt()).isEqualTo("2025-01-01T00:00:00Z");
            assertThat(Files.exists(dataDir.resolve(SwarmStore.REGISTRY_FILE))).isTrue();
        }

        @Test
        void singleAgentBotDocumentIsPickedUp() throws IOException {
            Files.writeString(dataDir.resolve("lettabot-agent.json"), "{\"agentId\": \"agent-bot\"}");

            SwarmStore store = new SwarmStore(dataDir);

            assertThat(store.getAgentId()).isEqualTo("agent-bot");
            assertThat(Files.exists(dataDir.resolve("swarm-registry.json"))).isTrue();
        }

        @Test
        void emptyLegacyIdsBecomeAbsent() throws IOException {
            Files.writeString(dataDir.resolve(SwarmStore.LEGACY_FILE), "{\"agentId\": \"\", \"conversationId\": \"\"}");

            SwarmStore store = new SwarmStore(dataDir, "agent-default");

            assertThat(store.getAgentId()).isEqualTo("agent-default");
            assertThat(store.getConversationId()).isNull();
        }

        @Test
        void existingRegistryWinsOverLegacyDocument() throws IOException {
            new SwarmStore(dataDir).setAgentId("agent-registry");
            Files.writeString(dataDir.resolve(SwarmStore.LEGACY_FILE), "{\"agentId\": \"agent-legacy\"}");

            assertThat(new SwarmStore(dataDir).getAgentId()).isEqualTo("agent-registry");
        }

        @Test
        @ExpectLog(level = LogLevel.WARN, messagePattern = "Failed to load swarm registry .*")
        void corruptRegistryFallsBackToLegacyDocument() throws IOException {
            Files.writeString(dataDir.resolve(SwarmStore.REGISTRY_FILE), "[[[");
            Files.writeString(dataDir.resolve(SwarmStore.LEGACY_FILE), "{\"agentId\": \"agent-legacy\"}");

            assertThat(new SwarmStore(dataDir).getAgentId()).isEqualTo("agent-legacy");
        }
    }

    @Nested
    @DisplayName("Agents and archive")
    class AgentsAndArchive {

        @Test
        void setAgentForNicheUpsertsAndKeepsConversation() {
            SwarmStore store = new SwarmStore(dataDir);
            store.addAgent(new SwarmAgentEntry("agent-1", "bp-1", TELEGRAM_CODING.key(), "conv-1", "2025-01-01T00:00:00Z"));

            store.setAgentForNiche("agent-2", "bp-2", TELEGRAM_CODING.key());

            List<SwarmAgentEntry> agents = store.getAgents();
            assertThat(agents).hasSize(1);
            SwarmAgentEntry entry = agents.get(0);
            assertThat(entry.agentId()).isEqualTo("agent-2");
            assertThat(entry.blueprintId()).isEqualTo("bp-2");
            assertThat(entry.conversationId()).isEqualTo("conv-1");
            assertThat(entry.createdAt()).isEqualTo("2025-01-01T00:00:00Z");
        }

        @Test
        void setAgentForNicheAddsNewNiche() {
            SwarmStore store = new SwarmStore(dataDir);
            store.setAgentForNiche("agent-1", "bp-1", TELEGRAM_CODING.key());
            store.setAgentForNiche("agent-2", "bp-2", DISCORD_RESEARCH.key());

            assertThat(store.getAgents()).extracting(SwarmAgentEntry::nicheKey)
                    .containsExactly("telegram-coding", "discord-research");
            assertThat(store.getAgentForNiche(DISCORD_RESEARCH).createdAt()).isNotNull();
        }

        @Test
        void removeAgentDropsEntry() {
            SwarmStore store = new SwarmStore(dataDir);
            store.setAgentForNiche("agent-1", "bp-1", TELEGRAM_CODING.key());

            store.removeAgent("agent-1");

            assertThat(store.getAgentForNiche(TELEGRAM_CODING)).isNull();
        }

        @Test
        void setBlueprintKeepsOneElitePerNiche() {
            SwarmStore store = new SwarmStore(dataDir);
            store.setBlueprint(TestBlueprints.coordinatorOnly("bp-1", TELEGRAM_CODING));
            store.setBlueprint(TestBlueprints.coordinatorOnly("bp-2", DISCORD_RESEARCH));
            store.setBlueprint(TestBlueprints.coordinatorOnly("bp-3", TELEGRAM_CODING));

            assertThat(store.getBlueprints()).hasSize(2);
            assertThat(store.getElite(TELEGRAM_CODING).id()).isEqualTo("bp-3");
            assertThat(store.getArchivedNicheKeys()).containsExactly("telegram-coding", "discord-research");
        }

        @Test
        void setAgentIdStampsTimestamps() {
            SwarmStore store = new SwarmStore(dataDir);

            store.setAgentId("agent-1");
            String created = store.getCreatedAt();
            store.setAgentId("agent-2");

            assertThat(created).isNotNull();
            assertThat(store.getCreatedAt()).isEqualTo(created);
            assertThat(store.getLastUsedAt()).isNotNull();
        }
    }

    @Nested
    @DisplayName("Routing counters")
    class Counters {

        @Test
        void successAndFallbackAreCountedPerNiche() {
            SwarmStore store = new SwarmStore(dataDir);
            store.incrementRouteSuccess("telegram-coding");
            store.incrementRouteSuccess("telegram-coding");
            store.incrementRouteFallback("discord-general");

            RouteStats stats = store.getRouteStats();

            assertThat(stats.successCount()).isEqualTo(2);
            assertThat(stats.fallbackCount()).isEqualTo(1);
            assertThat(stats.successByNiche()).containsEntry("telegram-coding", 2L);
            assertThat(stats.fallbackByNiche()).containsEntry("discord-general", 1L);
        }

        @Test
        void unservedCountsRecordLastSeen() {
            SwarmStore store = new SwarmStore(dataDir);

            store.incrementUnservedNiche("discord-scheduling");

            assertThat(store.getUnservedNicheCount("discord-scheduling")).isEqualTo(1);
            assertThat(store.getLastUnservedAt("discord-scheduling")).isNotNull();
            assertThat(store.getUnservedNicheCount("telegram-coding")).isZero();
        }

        @Test
        void chronicallyUnservedExcludesServedNichesAndSortsByCount() {
            SwarmStore store = new SwarmStore(dataDir);
            for (int i = 0; i < 3; i++) {
                store.incrementUnservedNiche("discord-research");
                store.incrementUnservedNiche("telegram-coding");
            }
            for (int i = 0; i < 5; i++) {
                store.incrementUnservedNiche("telegram-scheduling");
            }
            store.incrementUnservedNiche("discord-general");
            store.setAgentForNiche("agent-1", "bp-1", "telegram-coding");

            assertThat(store.getChronicallyUnservedNiches(3))
                    .containsExactly("telegram-scheduling", "discord-research");
        }
    }
}
