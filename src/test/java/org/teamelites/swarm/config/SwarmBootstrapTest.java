package org.teamelites.swarm.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.teamelites.junit.extensions.logging.ExpectLog;
import org.teamelites.junit.extensions.logging.LogLevel;
import org.teamelites.junit.extensions.logging.LogWatchExtension;
import org.teamelites.swarm.api.Domain;
import org.teamelites.swarm.api.NicheDescriptor;
import org.teamelites.swarm.evolution.EvolutionService;
import org.teamelites.swarm.evolution.GenerationReport;
import org.teamelites.swarm.rpc.FakeMcpServer;
import org.teamelites.swarm.telemetry.SwarmEventLog;

import com.google.gson.JsonObject;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Wires the whole swarm from configuration and drives it against an in-process hub.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class SwarmBootstrapTest {

    private static final NicheDescriptor TELEGRAM_CODING = NicheDescriptor.of("telegram", Domain.CODING);

    @TempDir
    Path dataDir;

    private Config config(String overrides) {
        String base = "team-elites {\n"
                + "  data-dir = \"" + dataDir.toString().replace("\\", "\\\\") + "\"\n"
                + "  random-seed = 7\n"
                + "  hub.request-timeout = 2s\n"
                + "  gateway.request-timeout = 2s\n"
                + "  evolution.niches = [{ channel = telegram, domain = coding }]\n"
                + "  evolution.population-size = 1\n"
                + "}\n";
        return ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.parseString(base))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static URI closedEndpoint() throws IOException {
        try (FakeMcpServer gone = FakeMcpServer.start()) {
            return gone.uri();
        }
    }

    @Test
    void defaultWiringKeepsOptionalPartsOff() {
        try (SwarmBootstrap bootstrap = new SwarmBootstrap(config(""), null)) {
            bootstrap.start();

            assertThat(bootstrap.getReasoningBridge()).isNull();
            assertThat(bootstrap.getEvolutionService().getCurrentState()).isEqualTo(EvolutionService.State.STOPPED);
            assertThat(bootstrap.getEvolutionConfig().niches()).containsExactly(TELEGRAM_CODING);
            assertThat(bootstrap.getEvents().getFile()).isEqualTo(dataDir.resolve(SwarmEventLog.FILE_NAME));
            assertThat(bootstrap.getStore().getRegistryPath().getParent()).isEqualTo(dataDir);
        }
    }

    @Test
    void disabledEventsOnlyLog() {
        try (SwarmBootstrap bootstrap = new SwarmBootstrap(config("team-elites.events.enabled = false"), null)) {
            assertThat(bootstrap.getEvents().getFile()).isNull();
        }
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Reasoning bridge unavailable, continuing without shared reasoning: .*")
    void unreachableGatewayLeavesReasoningInactive() throws IOException {
        Config config = config("team-elites.reasoning.enabled = true\n"
                + "team-elites.gateway.url = \"" + closedEndpoint() + "\"");
        try (SwarmBootstrap bootstrap = new SwarmBootstrap(config, null)) {
            bootstrap.start();

            assertThat(bootstrap.getReasoningBridge()).isNotNull();
            assertThat(bootstrap.getReasoningBridge().isInitialized()).isFalse();
        }
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Archive initialization failed, retrying next cycle: .*")
    void evolutionServiceSurvivesUnreachableHub() throws IOException {
        Config config = config("team-elites.evolution.enabled = true\n"
                + "team-elites.hub.url = \"" + closedEndpoint() + "\"");
        try (SwarmBootstrap bootstrap = new SwarmBootstrap(config, null)) {
            bootstrap.start();

            assertThat(bootstrap.getEvolutionService().getCurrentState()).isEqualTo(EvolutionService.State.RUNNING);
            await().atMost(Duration.ofSeconds(10)).until(() -> bootstrap.getEvolutionService().getCyclesRun() >= 1);
        }
    }

    @Test
    void generationAgainstHubArchivesAnElite() throws Exception {
        try (FakeMcpServer hub = FakeMcpServer.start()) {
            hub.on("register", "{\"agentId\":\"coord-1\"}")
                    .on("create_workspace", "{\"workspaceId\":\"ws-1\"}")
                    .on("create_problem", "{\"problemId\":\"prob-1\"}")
                    .on("claim_problem", "{\"branchFromThought\":1}")
                    .on("create_proposal", "{\"proposalId\":\"prop-1\"}")
                    .on("review_proposal", "{\"reviewId\":\"rev-1\"}")
                    .on("merge_proposal", "{\"merged\":true}");
            Config config = config("team-elites.hub.url = \"" + hub.uri() + "\"");

            try (SwarmBootstrap bootstrap = new SwarmBootstrap(config, null)) {
                bootstrap.getEngine().initializeArchive(bootstrap.getEvolutionConfig().niches());
                GenerationReport report = bootstrap.getEngine().runGeneration(bootstrap.getEvolutionConfig().niches());

                assertThat(report.merged()).isEqualTo(1);
                assertThat(bootstrap.getStore().getElite(TELEGRAM_CODING).hubRefs().proposalId()).isEqualTo("prop-1");
                assertThat(bootstrap.getStore().getGeneration()).isEqualTo(1);
            }

            JsonObject review = hub.calls("review_proposal").get(0).args();
            assertThat(review.get("verdict").getAsString()).isEqualTo("approve");
            assertThat(hub.calls("create_problem").get(0).args().get("title").getAsString())
                    .isEqualTo("niche:telegram-coding");
        }
    }
}
