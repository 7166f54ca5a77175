package org.teamelites.swarm.fitness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.teamelites.swarm.TestBlueprints;
import org.teamelites.swarm.api.AgentRole;
import org.teamelites.swarm.api.CoordinationStrategy;
import org.teamelites.swarm.api.Domain;
import org.teamelites.swarm.api.MemoryBlock;
import org.teamelites.swarm.api.NicheDescriptor;
import org.teamelites.swarm.api.ReviewVerdict;
import org.teamelites.swarm.api.SkillsConfig;
import org.teamelites.swarm.api.SwarmAgentConfig;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.evolution.GenesisBlueprints;
import org.teamelites.swarm.internal.services.SeededRandomProvider;

@Tag("unit")
class HeuristicConversationReplayerTest {

    private static final NicheDescriptor TELEGRAM_CODING = NicheDescriptor.of("telegram", Domain.CODING);
    private static final ProbeConversation BUGFIX =
            new ProbeConversation("coding-bugfix", "Fix the bug", List.of("Coding", "bug"), 3);

    private HeuristicConversationReplayer replayer;

    @BeforeEach
    void setUp() {
        replayer = new HeuristicConversationReplayer(Map.of(TestBlueprints.MODEL, 1.5), 1.0, 0.5);
    }

    @Test
    void genesisTeamCompletesOnPartialCoverage() {
        TeamBlueprint genesis = GenesisBlueprints.create(TELEGRAM_CODING, TestBlueprints.MODEL, new SeededRandomProvider(1L));

        ReplayOutcome outcome = replayer.replay(genesis, BUGFIX);

        assertThat(outcome.completed()).isTrue();
        assertThat(outcome.verdict()).isEqualTo(ReviewVerdict.COMMENT);
        assertThat(outcome.reasoningSteps()).isEqualTo(1);
        assertThat(outcome.turnsToConsensus()).isEqualTo(1);
        assertThat(outcome.costUnits()).isEqualTo(1.5);
    }

    @Test
    void reviewedDebateTeam() {
        TeamBlueprint team = TestBlueprints.withAgents("bp-1", TELEGRAM_CODING, List.of(
                TestBlueprints.agent(AgentRole.COORDINATOR, "You lead coding work."),
                TestBlueprints.agent(AgentRole.REVIEWER, "You review every bug fix."),
                new SwarmAgentConfig(AgentRole.CONTRIBUTOR, "unknown/model", "You help.", SkillsConfig.EMPTY, List.of())))
                .withCoordinationStrategy(CoordinationStrategy.DEBATE);

        ReplayOutcome outcome = replayer.replay(team, BUGFIX);

        assertThat(outcome.completed()).isTrue();
        assertThat(outcome.verdict()).isEqualTo(ReviewVerdict.APPROVE);
        assertThat(outcome.reasoningSteps()).isEqualTo(9);
        assertThat(outcome.turnsToConsensus()).isEqualTo(3);
        assertThat(outcome.costUnits()).isCloseTo(4.0, within(1e-9));
    }

    @Test
    void strategyShapesStepsAndTurns() {
        TeamBlueprint pair = TestBlueprints.ofSize("bp-2", 2);

        ReplayOutcome parallel = replayer.replay(pair.withCoordinationStrategy(CoordinationStrategy.PARALLEL), BUGFIX);
        ReplayOutcome pipeline = replayer.replay(pair.withCoordinationStrategy(CoordinationStrategy.PIPELINE), BUGFIX);

        assertThat(parallel.reasoningSteps()).isEqualTo(2);
        assertThat(parallel.turnsToConsensus()).isEqualTo(1);
        assertThat(pipeline.reasoningSteps()).isEqualTo(4);
        assertThat(pipeline.turnsToConsensus()).isEqualTo(1);
    }

    @Test
    void uncoveredProbeWithoutReviewerRequestsChanges() {
        TeamBlueprint team = TestBlueprints.coordinatorOnly("bp-3", TELEGRAM_CODING);
        ProbeConversation email = new ProbeConversation("email", "Draft an email", List.of("email", "draft"), 2);

        ReplayOutcome outcome = replayer.replay(team, email);

        assertThat(outcome.completed()).isFalse();
        assertThat(outcome.verdict()).isEqualTo(ReviewVerdict.REQUEST_CHANGES);
    }

    @Test
    void coverageCountsSkillsAndMemory() {
        SwarmAgentConfig agent = new SwarmAgentConfig(AgentRole.COORDINATOR, TestBlueprints.MODEL, "Plain prompt.",
                new SkillsConfig(Set.of(), List.of("calendar-sync")),
                List.of(new MemoryBlock("notes", "Owns SCHEDULING for the team")));
        TeamBlueprint team = TestBlueprints.withAgents("bp-4", TELEGRAM_CODING, List.of(agent));
        ProbeConversation meeting = new ProbeConversation("m", "Book it", List.of("scheduling", "calendar", "zoom"), 2);

        assertThat(HeuristicConversationReplayer.keywordCoverage(team, meeting)).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(HeuristicConversationReplayer.keywordCoverage(team,
                new ProbeConversation("free", "Anything", List.of(), 1))).isEqualTo(1.0);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new HeuristicConversationReplayer(Map.of(), -1.0, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HeuristicConversationReplayer(Map.of(), 1.0, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
