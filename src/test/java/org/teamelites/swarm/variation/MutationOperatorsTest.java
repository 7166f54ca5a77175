package org.teamelites.swarm.variation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.teamelites.swarm.TestBlueprints;
import org.teamelites.swarm.api.AgentRole;
import org.teamelites.swarm.api.SkillsConfig;
import org.teamelites.swarm.api.SwarmAgentConfig;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.internal.services.SeededRandomProvider;
import org.teamelites.swarm.spi.IRandomProvider;
import org.teamelites.swarm.spi.IVariationOperator;

@Tag("unit")
class MutationOperatorsTest {

    private static final VariationCatalog CATALOG = VariationCatalog.DEFAULT;

    static Stream<Arguments> operators() {
        return Stream.of(
                Arguments.of("skill", (BiFunction<IRandomProvider, VariationCatalog, IVariationOperator>) SkillMutation::new),
                Arguments.of("role", (BiFunction<IRandomProvider, VariationCatalog, IVariationOperator>) RoleMutation::new),
                Arguments.of("strategy", (BiFunction<IRandomProvider, VariationCatalog, IVariationOperator>) StrategyMutation::new),
                Arguments.of("team size", (BiFunction<IRandomProvider, VariationCatalog, IVariationOperator>) TeamSizeMutation::new),
                Arguments.of("model", (BiFunction<IRandomProvider, VariationCatalog, IVariationOperator>) ModelMutation::new));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("operators")
    void eachOperatorStampsItsOwnLineage(String name,
                                         BiFunction<IRandomProvider, VariationCatalog, IVariationOperator> factory) {
        TeamBlueprint parent = TestBlueprints.ofSize("bp-parent", 3).withLineage("bp-parent", 3, List.of("bp-root"));
        for (long seed = 0; seed < 20; seed++) {
            TeamBlueprint child = factory.apply(new SeededRandomProvider(seed), CATALOG).apply(parent);

            assertThat(child.generation()).isEqualTo(4);
            assertThat(child.parentIds()).containsExactly("bp-parent");
            assertThat(child.id()).isNotEqualTo("bp-parent").startsWith("bp-");
        }
    }

    @Nested
    @DisplayName("Strategy mutation")
    class Strategy {

        @Test
        void alwaysPicksADifferentStrategy() {
            TeamBlueprint parent = TestBlueprints.ofSize("bp-a", 2);
            for (long seed = 0; seed < 20; seed++) {
                TeamBlueprint child = new StrategyMutation(new SeededRandomProvider(seed), CATALOG).apply(parent);

                assertThat(child.coordinationStrategy()).isNotEqualTo(parent.coordinationStrategy());
            }
        }
    }

    @Nested
    @DisplayName("Team size mutation")
    class TeamSize {

        @Test
        void singleAgentTeamCanOnlyGrow() {
            TeamBlueprint parent = TestBlueprints.ofSize("bp-a", 1);
            for (long seed = 0; seed < 50; seed++) {
                TeamBlueprint child = new TeamSizeMutation(new SeededRandomProvider(seed), CATALOG).apply(parent);

                assertThat(child.agents()).hasSize(2);
                assertThat(child.agents().get(0)).isEqualTo(parent.agents().get(0));
                SwarmAgentConfig added = child.agents().get(1);
                assertThat(added.role()).isEqualTo(AgentRole.CONTRIBUTOR);
                assertThat(added.systemPrompt()).isEqualTo(CATALOG.contributorPrompt());
                assertThat(CATALOG.models()).contains(added.model());
            }
        }

        @Test
        void fullTeamShrinksAndKeepsCoordinator() {
            TeamBlueprint parent = TestBlueprints.ofSize("bp-a", TeamBlueprint.MAX_AGENTS);
            for (long seed = 0; seed < 50; seed++) {
                TeamBlueprint child = new TeamSizeMutation(new SeededRandomProvider(seed), CATALOG).apply(parent);

                assertThat(child.agents()).hasSize(TeamBlueprint.MAX_AGENTS - 1);
                assertThat(child.coordinatorCount()).isEqualTo(1);
            }
        }
    }

    @Nested
    @DisplayName("Role mutation")
    class Role {

        @Test
        void neverProducesTwoCoordinators() {
            TeamBlueprint parent = TestBlueprints.ofSize("bp-a", 4);
            for (long seed = 0; seed < 50; seed++) {
                TeamBlueprint child = new RoleMutation(new SeededRandomProvider(seed), CATALOG).apply(parent);

                assertThat(child.coordinatorCount()).isLessThanOrEqualTo(1);
                assertThat(child.agents()).hasSize(4);
            }
        }
    }

    @Nested
    @DisplayName("Model mutation")
    class Model {

        @Test
        void changesTheModelOfExactlyOneSlot() {
            TeamBlueprint parent = TestBlueprints.ofSize("bp-a", 3);

            TeamBlueprint child = new ModelMutation(new SeededRandomProvider(3L), CATALOG).apply(parent);

            long changed = 0;
            for (int i = 0; i < parent.agents().size(); i++) {
                if (!parent.agents().get(i).model().equals(child.agents().get(i).model())) {
                    changed++;
                }
            }
            assertThat(changed).isEqualTo(1);
        }

        @Test
        void singleModelCatalogLeavesTeamUnchanged() {
            VariationCatalog oneModel = new VariationCatalog(List.of(TestBlueprints.MODEL), CATALOG.roles(),
                    CATALOG.strategies(), CATALOG.skillFlags(), CATALOG.contributorPrompt());
            TeamBlueprint parent = TestBlueprints.ofSize("bp-a", 2);

            TeamBlueprint child = new ModelMutation(new SeededRandomProvider(3L), oneModel).apply(parent);

            assertThat(child.agents()).isEqualTo(parent.agents());
            assertThat(child.parentIds()).containsExactly("bp-a");
        }
    }

    @Nested
    @DisplayName("Skill mutation")
    class Skill {

        @Test
        void touchesOnlyTheSkillsOfOneSlot() {
            TeamBlueprint parent = TestBlueprints.ofSize("bp-a", 3);

            TeamBlueprint child = new SkillMutation(new SeededRandomProvider(11L), CATALOG).apply(parent);

            List<Integer> changed = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                SwarmAgentConfig before = parent.agents().get(i);
                SwarmAgentConfig after = child.agents().get(i);
                assertThat(after.role()).isEqualTo(before.role());
                assertThat(after.systemPrompt()).isEqualTo(before.systemPrompt());
                if (!after.skills().equals(before.skills())) {
                    changed.add(i);
                }
            }
            assertThat(changed).hasSizeLessThanOrEqualTo(1);
        }

        @Test
        void flagsStayWithinCatalog() {
            TeamBlueprint parent = TestBlueprints.ofSize("bp-a", 1);
            for (long seed = 0; seed < 30; seed++) {
                TeamBlueprint child = new SkillMutation(new SeededRandomProvider(seed), CATALOG).apply(parent);
                SkillsConfig skills = child.agents().get(0).skills();

                assertThat(CATALOG.skillFlags()).containsAll(skills.flags());
                assertThat(skills.additionalSkills()).allMatch(s -> s.matches("skill-[0-9a-z]{4}"));
            }
        }
    }

    @Test
    void emptyTeamPassesThroughWithNewLineage() {
        TeamBlueprint empty = TestBlueprints.withAgents("bp-empty", TestBlueprints.ofSize("x", 1).niche(), List.of());

        TeamBlueprint child = new RoleMutation(new SeededRandomProvider(1L), CATALOG).apply(empty);

        assertThat(child.agents()).isEmpty();
        assertThat(child.generation()).isEqualTo(1);
        assertThat(child.parentIds()).containsExactly("bp-empty");
    }
}
