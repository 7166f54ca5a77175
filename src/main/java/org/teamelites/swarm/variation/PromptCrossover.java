package org.teamelites.swarm.variation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.teamelites.swarm.api.SwarmAgentConfig;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.IRandomProvider;

/**
 * Two-parent operator blending the system prompts of two blueprints.
 * <p>
 * The child starts as a copy of parent A. For every agent index present in both teams, both
 * prompts are split into sentences and interleaved: even positions take A's sentence, odd
 * positions take B's, and when one parent runs out the other's remaining sentences are appended.
 * Slots beyond the shorter team are copied verbatim from A.
 * <p>
 * The child gets a fresh id, {@code generation = max(A, B) + 1} and {@code parentIds = [A, B]}.
 */
public class PromptCrossover {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    private final IRandomProvider random;

    public PromptCrossover(IRandomProvider random) {
        this.random = random;
    }

    public String name() {
        return "promptCrossover";
    }

    /**
     * @param a first parent; its structure is inherited.
     * @param b second parent.
     * @return the blended child.
     */
    public TeamBlueprint apply(TeamBlueprint a, TeamBlueprint b) {
        List<SwarmAgentConfig> agents = new ArrayList<>(a.agents());
        int shared = Math.min(a.agents().size(), b.agents().size());
        for (int i = 0; i < shared; i++) {
            String blended = interleave(a.agents().get(i).systemPrompt(), b.agents().get(i).systemPrompt());
            agents.set(i, agents.get(i).withSystemPrompt(blended));
        }
        return a.withAgents(agents).withLineage(
                BlueprintIds.next(random),
                Math.max(a.generation(), b.generation()) + 1,
                List.of(a.id(), b.id()));
    }

    static String interleave(String promptA, String promptB) {
        List<String> first = sentences(promptA);
        List<String> second = sentences(promptB);
        List<String> blended = new ArrayList<>();
        int maxLen = Math.max(first.size(), second.size());
        for (int j = 0; j < maxLen; j++) {
            if (j < first.size() && j % 2 == 0) {
                blended.add(first.get(j));
            } else if (j < second.size()) {
                blended.add(second.get(j));
            } else if (j < first.size()) {
                blended.add(first.get(j));
            }
        }
        return String.join(" ", blended);
    }

    static List<String> sentences(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return List.of();
        }
        return Arrays.stream(SENTENCE_BOUNDARY.split(prompt.trim()))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
