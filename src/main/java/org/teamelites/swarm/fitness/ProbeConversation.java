package org.teamelites.swarm.fitness;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.typesafe.config.Config;

/**
 * A recorded conversation a candidate team is replayed against.
 *
 * @param id               probe identifier.
 * @param prompt           the user's opening message.
 * @param expectedKeywords terms a competent answer covers, lower-case.
 * @param targetSteps      reasoning steps a thorough answer takes.
 */
public record ProbeConversation(String id, String prompt, List<String> expectedKeywords, int targetSteps) {

    public ProbeConversation {
        expectedKeywords = expectedKeywords == null
                ? List.of()
                : expectedKeywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableList());
        if (targetSteps < 1) {
            throw new IllegalArgumentException("target-steps must be >= 1, got: " + targetSteps);
        }
    }

    /**
     * Reads a probe with keys {@code id}, {@code prompt}, {@code expected-keywords} and
     * {@code target-steps}.
     */
    public static ProbeConversation fromConfig(Config config) {
        return new ProbeConversation(
                config.getString("id"),
                config.getString("prompt"),
                config.hasPath("expected-keywords") ? config.getStringList("expected-keywords") : List.of(),
                config.hasPath("target-steps") ? config.getInt("target-steps") : 3);
    }
}
