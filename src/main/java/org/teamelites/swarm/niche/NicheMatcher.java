package org.teamelites.swarm.niche;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.teamelites.swarm.api.Domain;
import org.teamelites.swarm.api.InboundMessage;
import org.teamelites.swarm.api.NicheDescriptor;

/**
 * Classifies messages into niches without model inference.
 * <p>
 * The channel dimension is taken from the message as-is. The domain dimension is decided by
 * keyword heuristics: each domain is scored by the number of its keywords occurring as
 * case-insensitive substrings of the text, the highest score wins, ties go to the domain
 * declared first in {@link Domain}, and a text without any hit is {@link Domain#GENERAL}.
 * <p>
 * <strong>Thread Safety:</strong> stateless and thread-safe.
 */
public final class NicheMatcher {

    private static final Map<Domain, List<String>> DOMAIN_KEYWORDS = new EnumMap<>(Domain.class);

    static {
        DOMAIN_KEYWORDS.put(Domain.CODING, List.of(
                "code", "coding", "debug", "function", "bug", "compile", "error",
                "typescript", "javascript", "python", "api", "implement", "algorithm",
                "syntax", "variable", "class", "import", "module", "test", "deploy",
                "refactor", "git", "commit", "merge", "pr", "pull request"));
        DOMAIN_KEYWORDS.put(Domain.RESEARCH, List.of(
                "research", "paper", "study", "analyze", "analysis", "dataset",
                "literature", "investigate", "hypothesis", "experiment", "survey",
                "findings", "methodology", "citation", "journal", "review",
                "evidence", "theory", "data"));
        DOMAIN_KEYWORDS.put(Domain.SCHEDULING, List.of(
                "schedule", "meeting", "calendar", "reminder", "book", "appointment",
                "plan", "event", "deadline", "agenda", "availability", "slot",
                "reschedule", "postpone", "cancel meeting"));
        DOMAIN_KEYWORDS.put(Domain.COMMUNICATION, List.of(
                "email", "message", "notify", "reply", "compose", "draft",
                "announcement", "broadcast", "newsletter", "memo", "letter",
                "outreach", "follow up", "reach out"));
    }

    private NicheMatcher() {
    }

    /**
     * Classifies text into a domain.
     *
     * @param text message text; null is treated as empty.
     * @return the best-scoring domain, {@link Domain#GENERAL} when nothing matches.
     */
    public static Domain classifyDomain(String text) {
        if (text == null || text.isEmpty()) {
            return Domain.GENERAL;
        }
        String lower = text.toLowerCase(Locale.ROOT);

        Domain bestDomain = Domain.GENERAL;
        int bestScore = 0;
        for (Map.Entry<Domain, List<String>> entry : DOMAIN_KEYWORDS.entrySet()) {
            int score = 0;
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword)) {
                    score++;
                }
            }
            // strictly greater: earlier-declared domain keeps ties
            if (score > bestScore) {
                bestScore = score;
                bestDomain = entry.getKey();
            }
        }
        return bestDomain;
    }

    /**
     * Matches a message to its niche.
     *
     * @param message the inbound message.
     * @return {@code {channel, domain, channel-domain}}.
     */
    public static NicheDescriptor matchNiche(InboundMessage message) {
        return NicheDescriptor.of(message.channel(), classifyDomain(message.text()));
    }

    /**
     * @param domain a scored domain.
     * @return its keyword list; empty for {@link Domain#GENERAL}.
     */
    public static List<String> keywordsFor(Domain domain) {
        return DOMAIN_KEYWORDS.getOrDefault(domain, List.of());
    }
}
