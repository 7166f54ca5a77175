package org.teamelites.swarm.api;

/**
 * Verdict recorded on a hub proposal.
 */
public enum ReviewVerdict {
    APPROVE("approve"),
    COMMENT("comment"),
    REQUEST_CHANGES("request-changes");

    private final String wireName;

    ReviewVerdict(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the verdict as sent to the hub.
     */
    public String wireName() {
        return wireName;
    }
}
