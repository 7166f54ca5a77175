package org.teamelites.swarm.reasoning;

/**
 * A thought read back from the reasoning session.
 */
public record ThoughtEntry(
        int thoughtNumber,
        String thought,
        String thoughtType,
        String branchId,
        String agentId,
        String timestamp) {
}
