package org.teamelites.swarm.api;

/**
 * Binds one live agent to one niche of the archive.
 *
 * @param agentId        id of the live agent in the execution service.
 * @param blueprintId    the elite blueprint the agent was provisioned from.
 * @param nicheKey       the niche key served by this agent.
 * @param conversationId the agent's current conversation, if any.
 * @param createdAt      ISO-8601 creation time.
 */
public record SwarmAgentEntry(
        String agentId,
        String blueprintId,
        String nicheKey,
        String conversationId,
        String createdAt) {
}
