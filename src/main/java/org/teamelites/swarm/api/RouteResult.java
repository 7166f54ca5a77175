package org.teamelites.swarm.api;

/**
 * Outcome of a successful routing decision.
 *
 * @param agentId the agent that should handle the message.
 * @param niche   the classified niche; null in single mode.
 */
public record RouteResult(String agentId, NicheDescriptor niche) {
}
