package org.teamelites.swarm.reasoning;

/**
 * @param thoughtNumber sequence number assigned by the gateway.
 * @param branchId      branch the thought landed on.
 * @param sessionId     reasoning session.
 */
public record ThoughtResult(int thoughtNumber, String branchId, String sessionId) {
}
