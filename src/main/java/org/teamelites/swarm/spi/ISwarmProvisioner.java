package org.teamelites.swarm.spi;

import org.teamelites.swarm.api.TeamBlueprint;

/**
 * Materializes the live agent serving a blueprint's niche.
 * <p>
 * Must be idempotent: when a live agent already exists under the niche's deterministic name it
 * is reused.
 */
@FunctionalInterface
public interface ISwarmProvisioner {

    /**
     * @param blueprint the newly merged elite.
     * @return id of the live agent serving the niche.
     * @throws CollaboratorException if the agent execution service fails.
     */
    String provisionNicheAgent(TeamBlueprint blueprint) throws CollaboratorException;
}
