package org.teamelites.swarm.fitness;

import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.CollaboratorException;

/**
 * Plays a probe conversation through a candidate team.
 */
@FunctionalInterface
public interface IConversationReplayer {

    /**
     * @param blueprint the candidate team.
     * @param probe     the conversation.
     * @return the outcome.
     * @throws CollaboratorException if a live agent service used for the replay fails.
     */
    ReplayOutcome replay(TeamBlueprint blueprint, ProbeConversation probe) throws CollaboratorException;
}
