package org.teamelites.swarm.reasoning;

import java.util.List;

import org.teamelites.swarm.spi.CollaboratorException;

/**
 * The reasoning gateway: an append-only, branchable log of thoughts shared by the swarm.
 */
public interface IReasoningGateway {

    /**
     * Opens a new reasoning session.
     *
     * @return the session id.
     */
    String startNew(String title, List<String> tags) throws CollaboratorException;

    /**
     * Resumes an existing session.
     */
    void loadContext(String sessionId) throws CollaboratorException;

    /**
     * Advances the session to the stage where thoughts are accepted.
     */
    void cipher() throws CollaboratorException;

    ThoughtResult thought(ThoughtInput input) throws CollaboratorException;

    /**
     * @param branchId branch to read, null for the main chain.
     * @param last     maximum number of most recent thoughts.
     * @return the thoughts, oldest first.
     */
    List<ThoughtEntry> readThoughts(String branchId, int last) throws CollaboratorException;
}
