package org.teamelites.swarm.hub;

import java.util.List;

import org.teamelites.swarm.api.ReviewVerdict;
import org.teamelites.swarm.spi.CollaboratorException;

/**
 * The consensus hub: workspaces hold problems (review channels), problems collect proposals,
 * proposals are reviewed and merged. The swarm uses it as the durable audit trail of its
 * MAP-Elites archive and as the shared decision channel of the reasoning bridge.
 * <p>
 * Every operation throws {@link CollaboratorException} on transport or RPC failure.
 */
public interface IHubClient {

    /**
     * @return the hub agent id of the registered identity.
     */
    String register(String name, String role) throws CollaboratorException;

    /**
     * @return the workspace id.
     */
    String createWorkspace(String name, String description) throws CollaboratorException;

    /**
     * @return the problem (review channel) id.
     */
    String createProblem(String workspaceId, String title, String description) throws CollaboratorException;

    /**
     * Claims a problem on a fresh branch.
     *
     * @return the thought number the branch forks from, or null if the hub reports none.
     */
    Integer claimProblem(String problemId, String branchId) throws CollaboratorException;

    /**
     * @return the proposal id.
     */
    String createProposal(String problemId, String title, String sourceBranch, String description)
            throws CollaboratorException;

    /**
     * @return the review id, or null if the hub reports none.
     */
    String reviewProposal(String proposalId, ReviewVerdict verdict, String comment) throws CollaboratorException;

    /**
     * @return true if the hub merged the proposal.
     */
    boolean mergeProposal(String proposalId) throws CollaboratorException;

    /**
     * @return the consensus marker id.
     */
    String markConsensus(String name, int thoughtRef) throws CollaboratorException;

    /**
     * Posts to a problem's channel.
     *
     * @return the message id, or null if the hub reports none.
     */
    String postMessage(String workspaceId, String problemId, String content) throws CollaboratorException;

    /**
     * @return the channel's message contents, oldest first.
     */
    List<String> readChannel(String workspaceId, String problemId) throws CollaboratorException;
}
