package org.teamelites.swarm.api;

/**
 * Identifiers of the hub records backing an archived blueprint.
 *
 * @param workspaceId       archive workspace.
 * @param problemId         the niche's review channel.
 * @param proposalId        the merged proposal, if any.
 * @param consensusMarkerId consensus marker, if one was placed.
 */
public record HubRefs(String workspaceId, String problemId, String proposalId, String consensusMarkerId) {

    public static final HubRefs EMPTY = new HubRefs("", "", null, null);
}
