package org.teamelites.swarm.reasoning;

/**
 * A thought to append to the reasoning session.
 *
 * @param thought           the text.
 * @param thoughtType       e.g. {@code reasoning} or {@code initialization}.
 * @param branchId          target branch, null for the main chain.
 * @param branchFromThought thought number the branch forks from; only for the first thought on a branch.
 * @param agentId           hub identity of the author, may be null.
 */
public record ThoughtInput(String thought, String thoughtType, String branchId, Integer branchFromThought,
                           String agentId) {

    public static ThoughtInput onMainChain(String thought, String thoughtType) {
        return new ThoughtInput(thought, thoughtType, null, null, null);
    }
}
