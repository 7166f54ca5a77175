package org.teamelites.swarm.evolution;

/**
 * Outcome of one {@link EvolutionEngine#runGeneration} call.
 *
 * @param attempted candidates started.
 * @param merged    candidates that became the elite of their niche.
 * @param rejected  candidates that lost against the current elite.
 * @param failed    candidates aborted by a collaborator failure or a missing review channel.
 */
public record GenerationReport(int attempted, int merged, int rejected, int failed) {

    public static final GenerationReport EMPTY = new GenerationReport(0, 0, 0, 0);
}
