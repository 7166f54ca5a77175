package org.teamelites.swarm.fitness;

import org.teamelites.swarm.api.ReviewVerdict;

/**
 * What happened when a team was replayed against one probe.
 *
 * @param completed        whether the team finished the task.
 * @param verdict          the reviewer's verdict on the answer.
 * @param reasoningSteps   reasoning steps the team took.
 * @param turnsToConsensus turns until the team agreed on an answer, at least 1.
 * @param costUnits        model cost spent, in configured cost units.
 */
public record ReplayOutcome(boolean completed, ReviewVerdict verdict, int reasoningSteps, int turnsToConsensus,
                            double costUnits) {

    public ReplayOutcome {
        if (verdict == null) {
            verdict = ReviewVerdict.REQUEST_CHANGES;
        }
        reasoningSteps = Math.max(0, reasoningSteps);
        turnsToConsensus = Math.max(1, turnsToConsensus);
        costUnits = Math.max(0.0, costUnits);
    }
}
