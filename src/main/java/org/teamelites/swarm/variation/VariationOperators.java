package org.teamelites.swarm.variation;

import java.util.ArrayList;
import java.util.List;

import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.IRandomProvider;
import org.teamelites.swarm.spi.IVariationOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes the single-parent operators into one variation step.
 * <p>
 * {@link #applyVariation(TeamBlueprint)} applies one to three operators, each chosen
 * independently and uniformly (the same operator may be chosen more than once), then normalizes
 * the lineage once: {@code generation = parent.generation + 1} and {@code parentIds = [parent.id]},
 * however many operators ran. Crossover is not part of the pool; use {@link #crossover} when two
 * parents are available.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe when the random provider is shared; the evolution
 * engine drives it from a single thread.
 */
public class VariationOperators {

    private static final Logger LOG = LoggerFactory.getLogger(VariationOperators.class);

    /** Upper bound of operators per variation step. */
    public static final int MAX_OPERATORS = 3;

    private final IRandomProvider random;
    private final List<IVariationOperator> operators;
    private final PromptCrossover crossover;

    public VariationOperators(IRandomProvider random, VariationCatalog catalog) {
        this.random = random;
        this.operators = List.of(
                new SkillMutation(random, catalog),
                new RoleMutation(random, catalog),
                new StrategyMutation(random, catalog),
                new TeamSizeMutation(random, catalog),
                new ModelMutation(random, catalog));
        this.crossover = new PromptCrossover(random);
    }

    /**
     * Applies 1 to {@value #MAX_OPERATORS} random operators.
     */
    public TeamBlueprint applyVariation(TeamBlueprint parent) {
        return applyVariation(parent, random.nextIntBetween(1, MAX_OPERATORS));
    }

    /**
     * Applies {@code numOps} random operators in sequence.
     *
     * @param parent the parent; not modified.
     * @param numOps number of operators, at least 1.
     * @return the child with normalized lineage.
     */
    public TeamBlueprint applyVariation(TeamBlueprint parent, int numOps) {
        if (numOps < 1) {
            throw new IllegalArgumentException("numOps must be >= 1, got: " + numOps);
        }
        TeamBlueprint result = parent;
        List<String> applied = new ArrayList<>(numOps);
        for (int i = 0; i < numOps; i++) {
            IVariationOperator op = random.pick(operators);
            result = op.apply(result);
            applied.add(op.name());
        }
        TeamBlueprint child = result.withLineage(result.id(), parent.generation() + 1, List.of(parent.id()));
        LOG.debug("Varied {} -> {} via {}", parent.id(), child.id(), applied);
        return child;
    }

    /**
     * Blends the prompts of two parents.
     *
     * @see PromptCrossover#apply(TeamBlueprint, TeamBlueprint)
     */
    public TeamBlueprint crossover(TeamBlueprint a, TeamBlueprint b) {
        return crossover.apply(a, b);
    }

    public List<IVariationOperator> getOperators() {
        return operators;
    }
}
