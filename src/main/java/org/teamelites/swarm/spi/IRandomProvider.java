package org.teamelites.swarm.spi;

import java.util.List;

/**
 * Source of randomness for selection and variation.
 * <p>
 * All randomized components receive an {@code IRandomProvider} instead of calling
 * {@link Math#random()}, so an evolutionary run is reproducible from its seed.
 */
public interface IRandomProvider {

    /**
     * @param bound exclusive upper bound, must be positive.
     * @return a uniformly distributed int in {@code [0, bound)}.
     */
    int nextInt(int bound);

    /**
     * @return a uniformly distributed double in {@code [0, 1)}.
     */
    double nextDouble();

    /**
     * Derives an independent, deterministic provider for a named scope.
     *
     * @param scope scope name, e.g. {@code "variation"}.
     * @param index scope-local index.
     * @return the derived provider.
     */
    IRandomProvider deriveFor(String scope, long index);

    /**
     * Picks a uniformly random element.
     *
     * @param items non-empty list.
     * @param <T>   element type.
     * @return the chosen element.
     * @throws IllegalArgumentException if the list is empty.
     */
    default <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(nextInt(items.size()));
    }

    /**
     * @param minInclusive lower bound.
     * @param maxInclusive upper bound.
     * @return a uniformly distributed int in {@code [minInclusive, maxInclusive]}.
     */
    default int nextIntBetween(int minInclusive, int maxInclusive) {
        return minInclusive + nextInt(maxInclusive - minInclusive + 1);
    }
}
