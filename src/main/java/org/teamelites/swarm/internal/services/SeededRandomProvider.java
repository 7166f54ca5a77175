package org.teamelites.swarm.internal.services;

import java.util.Random;

import org.teamelites.swarm.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by a seeded {@link Random}.
 * <p>
 * <strong>Thread Safety:</strong> delegates to {@link Random}, which is thread-safe; sequences are
 * only reproducible when a single thread draws from the provider.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Random random;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /**
     * Creates a provider seeded from the current time, for production runs without a fixed seed.
     */
    public static SeededRandomProvider unseeded() {
        return new SeededRandomProvider(System.nanoTime());
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public IRandomProvider deriveFor(String scope, long index) {
        long derived = seed;
        derived = 31 * derived + scope.hashCode();
        derived = 31 * derived + index;
        return new SeededRandomProvider(mix(derived));
    }

    public long getSeed() {
        return seed;
    }

    // SplitMix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
