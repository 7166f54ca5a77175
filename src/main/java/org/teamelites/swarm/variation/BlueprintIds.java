package org.teamelites.swarm.variation;

import org.teamelites.swarm.spi.IRandomProvider;

/**
 * Generates blueprint ids of the form {@code bp-<base36 millis>-<6 base36 chars>}.
 */
public final class BlueprintIds {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 6;

    private BlueprintIds() {
    }

    public static String next(IRandomProvider random) {
        return "bp-" + Long.toString(System.currentTimeMillis(), 36) + "-" + randomToken(random, SUFFIX_LENGTH);
    }

    /**
     * @param random randomness source.
     * @param length token length.
     * @return a random base36 token.
     */
    public static String randomToken(IRandomProvider random, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
