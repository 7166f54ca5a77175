package org.teamelites.swarm.api;

import java.util.Objects;

/**
 * A (channel, domain) cell of the MAP-Elites archive.
 *
 * @param channel the channel the message arrived on (e.g. {@code telegram}).
 * @param domain  the classified task domain.
 * @param key     the archive key, always {@code channel + "-" + domain}.
 */
public record NicheDescriptor(String channel, Domain domain, String key) {

    public NicheDescriptor {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(domain, "domain");
        if (key == null) {
            key = keyOf(channel, domain);
        }
    }

    /**
     * Creates a descriptor with the derived key.
     *
     * @param channel the channel identifier.
     * @param domain  the domain.
     * @return the descriptor.
     */
    public static NicheDescriptor of(String channel, Domain domain) {
        return new NicheDescriptor(channel, domain, keyOf(channel, domain));
    }

    /**
     * Builds the archive key for a channel/domain pair.
     *
     * @param channel the channel identifier.
     * @param domain  the domain.
     * @return {@code channel-domain}.
     */
    public static String keyOf(String channel, Domain domain) {
        return channel + "-" + domain.id();
    }
}
