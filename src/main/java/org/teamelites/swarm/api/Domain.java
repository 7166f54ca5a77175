package org.teamelites.swarm.api;

import com.google.gson.annotations.SerializedName;

/**
 * Task domain dimension of a niche.
 * <p>
 * Declaration order matters: when two domains score equally during classification,
 * the one declared first wins. {@link #GENERAL} is the fallback and is never scored.
 */
public enum Domain {
    @SerializedName("coding")
    CODING("coding"),
    @SerializedName("research")
    RESEARCH("research"),
    @SerializedName("scheduling")
    SCHEDULING("scheduling"),
    @SerializedName("communication")
    COMMUNICATION("communication"),
    @SerializedName("general")
    GENERAL("general");

    private final String id;

    Domain(String id) {
        this.id = id;
    }

    /**
     * @return the lower-case identifier used in niche keys and persisted documents.
     */
    public String id() {
        return id;
    }

    /**
     * Resolves a domain from its identifier.
     *
     * @param id the identifier, case-insensitive.
     * @return the matching domain.
     * @throws IllegalArgumentException if no domain has this identifier.
     */
    public static Domain fromId(String id) {
        for (Domain domain : values()) {
            if (domain.id.equalsIgnoreCase(id)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown domain: " + id);
    }

    @Override
    public String toString() {
        return id;
    }
}
