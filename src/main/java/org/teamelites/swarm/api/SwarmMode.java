package org.teamelites.swarm.api;

import com.google.gson.annotations.SerializedName;

/**
 * Routing mode of the registry.
 * <p>
 * {@link #SINGLE} sends every message to the one configured agent; {@link #SWARM}
 * classifies each message and routes it to the agent bound to its niche.
 */
public enum SwarmMode {
    @SerializedName("single")
    SINGLE,
    @SerializedName("swarm")
    SWARM
}
