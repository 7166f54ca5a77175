package org.teamelites.swarm.api;

import com.google.gson.annotations.SerializedName;

/**
 * How the agents of a team cooperate on one message.
 */
public enum CoordinationStrategy {
    @SerializedName("sequential")
    SEQUENTIAL,
    @SerializedName("parallel")
    PARALLEL,
    @SerializedName("debate")
    DEBATE,
    @SerializedName("pipeline")
    PIPELINE
}
