package org.teamelites.swarm.api;

import com.google.gson.annotations.SerializedName;

/**
 * Role of one agent slot within a team blueprint. At most one slot per team may be
 * the {@link #COORDINATOR}.
 */
public enum AgentRole {
    @SerializedName("coordinator")
    COORDINATOR,
    @SerializedName("contributor")
    CONTRIBUTOR,
    @SerializedName("reviewer")
    REVIEWER,
    @SerializedName("specialist")
    SPECIALIST
}
