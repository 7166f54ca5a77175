package org.teamelites.swarm.api;

/**
 * A labelled core-memory block seeded into an agent when it is provisioned.
 */
public record MemoryBlock(String label, String value) {
}
