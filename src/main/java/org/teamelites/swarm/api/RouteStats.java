package org.teamelites.swarm.api;

import java.util.Map;

/**
 * Snapshot of the routing counters kept by the registry.
 *
 * @param successCount    total routed messages.
 * @param fallbackCount   total messages that found no agent.
 * @param successByNiche  routed messages per niche key.
 * @param fallbackByNiche fallbacks per niche key.
 * @param unservedByNiche unserved messages per niche key.
 */
public record RouteStats(
        long successCount,
        long fallbackCount,
        Map<String, Long> successByNiche,
        Map<String, Long> fallbackByNiche,
        Map<String, Long> unservedByNiche) {

    public RouteStats {
        successByNiche = Map.copyOf(successByNiche);
        fallbackByNiche = Map.copyOf(fallbackByNiche);
        unservedByNiche = Map.copyOf(unservedByNiche);
    }
}
