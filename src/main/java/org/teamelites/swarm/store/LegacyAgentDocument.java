package org.teamelites.swarm.store;

/**
 * The pre-swarm single-agent document, read once for migration.
 */
record LegacyAgentDocument(
        String agentId,
        String conversationId,
        String baseUrl,
        String createdAt,
        String lastUsedAt) {
}
