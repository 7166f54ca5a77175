package org.teamelites.swarm.reasoning;

/**
 * Shared reasoning memory consulted by the router around message processing.
 * <p>
 * Implementations must never throw: failures degrade to {@link ReasoningContext#EMPTY} or to a
 * dropped log entry.
 */
public interface IReasoningContextProvider {

    /**
     * Collects recent reasoning of the other agents.
     *
     * @param agentId  the agent about to process a message.
     * @param nicheKey its niche key, may be null in single mode.
     * @return the context, {@link ReasoningContext#EMPTY} when nothing is available.
     */
    ReasoningContext gatherContext(String agentId, String nicheKey);

    /**
     * Records what an agent answered.
     *
     * @param agentId  the agent.
     * @param nicheKey its niche key, may be null in single mode.
     * @param entry    the exchange.
     */
    void logReasoning(String agentId, String nicheKey, ReasoningEntry entry);

    /**
     * An exchange worth remembering.
     *
     * @param inboundMessage the user's message text.
     * @param response       the agent's reply.
     * @param channel        the channel it happened on.
     */
    record ReasoningEntry(String inboundMessage, String response, String channel) {
    }
}
