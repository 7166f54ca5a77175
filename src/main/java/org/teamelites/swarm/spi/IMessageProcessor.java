package org.teamelites.swarm.spi;

import org.teamelites.swarm.api.InboundMessage;
import org.teamelites.swarm.reasoning.ReasoningContext;

/**
 * Processes one message for one agent, typically by calling the agent execution service and
 * delivering the reply through the adapter.
 * <p>
 * Called concurrently for different agents, never concurrently for the same agent. Timeouts, if
 * any, are the processor's responsibility.
 */
@FunctionalInterface
public interface IMessageProcessor {

    /**
     * @param agentId the agent handling the message.
     * @param message the message.
     * @param adapter adapter to reply through; may be null when enqueued without one.
     * @param context cross-agent reasoning context, {@link ReasoningContext#EMPTY} when unavailable.
     * @return the agent's reply text, or null if there is none.
     * @throws Exception any failure; caught and reported by the caller.
     */
    String process(String agentId, InboundMessage message, IChannelAdapter adapter, ReasoningContext context)
            throws Exception;
}
