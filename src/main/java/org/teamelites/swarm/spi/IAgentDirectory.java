package org.teamelites.swarm.spi;

import java.util.List;
import java.util.Optional;

import org.teamelites.swarm.api.MemoryBlock;

/**
 * The slice of the agent execution service used for provisioning niche agents.
 */
public interface IAgentDirectory {

    /**
     * Specification of an agent to create.
     *
     * @param name         deterministic agent name.
     * @param model        model handle.
     * @param systemPrompt system prompt.
     * @param memory       initial memory blocks.
     */
    record AgentSpec(String name, String model, String systemPrompt, List<MemoryBlock> memory) {
        public AgentSpec {
            memory = memory == null ? List.of() : List.copyOf(memory);
        }
    }

    /**
     * @param name agent name.
     * @return id of an agent with this name, if one is known.
     */
    Optional<String> findAgentByName(String name) throws CollaboratorException;

    /**
     * @param agentId agent id.
     * @return true if the agent is still live.
     */
    boolean agentExists(String agentId) throws CollaboratorException;

    /**
     * @param spec the agent to create.
     * @return the new agent's id.
     */
    String createAgent(AgentSpec spec) throws CollaboratorException;
}
