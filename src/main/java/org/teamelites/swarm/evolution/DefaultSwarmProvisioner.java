package org.teamelites.swarm.evolution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.teamelites.swarm.api.MemoryBlock;
import org.teamelites.swarm.api.SwarmAgentConfig;
import org.teamelites.swarm.api.TeamBlueprint;
import org.teamelites.swarm.spi.CollaboratorException;
import org.teamelites.swarm.spi.IAgentDirectory;
import org.teamelites.swarm.spi.IAgentDirectory.AgentSpec;
import org.teamelites.swarm.spi.ISwarmProvisioner;
import org.teamelites.swarm.telemetry.SwarmEventLog;

import com.typesafe.config.Config;

/**
 * Provisions one live agent per niche under the deterministic name {@code <prefix><nicheKey>}.
 * <p>
 * A live agent already carrying that name is reused. Otherwise an agent is created from the
 * blueprint's primary slot; a missing model falls back to the configured model, a blank prompt to
 * the niche's default prompt, and empty memory to the configured default memory blocks.
 */
public class DefaultSwarmProvisioner implements ISwarmProvisioner {

    private final IAgentDirectory directory;
    private final SwarmEventLog events;
    private final String namePrefix;
    private final String modelFallback;
    private final List<MemoryBlock> defaultMemory;

    /**
     * Options: {@code name-prefix}, {@code model-fallback} (may be empty),
     * {@code default-memory} (list of {@code {label, value}}).
     */
    public DefaultSwarmProvisioner(IAgentDirectory directory, SwarmEventLog events, Config options) {
        this(directory, events, options.getString("name-prefix"),
                blankToNull(options.getString("model-fallback")), readMemory(options));
    }

    DefaultSwarmProvisioner(IAgentDirectory directory, SwarmEventLog events, String namePrefix,
                            String modelFallback, List<MemoryBlock> defaultMemory) {
        this.directory = directory;
        this.events = events != null ? events : SwarmEventLog.loggingOnly();
        this.namePrefix = namePrefix;
        this.modelFallback = modelFallback;
        this.defaultMemory = List.copyOf(defaultMemory);
    }

    @Override
    public String provisionNicheAgent(TeamBlueprint blueprint) throws CollaboratorException {
        String agentName = agentNameOf(blueprint);

        Optional<String> existing = directory.findAgentByName(agentName);
        if (existing.isPresent() && directory.agentExists(existing.get())) {
            events.record("provision_reuse_agent", eventData(blueprint, existing.get(), agentName));
            return existing.get();
        }

        SwarmAgentConfig primary = blueprint.agents().isEmpty() ? null : blueprint.agents().get(0);
        String model = primary != null && primary.model() != null ? primary.model() : modelFallback;
        if (model == null) {
            throw new CollaboratorException("create_agent", "no model for agent " + agentName);
        }
        String systemPrompt = primary != null && !primary.systemPrompt().isBlank()
                ? primary.systemPrompt()
                : GenesisBlueprints.defaultPrompt(blueprint.niche());
        List<MemoryBlock> memory = primary != null && !primary.memoryBlocks().isEmpty()
                ? primary.memoryBlocks()
                : defaultMemory;

        String agentId = directory.createAgent(new AgentSpec(agentName, model, systemPrompt, memory));
        events.record("provision_create_agent", eventData(blueprint, agentId, agentName));
        return agentId;
    }

    /**
     * @return the agent name serving the blueprint's niche.
     */
    public String agentNameOf(TeamBlueprint blueprint) {
        return namePrefix + blueprint.niche().key();
    }

    private static Map<String, Object> eventData(TeamBlueprint blueprint, String agentId, String agentName) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("nicheKey", blueprint.niche().key());
        data.put("blueprintId", blueprint.id());
        data.put("agentId", agentId);
        data.put("agentName", agentName);
        return data;
    }

    private static List<MemoryBlock> readMemory(Config options) {
        List<MemoryBlock> blocks = new ArrayList<>();
        if (options.hasPath("default-memory")) {
            for (Config block : options.getConfigList("default-memory")) {
                blocks.add(new MemoryBlock(block.getString("label"), block.getString("value")));
            }
        }
        return blocks;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
