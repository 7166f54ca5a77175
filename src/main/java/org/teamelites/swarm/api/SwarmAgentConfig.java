package org.teamelites.swarm.api;

import java.util.List;
import java.util.Objects;

/**
 * Configuration of one agent slot in a {@link TeamBlueprint}.
 *
 * @param role         the slot's role in the team.
 * @param model        model handle, e.g. {@code anthropic/claude-sonnet-4-5-20250929}.
 * @param systemPrompt the slot's system prompt.
 * @param skills       enabled skills.
 * @param memoryBlocks memory blocks seeded at provisioning time.
 */
public record SwarmAgentConfig(
        AgentRole role,
        String model,
        String systemPrompt,
        SkillsConfig skills,
        List<MemoryBlock> memoryBlocks) {

    public SwarmAgentConfig {
        Objects.requireNonNull(role, "role");
        if (systemPrompt == null) {
            systemPrompt = "";
        }
        if (skills == null) {
            skills = SkillsConfig.EMPTY;
        }
        memoryBlocks = memoryBlocks == null ? List.of() : List.copyOf(memoryBlocks);
    }

    public SwarmAgentConfig withRole(AgentRole newRole) {
        return new SwarmAgentConfig(newRole, model, systemPrompt, skills, memoryBlocks);
    }

    public SwarmAgentConfig withModel(String newModel) {
        return new SwarmAgentConfig(role, newModel, systemPrompt, skills, memoryBlocks);
    }

    public SwarmAgentConfig withSystemPrompt(String newPrompt) {
        return new SwarmAgentConfig(role, model, newPrompt, skills, memoryBlocks);
    }

    public SwarmAgentConfig withSkills(SkillsConfig newSkills) {
        return new SwarmAgentConfig(role, model, systemPrompt, newSkills, memoryBlocks);
    }
}
