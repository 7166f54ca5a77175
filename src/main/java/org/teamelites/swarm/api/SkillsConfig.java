package org.teamelites.swarm.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Skills enabled for one agent slot: named boolean skill flags (e.g. {@code cronEnabled})
 * plus a free-form list of additional skill identifiers.
 *
 * @param flags            enabled skill flags, iteration order preserved.
 * @param additionalSkills free-form skill identifiers.
 */
public record SkillsConfig(Set<String> flags, List<String> additionalSkills) {

    public static final SkillsConfig EMPTY = new SkillsConfig(Set.of(), List.of());

    public SkillsConfig {
        flags = flags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(flags));
        additionalSkills = additionalSkills == null ? List.of() : List.copyOf(additionalSkills);
    }

    public boolean isEnabled(String flag) {
        return flags.contains(flag);
    }

    public SkillsConfig withFlag(String flag, boolean enabled) {
        Set<String> next = new LinkedHashSet<>(flags);
        if (enabled) {
            next.add(flag);
        } else {
            next.remove(flag);
        }
        return new SkillsConfig(next, additionalSkills);
    }

    public SkillsConfig withAdditionalSkills(List<String> skills) {
        return new SkillsConfig(flags, new ArrayList<>(skills));
    }
}
