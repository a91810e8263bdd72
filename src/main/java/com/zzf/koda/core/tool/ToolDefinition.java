package com.zzf.koda.core.tool;

import com.zzf.koda.core.agent.Phase;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Static description of a registered tool, as offered to the model.
 */
public final class ToolDefinition {

    private final String name;
    private final String description;
    private final ToolSchema schema;
    private final ToolCapability capability;
    private final Set<Phase> phases;

    public ToolDefinition(String name, String description, ToolSchema schema, ToolCapability capability, Set<Phase> phases) {
        this.name = name;
        this.description = description == null ? "" : description.trim();
        this.schema = schema;
        this.capability = capability;
        this.phases = phases == null || phases.isEmpty()
                ? capability.defaultPhases()
                : Collections.unmodifiableSet(EnumSet.copyOf(phases));
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public ToolSchema getSchema() {
        return schema;
    }

    public ToolCapability getCapability() {
        return capability;
    }

    public Set<Phase> getPhases() {
        return phases;
    }

    public boolean isCallableIn(Phase phase) {
        return phases.contains(phase);
    }
}
