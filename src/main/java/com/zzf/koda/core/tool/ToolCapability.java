package com.zzf.koda.core.tool;

import com.fasterxml.jackson.annotation.JsonValue;
import com.zzf.koda.core.agent.Phase;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum ToolCapability {
    READ(EnumSet.of(Phase.UNDERSTANDING, Phase.PLANNING, Phase.EXECUTING)),
    WRITE(EnumSet.of(Phase.EXECUTING)),
    EXEC(EnumSet.of(Phase.EXECUTING));

    private final Set<Phase> defaultPhases;

    ToolCapability(Set<Phase> defaultPhases) {
        this.defaultPhases = Collections.unmodifiableSet(defaultPhases);
    }

    public Set<Phase> defaultPhases() {
        return defaultPhases;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
