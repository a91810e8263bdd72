package com.zzf.koda.core.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Orchestrator states. Transitions only move forward along
 * {@code idle -> cloning? -> understanding -> planning -> executing -> awaiting_approval -> complete};
 * {@link #ERROR} is reachable from every non-terminal state.
 */
public enum Phase {
    IDLE("idle"),
    CLONING("cloning"),
    UNDERSTANDING("understanding"),
    PLANNING("planning"),
    EXECUTING("executing"),
    AWAITING_APPROVAL("awaiting_approval"),
    COMPLETE("complete"),
    ERROR("error");

    private static final Map<Phase, EnumSet<Phase>> NEXT = new EnumMap<>(Phase.class);

    static {
        NEXT.put(IDLE, EnumSet.of(CLONING, UNDERSTANDING));
        NEXT.put(CLONING, EnumSet.of(UNDERSTANDING));
        NEXT.put(UNDERSTANDING, EnumSet.of(PLANNING));
        NEXT.put(PLANNING, EnumSet.of(EXECUTING));
        NEXT.put(EXECUTING, EnumSet.of(AWAITING_APPROVAL, COMPLETE));
        NEXT.put(AWAITING_APPROVAL, EnumSet.of(COMPLETE));
        NEXT.put(COMPLETE, EnumSet.noneOf(Phase.class));
        NEXT.put(ERROR, EnumSet.noneOf(Phase.class));
    }

    private final String wireName;

    Phase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Phase fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("phase is null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Phase phase : values()) {
            if (phase.wireName.equals(normalized)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    public boolean canTransitionTo(Phase next) {
        if (next == null) {
            return false;
        }
        if (next == ERROR) {
            return !isTerminal();
        }
        return NEXT.get(this).contains(next);
    }

    public Set<Phase> successors() {
        EnumSet<Phase> out = EnumSet.copyOf(NEXT.get(this));
        if (!isTerminal()) {
            out.add(ERROR);
        }
        return Collections.unmodifiableSet(out);
    }
}
