package com.zzf.koda.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventType {
    TASK("task"),
    PHASE("phase"),
    TOOL_CALL("tool_call"),
    TOOL_RESULT("tool_result"),
    SUMMARY("summary"),
    PLAN("plan"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EventType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("event type is null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EventType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
