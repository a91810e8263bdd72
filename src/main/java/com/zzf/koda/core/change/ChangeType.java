package com.zzf.koda.core.change;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChangeType {
    CREATE,
    MODIFY,
    DELETE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
