package com.zzf.koda.core.symbol;

import java.util.Locale;

public enum SymbolKind {
    CLASS,
    INTERFACE,
    ENUM,
    METHOD,
    CONSTRUCTOR,
    FUNCTION,
    IMPORT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the kind, or null for an unknown name
     */
    public static SymbolKind fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (SymbolKind kind : values()) {
            if (kind.wireName().equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        return null;
    }
}
