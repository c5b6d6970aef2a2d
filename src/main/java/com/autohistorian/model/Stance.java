package com.autohistorian.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Stance {
    PRO("pro"),
    CON("con"),
    NEUTRAL("neutral");

    private final String wire;

    Stance(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** Lenient lookup; anything other than pro/con/neutral is treated as unset. */
    @JsonCreator
    public static Stance fromText(String text) {
        if (text == null) return null;
        String t = text.trim().toLowerCase(Locale.ROOT);
        for (Stance s : values()) {
            if (s.wire.equals(t)) return s;
        }
        return null;
    }
}
