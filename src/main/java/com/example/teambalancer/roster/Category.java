package com.example.teambalancer.roster;

import java.util.Locale;

/**
 * Balancing attribute carried by every member. Only {@link #A} and {@link #B}
 * are balanced across teams; {@link #UNKNOWN} members are placed by skill only.
 */
public enum Category {
    A,
    B,
    UNKNOWN;

    public boolean isBalanced() {
        return this != UNKNOWN;
    }

    public static Category parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (Category c : values()) {
            if (c.name().equals(v)) {
                return c;
            }
        }
        return UNKNOWN;
    }
}
