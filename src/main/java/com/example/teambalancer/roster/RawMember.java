package com.example.teambalancer.roster;

/**
 * Caller-supplied roster entry before normalization.
 */
public record RawMember(String name, int level, Category category, boolean present) {

    public static RawMember present(String name, int level, Category category) {
        return new RawMember(name, level, category, true);
    }

    public static RawMember absent(String name, int level, Category category) {
        return new RawMember(name, level, category, false);
    }
}
