package com.example.teambalancer.roster;

import java.util.Objects;

/**
 * A rostered individual. {@code identityKey} is the normalized form of the
 * display name and is unique within one roster snapshot.
 */
public record Member(String identityKey, String displayName, int level, Category category, boolean present) {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 3;

    public Member {
        Objects.requireNonNull(identityKey, "identityKey");
        Objects.requireNonNull(displayName, "displayName");
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("level must be between " + MIN_LEVEL + " and " + MAX_LEVEL + ": " + level);
        }
        category = category == null ? Category.UNKNOWN : category;
    }
}
