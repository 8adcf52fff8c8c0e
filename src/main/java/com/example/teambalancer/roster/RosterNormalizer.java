package com.example.teambalancer.roster;

import com.example.teambalancer.exception.TeamGenerationException;
import com.example.teambalancer.generation.ErrorKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class RosterNormalizer {

    private final NameNormalizer names;

    public RosterNormalizer(NameNormalizer names) {
        this.names = names;
    }

    /**
     * Builds the roster snapshot. Entries with a blank name are dropped. A level
     * outside {@value Member#MIN_LEVEL}..{@value Member#MAX_LEVEL} fails the call
     * with {@link ErrorKind#INVALID_LEVEL}; two entries that normalize to the
     * same key fail it with {@link ErrorKind#DUPLICATE_IDENTITY} naming the
     * collided names.
     */
    public NormalizedRoster normalize(List<RawMember> raw) {
        List<String> invalidLevels = invalidLevels(raw);
        if (!invalidLevels.isEmpty()) {
            throw new TeamGenerationException(ErrorKind.INVALID_LEVEL, invalidLevels);
        }
        DedupeResult<Member> result = dedupeMembers(raw);
        if (!result.duplicates().isEmpty()) {
            throw new TeamGenerationException(ErrorKind.DUPLICATE_IDENTITY, result.duplicates());
        }
        return new NormalizedRoster(result.unique());
    }

    private List<String> invalidLevels(List<RawMember> raw) {
        List<String> invalid = new ArrayList<>();
        if (raw == null) {
            return invalid;
        }
        for (RawMember entry : raw) {
            if (entry == null || names.clean(entry.name()).isEmpty()) {
                continue;
            }
            if (entry.level() < Member.MIN_LEVEL || entry.level() > Member.MAX_LEVEL) {
                invalid.add(names.clean(entry.name()) + " (" + entry.level() + ")");
            }
        }
        return invalid;
    }

    public DedupeResult<Member> dedupeMembers(List<RawMember> raw) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        List<Member> unique = new ArrayList<>();
        if (raw == null) {
            return new DedupeResult<>(unique, List.of());
        }
        for (RawMember entry : raw) {
            if (entry == null) {
                continue;
            }
            String cleaned = names.clean(entry.name());
            if (cleaned.isEmpty()) {
                continue;
            }
            String key = names.normalize(cleaned);
            if (!seen.add(key)) {
                duplicates.add(cleaned);
                continue;
            }
            unique.add(new Member(key, cleaned, entry.level(), entry.category(), entry.present()));
        }
        return new DedupeResult<>(unique, List.copyOf(duplicates));
    }

    /**
     * Name-only variant for a pasted list of names.
     */
    public DedupeResult<String> dedupeNames(List<String> raw) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        List<String> unique = new ArrayList<>();
        for (String name : raw) {
            String cleaned = names.clean(name);
            if (cleaned.isEmpty()) {
                continue;
            }
            if (!seen.add(names.normalize(cleaned))) {
                duplicates.add(cleaned);
                continue;
            }
            unique.add(cleaned);
        }
        return new DedupeResult<>(unique, List.copyOf(duplicates));
    }

    public NameNormalizer names() {
        return names;
    }

    public record DedupeResult<T>(List<T> unique, List<String> duplicates) { }
}
