package com.example.teambalancer.roster;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a pasted roster, one member per line. A bare name gets the default
 * level, an unknown category and is marked present; the long form is
 * {@code name;level;category;present}, where trailing fields may be omitted.
 */
public class RosterTextParser {

    public static final int DEFAULT_LEVEL = 2;

    private final NameNormalizer names;

    public RosterTextParser(NameNormalizer names) {
        this.names = names;
    }

    public List<String> parseNameLines(String text) {
        List<String> result = new ArrayList<>();
        if (text == null) {
            return result;
        }
        for (String line : text.split("\\r?\\n")) {
            String cleaned = names.clean(line);
            if (!cleaned.isEmpty()) {
                result.add(cleaned);
            }
        }
        return result;
    }

    public List<RawMember> parse(String text) {
        List<RawMember> result = new ArrayList<>();
        if (text == null) {
            return result;
        }
        String[] lines = text.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = names.clean(lines[i]);
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split(";", -1);
            String name = names.clean(parts[0]);
            if (name.isEmpty()) {
                continue;
            }
            int level = parts.length > 1 ? parseLevel(parts[1], lineNo) : DEFAULT_LEVEL;
            Category category = parts.length > 2 ? Category.parse(parts[2]) : Category.UNKNOWN;
            boolean present = parts.length <= 3 || parsePresent(parts[3]);
            result.add(new RawMember(name, level, category, present));
        }
        return result;
    }

    private int parseLevel(String value, int lineNo) {
        String v = value.trim();
        if (v.isEmpty()) {
            return DEFAULT_LEVEL;
        }
        try {
            int level = Integer.parseInt(v);
            if (level < Member.MIN_LEVEL || level > Member.MAX_LEVEL) {
                throw new IllegalArgumentException("line " + lineNo + ": level must be between "
                        + Member.MIN_LEVEL + " and " + Member.MAX_LEVEL);
            }
            return level;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("line " + lineNo + ": level is not a number: " + v, e);
        }
    }

    private boolean parsePresent(String value) {
        String v = value.trim().toLowerCase(java.util.Locale.ROOT);
        return !(v.equals("false") || v.equals("no") || v.equals("0") || v.equals("absent"));
    }
}
