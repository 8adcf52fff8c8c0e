package com.example.teambalancer.roster;

import java.util.Locale;

/**
 * Canonicalizes identity keys: trim, then case-fold with the configured locale.
 */
public class NameNormalizer {

    public static final String PAIR_SEPARATOR = "||";

    private final Locale locale;

    public NameNormalizer(Locale locale) {
        this.locale = locale == null ? Locale.ROOT : locale;
    }

    public static NameNormalizer defaultNormalizer() {
        return new NameNormalizer(Locale.forLanguageTag("sv-SE"));
    }

    public String clean(String value) {
        return value == null ? "" : value.trim();
    }

    public String normalize(String value) {
        return clean(value).toLowerCase(locale);
    }

    /**
     * Order-independent key for a pair of names, used for rule dedup and lookup.
     */
    public String pairKey(String a, String b) {
        String first = normalize(a);
        String second = normalize(b);
        return first.compareTo(second) < 0
                ? first + PAIR_SEPARATOR + second
                : second + PAIR_SEPARATOR + first;
    }
}
