package com.example.teambalancer.roster;

/**
 * Unordered pair of identities. Whether the pair must be kept apart or kept
 * together depends on which rule list it was supplied in.
 */
public record PairRule(String keyA, String keyB) {

    public static PairRule of(String a, String b) {
        return new PairRule(a, b);
    }
}
