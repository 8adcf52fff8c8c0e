package com.example.teambalancer.rules;

import com.example.teambalancer.roster.PairRule;

import java.util.List;

/**
 * Classification of one rule list against a roster snapshot. Active pairs are
 * normalized keys, deduplicated by canonical pair key; inactive rules only
 * count toward {@code ignoredCount}.
 */
public record RuleValidation(List<ActivePair> activePairs,
                             List<PairRule> selfReferential,
                             List<PairRule> dangling,
                             int ignoredCount) {

    boolean isValid() {
        return selfReferential.isEmpty() && dangling.isEmpty();
    }

    public record ActivePair(String a, String b) { }
}
