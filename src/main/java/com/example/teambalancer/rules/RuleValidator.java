package com.example.teambalancer.rules;

import com.example.teambalancer.roster.NameNormalizer;
import com.example.teambalancer.roster.NormalizedRoster;
import com.example.teambalancer.roster.PairRule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class RuleValidator {

    private final NameNormalizer names;

    public RuleValidator(NameNormalizer names) {
        this.names = names;
    }

    /**
     * Sorts each rule into self-referential, dangling, inactive or active.
     * A rule with a blank side is skipped like an inactive one.
     */
    public RuleValidation validate(NormalizedRoster roster, List<PairRule> rules) {
        List<RuleValidation.ActivePair> active = new ArrayList<>();
        List<PairRule> self = new ArrayList<>();
        List<PairRule> dangling = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int ignored = 0;
        if (rules == null) {
            return new RuleValidation(active, self, dangling, 0);
        }
        for (PairRule rule : rules) {
            if (rule == null) {
                continue;
            }
            String a = names.normalize(rule.keyA());
            String b = names.normalize(rule.keyB());
            if (a.isEmpty() || b.isEmpty()) {
                ignored++;
                continue;
            }
            if (a.equals(b)) {
                self.add(rule);
                continue;
            }
            if (!roster.contains(a) || !roster.contains(b)) {
                dangling.add(rule);
                continue;
            }
            if (!roster.isPresent(a) || !roster.isPresent(b)) {
                ignored++;
                continue;
            }
            if (seen.add(names.pairKey(a, b))) {
                active.add(new RuleValidation.ActivePair(a, b));
            }
        }
        return new RuleValidation(List.copyOf(active), List.copyOf(self), List.copyOf(dangling), ignored);
    }
}
