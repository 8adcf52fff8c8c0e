package com.example.teambalancer.rules;

import com.example.teambalancer.exception.TeamGenerationException;
import com.example.teambalancer.generation.ErrorKind;
import com.example.teambalancer.roster.NormalizedRoster;
import com.example.teambalancer.roster.PairRule;

import java.util.ArrayList;
import java.util.List;

public class ConstraintGraphBuilder {

    private final RuleValidator validator;

    public ConstraintGraphBuilder(RuleValidator validator) {
        this.validator = validator;
    }

    /**
     * Validates both rule lists and builds the exclusion and cohesion graphs over
     * present members. Self-referential rules are reported before dangling ones.
     */
    public ConstraintGraphs build(NormalizedRoster roster, List<PairRule> exclusionRules, List<PairRule> cohesionRules) {
        RuleValidation exclusion = validator.validate(roster, exclusionRules);
        RuleValidation cohesion = validator.validate(roster, cohesionRules);

        List<PairRule> self = new ArrayList<>(exclusion.selfReferential());
        self.addAll(cohesion.selfReferential());
        if (!self.isEmpty()) {
            throw new TeamGenerationException(ErrorKind.SELF_REFERENTIAL_RULE, describe(self));
        }
        List<PairRule> dangling = new ArrayList<>(exclusion.dangling());
        dangling.addAll(cohesion.dangling());
        if (!dangling.isEmpty()) {
            throw new TeamGenerationException(ErrorKind.UNKNOWN_IDENTITY_RULE, describe(dangling));
        }

        return new ConstraintGraphs(toGraph(roster, exclusion), toGraph(roster, cohesion));
    }

    private ConstraintGraph toGraph(NormalizedRoster roster, RuleValidation validation) {
        ConstraintGraph graph = new ConstraintGraph(roster.presentKeys());
        for (RuleValidation.ActivePair pair : validation.activePairs()) {
            graph.connect(pair.a(), pair.b());
        }
        return graph;
    }

    private List<String> describe(List<PairRule> rules) {
        return rules.stream()
                .map(r -> r.keyA() + " / " + r.keyB())
                .toList();
    }
}
