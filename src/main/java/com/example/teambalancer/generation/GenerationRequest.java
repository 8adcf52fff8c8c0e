package com.example.teambalancer.generation;

import com.example.teambalancer.roster.PairRule;
import com.example.teambalancer.roster.RawMember;

import java.util.List;

public record GenerationRequest(List<RawMember> members,
                                List<PairRule> exclusionRules,
                                List<PairRule> cohesionRules,
                                int teamCount,
                                int maxAttempts) {

    public static final int DEFAULT_MAX_ATTEMPTS = 2000;

    public GenerationRequest {
        members = members == null ? List.of() : List.copyOf(members);
        exclusionRules = exclusionRules == null ? List.of() : List.copyOf(exclusionRules);
        cohesionRules = cohesionRules == null ? List.of() : List.copyOf(cohesionRules);
    }

    public static GenerationRequest of(List<RawMember> members, List<PairRule> exclusionRules,
                                       List<PairRule> cohesionRules, int teamCount) {
        return new GenerationRequest(members, exclusionRules, cohesionRules, teamCount, DEFAULT_MAX_ATTEMPTS);
    }
}
