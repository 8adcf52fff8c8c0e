package com.example.teambalancer.generation;

import com.example.teambalancer.roster.Category;
import com.example.teambalancer.roster.PairRule;
import com.example.teambalancer.roster.RawMember;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * JSON payload of {@code POST /api/teams/generate}. Team count bounds are left to
 * the generator so they come back as a typed failure.
 */
public record TeamGenerationRequest(
        @NotNull(message = "メンバー一覧は必須です") List<@Valid MemberPayload> members,
        List<@Valid RulePayload> exclusionRules,
        List<@Valid RulePayload> cohesionRules,
        @NotNull(message = "チーム数は必須です") Integer teamCount,
        @Min(value = 1, message = "試行回数は1以上である必要があります") Integer maxAttempts,
        Long seed) {

    public GenerationRequest toGenerationRequest() {
        List<RawMember> raw = members.stream()
                .filter(Objects::nonNull)
                .map(MemberPayload::toRawMember)
                .toList();
        return new GenerationRequest(raw, toRules(exclusionRules), toRules(cohesionRules), teamCount,
                maxAttempts == null ? GenerationRequest.DEFAULT_MAX_ATTEMPTS : maxAttempts);
    }

    private static List<PairRule> toRules(List<RulePayload> rules) {
        return rules == null ? List.of() : rules.stream().map(r -> PairRule.of(r.a(), r.b())).toList();
    }

    public record MemberPayload(
            @NotBlank(message = "メンバー名は必須です") String name,
            @NotNull(message = "レベルは必須です")
            @Min(value = 1, message = "レベルは1以上である必要があります")
            @Max(value = 3, message = "レベルは3以下である必要があります") Integer level,
            String category,
            Boolean present) {

        public RawMember toRawMember() {
            return new RawMember(name, level, Category.parse(category), present == null || present);
        }
    }

    public record RulePayload(String a, String b) { }
}
