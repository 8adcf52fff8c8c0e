package com.example.teambalancer.generation;

import com.example.teambalancer.roster.Category;
import com.example.teambalancer.roster.Member;
import com.example.teambalancer.roster.PairRule;
import com.example.teambalancer.roster.RawMember;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class TeamGeneratorTest {

    private final TeamGenerator generator = TeamGenerator.withDefaults();

    private static List<RawMember> members(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> RawMember.present("Member " + i, 1 + (i * 7) % 3,
                        i % 3 == 0 ? Category.A : i % 3 == 1 ? Category.B : Category.UNKNOWN))
                .toList();
    }

    private static GenerationResult.Failure assertFailure(GenerationResult result, ErrorKind kind) {
        assertThat(result.isSuccess()).isFalse();
        GenerationResult.Failure failure = (GenerationResult.Failure) result;
        assertThat(failure.errorKind()).isEqualTo(kind);
        assertThat(failure.suggestion()).isNotBlank();
        return failure;
    }

    private static GenerationResult.Success assertSuccess(GenerationResult result) {
        assertThat(result.isSuccess())
                .as("生成結果: %s", result)
                .isTrue();
        return (GenerationResult.Success) result;
    }

    private static Map<String, Integer> teamIndexByName(GenerationResult.Success success) {
        Map<String, Integer> index = new HashMap<>();
        for (int t = 0; t < success.teams().size(); t++) {
            for (Member m : success.teams().get(t)) {
                index.put(m.displayName(), t);
            }
        }
        return index;
    }

    @Test
    void generate_teamCountOfOneFailsBeforeAnyAttempt() {
        GenerationResult result = generator.generate(GenerationRequest.of(members(4), List.of(), List.of(), 1),
                new Random(1));

        GenerationResult.Failure failure = assertFailure(result, ErrorKind.TEAM_COUNT_OUT_OF_RANGE);
        assertThat(failure.attemptsUsed()).isZero();
        assertThat(failure.errorKind().getCategory()).isEqualTo(ErrorKind.Category.INPUT);
    }

    @Test
    void generate_rejectsTooManyTeams() {
        assertFailure(generator.generate(GenerationRequest.of(members(20), List.of(), List.of(), 11), new Random(1)),
                ErrorKind.TEAM_COUNT_OUT_OF_RANGE);
        assertFailure(generator.generate(GenerationRequest.of(members(3), List.of(), List.of(), 4), new Random(1)),
                ErrorKind.TEAM_COUNT_EXCEEDS_PRESENT);
    }

    @Test
    void generate_rejectsRosterWithoutPresentMembers() {
        List<RawMember> absent = List.of(RawMember.absent("Anna", 1, Category.A), RawMember.absent("Bo", 2, Category.B));

        assertFailure(generator.generate(GenerationRequest.of(absent, List.of(), List.of(), 2), new Random(1)),
                ErrorKind.EMPTY_ROSTER);
    }

    @Test
    void generate_namesDuplicatedIdentities() {
        List<RawMember> roster = List.of(
                RawMember.present("Anna", 1, Category.A),
                RawMember.present(" anna ", 2, Category.A),
                RawMember.present("Bo", 2, Category.B));

        GenerationResult.Failure failure = assertFailure(
                generator.generate(GenerationRequest.of(roster, List.of(), List.of(), 2), new Random(1)),
                ErrorKind.DUPLICATE_IDENTITY);
        assertThat(failure.message()).contains("anna");
        assertThat(failure.attemptsUsed()).isZero();
    }

    @Test
    void generate_selfReferentialRuleNeverReachesTheAttemptLoop() {
        List<RawMember> roster = List.of(
                RawMember.present("Eva", 1, Category.A),
                RawMember.present("Bo", 2, Category.B));

        GenerationResult.Failure failure = assertFailure(
                generator.generate(GenerationRequest.of(roster, List.of(PairRule.of("Eva", "Eva")), List.of(), 2),
                        new Random(1)),
                ErrorKind.SELF_REFERENTIAL_RULE);
        assertThat(failure.attemptsUsed()).isZero();
        assertThat(failure.errorKind().getCategory()).isEqualTo(ErrorKind.Category.RULE);
    }

    @Test
    void generate_rejectsRuleForUnknownMember() {
        assertFailure(generator.generate(
                        GenerationRequest.of(members(4), List.of(), List.of(PairRule.of("Member 0", "Ghost")), 2),
                        new Random(1)),
                ErrorKind.UNKNOWN_IDENTITY_RULE);
    }

    @Test
    void generate_ignoresRulesOnAbsentMembers() {
        List<RawMember> roster = new ArrayList<>(members(4));
        roster.add(RawMember.absent("Away", 2, Category.B));

        GenerationResult result = generator.generate(GenerationRequest.of(roster,
                        List.of(PairRule.of("Away", "Member 0")),
                        List.of(PairRule.of("Away", "Member 1")), 2),
                new Random(3));

        GenerationResult.Success success = assertSuccess(result);
        assertThat(success.teams().stream().flatMap(List::stream).map(Member::displayName))
                .doesNotContain("Away")
                .hasSize(4);
    }

    @Test
    void generate_reportsContradictionBetweenRuleSets() {
        GenerationResult.Failure failure = assertFailure(generator.generate(GenerationRequest.of(members(6),
                        List.of(PairRule.of("Member 0", "Member 2")),
                        List.of(PairRule.of("Member 0", "Member 1"), PairRule.of("Member 1", "Member 2")), 2),
                new Random(1)), ErrorKind.CONTRADICTORY_RULES);

        assertThat(failure.message()).contains("Member 0").contains("Member 2");
    }

    @Test
    void generate_cohesionGroupLargerThanTargetSizeFails() {
        GenerationResult result = generator.generate(GenerationRequest.of(members(4), List.of(),
                List.of(PairRule.of("Member 0", "Member 1"), PairRule.of("Member 1", "Member 2")), 2), new Random(1));

        GenerationResult.Failure failure = assertFailure(result, ErrorKind.OVERSIZED_GROUP);
        assertThat(failure.attemptsUsed()).isZero();
        assertThat(failure.errorKind().getCategory()).isEqualTo(ErrorKind.Category.STRUCTURAL);
    }

    @Test
    void generate_cohesionPairsMayForceUnevenTeamSizes() {
        List<RawMember> roster = IntStream.range(0, 8)
                .mapToObj(i -> RawMember.present("M" + i, 1 + i % 3, Category.UNKNOWN))
                .toList();
        List<PairRule> pairs = List.of(
                PairRule.of("M0", "M1"),
                PairRule.of("M2", "M3"),
                PairRule.of("M4", "M5"),
                PairRule.of("M6", "M7"));

        GenerationResult.Success success = assertSuccess(generator.generate(
                new GenerationRequest(roster, List.of(), pairs, 3, 40), new Random(17)));

        assertThat(success.teams()).extracting(List::size).containsExactlyInAnyOrder(4, 2, 2);
        assertThat(success.quality().sizeDeviation()).isEqualTo(1);
        Map<String, Integer> teamOf = teamIndexByName(success);
        for (PairRule rule : pairs) {
            assertThat(teamOf.get(rule.keyA())).as("cohesion %s", rule).isEqualTo(teamOf.get(rule.keyB()));
        }
        assertThat(success.attemptsRun()).isEqualTo(40);
    }

    @Test
    void generate_cohesionLeavingATeamEmptyFails() {
        GenerationResult result = generator.generate(GenerationRequest.of(members(4), List.of(),
                List.of(PairRule.of("Member 0", "Member 1"), PairRule.of("Member 2", "Member 3")), 3), new Random(1));

        GenerationResult.Failure failure = assertFailure(result, ErrorKind.TOO_FEW_GROUPS);
        assertThat(failure.attemptsUsed()).isZero();
        assertThat(failure.errorKind().getCategory()).isEqualTo(ErrorKind.Category.STRUCTURAL);
    }

    @Test
    void generate_levelOutsideRangeIsTypedFailure() {
        List<RawMember> roster = List.of(
                RawMember.present("Anna", 4, Category.A),
                RawMember.present("Bo", 1, Category.B),
                RawMember.present("Cleo", 0, Category.B));

        GenerationResult.Failure failure = assertFailure(
                generator.generate(GenerationRequest.of(roster, List.of(), List.of(), 2), new Random(1)),
                ErrorKind.INVALID_LEVEL);
        assertThat(failure.attemptsUsed()).isZero();
        assertThat(failure.message()).contains("Anna (4)").contains("Cleo (0)").doesNotContain("Bo");
    }

    @Test
    void generate_alwaysSeparatesExcludedPair() {
        for (long seed = 0; seed < 25; seed++) {
            GenerationResult result = generator.generate(GenerationRequest.of(members(4),
                    List.of(PairRule.of("Member 1", "Member 2")), List.of(), 2), new Random(seed));

            Map<String, Integer> teamOf = teamIndexByName(assertSuccess(result));
            assertThat(teamOf.get("Member 1")).as("seed %d", seed).isNotEqualTo(teamOf.get("Member 2"));
        }
    }

    @Test
    void generate_producesAValidPartition() {
        List<RawMember> roster = new ArrayList<>(members(17));
        roster.add(RawMember.absent("Away", 3, Category.A));
        List<PairRule> exclusions = List.of(
                PairRule.of("Member 0", "Member 3"),
                PairRule.of("Member 0", "Member 6"),
                PairRule.of("Member 4", "Member 5"),
                PairRule.of("Member 9", "Member 10"));
        List<PairRule> cohesions = List.of(
                PairRule.of("Member 1", "Member 2"),
                PairRule.of("Member 7", "Member 8"),
                PairRule.of("Member 8", "Member 11"));

        GenerationResult.Success success = assertSuccess(generator.generate(
                new GenerationRequest(roster, exclusions, cohesions, 4, 200), new Random(42)));

        assertThat(success.teams()).hasSize(4);
        List<String> placed = success.teams().stream().flatMap(List::stream).map(Member::displayName).toList();
        assertThat(placed).hasSize(17).doesNotHaveDuplicates().doesNotContain("Away");

        List<Integer> sizes = success.teams().stream().map(List::size).toList();
        assertThat(sizes.stream().mapToInt(Integer::intValue).max().orElseThrow()
                - sizes.stream().mapToInt(Integer::intValue).min().orElseThrow()).isLessThanOrEqualTo(1);

        Map<String, Integer> teamOf = teamIndexByName(success);
        for (PairRule rule : exclusions) {
            assertThat(teamOf.get(rule.keyA())).as("exclusion %s", rule).isNotEqualTo(teamOf.get(rule.keyB()));
        }
        for (PairRule rule : cohesions) {
            assertThat(teamOf.get(rule.keyA())).as("cohesion %s", rule).isEqualTo(teamOf.get(rule.keyB()));
        }
        assertThat(success.attemptsUsed()).isBetween(1, success.attemptsRun());
    }

    @Test
    void generate_splitsEachLevelAsEvenlyAsPossible() {
        List<RawMember> roster = List.of(
                RawMember.present("H1", 3, Category.UNKNOWN),
                RawMember.present("H2", 3, Category.UNKNOWN),
                RawMember.present("H3", 3, Category.UNKNOWN),
                RawMember.present("L1", 1, Category.UNKNOWN),
                RawMember.present("L2", 1, Category.UNKNOWN),
                RawMember.present("L3", 1, Category.UNKNOWN));

        GenerationResult.Success success = assertSuccess(generator.generate(
                new GenerationRequest(roster, List.of(), List.of(), 2, 50), new Random(5)));

        assertThat(success.quality().levelCountGap()).isZero();
        for (List<Member> team : success.teams()) {
            long high = team.stream().filter(m -> m.level() == 3).count();
            assertThat(high).isBetween(1L, 2L);
        }
    }

    @Test
    void generate_sameSeedGivesSameTeams() {
        GenerationRequest request = new GenerationRequest(members(12),
                List.of(PairRule.of("Member 0", "Member 5")), List.of(PairRule.of("Member 2", "Member 3")), 3, 100);

        GenerationResult first = generator.generate(request, new Random(2024));
        GenerationResult second = generator.generate(request, new Random(2024));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void generate_exhaustsAttemptsWhenNoSplitExists() {
        List<RawMember> roster = members(3);
        List<PairRule> allApart = List.of(
                PairRule.of("Member 0", "Member 1"),
                PairRule.of("Member 1", "Member 2"),
                PairRule.of("Member 0", "Member 2"));

        GenerationResult result = generator.generate(new GenerationRequest(roster, allApart, List.of(), 2, 25),
                new Random(9));

        GenerationResult.Failure failure = assertFailure(result, ErrorKind.NO_FEASIBLE_ALLOCATION);
        assertThat(failure.attemptsUsed()).isEqualTo(25);
    }

    @Test
    void generate_stopsAtFirstPerfectSplit() {
        List<RawMember> roster = List.of(
                RawMember.present("A1", 2, Category.A),
                RawMember.present("A2", 2, Category.A),
                RawMember.present("A3", 2, Category.A),
                RawMember.present("A4", 2, Category.A));

        GenerationResult.Success success = assertSuccess(generator.generate(
                new GenerationRequest(roster, List.of(), List.of(), 2, 500), new Random(11)));

        assertThat(success.quality().isPerfect()).isTrue();
        assertThat(success.attemptsUsed()).isEqualTo(1);
        assertThat(success.attemptsRun()).isEqualTo(1);
    }

    @Test
    void generate_cancellationBeforeFirstAttemptFails() {
        GenerationResult result = generator.generate(GenerationRequest.of(members(6), List.of(), List.of(), 2),
                new Random(1), () -> true);

        GenerationResult.Failure failure = assertFailure(result, ErrorKind.CANCELLED);
        assertThat(failure.attemptsUsed()).isZero();
    }

    @Test
    void generate_cancellationKeepsBestFoundSoFar() {
        AtomicInteger checks = new AtomicInteger();
        GenerationResult result = generator.generate(GenerationRequest.of(members(9), List.of(), List.of(), 3),
                new Random(1), () -> checks.incrementAndGet() > 1);

        GenerationResult.Success success = assertSuccess(result);
        assertThat(success.attemptsRun()).isEqualTo(1);
        assertThat(success.attemptsUsed()).isEqualTo(1);
        assertThat(success.teams().stream().mapToInt(List::size).sum()).isEqualTo(9);
    }

    @Test
    void generate_balancesCategoriesWhenLevelsAreEqual() {
        List<RawMember> roster = IntStream.range(0, 8)
                .mapToObj(i -> RawMember.present("P" + i, 2, i < 4 ? Category.A : Category.B))
                .toList();

        GenerationResult.Success success = assertSuccess(generator.generate(
                new GenerationRequest(roster, List.of(), List.of(), 2, 200), new Random(8)));

        for (List<Member> team : success.teams()) {
            Map<Category, Long> counts = team.stream()
                    .collect(Collectors.groupingBy(Member::category, Collectors.counting()));
            assertThat(counts).containsEntry(Category.A, 2L).containsEntry(Category.B, 2L);
        }
    }
}
