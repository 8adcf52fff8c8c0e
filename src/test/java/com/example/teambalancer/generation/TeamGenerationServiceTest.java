package com.example.teambalancer.generation;

import com.example.teambalancer.roster.Category;
import com.example.teambalancer.roster.PairRule;
import com.example.teambalancer.roster.RawMember;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class TeamGenerationServiceTest {

    @Autowired
    private TeamGenerationService service;

    private final GenerationRequest request = GenerationRequest.of(
            IntStream.range(0, 10)
                    .mapToObj(i -> RawMember.present("Spelare " + i, 1 + i % 3, i % 2 == 0 ? Category.A : Category.B))
                    .toList(),
            List.of(PairRule.of("Spelare 0", "Spelare 1")),
            List.of(PairRule.of("Spelare 2", "Spelare 3")),
            2);

    @Test
    void generate_withSeedIsReproducible() {
        GenerationResult first = service.generate(request, 50, 99L);
        GenerationResult second = service.generate(request, 50, 99L);

        assertThat(first.isSuccess()).isTrue();
        assertThat(first).isEqualTo(second);
    }

    @Test
    void generate_respectsAttemptOverride() {
        List<RawMember> three = List.of(
                RawMember.present("A", 1, Category.A),
                RawMember.present("B", 1, Category.A),
                RawMember.present("C", 1, Category.A));
        GenerationRequest impossible = GenerationRequest.of(three,
                List.of(PairRule.of("A", "B"), PairRule.of("B", "C"), PairRule.of("A", "C")), List.of(), 2);

        GenerationResult result = service.generate(impossible, 7, 1L);

        assertThat(result.isSuccess()).isFalse();
        assertThat(((GenerationResult.Failure) result).errorKind()).isEqualTo(ErrorKind.NO_FEASIBLE_ALLOCATION);
        assertThat(result.attemptsUsed()).isEqualTo(7);
    }

    @Test
    void generate_fallsBackToConfiguredAttemptBudget() {
        List<RawMember> three = List.of(
                RawMember.present("A", 1, Category.A),
                RawMember.present("B", 1, Category.A),
                RawMember.present("C", 1, Category.A));
        GenerationRequest impossible = GenerationRequest.of(three,
                List.of(PairRule.of("A", "B"), PairRule.of("B", "C"), PairRule.of("A", "C")), List.of(), 2);

        // test profile sets teams.generation.max-attempts=300
        assertThat(service.generate(impossible, null, 1L).attemptsUsed()).isEqualTo(300);
    }
}
