package com.example.teambalancer.export;

import com.example.teambalancer.roster.Category;
import com.example.teambalancer.roster.Member;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Plain-text rendering of generated teams for copy and .txt download.
 */
@Component
public class TeamTextExporter {

    public String format(List<List<Member>> teams) {
        return IntStream.range(0, teams.size())
                .mapToObj(i -> formatTeam(i, teams.get(i)))
                .collect(Collectors.joining("\n\n"));
    }

    private String formatTeam(int index, List<Member> team) {
        String members = team.stream()
                .map(m -> "- " + m.displayName() + " (レベル " + m.level() + ", " + m.category() + ")")
                .collect(Collectors.joining("\n"));
        return teamLabel(index) + "\n" + members;
    }

    public String summarize(List<Member> team) {
        int skill = team.stream().mapToInt(Member::level).sum();
        long a = team.stream().filter(m -> m.category() == Category.A).count();
        long b = team.stream().filter(m -> m.category() == Category.B).count();
        return "スキル合計: " + skill + " • A: " + a + " • B: " + b;
    }

    public static String teamLabel(int index) {
        return "チーム " + (index + 1);
    }
}
