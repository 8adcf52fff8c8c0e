package com.example.teambalancer.export;

import com.example.teambalancer.roster.Member;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.StringJoiner;

@Component
public class TeamCsvExporter {

    private static final String[] HEADERS = {"チーム", "メンバー名", "レベル", "区分"};

    public CsvFile export(List<List<Member>> teams, String filename) {
        StringBuilder builder = new StringBuilder();
        builder.append('\uFEFF');
        builder.append(String.join(",", HEADERS)).append('\n');
        for (int i = 0; i < teams.size(); i++) {
            for (Member member : teams.get(i)) {
                appendRow(builder, i, member);
            }
        }
        byte[] data = builder.toString().getBytes(StandardCharsets.UTF_8);
        return new CsvFile(filename == null || filename.isBlank() ? "teams.csv" : filename, data);
    }

    private void appendRow(StringBuilder builder, int teamIndex, Member member) {
        StringJoiner joiner = new StringJoiner(",");
        joiner.add(escapeCsv(TeamTextExporter.teamLabel(teamIndex)));
        joiner.add(escapeCsv(member.displayName()));
        joiner.add(escapeCsv(Integer.toString(member.level())));
        joiner.add(escapeCsv(member.category().name()));
        builder.append(joiner).append('\n');
    }

    private String escapeCsv(String value) {
        String target = value == null ? "" : value;
        if (target.contains(",") || target.contains("\"") || target.contains("\n")) {
            return "\"" + target.replace("\"", "\"\"") + "\"";
        }
        return target;
    }

    public record CsvFile(String filename, byte[] data) { }
}
