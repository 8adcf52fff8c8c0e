package com.example.teambalancer.generation;

import com.example.teambalancer.export.TeamTextExporter;
import com.example.teambalancer.roster.Member;

import java.util.ArrayList;
import java.util.List;

public record TeamsView(List<TeamView> teams) {

    public static TeamsView from(List<List<Member>> teams, TeamTextExporter textExporter) {
        List<TeamView> views = new ArrayList<>(teams.size());
        for (int i = 0; i < teams.size(); i++) {
            List<Member> team = teams.get(i);
            views.add(new TeamView(i + 1, TeamTextExporter.teamLabel(i), textExporter.summarize(team),
                    team.stream().map(MemberView::from).toList()));
        }
        return new TeamsView(views);
    }

    public record TeamView(int number, String label, String summary, List<MemberView> members) { }

    public record MemberView(String name, int level, String category) {
        static MemberView from(Member member) {
            return new MemberView(member.displayName(), member.level(), member.category().name());
        }
    }
}
