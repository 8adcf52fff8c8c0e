package com.example.teambalancer.allocation;

import com.example.teambalancer.grouping.AtomicGroup;
import com.example.teambalancer.roster.Member;

import java.util.ArrayList;
import java.util.List;

/**
 * Complete assignment of every atomic group to one team.
 */
public class Allocation {

    private final List<TeamState> teams;

    public Allocation(List<TeamState> teams) {
        this.teams = teams;
    }

    public Allocation copy() {
        List<TeamState> c = new ArrayList<>(teams.size());
        teams.forEach(t -> c.add(t.copy()));
        return new Allocation(c);
    }

    public List<TeamState> teams() {
        return teams;
    }

    public TeamState team(int index) {
        return teams.get(index);
    }

    public List<TeamTally> tallies() {
        return teams.stream().map(TeamState::tally).toList();
    }

    public void relocate(AtomicGroup group, int from, int to) {
        teams.get(from).remove(group);
        teams.get(to).add(group);
    }

    public void swap(AtomicGroup a, int teamOfA, AtomicGroup b, int teamOfB) {
        teams.get(teamOfA).remove(a);
        teams.get(teamOfB).remove(b);
        teams.get(teamOfA).add(b);
        teams.get(teamOfB).add(a);
    }

    public List<List<Member>> toMemberLists() {
        return teams.stream().map(TeamState::members).toList();
    }
}
