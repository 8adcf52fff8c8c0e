package com.example.teambalancer.grouping;

import com.example.teambalancer.roster.Category;
import com.example.teambalancer.roster.Member;

import java.util.List;

/**
 * Members forced into the same team by cohesion rules. The allocator only ever
 * moves whole groups; a member without cohesion rules forms a group of one.
 */
public final class AtomicGroup {

    private final int id;
    private final List<Member> members;
    private final int skillSum;
    private final int[] levelCounts = new int[Member.MAX_LEVEL + 1];
    private final int[] categoryCounts = new int[Category.values().length];

    public AtomicGroup(int id, List<Member> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("atomic group must not be empty");
        }
        this.id = id;
        this.members = List.copyOf(members);
        int skill = 0;
        for (Member m : members) {
            skill += m.level();
            levelCounts[m.level()]++;
            categoryCounts[m.category().ordinal()]++;
        }
        this.skillSum = skill;
    }

    public int id() {
        return id;
    }

    public List<Member> members() {
        return members;
    }

    public List<String> memberKeys() {
        return members.stream().map(Member::identityKey).toList();
    }

    public int size() {
        return members.size();
    }

    public int skillSum() {
        return skillSum;
    }

    public int levelCount(int level) {
        return levelCounts[level];
    }

    public int categoryCount(Category category) {
        return categoryCounts[category.ordinal()];
    }

    @Override
    public String toString() {
        return "AtomicGroup{id=" + id + ", members=" + memberKeys() + "}";
    }
}
