package com.example.teambalancer.roster;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deduplicated roster snapshot, keyed by identity key in input order.
 */
public class NormalizedRoster {

    private final Map<String, Member> byKey;
    private final List<Member> present;

    public NormalizedRoster(List<Member> members) {
        Map<String, Member> map = new LinkedHashMap<>();
        for (Member m : members) {
            if (map.putIfAbsent(m.identityKey(), m) != null) {
                throw new IllegalArgumentException("duplicate identity key: " + m.identityKey());
            }
        }
        this.byKey = Collections.unmodifiableMap(map);
        this.present = map.values().stream().filter(Member::present).toList();
    }

    public List<Member> members() {
        return List.copyOf(byKey.values());
    }

    public List<Member> presentMembers() {
        return present;
    }

    public Set<String> presentKeys() {
        Set<String> keys = new LinkedHashSet<>();
        present.forEach(m -> keys.add(m.identityKey()));
        return keys;
    }

    public boolean contains(String key) {
        return byKey.containsKey(key);
    }

    public boolean isPresent(String key) {
        Member m = byKey.get(key);
        return m != null && m.present();
    }

    public Member get(String key) {
        return byKey.get(key);
    }

    public String displayName(String key) {
        Member m = byKey.get(key);
        return m == null ? key : m.displayName();
    }

    public int size() {
        return byKey.size();
    }
}
