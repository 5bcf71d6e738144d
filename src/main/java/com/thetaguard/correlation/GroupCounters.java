package com.thetaguard.correlation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-group active positions: group id -> (position id -> symbol), in admission order.
 * Unmapped symbols go to {@link #UNMAPPED} so the buckets always add up to every tracked position.
 *
 * <p>Not thread-safe. The controller guards its live instance with its lock; stress tests work on
 * private instances.
 */
class GroupCounters {

    static final String UNMAPPED = "UNMAPPED";

    private final Map<String, LinkedHashMap<String, String>> byGroup = new TreeMap<>();
    private final Map<String, String> groupOfPosition = new LinkedHashMap<>();

    boolean contains(String positionId) {
        return groupOfPosition.containsKey(positionId);
    }

    void add(String groupId, String positionId, String symbol) {
        byGroup.computeIfAbsent(groupId, g -> new LinkedHashMap<>()).put(positionId, symbol);
        groupOfPosition.put(positionId, groupId);
    }

    /** @return the group the position was counted in, or null when it was not tracked */
    String remove(String positionId) {
        String groupId = groupOfPosition.remove(positionId);
        if (groupId == null) {
            return null;
        }
        Map<String, String> members = byGroup.get(groupId);
        members.remove(positionId);
        if (members.isEmpty()) {
            byGroup.remove(groupId);
        }
        return groupId;
    }

    int count(String groupId) {
        Map<String, String> members = byGroup.get(groupId);
        return members != null ? members.size() : 0;
    }

    int countAll(Set<String> groupIds) {
        return groupIds.stream().mapToInt(this::count).sum();
    }

    /** Positions counted in real groups, excluding the UNMAPPED bucket. */
    int mappedTotal() {
        return total() - count(UNMAPPED);
    }

    int total() {
        return groupOfPosition.size();
    }

    /** Real groups with at least one position. */
    List<String> groupsInUse() {
        List<String> groups = new ArrayList<>(byGroup.keySet());
        groups.remove(UNMAPPED);
        return groups;
    }

    Map<String, String> members(String groupId) {
        Map<String, String> members = byGroup.get(groupId);
        return members != null ? Map.copyOf(members) : Map.of();
    }

    void clear() {
        byGroup.clear();
        groupOfPosition.clear();
    }

    /** Snapshot form: group id -> entries in admission order. */
    Map<String, List<CorrelationSnapshot.Entry>> export() {
        Map<String, List<CorrelationSnapshot.Entry>> exported = new TreeMap<>();
        byGroup.forEach((groupId, members) -> {
            List<CorrelationSnapshot.Entry> entries = new ArrayList<>();
            members.forEach((positionId, symbol) -> entries.add(new CorrelationSnapshot.Entry(positionId, symbol)));
            exported.put(groupId, entries);
        });
        return exported;
    }
}
