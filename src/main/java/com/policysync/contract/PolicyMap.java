package com.policysync.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable mapping from policy name to {@link PolicyEntry}.
 *
 * Instances are never modified in place. Holders replace their reference with
 * a freshly built map, so readers always see either the old or the new snapshot.
 */
public final class PolicyMap {

    private static final PolicyMap EMPTY = new PolicyMap(new TreeMap<>());

    private final Map<String, PolicyEntry> entries;

    private PolicyMap(TreeMap<String, PolicyEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static PolicyMap empty() {
        return EMPTY;
    }

    @JsonCreator
    public static PolicyMap of(Map<String, PolicyEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, PolicyEntry> copy = new TreeMap<>();
        entries.forEach((name, entry) -> copy.put(
            Objects.requireNonNull(name, "policy name cannot be null"),
            Objects.requireNonNull(entry, "policy entry cannot be null for " + name)));
        return new PolicyMap(copy);
    }

    public Optional<PolicyEntry> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public Optional<Object> getValue(String name) {
        return get(name).map(PolicyEntry::value);
    }

    public boolean containsKey(String name) {
        return entries.containsKey(name);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Set<String> keySet() {
        return entries.keySet();
    }

    @JsonValue
    public Map<String, PolicyEntry> asMap() {
        return entries;
    }

    /**
     * Returns a map holding every entry of this map plus the entries of
     * {@code other} whose keys are not present here. Entries already in the
     * receiver always win, which is what gives earlier sources precedence.
     */
    public PolicyMap mergeFrom(PolicyMap other) {
        if (other.isEmpty()) {
            return this;
        }
        TreeMap<String, PolicyEntry> merged = new TreeMap<>(entries);
        other.entries.forEach(merged::putIfAbsent);
        return new PolicyMap(merged);
    }

    /** Keeps only the entries at {@code level}. */
    public PolicyMap filterLevel(PolicyLevel level) {
        TreeMap<String, PolicyEntry> filtered = new TreeMap<>();
        entries.forEach((name, entry) -> {
            if (entry.level() == level) {
                filtered.put(name, entry);
            }
        });
        return filtered.size() == entries.size() ? this : new PolicyMap(filtered);
    }

    /** Names of policies that are added, removed or changed between the two maps, sorted. */
    public List<String> differingKeys(PolicyMap other) {
        Set<String> keys = new TreeSet<>(entries.keySet());
        keys.addAll(other.entries.keySet());
        List<String> differing = new ArrayList<>();
        for (String key : keys) {
            if (!Objects.equals(entries.get(key), other.entries.get(key))) {
                differing.add(key);
            }
        }
        return differing;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PolicyMap other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "PolicyMap" + entries;
    }
}
