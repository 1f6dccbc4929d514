package com.causal.summary.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable node identity in a causal DAG: an ordered, non-empty sequence of
 * atomic variable identifiers.
 *
 * An atomic node is a cluster of size one. Merging two clusters produces a new
 * cluster whose members are the first operand's members followed by the
 * second's. Two clusters are equal only if their member sequences are equal.
 */
public final class Cluster {

    private final List<String> members;

    private Cluster(List<String> members) {
        Objects.requireNonNull(members, "members is required");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least one member");
        }
        for (String member : members) {
            Objects.requireNonNull(member, "member identifier is required");
            if (member.isBlank()) {
                throw new IllegalArgumentException("Member identifier must not be blank");
            }
        }
        this.members = List.copyOf(members);
    }

    /**
     * Creates an atomic cluster for a single variable.
     */
    public static Cluster of(String identifier) {
        return new Cluster(List.of(identifier));
    }

    /**
     * Creates a cluster from an ordered member list.
     */
    public static Cluster of(List<String> members) {
        return new Cluster(members);
    }

    /**
     * Returns a new cluster holding this cluster's members followed by {@code other}'s.
     */
    public Cluster concat(Cluster other) {
        Objects.requireNonNull(other, "other is required");
        List<String> combined = new ArrayList<>(members.size() + other.members.size());
        combined.addAll(members);
        combined.addAll(other.members);
        return new Cluster(combined);
    }

    public List<String> members() {
        return members;
    }

    public int size() {
        return members.size();
    }

    public boolean isAtomic() {
        return members.size() == 1;
    }

    public boolean contains(String identifier) {
        return members.contains(identifier);
    }

    /**
     * Display label only; never used for identity.
     */
    public String label() {
        return String.join(", ", members);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Cluster cluster = (Cluster) o;
        return members.equals(cluster.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return "Cluster{" + members + "}";
    }
}
