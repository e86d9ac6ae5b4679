package com.connectk.core.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Instrumentation data captured during a single {@link Searcher#search} call: the statistics of
 * every root child plus the shape of the tree when the search stopped.
 */
public final class SearchTelemetry {

    private final List<ChildStatistics> rootChildren;
    private final long rootVisits;
    private final int treeSize;
    private final int treeDepth;
    private final long elapsedNanos;

    public SearchTelemetry(List<ChildStatistics> rootChildren, long rootVisits, int treeSize, int treeDepth,
            long elapsedNanos) {
        if (rootChildren == null || rootChildren.isEmpty()) {
            this.rootChildren = List.of();
        } else {
            this.rootChildren = Collections.unmodifiableList(new ArrayList<>(rootChildren));
        }
        this.rootVisits = rootVisits;
        this.treeSize = treeSize;
        this.treeDepth = treeDepth;
        this.elapsedNanos = elapsedNanos;
    }

    /**
     * Returns the root's children ordered by column.
     */
    public List<ChildStatistics> rootChildren() {
        return rootChildren;
    }

    /**
     * Returns the statistics of the root child reached by {@code move}, or {@code null} if that move
     * was never expanded.
     */
    public ChildStatistics child(int move) {
        for (ChildStatistics child : rootChildren) {
            if (child.move() == move) {
                return child;
            }
        }
        return null;
    }

    public long rootVisits() {
        return rootVisits;
    }

    public long totalChildVisits() {
        return rootChildren.stream().mapToLong(ChildStatistics::visits).sum();
    }

    public int treeSize() {
        return treeSize;
    }

    public int treeDepth() {
        return treeDepth;
    }

    public long elapsedNanos() {
        return elapsedNanos;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    /**
     * Visit count and mean reward of one root child, the reward seen from the player to move at
     * the root.
     */
    public record ChildStatistics(int move, long visits, double averageReward) {
    }
}
