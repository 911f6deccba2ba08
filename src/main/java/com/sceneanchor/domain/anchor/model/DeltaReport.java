package com.sceneanchor.domain.anchor.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Classification of every tracked span between two snapshots. Unchanged spans (same hash,
 * same offset) appear in none of the lists; every other id appears in exactly one.
 */
public record DeltaReport(
        List<String> added,
        List<String> removed,
        List<ModifiedSpan> modified,
        List<MovedSpan> moved,
        List<UnresolvedSpan> unresolved
) {
    public DeltaReport {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        modified = List.copyOf(modified);
        moved = List.copyOf(moved);
        unresolved = List.copyOf(unresolved);
    }

    /**
     * @param position new start position
     * @param tier     resolving tier level, 0 when no current text was available
     */
    public record ModifiedSpan(String id, int position, int tier, double confidence) {}

    /**
     * @param tier resolving tier level, 0 when no current text was available
     */
    public record MovedSpan(String id, int from, int to, int tier, double confidence) {}

    /**
     * @param lastTier level of the last tier attempted before giving up, null for exceptions
     */
    public record UnresolvedSpan(String id, int priorOffset, UnresolvedReason reason, Integer lastTier) {}

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty()
                && moved.isEmpty() && unresolved.isEmpty();
    }

    /**
     * Spans whose analysis is stale: new ones, changed ones and relocated ones.
     */
    public Set<String> idsRequiringReanalysis() {
        Set<String> ids = new LinkedHashSet<>(added);
        modified.forEach(m -> ids.add(m.id()));
        moved.forEach(m -> ids.add(m.id()));
        return ids;
    }

    /**
     * True when some spans could not be located and need a human to reattach them.
     */
    public boolean requiresReconciliation() {
        return !unresolved.isEmpty();
    }

    public List<String> allIds() {
        List<String> ids = new ArrayList<>(added);
        ids.addAll(removed);
        modified.forEach(m -> ids.add(m.id()));
        moved.forEach(m -> ids.add(m.id()));
        unresolved.forEach(u -> ids.add(u.id()));
        return ids;
    }
}
