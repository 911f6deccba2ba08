package com.sceneanchor.infrastructure.anchor.delta;

import com.sceneanchor.domain.anchor.model.AnchorMatch;
import com.sceneanchor.domain.anchor.model.AnchorTier;
import com.sceneanchor.domain.anchor.model.DeltaReport;
import com.sceneanchor.domain.anchor.model.DeltaReport.ModifiedSpan;
import com.sceneanchor.domain.anchor.model.DeltaReport.MovedSpan;
import com.sceneanchor.domain.anchor.model.DeltaReport.UnresolvedSpan;
import com.sceneanchor.domain.anchor.model.Fingerprint;
import com.sceneanchor.domain.anchor.model.FingerprintCollection;
import com.sceneanchor.domain.anchor.model.ResolutionTrace;
import com.sceneanchor.domain.anchor.model.UnresolvedReason;
import com.sceneanchor.infrastructure.anchor.resolver.AnchorResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Classifies every tracked span between a previous and a current fingerprint collection.
 * <p>
 * Spans present in both with a different hash or offset are relocated with the previous
 * fingerprint against the current text. A span that cannot be relocated, or whose record
 * makes the resolver throw, is reported as unresolved; one bad record never aborts the diff.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeltaEngine {

    private final AnchorResolver resolver;

    @Value("${anchor.delta.parallel-threshold:64}")
    private int parallelThreshold = 64;

    private enum Kind { MOVED, MODIFIED }

    private record Candidate(Fingerprint previous, Fingerprint current, Kind kind) {}

    private interface Outcome {}

    private record Moved(MovedSpan span) implements Outcome {}

    private record Modified(ModifiedSpan span) implements Outcome {}

    private record Unresolved(UnresolvedSpan span) implements Outcome {}

    public DeltaReport diff(FingerprintCollection previous, FingerprintCollection current) {
        return diff(previous, current, null, null);
    }

    public DeltaReport diff(FingerprintCollection previous, FingerprintCollection current, String currentFullText) {
        return diff(previous, current, currentFullText, null);
    }

    /**
     * Compare two snapshots.
     *
     * @param previous        the baseline, null on a first run
     * @param current         the fresh snapshot
     * @param currentFullText current document text; without it moved/modified spans get tier 0
     * @param executor        pool for per-span resolution, used once the number of spans to resolve
     *                        reaches the parallel threshold; null to always resolve on the calling thread
     * @return the complete report; entries keep the current collection's order
     */
    public DeltaReport diff(FingerprintCollection previous,
                            FingerprintCollection current,
                            String currentFullText,
                            Executor executor) {
        Objects.requireNonNull(current, "current");

        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<Candidate> candidates = new ArrayList<>();

        for (Fingerprint curr : current.spans().values()) {
            Fingerprint prev = previous != null ? previous.get(curr.id()) : null;
            if (prev == null) {
                added.add(curr.id());
                continue;
            }

            boolean sameHash = Objects.equals(prev.contentHash(), curr.contentHash());
            boolean sameOffset = prev.offset() == curr.offset();
            if (sameHash && sameOffset) {
                continue;
            }
            candidates.add(new Candidate(prev, curr, sameHash ? Kind.MOVED : Kind.MODIFIED));
        }

        if (previous != null) {
            for (String id : previous.spans().keySet()) {
                if (!current.contains(id)) {
                    removed.add(id);
                }
            }
        }

        List<Outcome> outcomes = classifyAll(candidates, currentFullText, executor);

        List<ModifiedSpan> modified = new ArrayList<>();
        List<MovedSpan> moved = new ArrayList<>();
        List<UnresolvedSpan> unresolved = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome instanceof Moved m) {
                moved.add(m.span());
            } else if (outcome instanceof Modified m) {
                modified.add(m.span());
            } else if (outcome instanceof Unresolved u) {
                unresolved.add(u.span());
            }
        }

        DeltaReport report = new DeltaReport(added, removed, modified, moved, unresolved);
        log.info("[DeltaEngine] added={}, removed={}, modified={}, moved={}, unresolved={} ({} spans compared)",
                added.size(), removed.size(), modified.size(), moved.size(), unresolved.size(), current.size());
        return report;
    }

    private List<Outcome> classifyAll(List<Candidate> candidates, String currentFullText, Executor executor) {
        if (executor == null || candidates.size() < Math.max(2, parallelThreshold)) {
            return candidates.stream().map(c -> classify(c, currentFullText)).toList();
        }

        List<CompletableFuture<Outcome>> futures = candidates.stream()
                .map(c -> CompletableFuture.supplyAsync(() -> classify(c, currentFullText), executor))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private Outcome classify(Candidate candidate, String currentFullText) {
        Fingerprint prev = candidate.previous();
        Fingerprint curr = candidate.current();

        if (currentFullText == null) {
            return candidate.kind() == Kind.MOVED
                    ? new Moved(new MovedSpan(prev.id(), prev.offset(), curr.offset(), 0, 0.0))
                    : new Modified(new ModifiedSpan(prev.id(), curr.offset(), 0, 0.0));
        }

        ResolutionTrace trace;
        try {
            trace = resolver.resolveTrace(prev, currentFullText);
        } catch (RuntimeException e) {
            log.warn("[DeltaEngine] span {} could not be resolved: {}", prev.id(), e.getMessage());
            return new Unresolved(new UnresolvedSpan(prev.id(), prev.offset(), UnresolvedReason.EXCEPTION, null));
        }

        if (!trace.resolved()) {
            AnchorTier lastTier = trace.lastAttemptedTier();
            return new Unresolved(new UnresolvedSpan(prev.id(), prev.offset(), UnresolvedReason.RESOLUTION_FAILED,
                    lastTier != null ? lastTier.level() : null));
        }

        AnchorMatch match = trace.match();
        return candidate.kind() == Kind.MOVED
                ? new Moved(new MovedSpan(prev.id(), prev.offset(), match.position(), match.level(), match.confidence()))
                : new Modified(new ModifiedSpan(prev.id(), match.position(), match.level(), match.confidence()));
    }
}
