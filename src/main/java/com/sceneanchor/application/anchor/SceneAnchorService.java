package com.sceneanchor.application.anchor;

import com.sceneanchor.config.AnchorConfig;
import com.sceneanchor.domain.anchor.model.DeltaReport;
import com.sceneanchor.domain.anchor.model.FingerprintCollection;
import com.sceneanchor.domain.anchor.model.SceneSpan;
import com.sceneanchor.domain.anchor.repository.FingerprintStore;
import com.sceneanchor.infrastructure.anchor.delta.DeltaEngine;
import com.sceneanchor.infrastructure.anchor.fingerprint.FingerprintBuilder;
import com.sceneanchor.infrastructure.store.FingerprintStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Entry point for the host editor: fingerprint the current spans, compare them with the
 * previous pass and keep the new snapshot as the next baseline.
 */
@Slf4j
@Service
public class SceneAnchorService {

    private final FingerprintBuilder fingerprintBuilder;
    private final DeltaEngine deltaEngine;
    private final FingerprintStore fingerprintStore;
    private final Executor resolutionExecutor;

    public SceneAnchorService(FingerprintBuilder fingerprintBuilder,
                              DeltaEngine deltaEngine,
                              FingerprintStore fingerprintStore,
                              @Qualifier(AnchorConfig.RESOLUTION_EXECUTOR) Executor resolutionExecutor) {
        this.fingerprintBuilder = fingerprintBuilder;
        this.deltaEngine = deltaEngine;
        this.fingerprintStore = fingerprintStore;
        this.resolutionExecutor = resolutionExecutor;
    }

    /**
     * Fingerprint the spans of the current document without touching the store.
     */
    public FingerprintCollection snapshot(String fullText, List<SceneSpan> spans) {
        return fingerprintBuilder.build(fullText, spans);
    }

    /**
     * Compare the current spans against a caller-held baseline without touching the store.
     */
    public DeltaReport compare(FingerprintCollection previous, String fullText, List<SceneSpan> spans) {
        FingerprintCollection current = fingerprintBuilder.build(fullText, spans);
        return deltaEngine.diff(previous, current, fullText, resolutionExecutor);
    }

    /**
     * Full pass: load the previous snapshot, diff against the current document, then replace
     * the stored snapshot. A failed write is logged and reported, never thrown.
     */
    public AnchorReconciliation reconcile(String fullText, List<SceneSpan> spans) {
        FingerprintCollection current = fingerprintBuilder.build(fullText, spans);
        Optional<FingerprintCollection> previous = fingerprintStore.load();

        DeltaReport report = deltaEngine.diff(previous.orElse(null), current, fullText, resolutionExecutor);
        if (report.requiresReconciliation()) {
            log.info("[SceneAnchorService] {} spans need manual reconciliation: {}",
                    report.unresolved().size(),
                    report.unresolved().stream().map(DeltaReport.UnresolvedSpan::id).toList());
        }

        boolean persisted = true;
        try {
            fingerprintStore.save(current);
        } catch (FingerprintStoreException e) {
            log.error("[SceneAnchorService] could not persist fingerprints", e);
            persisted = false;
        }

        return new AnchorReconciliation(current, report, previous.isEmpty(), persisted);
    }
}
