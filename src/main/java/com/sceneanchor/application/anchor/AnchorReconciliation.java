package com.sceneanchor.application.anchor;

import com.sceneanchor.domain.anchor.model.DeltaReport;
import com.sceneanchor.domain.anchor.model.FingerprintCollection;

/**
 * Outcome of one analysis pass.
 *
 * @param current   the fresh snapshot, now the baseline for the next pass
 * @param report    changes since the previous snapshot
 * @param firstRun  true when no previous snapshot could be loaded
 * @param persisted false when writing the new snapshot failed (the next pass will compare
 *                  against the older one)
 */
public record AnchorReconciliation(
        FingerprintCollection current,
        DeltaReport report,
        boolean firstRun,
        boolean persisted
) {}
