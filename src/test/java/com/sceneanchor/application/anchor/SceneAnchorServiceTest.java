package com.sceneanchor.application.anchor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sceneanchor.domain.anchor.model.DeltaReport;
import com.sceneanchor.domain.anchor.model.FingerprintCollection;
import com.sceneanchor.domain.anchor.repository.FingerprintStore;
import com.sceneanchor.infrastructure.anchor.AnchorFixtures;
import com.sceneanchor.infrastructure.anchor.FillerText;
import com.sceneanchor.infrastructure.anchor.ManuscriptDraft;
import com.sceneanchor.infrastructure.anchor.delta.DeltaEngine;
import com.sceneanchor.infrastructure.anchor.fingerprint.FingerprintBuilder;
import com.sceneanchor.infrastructure.store.FingerprintStoreException;
import com.sceneanchor.infrastructure.store.JsonFingerprintStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.lang.reflect.Field;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static com.sceneanchor.infrastructure.anchor.AnchorFixtures.LIGHTHOUSE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SceneAnchorServiceTest {

    private static final String HARBOUR = "Morning fog rolled over the harbour while the ferry waited at the pier.";

    @Mock
    private FingerprintStore fingerprintStore;

    private final AtomicInteger pooledTasks = new AtomicInteger();
    private final Executor countingExecutor = task -> {
        pooledTasks.incrementAndGet();
        task.run();
    };

    private FingerprintBuilder fingerprintBuilder;
    private DeltaEngine deltaEngine;
    private SceneAnchorService service;

    @BeforeEach
    void setUp() {
        fingerprintBuilder = AnchorFixtures.fingerprintBuilder();
        deltaEngine = new DeltaEngine(AnchorFixtures.resolver());
        service = new SceneAnchorService(
                fingerprintBuilder,
                deltaEngine,
                fingerprintStore,
                countingExecutor);
    }

    private static ManuscriptDraft draft(int insertedChars) {
        ManuscriptDraft draft = new ManuscriptDraft()
                .prose(FillerText.of(90L, 200));
        if (insertedChars > 0) {
            draft.prose(FillerText.of(91L, insertedChars));
        }
        return draft
                .prose(FillerText.of(92L, 200)).scene("fog", HARBOUR)
                .prose(" " + FillerText.of(93L, 200)).scene("keeper", LIGHTHOUSE)
                .prose(" " + FillerText.of(94L, 200));
    }

    @Test
    @DisplayName("no stored snapshot -> first run, every span added, snapshot saved")
    void first_run() {
        when(fingerprintStore.load()).thenReturn(Optional.empty());
        ManuscriptDraft draft = draft(0);

        AnchorReconciliation result = service.reconcile(draft.text(), draft.spans());

        assertThat(result.firstRun()).isTrue();
        assertThat(result.persisted()).isTrue();
        assertThat(result.report().added()).containsExactly("fog", "keeper");
        verify(fingerprintStore).save(result.current());
    }

    @Test
    @DisplayName("stored snapshot -> moved spans reported against it")
    void later_run() {
        ManuscriptDraft before = draft(0);
        when(fingerprintStore.load())
                .thenReturn(Optional.of(fingerprintBuilder.build(before.text(), before.spans())));
        ManuscriptDraft after = draft(180);

        AnchorReconciliation result = service.reconcile(after.text(), after.spans());

        DeltaReport report = result.report();
        assertThat(result.firstRun()).isFalse();
        assertThat(report.moved()).extracting(DeltaReport.MovedSpan::id).containsExactly("fog", "keeper");
        assertThat(report.moved()).allSatisfy(m -> {
            assertThat(m.to()).isEqualTo(m.from() + 180);
            assertThat(m.tier()).isEqualTo(2);
        });
        assertThat(report.idsRequiringReanalysis()).containsExactly("fog", "keeper");
    }

    @Test
    @DisplayName("write failure -> report still returned, persisted=false")
    void save_failure() {
        when(fingerprintStore.load()).thenReturn(Optional.empty());
        doThrow(new FingerprintStoreException("disk full", new IOException("no space")))
                .when(fingerprintStore).save(any(FingerprintCollection.class));
        ManuscriptDraft draft = draft(0);

        AnchorReconciliation result = service.reconcile(draft.text(), draft.spans());

        assertThat(result.persisted()).isFalse();
        assertThat(result.report().added()).hasSize(2);
    }

    @Test
    @DisplayName("compare and snapshot never touch the store")
    void compare_only() {
        ManuscriptDraft before = draft(0);
        ManuscriptDraft after = draft(60);

        FingerprintCollection previous = service.snapshot(before.text(), before.spans());
        DeltaReport report = service.compare(previous, after.text(), after.spans());

        assertThat(report.moved()).hasSize(2);
        verifyNoInteractions(fingerprintStore);
    }

    @Test
    @DisplayName("worker pool only used once enough spans need resolving")
    void parallel_threshold() throws Exception {
        ManuscriptDraft before = draft(0);
        ManuscriptDraft after = draft(60);
        FingerprintCollection previous = service.snapshot(before.text(), before.spans());

        service.compare(previous, after.text(), after.spans());
        assertThat(pooledTasks).hasValue(0);

        Field threshold = DeltaEngine.class.getDeclaredField("parallelThreshold");
        threshold.setAccessible(true);
        threshold.set(deltaEngine, 2);

        service.compare(previous, after.text(), after.spans());
        assertThat(pooledTasks).hasValue(2);
    }

    @Test
    @DisplayName("damaged fingerprint file -> treated as a first run, not an error")
    void damaged_file(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("fingerprints.json");
        Files.writeString(file, "{\"spans\": {\"fog\": {\"sha\": \"abc\", \"offset\": 3, \"len\": 9, "
                + "\"rareShingles\": [null]}, \"keeper\": null}, \"generatedAt\": \"last tuesday\"}");
        SceneAnchorService fileBacked = new SceneAnchorService(
                fingerprintBuilder, deltaEngine, new JsonFingerprintStore(new ObjectMapper(), file, false), countingExecutor);
        ManuscriptDraft draft = draft(0);

        AnchorReconciliation result = fileBacked.reconcile(draft.text(), draft.spans());

        assertThat(result.firstRun()).isTrue();
        assertThat(result.persisted()).isTrue();
        assertThat(result.report().added()).containsExactly("fog", "keeper");
    }
}
