package com.sceneanchor;

import com.sceneanchor.application.anchor.AnchorReconciliation;
import com.sceneanchor.application.anchor.SceneAnchorService;
import com.sceneanchor.infrastructure.anchor.FillerText;
import com.sceneanchor.infrastructure.anchor.ManuscriptDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;

import static com.sceneanchor.infrastructure.anchor.AnchorFixtures.LIGHTHOUSE;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class SceneAnchorApplicationTests {

    @TempDir
    static Path storeDir;

    @DynamicPropertySource
    static void storeProperties(DynamicPropertyRegistry registry) {
        registry.add("anchor.store.path", () -> storeDir.resolve("fingerprints.json").toString());
    }

    @Autowired
    private SceneAnchorService sceneAnchorService;

    @Test
    @DisplayName("wired context reconciles twice against its own file")
    void reconcile_round_trip() {
        ManuscriptDraft first = new ManuscriptDraft()
                .prose(FillerText.of(1L, 300)).scene("keeper", LIGHTHOUSE).prose(" " + FillerText.of(2L, 300));
        ManuscriptDraft second = new ManuscriptDraft()
                .prose(FillerText.of(3L, 90))
                .prose(FillerText.of(1L, 300)).scene("keeper", LIGHTHOUSE).prose(" " + FillerText.of(2L, 300));

        AnchorReconciliation initial = sceneAnchorService.reconcile(first.text(), first.spans());
        AnchorReconciliation next = sceneAnchorService.reconcile(second.text(), second.spans());

        assertThat(initial.firstRun()).isTrue();
        assertThat(Files.exists(storeDir.resolve("fingerprints.json"))).isTrue();
        assertThat(next.firstRun()).isFalse();
        assertThat(next.report().moved()).singleElement()
                .satisfies(m -> assertThat(m.to()).isEqualTo(390));
    }
}
