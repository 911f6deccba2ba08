package com.sceneanchor.infrastructure.anchor.fingerprint;

import com.sceneanchor.domain.anchor.model.Fingerprint;
import com.sceneanchor.domain.anchor.model.FingerprintCollection;
import com.sceneanchor.domain.anchor.model.SceneSpan;
import com.sceneanchor.infrastructure.anchor.AnchorFixtures;
import com.sceneanchor.infrastructure.anchor.FillerText;
import com.sceneanchor.infrastructure.anchor.InvalidSpanException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FingerprintBuilderTest {

    private static final String BEFORE = FillerText.of(11L, 200);
    private static final String AFTER = " " + FillerText.of(12L, 200);
    private static final String DOCUMENT = BEFORE + AnchorFixtures.LIGHTHOUSE + AFTER;

    private FingerprintBuilder builder;

    @BeforeEach
    void setUp() {
        builder = AnchorFixtures.fingerprintBuilder();
    }

    private void setField(String name, Object value) throws Exception {
        Field field = FingerprintBuilder.class.getDeclaredField(name);
        field.setAccessible(true);
        field.set(builder, value);
    }

    private static SceneSpan lighthouse() {
        return new SceneSpan("s1", null, BEFORE.length(),
                BEFORE.length() + AnchorFixtures.LIGHTHOUSE.length(), AnchorFixtures.LIGHTHOUSE);
    }

    @Nested
    @DisplayName("Single span")
    class SingleSpan {

        @Test
        @DisplayName("hash, offset, length and text of the exact slice")
        void captures_slice() {
            Fingerprint fp = builder.fingerprint(DOCUMENT, lighthouse());

            assertThat(fp.id()).isEqualTo("s1");
            assertThat(fp.offset()).isEqualTo(BEFORE.length());
            assertThat(fp.length()).isEqualTo(AnchorFixtures.LIGHTHOUSE.length());
            assertThat(fp.contentHash()).isEqualTo(new ContentHasher().sha256(AnchorFixtures.LIGHTHOUSE));
            assertThat(fp.contentHash()).hasSize(64).matches("[0-9a-f]+");
            assertThat(fp.text()).isEqualTo(AnchorFixtures.LIGHTHOUSE);
        }

        @Test
        @DisplayName("64 chars of context on each side, stored verbatim")
        void contexts() {
            Fingerprint fp = builder.fingerprint(DOCUMENT, lighthouse());

            assertThat(fp.precedingContext()).isEqualTo(BEFORE.substring(BEFORE.length() - 64));
            assertThat(fp.followingContext()).isEqualTo(AFTER.substring(0, 64));
        }

        @Test
        @DisplayName("contexts are truncated at document bounds")
        void contexts_at_bounds() {
            String doc = "Opening line. Closing";
            Fingerprint fp = builder.fingerprint(doc, new SceneSpan("s1", null, 0, 13, null));

            assertThat(fp.precedingContext()).isEmpty();
            assertThat(fp.followingContext()).isEqualTo(" Closing");
        }

        @Test
        @DisplayName("rare shingles are cached on the fingerprint")
        void shingles() {
            Fingerprint fp = builder.fingerprint(DOCUMENT, lighthouse());

            assertThat(fp.rareShingles()).hasSize(3)
                    .contains("nobody else was allowed to read his daughter");
        }

        @Test
        @DisplayName("empty span is allowed")
        void empty_span() {
            Fingerprint fp = builder.fingerprint(DOCUMENT, new SceneSpan("e", null, 10, 10, ""));

            assertThat(fp.length()).isZero();
            assertThat(fp.hasText()).isFalse();
            assertThat(fp.rareShingles()).isEmpty();
        }

        @Test
        @DisplayName("stale span text -> the document slice wins")
        void stale_text() {
            SceneSpan span = new SceneSpan("s1", null, BEFORE.length(),
                    BEFORE.length() + AnchorFixtures.LIGHTHOUSE.length(), "something else");

            assertThat(builder.fingerprint(DOCUMENT, span).text()).isEqualTo(AnchorFixtures.LIGHTHOUSE);
        }

        @Test
        @DisplayName("retain-text off -> hash only")
        void hash_only() throws Exception {
            setField("retainText", false);
            setField("computeRareShingles", false);

            Fingerprint fp = builder.fingerprint(DOCUMENT, lighthouse());

            assertThat(fp.text()).isNull();
            assertThat(fp.rareShingles()).isEmpty();
            assertThat(fp.contentHash()).isNotNull();
        }
    }

    @Nested
    @DisplayName("Collection")
    class Collection {

        @Test
        @DisplayName("keyed by id in span order, stamped with the clock")
        void build() {
            List<SceneSpan> spans = List.of(
                    new SceneSpan("b", null, 0, 20, null),
                    lighthouse(),
                    new SceneSpan("a", "s1", 30, 40, null));

            FingerprintCollection collection = builder.build(DOCUMENT, spans);

            assertThat(collection.spans().keySet()).containsExactly("b", "s1", "a");
            assertThat(collection.generatedAt()).isEqualTo(AnchorFixtures.NOW);
            assertThat(collection.documentChecksum()).isEqualTo(builder.checksum(DOCUMENT));
        }

        @Test
        @DisplayName("checksum ignores line endings and curly quotes")
        void checksum_ignores_churn() {
            assertThat(builder.checksum("\u201CHi,\u201D she said.\r\nThen left.\r\n"))
                    .isEqualTo(builder.checksum("\"Hi,\" she said.\nThen left."));
            assertThat(builder.checksum("Then left.")).isNotEqualTo(builder.checksum("Then right."));
        }

        @Test
        @DisplayName("no spans -> empty collection")
        void no_spans() {
            assertThat(builder.build(DOCUMENT, List.of()).spans()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Invalid input")
    class InvalidInput {

        @Test
        @DisplayName("end past the document -> InvalidSpanException")
        void out_of_bounds() {
            assertThatThrownBy(() -> builder.build("short", List.of(new SceneSpan("x", null, 2, 9, null))))
                    .isInstanceOf(InvalidSpanException.class)
                    .hasMessageContaining("x");
        }

        @Test
        @DisplayName("start after end -> InvalidSpanException")
        void inverted() {
            assertThatThrownBy(() -> builder.fingerprint(DOCUMENT, new SceneSpan("x", null, 9, 2, null)))
                    .isInstanceOf(InvalidSpanException.class);
        }

        @Test
        @DisplayName("repeated id -> InvalidSpanException")
        void duplicate_id() {
            List<SceneSpan> spans = List.of(
                    new SceneSpan("dup", null, 0, 5, null),
                    new SceneSpan("dup", null, 10, 15, null));

            assertThatThrownBy(() -> builder.build(DOCUMENT, spans))
                    .isInstanceOf(InvalidSpanException.class)
                    .hasMessageContaining("dup");
        }

        @Test
        @DisplayName("null document -> InvalidSpanException")
        void null_document() {
            assertThatThrownBy(() -> builder.build(null, List.of()))
                    .isInstanceOf(InvalidSpanException.class);
        }
    }
}
