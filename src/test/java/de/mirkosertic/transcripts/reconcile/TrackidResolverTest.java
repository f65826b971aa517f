package de.mirkosertic.transcripts.reconcile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TrackidResolver")
class TrackidResolverTest {

    private final TrackidResolver resolver = TrackidResolver.withDefaultRules("transcript_", 8);

    @Nested
    @DisplayName("extract")
    class Extract {

        @ParameterizedTest(name = "transcript_{0} -> {0}")
        @ValueSource(strings = {"1000654321987", "x", "abc_def", "transcript_"})
        @DisplayName("Should return the suffix after the generator prefix")
        void shouldReturnSuffixAfterPrefix(final String suffix) {
            final TrackidExtractionResult result = resolver.extract("transcript_" + suffix);

            assertThat(result.succeeded()).isTrue();
            assertThat(result.token()).isEqualTo(suffix);
            assertThat(result.lowConfidence()).isFalse();
        }

        @Test
        @DisplayName("Should fail for the bare generator prefix")
        void shouldFailForBarePrefix() {
            final TrackidExtractionResult result = resolver.extract("transcript_");

            assertThat(result.succeeded()).isFalse();
            assertThat(result.token()).isNull();
        }

        @ParameterizedTest
        @CsvSource({
                "A1B2C3D4E5F6, stem",
                "12345678, stem",
                "1234567, short-stem",
                "ab, short-stem"
        })
        @DisplayName("Should use the whole stem and flag short stems")
        void shouldUseWholeStem(final String stem, final String rule) {
            final TrackidExtractionResult result = resolver.extract(stem);

            assertThat(result.succeeded()).isTrue();
            assertThat(result.token()).isEqualTo(stem);
            assertThat(result.rule()).isEqualTo(rule);
            assertThat(result.lowConfidence()).isEqualTo("short-stem".equals(rule));
        }

        @Test
        @DisplayName("Should fail when no rule applies")
        void shouldFailWhenNoRuleApplies() {
            assertThat(resolver.extract("").succeeded()).isFalse();
        }

        @Test
        @DisplayName("Should evaluate custom rules in order")
        void shouldEvaluateRulesInOrder() {
            final TrackidResolver custom = new TrackidResolver(List.of(
                    new TrackidRule("never", stem -> false, stem -> TrackidExtractionResult.failed("never")),
                    new TrackidRule("upper", stem -> true, stem -> TrackidExtractionResult.success(stem.toUpperCase(), "upper")),
                    TrackidRule.wholeStem(1)));

            assertThat(custom.extract("abc").token()).isEqualTo("ABC");
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("Should record failed extractions verbatim in the batch state")
        void shouldRecordFailedParse() {
            final ReconciliationState state = new ReconciliationState();

            final TrackidExtractionResult result = resolver.resolve(
                    Path.of("PodcastContent1", "transcript_.ttml"), state);

            assertThat(result.succeeded()).isFalse();
            assertThat(state.failedParses()).containsExactly("transcript_.ttml");
        }

        @Test
        @DisplayName("Should record low-confidence trackids")
        void shouldRecordLowConfidence() {
            final ReconciliationState state = new ReconciliationState();

            resolver.resolve(Path.of("abc.ttml"), state);

            assertThat(state.lowConfidenceFiles()).containsExactly("abc.ttml");
            assertThat(state.failedParses()).isEmpty();
        }

        @Test
        @DisplayName("Should leave the state untouched for regular trackids")
        void shouldNotRecordRegularTrackids() {
            final ReconciliationState state = new ReconciliationState();

            final TrackidExtractionResult result = resolver.resolve(Path.of("transcript_99887766.ttml"), state);

            assertThat(result.token()).isEqualTo("99887766");
            assertThat(state.failedParses()).isEmpty();
            assertThat(state.lowConfidenceFiles()).isEmpty();
        }
    }

    @ParameterizedTest
    @CsvSource({
            "episode.ttml, episode",
            "archive.tar.ttml, archive.tar",
            ".hidden, .hidden",
            "noextension, noextension"
    })
    void shouldStripLastExtension(final String filename, final String stem) {
        assertThat(TrackidResolver.stemOf(filename)).isEqualTo(stem);
    }
}
