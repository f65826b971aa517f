package de.mirkosertic.transcripts.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApplicationConfig")
class ApplicationConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("transcripts.test.dir");
    }

    @Test
    @DisplayName("Should load defaults from the classpath")
    void shouldLoadDefaults() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        assertThat(config.getIncludePatterns()).containsExactly("*.ttml");
        assertThat(config.getExcludePatterns()).isEmpty();
        assertThat(config.getPodcastDirectoryPrefix()).isEqualTo("PodcastContent");
        assertThat(config.getTrackidPrefix()).isEqualTo("transcript_");
        assertThat(config.getTrackidConfidentLength()).isEqualTo(8);
        assertThat(config.getSubstringMinLength()).isEqualTo(10);
        assertThat(config.getOutputDirectory()).isEqualTo(Path.of("transcripts_with_metadata"));
        assertThat(config.isIncludeTimestamps()).isFalse();
        assertThat(config.getMaxTitleLength()).isEqualTo(100);
        assertThat(config.getSearchContextLines()).isEqualTo(2);
        assertThat(config.getSearchLimit()).isEqualTo(50);
        assertThat(config.getDatabasePath().getFileName()).isEqualTo(Path.of("MTLibrary.sqlite"));
        assertThat(config.getTtmlDirectory().toString()).startsWith(System.getProperty("user.home"));
    }

    @Test
    @DisplayName("Should derive reports and search directories from the output directory")
    void shouldDeriveDirectoriesFromOutput() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        config.setOutputDirectory(Path.of("custom"));

        assertThat(config.getReportsDirectory()).isEqualTo(Path.of("custom", "reports"));
        assertThat(config.getSearchDirectory()).isEqualTo(Path.of("custom"));

        config.setReportsDirectory(Path.of("elsewhere"));
        config.setSearchDirectory(Path.of("transcripts"));

        assertThat(config.getReportsDirectory()).isEqualTo(Path.of("elsewhere"));
        assertThat(config.getSearchDirectory()).isEqualTo(Path.of("transcripts"));
    }

    @Test
    @DisplayName("Should apply nested YAML settings")
    void shouldApplyYamlSettings() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        config.applyYamlConfig(Map.of("transcripts", Map.of(
                "source", Map.of(
                        "ttml-directory", "/data/ttml",
                        "include-patterns", List.of("*.ttml", "*.xml"),
                        "podcast-directory-prefix", "Show"),
                "trackid", Map.of("prefix", "tx-", "confident-length", 6),
                "matching", Map.of("substring-min-length", 12),
                "output", Map.of("include-timestamps", true, "max-title-length", 40),
                "search", Map.of("limit", 0))));

        assertThat(config.getTtmlDirectory()).isEqualTo(Path.of("/data/ttml"));
        assertThat(config.getIncludePatterns()).containsExactly("*.ttml", "*.xml");
        assertThat(config.getPodcastDirectoryPrefix()).isEqualTo("Show");
        assertThat(config.getTrackidPrefix()).isEqualTo("tx-");
        assertThat(config.getTrackidConfidentLength()).isEqualTo(6);
        assertThat(config.getSubstringMinLength()).isEqualTo(12);
        assertThat(config.isIncludeTimestamps()).isTrue();
        assertThat(config.getMaxTitleLength()).isEqualTo(40);
        assertThat(config.getSearchLimit()).isZero();
    }

    @Test
    @DisplayName("Should keep the title length when a non-positive one is configured")
    void shouldRejectNonPositiveTitleLength() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        config.applyYamlConfig(Map.of("transcripts", Map.of("output", Map.of("max-title-length", 0))));
        assertThat(config.getMaxTitleLength()).isEqualTo(100);

        config.applyYamlConfig(Map.of("transcripts", Map.of("output", Map.of("max-title-length", -5))));
        assertThat(config.getMaxTitleLength()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should ignore YAML without a transcripts section")
    void shouldIgnoreForeignYaml() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        config.applyYamlConfig(Map.of("lucene", Map.of("index", "x")));

        assertThat(config.getTrackidPrefix()).isEqualTo("transcript_");
    }

    @Test
    @DisplayName("Should resolve placeholders from system properties and defaults")
    void shouldResolveVariables() {
        System.setProperty("transcripts.test.dir", "/from/property");

        assertThat(ApplicationConfig.resolveVariables("${transcripts.test.dir:/fallback}/ttml"))
                .isEqualTo("/from/property/ttml");
        assertThat(ApplicationConfig.resolveVariables("${transcripts.unset.variable:/fallback}/ttml"))
                .isEqualTo("/fallback/ttml");
        assertThat(ApplicationConfig.resolveVariables("plain")).isEqualTo("plain");
    }
}
