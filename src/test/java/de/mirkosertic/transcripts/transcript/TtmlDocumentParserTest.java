package de.mirkosertic.transcripts.transcript;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TtmlDocumentParser")
class TtmlDocumentParserTest {

    @TempDir
    Path tempDir;

    private final TtmlDocumentParser parser = new TtmlDocumentParser();

    @Test
    @DisplayName("Should extract paragraphs in document order with timestamps")
    void shouldExtractParagraphsInOrder() throws IOException {
        // Given
        final Path file = write("episode.ttml", """
                <?xml version="1.0" encoding="UTF-8"?>
                <tt xmlns="http://www.w3.org/ns/ttml" xmlns:podcasts="http://podcasts.apple.com/transcript-ttml-internal">
                  <body>
                    <div>
                      <p begin="0.5" end="4.2">
                        <span podcasts:unit="sentence"><span podcasts:unit="word">Welcome</span>
                        <span podcasts:unit="word">to</span> <span podcasts:unit="word">the</span>
                        <span podcasts:unit="word">show.</span></span>
                      </p>
                      <p begin="00:01:05.250">Second paragraph.</p>
                    </div>
                  </body>
                </tt>
                """);

        // When
        final List<TranscriptSegment> segments = parser.parse(file);

        // Then
        assertThat(segments).containsExactly(
                new TranscriptSegment(Duration.ofMillis(500), "Welcome to the show."),
                new TranscriptSegment(Duration.ofMillis(65_250), "Second paragraph."));
    }

    @Test
    @DisplayName("Should fall back to any p element when the TTML namespace is missing")
    void shouldFallBackToElementsWithoutNamespace() throws IOException {
        final Path file = write("plain.ttml", """
                <tt><body><div>
                  <p begin="3s">No namespace here</p>
                </div></body></tt>
                """);

        final List<TranscriptSegment> segments = parser.parse(file);

        assertThat(segments).containsExactly(new TranscriptSegment(Duration.ofSeconds(3), "No namespace here"));
    }

    @Test
    @DisplayName("Should skip empty paragraphs and keep missing timestamps as null")
    void shouldSkipEmptyParagraphs() throws IOException {
        final Path file = write("sparse.ttml", """
                <tt xmlns="http://www.w3.org/ns/ttml"><body><div>
                  <p begin="1"> \u200B </p>
                  <p>No begin attribute</p>
                  <p begin="garbage">Bad begin</p>
                </div></body></tt>
                """);

        final List<TranscriptSegment> segments = parser.parse(file);

        assertThat(segments).containsExactly(
                new TranscriptSegment(null, "No begin attribute"),
                new TranscriptSegment(null, "Bad begin"));
    }

    @Test
    @DisplayName("Should return no segments for a document without paragraphs")
    void shouldReturnEmptyListWithoutParagraphs() throws IOException {
        final Path file = write("empty.ttml", "<tt xmlns=\"http://www.w3.org/ns/ttml\"><body/></tt>");

        assertThat(parser.parse(file)).isEmpty();
    }

    @Test
    @DisplayName("Should report malformed XML as IOException")
    void shouldWrapMalformedXml() throws IOException {
        final Path file = write("broken.ttml", "<tt><body><p>unclosed</body>");

        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Failed to parse transcript document");
    }

    @Test
    @DisplayName("Should not resolve external entities")
    void shouldNotResolveExternalEntities() throws IOException {
        final Path secret = write("secret.txt", "top secret");
        final Path file = write("xxe.ttml", """
                <?xml version="1.0"?>
                <!DOCTYPE tt [<!ENTITY xxe SYSTEM "%s">]>
                <tt><body><p>before &xxe; after</p></body></tt>
                """.formatted(secret.toUri()));

        final List<String> texts;
        try {
            texts = parser.parse(file).stream().map(TranscriptSegment::text).toList();
        } catch (final IOException e) {
            // rejecting the document outright is fine as well
            return;
        }
        assertThat(texts).noneMatch(text -> text.contains("top secret"));
    }

    private Path write(final String name, final String content) throws IOException {
        final Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
