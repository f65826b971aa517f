package de.mirkosertic.transcripts;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TranscriptReconcilerApplication")
class TranscriptReconcilerApplicationTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private Path ttmlDir;
    private Path database;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException, SQLException {
        ttmlDir = tempDir.resolve("TTML");
        database = tempDir.resolve("MTLibrary.sqlite");
        outputDir = tempDir.resolve("out");

        writeTtml("PodcastContent42/A1B2C3D4E5F6.ttml", "The needle is in this episode.");
        writeTtml("PodcastContent99/transcript_1000123456.ttml", "Nothing to find here.");

        try (final Connection connection = DriverManager.getConnection("jdbc:sqlite:" + database.toAbsolutePath());
             final Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE ZMTPODCAST (Z_PK INTEGER PRIMARY KEY, ZTITLE VARCHAR, ZAUTHOR VARCHAR)");
            statement.execute("CREATE TABLE ZMTEPISODE (Z_PK INTEGER PRIMARY KEY, ZPODCAST INTEGER, ZTITLE VARCHAR, "
                    + "ZPUBDATE FLOAT, ZGUID VARCHAR)");
            statement.execute("INSERT INTO ZMTPODCAST VALUES (42, 'Tech Talk', 'Jane Doe')");
            statement.execute("INSERT INTO ZMTEPISODE VALUES (1, 42, 'Pilot', 86400, 'A1B2C3D4E5F6')");
            statement.execute("INSERT INTO ZMTEPISODE VALUES (2, 42, 'Second', 172800, 'never-transcribed')");
        }
    }

    @Test
    @DisplayName("Should extract transcripts and write reports")
    void shouldExtractTranscripts() throws IOException {
        // When
        final int exitCode = run("--ttml-dir", ttmlDir.toString(), "--db", database.toString(),
                "-o", outputDir.toString(), "--timestamps");

        // Then
        assertThat(exitCode).isEqualTo(TranscriptReconcilerApplication.EXIT_OK);
        assertThat(Files.readString(outputDir.resolve("Tech_Talk_2001-01-02_Pilot.txt")))
                .contains("Podcast: Tech Talk")
                .endsWith("[00:00:01] The needle is in this episode.");
        assertThat(outputDir.resolve("Podcast_99_transcript_1000123456.txt")).isRegularFile();

        final Path reports = outputDir.resolve("reports");
        assertThat(reports.resolve("transcript_mapping.csv")).isRegularFile();
        assertThat(Files.readAllLines(reports.resolve("unmatched_db_entries.txt"))).contains("never-transcribed");
        assertThat(Files.readAllLines(reports.resolve("unmatched_transcripts.txt"))).contains("Trackid: 1000123456");
    }

    @Test
    @DisplayName("Should extract a single file")
    void shouldExtractSingleFile() {
        final int exitCode = run("--db", database.toString(), "-o", outputDir.toString(),
                "--file", ttmlDir.resolve("PodcastContent42/A1B2C3D4E5F6.ttml").toString());

        assertThat(exitCode).isEqualTo(TranscriptReconcilerApplication.EXIT_OK);
        assertThat(outputDir.resolve("Tech_Talk_2001-01-02_Pilot.txt")).isRegularFile();
        assertThat(outputDir.resolve("Podcast_99_transcript_1000123456.txt")).doesNotExist();
    }

    @Test
    @DisplayName("Should exit with 1 when the transcript source is missing")
    void shouldFailForMissingSource() {
        assertThat(run("--ttml-dir", tempDir.resolve("missing").toString(), "-o", outputDir.toString()))
                .isEqualTo(TranscriptReconcilerApplication.EXIT_SOURCE_MISSING);
        assertThat(run("-o", outputDir.toString(), "--file", tempDir.resolve("missing.ttml").toString()))
                .isEqualTo(TranscriptReconcilerApplication.EXIT_SOURCE_MISSING);
        assertThat(outputDir).doesNotExist();
    }

    @Test
    @DisplayName("Should still complete without a library database")
    void shouldRunWithoutDatabase() {
        final int exitCode = run("--ttml-dir", ttmlDir.toString(), "--db", tempDir.resolve("none.sqlite").toString(),
                "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(TranscriptReconcilerApplication.EXIT_OK);
        assertThat(outputDir.resolve("Podcast_42_A1B2C3D4E5F6.txt")).isRegularFile();
    }

    @Test
    @DisplayName("Should search the extracted transcripts")
    void shouldSearchExtractedTranscripts() {
        run("--ttml-dir", ttmlDir.toString(), "--db", database.toString(), "-o", outputDir.toString());
        out.reset();

        final int exitCode = run("search", "NEEDLE", "--dir", outputDir.toString(), "--context", "0");

        assertThat(exitCode).isEqualTo(TranscriptReconcilerApplication.EXIT_OK);
        assertThat(stdout())
                .contains("Found 1 match(es) for: \"NEEDLE\"")
                .contains("Tech_Talk_2001-01-02_Pilot.txt")
                .contains("    The needle is in this episode.");
    }

    @Test
    @DisplayName("Should exit with 1 when the search directory is missing")
    void shouldFailSearchForMissingDirectory() {
        assertThat(run("search", "needle", "--dir", tempDir.resolve("missing").toString()))
                .isEqualTo(TranscriptReconcilerApplication.EXIT_SOURCE_MISSING);
    }

    @Test
    @DisplayName("Should exit with 2 and print usage for invalid arguments")
    void shouldRejectInvalidArguments() {
        assertThat(run("--bogus")).isEqualTo(TranscriptReconcilerApplication.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Unknown option: --bogus").contains("Usage:");
    }

    @Test
    @DisplayName("Should print usage for --help")
    void shouldPrintHelp() {
        assertThat(run("--help")).isEqualTo(TranscriptReconcilerApplication.EXIT_OK);
        assertThat(stdout()).contains("Usage:");
    }

    private int run(final String... args) {
        return TranscriptReconcilerApplication.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private void writeTtml(final String relative, final String text) throws IOException {
        final Path file = ttmlDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, """
                <tt xmlns="http://www.w3.org/ns/ttml"><body><div>
                  <p begin="1.2s"><span>%s</span></p>
                </div></body></tt>
                """.formatted(text));
    }
}
