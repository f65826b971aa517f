package de.mirkosertic.transcripts.reconcile;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Computes what could not be reconciled after a batch and writes the audit artifacts.
 * <p>
 * Both unmatched sets are set differences against the <em>matched</em> trackids:
 * <ul>
 *   <li>unmatched transcripts = transcript trackids - matched trackids</li>
 *   <li>unmatched database entries = library guids - matched trackids</li>
 * </ul>
 * A library entry only counts as covered when a transcript was matched back to it under
 * the same token; a file on disk that merely shares the token is not enough.
 * <p>
 * Each artifact is written independently. A failure is logged and the remaining
 * artifacts are still produced.
 */
public class ReconciliationReporter {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationReporter.class);

    public static final String MAPPING_FILE = "transcript_mapping.csv";
    public static final String UNMATCHED_TRANSCRIPTS_FILE = "unmatched_transcripts.txt";
    public static final String UNMATCHED_DB_ENTRIES_FILE = "unmatched_db_entries.txt";
    public static final String FAILED_PARSES_FILE = "failed_trackid_parses.txt";
    public static final String DOCUMENT_FAILURES_FILE = "document_failures.txt";
    public static final String LOW_CONFIDENCE_FILE = "low_confidence_trackids.txt";
    public static final String SUMMARY_FILE = "reconciliation_summary.txt";

    static final String[] MAPPING_COLUMNS = {
            "transcript_file", "trackid", "output_file", "matched",
            "podcast_title", "episode_title", "pub_date", "author"
    };

    static final String SEPARATOR = "=".repeat(70);

    /**
     * Compute the unmatched sets and totals without touching the filesystem.
     */
    public ReconciliationReport reconcile(final ReconciliationState state) {
        final SortedSet<String> unmatchedTranscripts = new TreeSet<>(state.transcriptTrackids());
        unmatchedTranscripts.removeAll(state.matchedTrackids());

        final SortedSet<String> unmatchedDatabaseEntries = new TreeSet<>(state.databaseGuids());
        unmatchedDatabaseEntries.removeAll(state.matchedTrackids());

        final List<MappingRow> rows = state.mappingRows();
        final int matched = (int) rows.stream().filter(MappingRow::matched).count();

        final ReconciliationSummary summary = new ReconciliationSummary(
                state.discoveredFiles(),
                rows.size(),
                matched,
                rows.size() - matched,
                state.failedParses().size(),
                unmatchedTranscripts.size(),
                unmatchedDatabaseEntries.size(),
                state.emptyDocuments().size(),
                state.unreadableDocuments().size(),
                state.writeFailures().size(),
                state.lowConfidenceFiles().size(),
                Map.copyOf(state.matchesByTier()));

        return new ReconciliationReport(unmatchedTranscripts, unmatchedDatabaseEntries, summary);
    }

    /**
     * Compute the report and write all artifacts into {@code reportsDirectory}.
     */
    public ReconciliationReport writeReports(final ReconciliationState state, final Path reportsDirectory) {
        final ReconciliationReport report = reconcile(state);

        try {
            Files.createDirectories(reportsDirectory);
        } catch (final IOException e) {
            logger.error("Cannot create reports directory {}", reportsDirectory, e);
            logSummary(report.summary());
            return report;
        }

        final Path mapping = reportsDirectory.resolve(MAPPING_FILE);
        writeArtifact(mapping, () -> writeMapping(state, mapping));

        final Path unmatchedTranscripts = reportsDirectory.resolve(UNMATCHED_TRANSCRIPTS_FILE);
        writeArtifact(unmatchedTranscripts, () -> writeLog(unmatchedTranscripts,
                "Transcripts without a matching library episode",
                report.unmatchedTranscripts().size(),
                unmatchedTranscriptLines(state, report.unmatchedTranscripts())));

        final Path unmatchedEntries = reportsDirectory.resolve(UNMATCHED_DB_ENTRIES_FILE);
        writeArtifact(unmatchedEntries, () -> writeLog(unmatchedEntries,
                "Library episodes without a matched transcript",
                report.unmatchedDatabaseEntries().size(),
                new ArrayList<>(report.unmatchedDatabaseEntries())));

        final Path failedParses = reportsDirectory.resolve(FAILED_PARSES_FILE);
        writeArtifact(failedParses, () -> writeLog(failedParses,
                "Transcript files without an extractable trackid",
                state.failedParses().size(),
                state.failedParses()));

        final Path documentFailures = reportsDirectory.resolve(DOCUMENT_FAILURES_FILE);
        final List<String> failureLines = documentFailureLines(state);
        writeArtifact(documentFailures, () -> writeLog(documentFailures,
                "Transcript files skipped or not written",
                failureLines.size(),
                failureLines));

        final Path lowConfidence = reportsDirectory.resolve(LOW_CONFIDENCE_FILE);
        writeArtifact(lowConfidence, () -> writeLog(lowConfidence,
                "Short trackids accepted with low confidence",
                state.lowConfidenceFiles().size(),
                state.lowConfidenceFiles().stream().sorted().toList()));

        final Path summary = reportsDirectory.resolve(SUMMARY_FILE);
        writeArtifact(summary, () -> writeLog(summary,
                "Reconciliation summary",
                report.summary().discoveredFiles(),
                report.summary().toLines()));

        logSummary(report.summary());
        logger.info("Reports saved to: {}", reportsDirectory.toAbsolutePath());
        return report;
    }

    @FunctionalInterface
    private interface ArtifactWriter {
        void write() throws IOException;
    }

    private void writeArtifact(final Path target, final ArtifactWriter writer) {
        try {
            writer.write();
            logger.debug("Wrote {}", target);
        } catch (final IOException e) {
            logger.error("Failed to write report {}", target, e);
        }
    }

    private void writeMapping(final ReconciliationState state, final Path target) throws IOException {
        final CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(MAPPING_COLUMNS)
                .build();
        try (final BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             final CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (final MappingRow row : state.mappingRows()) {
                printer.printRecord(
                        row.transcriptFile(),
                        row.trackid(),
                        row.outputFile(),
                        row.matched(),
                        row.podcastTitle(),
                        row.episodeTitle(),
                        row.pubDate(),
                        row.author());
            }
        }
    }

    private static List<String> unmatchedTranscriptLines(final ReconciliationState state,
                                                         final SortedSet<String> unmatchedTrackids) {
        final List<String> lines = new ArrayList<>();
        for (final String trackid : unmatchedTrackids) {
            for (final Path file : state.filesFor(trackid)) {
                lines.add("File: " + file.getFileName());
                lines.add("Trackid: " + trackid);
                lines.add("Path: " + file.toAbsolutePath());
                lines.add("");
            }
        }
        return lines;
    }

    /**
     * One line per affected file, prefixed with what went wrong, sorted by path.
     */
    static List<String> documentFailureLines(final ReconciliationState state) {
        final List<String> lines = new ArrayList<>();
        lines.addAll(prefixed("No text: ", state.emptyDocuments()));
        lines.addAll(prefixed("Unreadable: ", state.unreadableDocuments()));
        lines.addAll(prefixed("Write failed: ", state.writeFailures()));
        return lines;
    }

    private static List<String> prefixed(final String reason, final List<Path> files) {
        return files.stream()
                .map(file -> file.toAbsolutePath().toString())
                .sorted()
                .map(path -> reason + path)
                .toList();
    }

    /**
     * Plain text log: title, total, separator, body.
     */
    static void writeLog(final Path target, final String title, final int total, final List<String> body)
            throws IOException {
        final List<String> lines = new ArrayList<>(body.size() + 4);
        lines.add(title);
        lines.add("Total: " + total);
        lines.add(SEPARATOR);
        lines.addAll(body);
        Files.write(target, lines, StandardCharsets.UTF_8);
    }

    private static void logSummary(final ReconciliationSummary summary) {
        logger.info("");
        logger.info("Reconciliation summary");
        logger.info(SEPARATOR);
        for (final String line : summary.toLines()) {
            logger.info(line);
        }
    }
}
