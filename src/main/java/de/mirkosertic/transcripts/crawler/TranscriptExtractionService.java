package de.mirkosertic.transcripts.crawler;

import de.mirkosertic.transcripts.metadata.MetadataIndex;
import de.mirkosertic.transcripts.reconcile.EpisodeMatcher;
import de.mirkosertic.transcripts.reconcile.MappingRow;
import de.mirkosertic.transcripts.reconcile.MatchResult;
import de.mirkosertic.transcripts.reconcile.OutputNamer;
import de.mirkosertic.transcripts.reconcile.ReconciliationReport;
import de.mirkosertic.transcripts.reconcile.ReconciliationReporter;
import de.mirkosertic.transcripts.reconcile.ReconciliationState;
import de.mirkosertic.transcripts.reconcile.TrackidExtractionResult;
import de.mirkosertic.transcripts.reconcile.TrackidResolver;
import de.mirkosertic.transcripts.transcript.TranscriptSegment;
import de.mirkosertic.transcripts.transcript.TranscriptWriter;
import de.mirkosertic.transcripts.transcript.TtmlDocumentParser;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one extraction batch: every transcript file is parsed, matched against the library,
 * written under a descriptive name and recorded in the batch state. The reports are written
 * once all files have been processed.
 * <p>
 * Files are processed one at a time. A failure while handling one file is logged and
 * recorded and never stops the batch.
 */
public class TranscriptExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(TranscriptExtractionService.class);

    private final TtmlDocumentParser parser;
    private final TrackidResolver trackidResolver;
    private final PodcastIdResolver podcastIdResolver;
    private final EpisodeMatcher matcher;
    private final OutputNamer namer;
    private final TranscriptWriter writer;
    private final ReconciliationReporter reporter;
    private final MetadataIndex index;

    public TranscriptExtractionService(final TtmlDocumentParser parser,
                                       final TrackidResolver trackidResolver,
                                       final PodcastIdResolver podcastIdResolver,
                                       final EpisodeMatcher matcher,
                                       final OutputNamer namer,
                                       final TranscriptWriter writer,
                                       final ReconciliationReporter reporter,
                                       final MetadataIndex index) {
        this.parser = parser;
        this.trackidResolver = trackidResolver;
        this.podcastIdResolver = podcastIdResolver;
        this.matcher = matcher;
        this.namer = namer;
        this.writer = writer;
        this.reporter = reporter;
        this.index = index;
    }

    /**
     * Process all given files and write the reports.
     *
     * @throws IOException if the output directory cannot be created
     */
    public ReconciliationReport extractAll(final List<Path> files,
                                           final Path outputDirectory,
                                           final Path reportsDirectory) throws IOException {
        Files.createDirectories(outputDirectory);

        final ReconciliationState state = new ReconciliationState();
        state.recordDiscovered(files.size());
        state.recordDatabaseGuids(index.guids());

        logger.info("Found {} TTML files", files.size());
        logger.info("Output directory: {}", outputDirectory.toAbsolutePath());

        for (final Path file : files) {
            try {
                processFile(file, outputDirectory, state);
            } catch (final IOException | RuntimeException e) {
                logger.warn("Error processing {}: {}", file.getFileName(), e.getMessage());
                logger.debug("Failure details for {}", file, e);
                state.recordUnreadableDocument(file);
            }
        }

        return reporter.writeReports(state, reportsDirectory);
    }

    /**
     * Handle one transcript file. Parse failures propagate to the caller.
     */
    void processFile(final Path file, final Path outputDirectory, final ReconciliationState state)
            throws IOException {
        final List<TranscriptSegment> segments = parser.parse(file);
        if (segments.isEmpty()) {
            logger.warn("No content extracted from {}", file.getFileName());
            state.recordEmptyDocument(file);
            return;
        }

        final String stem = TrackidResolver.stemOf(file.getFileName().toString());
        final Long podcastId = podcastIdResolver.resolve(file);
        final TrackidExtractionResult extraction = trackidResolver.resolve(file, state);

        MatchResult match = null;
        if (extraction.succeeded() && extraction.token() != null) {
            final String trackid = extraction.token();
            state.recordTranscriptTrackid(trackid, file);
            match = matcher.match(podcastId, trackid, index);
            if (match != null) {
                state.recordMatch(trackid, match.tier());
            }
        }

        final Path output = namer.name(outputDirectory, match, podcastId, stem);
        final Path written = write(file, output, segments, match, state);

        final String trackid = extraction.token() != null ? extraction.token() : stem;
        state.recordMapping(MappingRow.of(file, trackid, written, match));
    }

    private @Nullable Path write(final Path source,
                                 final Path output,
                                 final List<TranscriptSegment> segments,
                                 final @Nullable MatchResult match,
                                 final ReconciliationState state) {
        try {
            writer.write(output, segments, match);
            logger.info("Saved: {}", output.getFileName());
            return output;
        } catch (final IOException e) {
            logger.error("Could not write {} for {}", output, source.getFileName(), e);
            state.recordWriteFailure(source);
            return null;
        }
    }
}
