package de.mirkosertic.transcripts;

import de.mirkosertic.transcripts.config.ApplicationConfig;
import de.mirkosertic.transcripts.config.LoggingConfigurator;
import de.mirkosertic.transcripts.crawler.PodcastIdResolver;
import de.mirkosertic.transcripts.crawler.TranscriptExtractionService;
import de.mirkosertic.transcripts.crawler.TranscriptFileMatcher;
import de.mirkosertic.transcripts.crawler.TranscriptFileScanner;
import de.mirkosertic.transcripts.crawler.TranscriptSourceException;
import de.mirkosertic.transcripts.metadata.MetadataIndex;
import de.mirkosertic.transcripts.metadata.MetadataIndexLoader;
import de.mirkosertic.transcripts.reconcile.EpisodeMatcher;
import de.mirkosertic.transcripts.reconcile.OutputNamer;
import de.mirkosertic.transcripts.reconcile.ReconciliationReporter;
import de.mirkosertic.transcripts.reconcile.TrackidResolver;
import de.mirkosertic.transcripts.search.SearchMatch;
import de.mirkosertic.transcripts.search.SearchResultPrinter;
import de.mirkosertic.transcripts.search.TranscriptSearchService;
import de.mirkosertic.transcripts.transcript.TranscriptWriter;
import de.mirkosertic.transcripts.transcript.TtmlDocumentParser;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Main entry point of the transcript reconciler.
 * <p>
 * {@code extract} (the default command) turns the podcast app's TTML transcript cache into
 * readable text files named after the matching library episodes and writes the reconciliation
 * reports. {@code search} looks for text in the extracted transcripts.
 */
public class TranscriptReconcilerApplication {

    private static final Logger logger = LoggerFactory.getLogger(TranscriptReconcilerApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SOURCE_MISSING = 1;
    static final int EXIT_USAGE = 2;

    private final ApplicationConfig config;
    private final TranscriptFileScanner scanner;
    private final MetadataIndexLoader metadataLoader;
    private final TtmlDocumentParser parser;
    private final TrackidResolver trackidResolver;
    private final PodcastIdResolver podcastIdResolver;
    private final EpisodeMatcher matcher;
    private final OutputNamer namer;
    private final ReconciliationReporter reporter;

    public TranscriptReconcilerApplication(final ApplicationConfig config) {
        this.config = config;

        this.scanner = new TranscriptFileScanner(
                new TranscriptFileMatcher(config.getIncludePatterns(), config.getExcludePatterns()));
        this.metadataLoader = new MetadataIndexLoader();
        this.parser = new TtmlDocumentParser();
        this.trackidResolver = TrackidResolver.withDefaultRules(
                config.getTrackidPrefix(), config.getTrackidConfidentLength());
        this.podcastIdResolver = new PodcastIdResolver(config.getPodcastDirectoryPrefix());
        this.matcher = new EpisodeMatcher(config.getSubstringMinLength());
        this.namer = new OutputNamer(config.getMaxTitleLength());
        this.reporter = new ReconciliationReporter();
    }

    /**
     * Extract all transcripts, or only {@code singleFile} when given.
     *
     * @return the process exit code
     */
    public int extract(final @Nullable Path singleFile) {
        final List<Path> files;
        if (singleFile != null) {
            if (!Files.isRegularFile(singleFile)) {
                logger.error("Error: File not found at {}", singleFile);
                return EXIT_SOURCE_MISSING;
            }
            files = List.of(singleFile);
        } else {
            logger.info("Scanning TTML files in {}", config.getTtmlDirectory());
            try {
                files = scanner.discover(config.getTtmlDirectory());
            } catch (final TranscriptSourceException e) {
                logger.error(e.getMessage());
                logger.debug("Transcript source failure", e);
                return EXIT_SOURCE_MISSING;
            }
            if (files.isEmpty()) {
                logger.warn("No TTML files found in {}", config.getTtmlDirectory());
            }
        }

        logger.info("Loading podcast metadata from {}", config.getDatabasePath());
        final MetadataIndex index = metadataLoader.load(config.getDatabasePath());

        final TranscriptExtractionService extractionService = new TranscriptExtractionService(
                parser,
                trackidResolver,
                podcastIdResolver,
                matcher,
                namer,
                new TranscriptWriter(config.isIncludeTimestamps()),
                reporter,
                index);

        try {
            extractionService.extractAll(files, config.getOutputDirectory(), config.getReportsDirectory());
        } catch (final IOException e) {
            logger.error("Error: Cannot create output directory {}", config.getOutputDirectory(), e);
            return EXIT_SOURCE_MISSING;
        }

        logger.info("Done! Transcripts saved to: {}", config.getOutputDirectory().toAbsolutePath());
        return EXIT_OK;
    }

    /**
     * Search the extracted transcripts and print the matches to {@code out}.
     *
     * @return the process exit code
     */
    public int search(final String query, final int contextLines, final int limit, final PrintStream out) {
        final Path directory = config.getSearchDirectory();
        // Reports of an extraction into the searched directory are not transcripts
        final TranscriptSearchService searchService = new TranscriptSearchService(List.of(
                config.getReportsDirectory(),
                directory.resolve(ApplicationConfig.REPORTS_FOLDER)));
        try {
            final List<SearchMatch> matches = searchService.search(directory, query, contextLines, limit);
            new SearchResultPrinter(out).print(matches, query, contextLines);
            return EXIT_OK;
        } catch (final TranscriptSourceException e) {
            logger.error(e.getMessage());
            logger.error("Run the extract command first, or adjust --dir.");
            return EXIT_SOURCE_MISSING;
        } catch (final IOException e) {
            logger.error("Error searching transcripts in {}", directory, e);
            return EXIT_SOURCE_MISSING;
        }
    }

    /**
     * Parse the command line, load the configuration and run the selected command.
     */
    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        final CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (final IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println();
            err.print(CommandLineOptions.usage());
            return EXIT_USAGE;
        }

        if (options.help()) {
            out.print(CommandLineOptions.usage());
            return EXIT_OK;
        }

        // Configure logging FIRST, before any other code that might log
        LoggingConfigurator.configure(options.verbose());

        final ApplicationConfig config = ApplicationConfig.load();
        options.applyTo(config);

        final TranscriptReconcilerApplication app = new TranscriptReconcilerApplication(config);
        return switch (options.command()) {
            case EXTRACT -> app.extract(options.singleFile());
            case SEARCH -> app.search(
                    options.query(),
                    options.contextLines() != null ? options.contextLines() : config.getSearchContextLines(),
                    options.limit() != null ? options.limit() : config.getSearchLimit(),
                    out);
        };
    }

    public static void main(final String[] args) {
        System.exit(run(args, System.out, System.err));
    }
}
