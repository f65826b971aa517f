package de.mirkosertic.transcripts;

import de.mirkosertic.transcripts.config.ApplicationConfig;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Parsed command line. Values that were not given stay null and leave the loaded
 * configuration untouched.
 */
public record CommandLineOptions(
        Command command,
        boolean help,
        boolean verbose,
        // extract
        @Nullable Path outputDirectory,
        boolean includeTimestamps,
        @Nullable Path ttmlDirectory,
        @Nullable Path databasePath,
        @Nullable Path singleFile,
        // search
        @Nullable String query,
        @Nullable Path searchDirectory,
        @Nullable Integer contextLines,
        @Nullable Integer limit
) {

    public enum Command {
        EXTRACT,
        SEARCH
    }

    /**
     * @throws IllegalArgumentException on unknown flags, missing values or a missing search query
     */
    public static CommandLineOptions parse(final String[] args) {
        Command command = Command.EXTRACT;
        int start = 0;
        if (args.length > 0 && "extract".equals(args[0])) {
            start = 1;
        } else if (args.length > 0 && "search".equals(args[0])) {
            command = Command.SEARCH;
            start = 1;
        }

        boolean help = false;
        boolean verbose = false;
        Path outputDirectory = null;
        boolean includeTimestamps = false;
        Path ttmlDirectory = null;
        Path databasePath = null;
        Path singleFile = null;
        String query = null;
        Path searchDirectory = null;
        Integer contextLines = null;
        Integer limit = null;

        for (int i = start; i < args.length; i++) {
            final String arg = args[i];
            switch (arg) {
                case "-h", "--help" -> help = true;
                case "-v", "--verbose" -> verbose = true;
                default -> {
                    if (command == Command.EXTRACT) {
                        switch (arg) {
                            case "-o", "--output" -> outputDirectory = Path.of(valueOf(args, ++i, arg));
                            case "--timestamps" -> includeTimestamps = true;
                            case "--ttml-dir" -> ttmlDirectory = Path.of(valueOf(args, ++i, arg));
                            case "--db" -> databasePath = Path.of(valueOf(args, ++i, arg));
                            case "-f", "--file" -> singleFile = Path.of(valueOf(args, ++i, arg));
                            default -> throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                    } else {
                        switch (arg) {
                            case "--dir" -> searchDirectory = Path.of(valueOf(args, ++i, arg));
                            case "--context" -> contextLines = nonNegative(valueOf(args, ++i, arg), arg);
                            case "--limit" -> limit = nonNegative(valueOf(args, ++i, arg), arg);
                            default -> {
                                if (arg.startsWith("-") && arg.length() > 1) {
                                    throw new IllegalArgumentException("Unknown option: " + arg);
                                }
                                if (query != null) {
                                    throw new IllegalArgumentException("Only one search query is allowed, got: " + arg);
                                }
                                query = arg;
                            }
                        }
                    }
                }
            }
        }

        if (command == Command.SEARCH && !help && (query == null || query.isEmpty())) {
            throw new IllegalArgumentException("A non-empty search query is required");
        }

        return new CommandLineOptions(command, help, verbose, outputDirectory, includeTimestamps,
                ttmlDirectory, databasePath, singleFile, query, searchDirectory, contextLines, limit);
    }

    private static String valueOf(final String[] args, final int index, final String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int nonNegative(final String value, final String option) {
        final int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number for " + option + ", got: " + value, e);
        }
        if (parsed < 0) {
            throw new IllegalArgumentException(option + " must not be negative");
        }
        return parsed;
    }

    /**
     * Override the loaded configuration with every flag that was given.
     */
    public void applyTo(final ApplicationConfig config) {
        if (outputDirectory != null) {
            config.setOutputDirectory(outputDirectory);
        }
        if (includeTimestamps) {
            config.setIncludeTimestamps(true);
        }
        if (ttmlDirectory != null) {
            config.setTtmlDirectory(ttmlDirectory);
        }
        if (databasePath != null) {
            config.setDatabasePath(databasePath);
        }
        if (searchDirectory != null) {
            config.setSearchDirectory(searchDirectory);
        }
    }

    public static String usage() {
        return """
                Usage:
                  transcript-reconciler [extract] [options]
                  transcript-reconciler search QUERY [options]

                Extract options:
                  -o, --output DIR     Output directory for transcript text files
                      --timestamps     Prefix every paragraph with [HH:MM:SS]
                      --ttml-dir DIR   Directory holding the TTML transcript cache
                      --db PATH        Podcast library database (MTLibrary.sqlite)
                  -f, --file FILE      Process a single TTML file

                Search options:
                      --dir DIR        Directory containing .txt transcripts
                      --context N      Context lines before/after each match (default: 2)
                      --limit N        Maximum number of matches, 0 = no limit (default: 50)

                Common options:
                  -v, --verbose        Show diagnostic output
                  -h, --help           Show this help
                """;
    }
}
