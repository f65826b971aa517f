package de.mirkosertic.transcripts.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Discovers transcript documents below the source directory.
 * <p>
 * Unreadable subdirectories are logged and skipped. Only a missing or unreadable source
 * root is reported as {@link TranscriptSourceException}.
 */
public class TranscriptFileScanner {

    private static final Logger logger = LoggerFactory.getLogger(TranscriptFileScanner.class);

    private final TranscriptFileMatcher matcher;

    public TranscriptFileScanner(final TranscriptFileMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * @return matching files sorted by path
     * @throws TranscriptSourceException if the source directory is missing or cannot be walked
     */
    public List<Path> discover(final Path root) throws TranscriptSourceException {
        if (!Files.isDirectory(root)) {
            throw new TranscriptSourceException("Error: TTML directory not found at " + root);
        }
        if (!Files.isReadable(root)) {
            throw new TranscriptSourceException("Error: TTML directory is not readable: " + root);
        }

        final List<Path> result = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && matcher.shouldInclude(root, file)) {
                        result.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(final Path file, final IOException e) {
                    logger.warn("Skipping unreadable path {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (final IOException e) {
            throw new TranscriptSourceException("Error walking TTML directory " + root, e);
        }

        Collections.sort(result);
        logger.debug("Discovered {} transcript files below {}", result.size(), root);
        return result;
    }
}
