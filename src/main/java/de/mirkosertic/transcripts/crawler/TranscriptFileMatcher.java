package de.mirkosertic.transcripts.crawler;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Decides which files below the transcript source are transcript documents.
 * Include globs are matched against the filename, exclude globs against the path
 * relative to the source root. Hidden files (including macOS {@code ._} resource forks)
 * are never included.
 */
public class TranscriptFileMatcher {

    private final List<PathMatcher> includeMatchers;
    private final List<PathMatcher> excludeMatchers;

    public TranscriptFileMatcher(final List<String> includePatterns, final List<String> excludePatterns) {
        this.includeMatchers = includePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
        this.excludeMatchers = excludePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    public boolean shouldInclude(final Path root, final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null || fileName.toString().startsWith(".")) {
            return false;
        }

        final Path relative = file.startsWith(root) ? root.relativize(file) : file;
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(relative)) {
                return false;
            }
        }

        if (includeMatchers.isEmpty()) {
            return true;
        }
        for (final PathMatcher includeMatcher : includeMatchers) {
            if (includeMatcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }
}
