package de.mirkosertic.transcripts.crawler;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the podcast id from the folder layout of the transcript cache, where transcripts
 * live below a directory named like {@code PodcastContent42}. The nearest such ancestor wins.
 */
public class PodcastIdResolver {

    private static final Logger logger = LoggerFactory.getLogger(PodcastIdResolver.class);

    private final Pattern directoryPattern;

    public PodcastIdResolver(final String directoryPrefix) {
        this.directoryPattern = Pattern.compile(Pattern.quote(directoryPrefix) + "(\\d+)");
    }

    /**
     * @return the podcast id, or null if no ancestor directory follows the naming convention
     */
    public @Nullable Long resolve(final Path file) {
        for (Path directory = file.getParent(); directory != null; directory = directory.getParent()) {
            final Path name = directory.getFileName();
            if (name == null) {
                continue;
            }
            final Matcher matcher = directoryPattern.matcher(name.toString());
            if (matcher.matches()) {
                try {
                    return Long.parseLong(matcher.group(1));
                } catch (final NumberFormatException e) {
                    logger.debug("Podcast id in {} is out of range", name);
                }
            }
        }
        logger.debug("No podcast folder above {}", file);
        return null;
    }
}
