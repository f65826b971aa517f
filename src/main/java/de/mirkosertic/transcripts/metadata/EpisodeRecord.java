package de.mirkosertic.transcripts.metadata;

import org.jspecify.annotations.Nullable;

/**
 * A single episode as stored in the podcast library.
 * <p>
 * Guids may be missing and are not guaranteed to be unique within a podcast.
 */
public record EpisodeRecord(
        String title,
        /** Seconds since 2001-01-01T00:00:00Z. */
        @Nullable Long publishTime,
        @Nullable String guid
) {

    public static final String UNKNOWN_TITLE = "Unknown Episode";

    /**
     * Stand-in for podcasts that have no episodes in the library at all.
     */
    public static EpisodeRecord placeholder() {
        return new EpisodeRecord(UNKNOWN_TITLE, null, null);
    }

    public boolean hasGuid() {
        return guid != null && !guid.isEmpty();
    }
}
