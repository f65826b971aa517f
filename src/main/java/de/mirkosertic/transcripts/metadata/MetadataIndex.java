package de.mirkosertic.transcripts.metadata;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of the podcast library, built once before any transcript is processed.
 * <p>
 * Episodes live in one list, grouped so that every podcast owns a contiguous slice of it.
 * Within a slice the library's insertion order is preserved, which is the order the
 * matcher walks when it looks for the first applicable episode. Episodes carry no
 * reference back to their podcast.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public final class MetadataIndex {

    private static final MetadataIndex EMPTY = new MetadataIndex(Map.of(), List.of(), Map.of(), Set.of());

    private final Map<Long, PodcastRecord> podcasts;
    private final List<EpisodeRecord> episodes;
    private final Map<Long, Slice> slices;
    private final Set<String> guids;

    private record Slice(int from, int to) {
    }

    private MetadataIndex(final Map<Long, PodcastRecord> podcasts,
                          final List<EpisodeRecord> episodes,
                          final Map<Long, Slice> slices,
                          final Set<String> guids) {
        this.podcasts = podcasts;
        this.episodes = episodes;
        this.slices = slices;
        this.guids = guids;
    }

    /**
     * The index used when the library database is unavailable.
     */
    public static MetadataIndex empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public @Nullable PodcastRecord podcast(final long podcastId) {
        return podcasts.get(podcastId);
    }

    /**
     * @return the podcast's episodes in library order, empty if it has none
     */
    public List<EpisodeRecord> episodesOf(final long podcastId) {
        final Slice slice = slices.get(podcastId);
        if (slice == null) {
            return List.of();
        }
        return episodes.subList(slice.from(), slice.to());
    }

    /**
     * @return every non-empty episode guid in the library, including episodes of unknown podcasts
     */
    public Set<String> guids() {
        return guids;
    }

    public int podcastCount() {
        return podcasts.size();
    }

    public int episodeCount() {
        return episodes.size();
    }

    public boolean isEmpty() {
        return podcasts.isEmpty() && episodes.isEmpty() && guids.isEmpty();
    }

    public static final class Builder {

        private final Map<Long, PodcastRecord> podcasts = new HashMap<>();
        private final Map<Long, List<EpisodeRecord>> episodesByPodcast = new LinkedHashMap<>();
        private final Set<String> guids = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder addPodcast(final long podcastId, final PodcastRecord podcast) {
            podcasts.put(podcastId, podcast);
            return this;
        }

        /**
         * @param podcastId owning podcast; null for episodes the library no longer links to a show,
         *                  which only contribute their guid
         */
        public Builder addEpisode(final @Nullable Long podcastId, final EpisodeRecord episode) {
            if (podcastId != null) {
                episodesByPodcast.computeIfAbsent(podcastId, id -> new ArrayList<>()).add(episode);
            }
            if (episode.hasGuid()) {
                guids.add(episode.guid());
            }
            return this;
        }

        public MetadataIndex build() {
            final List<EpisodeRecord> arena = new ArrayList<>();
            final Map<Long, Slice> slices = new HashMap<>();

            for (final Map.Entry<Long, List<EpisodeRecord>> entry : episodesByPodcast.entrySet()) {
                final int from = arena.size();
                arena.addAll(entry.getValue());
                slices.put(entry.getKey(), new Slice(from, arena.size()));
            }

            return new MetadataIndex(
                    Map.copyOf(podcasts),
                    Collections.unmodifiableList(arena),
                    Map.copyOf(slices),
                    Collections.unmodifiableSet(new LinkedHashSet<>(guids)));
        }
    }
}
