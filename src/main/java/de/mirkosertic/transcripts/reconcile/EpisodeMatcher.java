package de.mirkosertic.transcripts.reconcile;

import de.mirkosertic.transcripts.metadata.EpisodeRecord;
import de.mirkosertic.transcripts.metadata.MetadataIndex;
import de.mirkosertic.transcripts.metadata.PodcastRecord;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Selects the episode a transcript belongs to.
 * <p>
 * The podcast is fixed by the id parsed from the transcript's folder; within it the
 * episodes are tried in three tiers, first hit wins:
 * <ol>
 *   <li>exact guid equality,</li>
 *   <li>substring containment in either direction, only when the shorter string is longer
 *       than the configured minimum,</li>
 *   <li>the most recently published episode.</li>
 * </ol>
 * Within tiers 1 and 2 the first episode in library order wins.
 * <p>
 * Tier 3 also answers for podcasts whose episodes carry no usable guid at all. Such matches
 * may hide gaps in the library data; they are counted separately in the summary.
 */
public class EpisodeMatcher {

    private static final Logger logger = LoggerFactory.getLogger(EpisodeMatcher.class);

    private final int substringMinLength;

    /**
     * @param substringMinLength substring matching applies only when the shorter of guid and
     *                           trackid is strictly longer than this
     */
    public EpisodeMatcher(final int substringMinLength) {
        this.substringMinLength = substringMinLength;
    }

    /**
     * @param podcastId podcast id parsed from the transcript path, null if none was found
     * @param trackid   trackid extracted from the filename, null if extraction failed
     * @param index     the library
     * @return the match, or null when the podcast id is absent or unknown to the library
     */
    public @Nullable MatchResult match(final @Nullable Long podcastId,
                                       final @Nullable String trackid,
                                       final MetadataIndex index) {
        if (podcastId == null) {
            return null;
        }
        final PodcastRecord podcast = index.podcast(podcastId);
        if (podcast == null) {
            logger.debug("Podcast {} is not in the library", podcastId);
            return null;
        }

        final List<EpisodeRecord> episodes = index.episodesOf(podcastId);
        if (episodes.isEmpty()) {
            logger.debug("Podcast {} has no episodes, using placeholder", podcastId);
            return new MatchResult(podcast, EpisodeRecord.placeholder(), MatchTier.PLACEHOLDER);
        }

        if (trackid != null && !trackid.isEmpty()) {
            final EpisodeRecord exact = findExact(episodes, trackid);
            if (exact != null) {
                logger.debug("Trackid '{}' matched exactly in podcast {}", trackid, podcastId);
                return new MatchResult(podcast, exact, MatchTier.EXACT);
            }

            final EpisodeRecord partial = findSubstring(episodes, trackid);
            if (partial != null) {
                logger.debug("Trackid '{}' matched guid '{}' by containment in podcast {}",
                        trackid, partial.guid(), podcastId);
                return new MatchResult(podcast, partial, MatchTier.SUBSTRING);
            }
        }

        final EpisodeRecord latest = findMostRecent(episodes);
        logger.debug("No guid matched trackid '{}' in podcast {}, falling back to '{}'",
                trackid, podcastId, latest.title());
        return new MatchResult(podcast, latest, MatchTier.RECENCY);
    }

    private static @Nullable EpisodeRecord findExact(final List<EpisodeRecord> episodes, final String trackid) {
        for (final EpisodeRecord episode : episodes) {
            if (trackid.equals(episode.guid())) {
                return episode;
            }
        }
        return null;
    }

    private @Nullable EpisodeRecord findSubstring(final List<EpisodeRecord> episodes, final String trackid) {
        for (final EpisodeRecord episode : episodes) {
            if (!episode.hasGuid()) {
                continue;
            }
            final String guid = episode.guid();
            if (Math.min(guid.length(), trackid.length()) <= substringMinLength) {
                continue;
            }
            if (guid.contains(trackid) || trackid.contains(guid)) {
                return episode;
            }
        }
        return null;
    }

    /**
     * Latest publish time wins, ties go to the earlier episode. Without any publish time
     * the first episode is taken.
     */
    static EpisodeRecord findMostRecent(final List<EpisodeRecord> episodes) {
        EpisodeRecord latest = null;
        for (final EpisodeRecord episode : episodes) {
            final Long publishTime = episode.publishTime();
            if (publishTime == null) {
                continue;
            }
            if (latest == null || publishTime > latest.publishTime()) {
                latest = episode;
            }
        }
        return latest != null ? latest : episodes.get(0);
    }
}
