package de.mirkosertic.transcripts.reconcile;

import de.mirkosertic.transcripts.metadata.EpisodeRecord;
import de.mirkosertic.transcripts.metadata.PodcastRecord;

public record MatchResult(
        PodcastRecord podcast,
        EpisodeRecord episode,
        MatchTier tier
) {
}
