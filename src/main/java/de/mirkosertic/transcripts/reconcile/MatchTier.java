package de.mirkosertic.transcripts.reconcile;

/**
 * How an episode was selected, from most to least confident.
 */
public enum MatchTier {
    /** The episode guid equals the trackid. */
    EXACT,
    /** One of guid and trackid contains the other. */
    SUBSTRING,
    /** No guid matched; the most recently published episode was taken. */
    RECENCY,
    /** The podcast has no episodes; a synthetic "Unknown Episode" stands in. */
    PLACEHOLDER
}
