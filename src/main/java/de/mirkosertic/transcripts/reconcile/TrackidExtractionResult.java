package de.mirkosertic.transcripts.reconcile;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of pulling a trackid out of a transcript filename.
 */
public record TrackidExtractionResult(
        /** The matching token; null when extraction failed. */
        @Nullable String token,
        boolean succeeded,
        /** True when the token was accepted even though it is too short to be a reliable identifier. */
        boolean lowConfidence,
        /** Name of the rule that produced this result. */
        String rule
) {

    public static TrackidExtractionResult success(final String token, final String rule) {
        return new TrackidExtractionResult(token, true, false, rule);
    }

    public static TrackidExtractionResult lowConfidence(final String token, final String rule) {
        return new TrackidExtractionResult(token, true, true, rule);
    }

    public static TrackidExtractionResult failed(final String rule) {
        return new TrackidExtractionResult(null, false, false, rule);
    }
}
