package de.mirkosertic.transcripts.crawler;

import java.io.IOException;

/**
 * The transcript source cannot be located or walked at all. Aborts the run.
 */
public class TranscriptSourceException extends IOException {

    public TranscriptSourceException(final String message) {
        super(message);
    }

    public TranscriptSourceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
