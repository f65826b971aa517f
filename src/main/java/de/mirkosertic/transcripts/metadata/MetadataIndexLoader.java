package de.mirkosertic.transcripts.metadata;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Reads the podcast library (a Core Data SQLite store) into a {@link MetadataIndex}.
 * <p>
 * The store is opened read-only. A missing or unreadable store is not fatal: the loader
 * logs a warning and returns an empty index, and every transcript falls back to
 * filename-derived naming.
 */
public class MetadataIndexLoader {

    private static final Logger logger = LoggerFactory.getLogger(MetadataIndexLoader.class);

    static final String PODCAST_QUERY = """
            SELECT Z_PK, ZTITLE, ZAUTHOR
            FROM ZMTPODCAST
            ORDER BY Z_PK
            """;

    static final String EPISODE_QUERY = """
            SELECT ZPODCAST, ZTITLE, ZPUBDATE, ZGUID
            FROM ZMTEPISODE
            ORDER BY Z_PK
            """;

    static final String UNKNOWN_PODCAST = "Unknown Podcast";

    /**
     * Load the index from the given store.
     *
     * @param databasePath path to the SQLite file
     * @return the populated index, or {@link MetadataIndex#empty()} if the store is unavailable
     */
    public MetadataIndex load(final Path databasePath) {
        if (!Files.isRegularFile(databasePath)) {
            logger.warn("Warning: Database not found at {}", databasePath);
            logger.warn("Will use generic filenames instead.");
            return MetadataIndex.empty();
        }

        final SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setReadOnly(true);

        final MetadataIndex.Builder builder = MetadataIndex.builder();
        try (final Connection connection = DriverManager.getConnection(
                "jdbc:sqlite:" + databasePath.toAbsolutePath(), sqliteConfig.toProperties())) {

            loadPodcasts(connection, builder);
            loadEpisodes(connection, builder);

        } catch (final SQLException e) {
            logger.warn("Warning: Could not load metadata from database: {}", e.getMessage());
            logger.debug("Metadata load failure", e);
            logger.warn("Will use generic filenames instead.");
            return MetadataIndex.empty();
        }

        final MetadataIndex index = builder.build();
        if (index.isEmpty()) {
            logger.warn("Warning: Database at {} holds no podcasts or episodes", databasePath);
            logger.warn("Will use generic filenames instead.");
            return index;
        }
        logger.info("Loaded metadata for {} podcasts and {} episodes", index.podcastCount(), index.episodeCount());
        return index;
    }

    private void loadPodcasts(final Connection connection, final MetadataIndex.Builder builder) throws SQLException {
        try (final PreparedStatement statement = connection.prepareStatement(PODCAST_QUERY);
             final ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                final long podcastId = rs.getLong(1);
                final String title = rs.getString(2);
                final String author = rs.getString(3);
                builder.addPodcast(podcastId, new PodcastRecord(
                        title == null || title.isBlank() ? UNKNOWN_PODCAST : title,
                        author == null ? "" : author));
            }
        }
    }

    private void loadEpisodes(final Connection connection, final MetadataIndex.Builder builder) throws SQLException {
        try (final PreparedStatement statement = connection.prepareStatement(EPISODE_QUERY);
             final ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                final long podcastId = rs.getLong(1);
                final Long owner = rs.wasNull() ? null : podcastId;
                final String title = rs.getString(2);
                final Long publishTime = toSeconds(rs.getObject(3));
                final String guid = rs.getString(4);

                builder.addEpisode(owner, new EpisodeRecord(
                        title == null || title.isBlank() ? EpisodeRecord.UNKNOWN_TITLE : title,
                        publishTime,
                        guid == null || guid.isEmpty() ? null : guid));
            }
        }
    }

    /**
     * Core Data stores dates as REAL seconds; SQLite's loose typing means text can show up too.
     */
    static @Nullable Long toSeconds(final @Nullable Object value) {
        if (value instanceof Number number) {
            final double seconds = number.doubleValue();
            if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                return null;
            }
            return (long) Math.floor(seconds);
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return (long) Math.floor(Double.parseDouble(text.trim()));
            } catch (final NumberFormatException e) {
                logger.debug("Ignoring non-numeric publish date '{}'", text);
                return null;
            }
        }
        return null;
    }
}
