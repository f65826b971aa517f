package de.mirkosertic.transcripts.search;

import de.mirkosertic.transcripts.crawler.TranscriptSourceException;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TopFieldDocs;
import org.apache.lucene.search.WildcardQuery;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.BytesRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Case-insensitive substring search over the extracted transcript text files.
 * <p>
 * Every line of every {@code .txt} file below the search directory becomes one document of a
 * throwaway in-memory index. The lower-cased line is indexed as a single keyword term and
 * matched with a {@code *query*} wildcard; path and line number doc values give the result order.
 * Lines longer than a Lucene term allows are indexed as overlapping chunks.
 */
public class TranscriptSearchService {

    private static final Logger logger = LoggerFactory.getLogger(TranscriptSearchService.class);

    static final String TEXT_FIELD = "text";
    static final String PATH_FIELD = "path";
    static final String LINE_FIELD = "line";

    // Keeps every chunk well below IndexWriter.MAX_TERM_LENGTH bytes in UTF-8
    static final int CHUNK_LENGTH = 8000;

    private static final String TEXT_EXTENSION = ".txt";

    private final List<Path> excludedDirectories;

    public TranscriptSearchService() {
        this(List.of());
    }

    /**
     * @param excludedDirectories directories whose files are never searched, such as the reports folder
     */
    public TranscriptSearchService(final List<Path> excludedDirectories) {
        this.excludedDirectories = excludedDirectories.stream()
                .map(directory -> directory.toAbsolutePath().normalize())
                .toList();
    }

    /**
     * @param baseDirectory directory holding the transcript text files, searched recursively
     * @param query         substring to look for, case-insensitive
     * @param contextLines  lines to include before and after each match
     * @param limit         maximum number of matches, 0 for no limit
     * @return matches ordered by file path, then line number
     * @throws TranscriptSourceException if the directory does not exist
     */
    public List<SearchMatch> search(final Path baseDirectory,
                                    final String query,
                                    final int contextLines,
                                    final int limit) throws IOException {
        if (!Files.isDirectory(baseDirectory)) {
            throw new TranscriptSourceException("Error: transcripts directory not found at: " + baseDirectory);
        }
        if (query.isEmpty()) {
            throw new IllegalArgumentException("Search query must not be empty");
        }

        final List<Path> files = listTextFiles(baseDirectory);
        final Map<String, List<String>> linesByPath = new HashMap<>();
        final String needle = query.toLowerCase(Locale.ROOT);

        try (final Directory directory = new ByteBuffersDirectory()) {
            int documents = 0;
            try (final IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig())) {
                for (final Path file : files) {
                    final List<String> lines;
                    try {
                        lines = readLines(file);
                    } catch (final IOException e) {
                        logger.warn("Skipping unreadable transcript {}: {}", file, e.getMessage());
                        continue;
                    }
                    final String path = file.toString();
                    linesByPath.put(path, lines);
                    for (int i = 0; i < lines.size(); i++) {
                        for (final String chunk : chunks(lines.get(i).toLowerCase(Locale.ROOT), needle.length())) {
                            writer.addDocument(lineDocument(path, i, chunk));
                            documents++;
                        }
                    }
                }
                writer.commit();
            }
            logger.debug("Indexed {} lines from {} files below {}", documents, files.size(), baseDirectory);
            if (documents == 0) {
                return List.of();
            }

            try (final DirectoryReader reader = DirectoryReader.open(directory)) {
                final IndexSearcher searcher = new IndexSearcher(reader);
                final Sort sort = new Sort(
                        new SortField(PATH_FIELD, SortField.Type.STRING),
                        new SortField(LINE_FIELD, SortField.Type.LONG));
                final WildcardQuery wildcard = new WildcardQuery(
                        new Term(TEXT_FIELD, "*" + escapeWildcard(needle) + "*"));

                final TopFieldDocs topDocs = searcher.search(wildcard, reader.maxDoc(), sort);
                final StoredFields storedFields = searcher.storedFields();

                final List<SearchMatch> matches = new ArrayList<>();
                String previousPath = null;
                int previousLine = -1;
                for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                    final Document doc = storedFields.document(scoreDoc.doc);
                    final String path = doc.get(PATH_FIELD);
                    final int line = doc.getField(LINE_FIELD).numericValue().intValue();
                    if (path.equals(previousPath) && line == previousLine) {
                        // another chunk of a line that already matched
                        continue;
                    }
                    previousPath = path;
                    previousLine = line;

                    matches.add(new SearchMatch(Path.of(path), line + 1,
                            contextOf(linesByPath.get(path), line, contextLines)));
                    if (limit > 0 && matches.size() >= limit) {
                        break;
                    }
                }
                return matches;
            }
        }
    }

    private static Document lineDocument(final String path, final int lineIndex, final String text) {
        final Document doc = new Document();
        doc.add(new StringField(TEXT_FIELD, text, Field.Store.NO));
        doc.add(new SortedDocValuesField(PATH_FIELD, new BytesRef(path)));
        doc.add(new StoredField(PATH_FIELD, path));
        doc.add(new NumericDocValuesField(LINE_FIELD, lineIndex));
        doc.add(new StoredField(LINE_FIELD, lineIndex));
        return doc;
    }

    /**
     * Split a long line into chunks that overlap by {@code queryLength - 1} characters, so any
     * occurrence of the query lies completely within at least one chunk.
     */
    static List<String> chunks(final String line, final int queryLength) {
        if (line.length() <= CHUNK_LENGTH) {
            return List.of(line);
        }
        final int step = Math.max(1, CHUNK_LENGTH - Math.max(0, queryLength - 1));
        final List<String> result = new ArrayList<>();
        for (int start = 0; start < line.length(); start += step) {
            final int end = Math.min(line.length(), start + CHUNK_LENGTH);
            result.add(line.substring(start, end));
            if (end == line.length()) {
                break;
            }
        }
        return result;
    }

    static String escapeWildcard(final String text) {
        final StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == WildcardQuery.WILDCARD_STRING || c == WildcardQuery.WILDCARD_CHAR
                    || c == WildcardQuery.WILDCARD_ESCAPE) {
                escaped.append((char) WildcardQuery.WILDCARD_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    static List<String> contextOf(final List<String> lines, final int lineIndex, final int contextLines) {
        final int from = Math.max(0, lineIndex - contextLines);
        final int to = Math.min(lines.size(), lineIndex + contextLines + 1);
        return List.copyOf(lines.subList(from, to));
    }

    /**
     * Unreadable subdirectories are logged and skipped.
     */
    private List<Path> listTextFiles(final Path baseDirectory) throws IOException {
        final List<Path> result = new ArrayList<>();
        Files.walkFileTree(baseDirectory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (attrs.isRegularFile()
                        && file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(TEXT_EXTENSION)
                        && isSearchable(baseDirectory, file)) {
                    result.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException e) {
                logger.warn("Skipping unreadable path {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(final Path dir, final IOException e) {
                if (e != null) {
                    logger.warn("Could not list all entries of {}: {}", dir, e.getMessage());
                }
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(result);
        return result;
    }

    /**
     * Exclusions only apply below the search root. Searching an excluded directory directly still works.
     */
    private boolean isSearchable(final Path baseDirectory, final Path file) {
        final Path base = baseDirectory.toAbsolutePath().normalize();
        final Path absolute = file.toAbsolutePath().normalize();
        return excludedDirectories.stream()
                .filter(excluded -> !base.startsWith(excluded))
                .noneMatch(absolute::startsWith);
    }

    /**
     * Malformed UTF-8 is decoded with replacement characters instead of failing.
     */
    private static List<String> readLines(final Path file) throws IOException {
        final String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return content.lines().toList();
    }
}
