package de.mirkosertic.transcripts.transcript;

import de.mirkosertic.transcripts.util.TextCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a TTML subtitle document into its ordered list of paragraph segments.
 * <p>
 * Paragraphs are the {@code p} elements of the TTML namespace. Documents written without
 * the namespace are accepted as well, in which case any element named {@code p} counts.
 * Paragraphs without visible text are skipped.
 */
public class TtmlDocumentParser {

    private static final Logger logger = LoggerFactory.getLogger(TtmlDocumentParser.class);

    public static final String TTML_NAMESPACE = "http://www.w3.org/ns/ttml";

    private final DocumentBuilderFactory factory;

    public TtmlDocumentParser() {
        this.factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (final ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    /**
     * Parse one document.
     *
     * @param file the TTML file
     * @return segments in document order, empty if the document holds no text
     * @throws IOException if the file cannot be read or is not well-formed XML
     */
    public List<TranscriptSegment> parse(final Path file) throws IOException {
        final Document document;
        try (final InputStream stream = Files.newInputStream(file)) {
            final DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new LoggingErrorHandler(file));
            document = builder.parse(stream);
        } catch (final SAXException | ParserConfigurationException e) {
            throw new IOException("Failed to parse transcript document " + file.getFileName(), e);
        }

        NodeList paragraphs = document.getElementsByTagNameNS(TTML_NAMESPACE, "p");
        if (paragraphs.getLength() == 0) {
            paragraphs = document.getElementsByTagNameNS("*", "p");
        }

        final List<TranscriptSegment> segments = new ArrayList<>();
        for (int i = 0; i < paragraphs.getLength(); i++) {
            final Element paragraph = (Element) paragraphs.item(i);

            final List<String> fragments = new ArrayList<>();
            collectText(paragraph, fragments);
            final String text = TextCleaner.joinFragments(fragments);
            if (text.isEmpty()) {
                continue;
            }

            final String begin = paragraph.hasAttribute("begin") ? paragraph.getAttribute("begin") : null;
            segments.add(new TranscriptSegment(TimestampFormatter.parse(begin), text));
        }

        logger.debug("Parsed {} paragraphs from {}", segments.size(), file.getFileName());
        return segments;
    }

    private static void collectText(final Node node, final List<String> fragments) {
        final NodeList children = node.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            final Node child = children.item(i);
            switch (child.getNodeType()) {
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> fragments.add(child.getNodeValue());
                case Node.ELEMENT_NODE -> collectText(child, fragments);
                default -> {
                    // comments and processing instructions carry no transcript text
                }
            }
        }
    }

    /**
     * Keeps the parser from printing to stderr; fatal errors still abort the parse.
     */
    private record LoggingErrorHandler(Path file) implements ErrorHandler {

        @Override
        public void warning(final SAXParseException e) {
            logger.debug("XML warning in {} at line {}: {}", file.getFileName(), e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(final SAXParseException e) {
            logger.debug("XML error in {} at line {}: {}", file.getFileName(), e.getLineNumber(), e.getMessage());
        }

        @Override
        public void fatalError(final SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
