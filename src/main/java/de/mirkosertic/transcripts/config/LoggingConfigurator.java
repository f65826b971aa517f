package de.mirkosertic.transcripts.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Switches logging between the CLI console format and verbose diagnostic tracing.
 * <p>
 * The default console setup comes from logback.xml, which Logback loads automatically.
 * With {@code --verbose}, logback-verbose.xml replaces it and enables DEBUG output
 * including every matching decision.
 */
public final class LoggingConfigurator {

    static final String VERBOSE_CONFIG = "logback-verbose.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before anything else logs.
     *
     * @param verbose true to enable diagnostic tracing
     */
    public static void configure(final boolean verbose) {
        if (verbose) {
            loadConfiguration(VERBOSE_CONFIG);
        }
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                .getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final IOException e) {
            System.err.println("Warning: Could not read " + configFile + ": " + e.getMessage());
        }
    }
}
