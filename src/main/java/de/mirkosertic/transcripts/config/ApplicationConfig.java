package de.mirkosertic.transcripts.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the transcript reconciler.
 * Loads configuration from YAML files, environment variables and system properties.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Command line flags (applied by the application after loading)
 * 2. System properties
 * 3. Environment variables
 * 4. User config file (~/.transcript-reconciler/config.yaml)
 * 5. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_TTML_DIR = "TRANSCRIPTS_TTML_DIR";
    private static final String ENV_DATABASE_PATH = "TRANSCRIPTS_DATABASE_PATH";
    private static final String ENV_OUTPUT_DIR = "TRANSCRIPTS_OUTPUT_DIR";
    private static final String PROP_TTML_DIR = "transcripts.ttml.dir";
    private static final String PROP_DATABASE_PATH = "transcripts.database.path";
    private static final String PROP_OUTPUT_DIR = "transcripts.output.dir";
    private static final String CONFIG_DIR = ".transcript-reconciler";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    /** Name of the reports folder inside the output directory when none is configured. */
    public static final String REPORTS_FOLDER = "reports";

    private static final String PODCASTS_CONTAINER =
            "Library/Group Containers/243LU875E5.groups.com.apple.podcasts";

    // Source settings
    private String ttmlDirectory = Paths.get(System.getProperty("user.home"), PODCASTS_CONTAINER,
            "Library", "Cache", "Assets", "TTML").toString();
    private String databasePath = Paths.get(System.getProperty("user.home"), PODCASTS_CONTAINER,
            "Documents", "MTLibrary.sqlite").toString();
    private List<String> includePatterns = List.of("*.ttml");
    private List<String> excludePatterns = List.of();
    private String podcastDirectoryPrefix = "PodcastContent";

    // Trackid settings
    private String trackidPrefix = "transcript_";
    private int trackidConfidentLength = 8;

    // Matching settings
    private int substringMinLength = 10;

    // Output settings
    private String outputDirectory = "transcripts_with_metadata";
    private boolean includeTimestamps = false;
    private int maxTitleLength = 100;
    private String reportsDirectory;

    // Search settings
    private String searchDirectory;
    private int searchContextLines = 2;
    private int searchLimit = 50;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        logger.debug("Configuration loaded: ttmlDirectory={}, databasePath={}, outputDirectory={}",
                config.ttmlDirectory, config.databasePath, config.outputDirectory);

        return config;
    }

    /**
     * Classpath defaults only, ignoring user files and the environment.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> transcriptsConfig = (Map<String, Object>) config.get("transcripts");
        if (transcriptsConfig == null) {
            return;
        }

        final Map<String, Object> sourceConfig = (Map<String, Object>) transcriptsConfig.get("source");
        if (sourceConfig != null) {
            applySourceConfig(sourceConfig);
        }

        final Map<String, Object> trackidConfig = (Map<String, Object>) transcriptsConfig.get("trackid");
        if (trackidConfig != null) {
            if (trackidConfig.containsKey("prefix")) {
                this.trackidPrefix = String.valueOf(trackidConfig.get("prefix"));
            }
            if (trackidConfig.containsKey("confident-length")) {
                this.trackidConfidentLength = ((Number) trackidConfig.get("confident-length")).intValue();
            }
        }

        final Map<String, Object> matchingConfig = (Map<String, Object>) transcriptsConfig.get("matching");
        if (matchingConfig != null && matchingConfig.containsKey("substring-min-length")) {
            this.substringMinLength = ((Number) matchingConfig.get("substring-min-length")).intValue();
        }

        final Map<String, Object> outputConfig = (Map<String, Object>) transcriptsConfig.get("output");
        if (outputConfig != null) {
            applyOutputConfig(outputConfig);
        }

        final Map<String, Object> reportsConfig = (Map<String, Object>) transcriptsConfig.get("reports");
        if (reportsConfig != null && reportsConfig.get("directory") != null) {
            this.reportsDirectory = resolveVariables(reportsConfig.get("directory").toString());
        }

        final Map<String, Object> searchConfig = (Map<String, Object>) transcriptsConfig.get("search");
        if (searchConfig != null) {
            if (searchConfig.get("directory") != null) {
                this.searchDirectory = resolveVariables(searchConfig.get("directory").toString());
            }
            if (searchConfig.containsKey("context-lines")) {
                this.searchContextLines = ((Number) searchConfig.get("context-lines")).intValue();
            }
            if (searchConfig.containsKey("limit")) {
                this.searchLimit = ((Number) searchConfig.get("limit")).intValue();
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applySourceConfig(final Map<String, Object> sourceConfig) {
        if (sourceConfig.get("ttml-directory") != null) {
            this.ttmlDirectory = resolveVariables(sourceConfig.get("ttml-directory").toString());
        }
        if (sourceConfig.get("database-path") != null) {
            this.databasePath = resolveVariables(sourceConfig.get("database-path").toString());
        }
        if (sourceConfig.containsKey("include-patterns")) {
            final Object patterns = sourceConfig.get("include-patterns");
            if (patterns instanceof List) {
                this.includePatterns = new ArrayList<>((List<String>) patterns);
            }
        }
        if (sourceConfig.containsKey("exclude-patterns")) {
            final Object patterns = sourceConfig.get("exclude-patterns");
            if (patterns instanceof List) {
                this.excludePatterns = new ArrayList<>((List<String>) patterns);
            }
        }
        if (sourceConfig.get("podcast-directory-prefix") != null) {
            this.podcastDirectoryPrefix = sourceConfig.get("podcast-directory-prefix").toString();
        }
    }

    private void applyOutputConfig(final Map<String, Object> outputConfig) {
        if (outputConfig.get("directory") != null) {
            this.outputDirectory = resolveVariables(outputConfig.get("directory").toString());
        }
        if (outputConfig.containsKey("include-timestamps")) {
            this.includeTimestamps = (Boolean) outputConfig.get("include-timestamps");
        }
        if (outputConfig.containsKey("max-title-length")) {
            final int length = ((Number) outputConfig.get("max-title-length")).intValue();
            if (length > 0) {
                this.maxTitleLength = length;
            } else {
                logger.warn("Ignoring max-title-length {}, it must be positive. Keeping {}", length, maxTitleLength);
            }
        }
    }

    private void applyEnvironmentOverrides() {
        final String envTtmlDir = System.getenv(ENV_TTML_DIR);
        if (envTtmlDir != null && !envTtmlDir.trim().isEmpty()) {
            this.ttmlDirectory = envTtmlDir.trim();
            logger.info("TTML directory from environment: {}", this.ttmlDirectory);
        }

        final String envDatabasePath = System.getenv(ENV_DATABASE_PATH);
        if (envDatabasePath != null && !envDatabasePath.trim().isEmpty()) {
            this.databasePath = envDatabasePath.trim();
            logger.info("Database path from environment: {}", this.databasePath);
        }

        final String envOutputDir = System.getenv(ENV_OUTPUT_DIR);
        if (envOutputDir != null && !envOutputDir.trim().isEmpty()) {
            this.outputDirectory = envOutputDir.trim();
        }

        final String propTtmlDir = System.getProperty(PROP_TTML_DIR);
        if (propTtmlDir != null && !propTtmlDir.isEmpty()) {
            this.ttmlDirectory = propTtmlDir;
        }
        final String propDatabasePath = System.getProperty(PROP_DATABASE_PATH);
        if (propDatabasePath != null && !propDatabasePath.isEmpty()) {
            this.databasePath = propDatabasePath;
        }
        final String propOutputDir = System.getProperty(PROP_OUTPUT_DIR);
        if (propOutputDir != null && !propOutputDir.isEmpty()) {
            this.outputDirectory = propOutputDir;
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    // Getters and command line overrides
    public Path getTtmlDirectory() {
        return Paths.get(ttmlDirectory);
    }

    public void setTtmlDirectory(final Path ttmlDirectory) {
        this.ttmlDirectory = ttmlDirectory.toString();
    }

    public Path getDatabasePath() {
        return Paths.get(databasePath);
    }

    public void setDatabasePath(final Path databasePath) {
        this.databasePath = databasePath.toString();
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public String getPodcastDirectoryPrefix() {
        return podcastDirectoryPrefix;
    }

    public String getTrackidPrefix() {
        return trackidPrefix;
    }

    public int getTrackidConfidentLength() {
        return trackidConfidentLength;
    }

    public int getSubstringMinLength() {
        return substringMinLength;
    }

    public Path getOutputDirectory() {
        return Paths.get(outputDirectory);
    }

    public void setOutputDirectory(final Path outputDirectory) {
        this.outputDirectory = outputDirectory.toString();
    }

    public boolean isIncludeTimestamps() {
        return includeTimestamps;
    }

    public void setIncludeTimestamps(final boolean includeTimestamps) {
        this.includeTimestamps = includeTimestamps;
    }

    public int getMaxTitleLength() {
        return maxTitleLength;
    }

    /**
     * Defaults to {@code reports} inside the output directory.
     */
    public Path getReportsDirectory() {
        if (reportsDirectory == null || reportsDirectory.isEmpty()) {
            return getOutputDirectory().resolve(REPORTS_FOLDER);
        }
        return Paths.get(reportsDirectory);
    }

    public void setReportsDirectory(final Path reportsDirectory) {
        this.reportsDirectory = reportsDirectory.toString();
    }

    /**
     * Defaults to the output directory, where the extracted transcripts land.
     */
    public Path getSearchDirectory() {
        if (searchDirectory == null || searchDirectory.isEmpty()) {
            return getOutputDirectory();
        }
        return Paths.get(searchDirectory);
    }

    public void setSearchDirectory(final Path searchDirectory) {
        this.searchDirectory = searchDirectory.toString();
    }

    public int getSearchContextLines() {
        return searchContextLines;
    }

    public int getSearchLimit() {
        return searchLimit;
    }
}
