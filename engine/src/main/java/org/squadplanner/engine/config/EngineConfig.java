package org.squadplanner.engine.config;

import io.github.cdimascio.dotenv.Dotenv;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Immutable configuration for the planner process.
 * Values are read from environment variables, then from a {@code .env} file in the working
 * directory or its parent, with sensible defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final String PARAMETER_API_URL = "PARAMETER_API_URL";
    public static final String PARAMETER_API_TOKEN = "PARAMETER_API_TOKEN";
    public static final String PARAMETER_FILE = "PARAMETER_FILE";
    public static final String PLANNER_THREADS = "PLANNER_THREADS";
    public static final String PLANNER_LOG_FILE = "PLANNER_LOG_FILE";
    public static final String PLANNER_FILE_LOGGING_ENABLED = "PLANNER_FILE_LOGGING_ENABLED";

    public static final int DEFAULT_THREADS = 4;
    public static final String DEFAULT_LOG_FILE = "logs/planner.log";

    // Parameter source; both empty means built-in defaults
    private final String parameterApiUrl;
    private final String parameterApiToken;
    private final String parameterFile;

    // Formation evaluation
    private final int threads;

    // Logging Configuration
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.parameterApiUrl = builder.parameterApiUrl;
        this.parameterApiToken = builder.parameterApiToken;
        this.parameterFile = builder.parameterFile;
        this.threads = builder.threads;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables with a {@code .env} fallback.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv local = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        Dotenv parent = Dotenv.configure()
                .directory("../")
                .ignoreIfMissing()
                .load();
        return fromLookup(key -> firstNonBlank(System.getenv(key), local.get(key), parent.get(key)));
    }

    /**
     * Creates configuration from an arbitrary key lookup; a null or blank value means unset.
     */
    public static EngineConfig fromLookup(UnaryOperator<String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        return new Builder()
                .parameterApiUrl(getString(lookup, PARAMETER_API_URL, ""))
                .parameterApiToken(getString(lookup, PARAMETER_API_TOKEN, ""))
                .parameterFile(getString(lookup, PARAMETER_FILE, ""))
                .threads(getInt(lookup, PLANNER_THREADS, DEFAULT_THREADS))
                .logFilePath(getString(lookup, PLANNER_LOG_FILE, DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, PLANNER_FILE_LOGGING_ENABLED, false))
                .build();
    }

    // Getters
    public String getParameterApiUrl() {
        return parameterApiUrl;
    }

    public String getParameterApiToken() {
        return parameterApiToken;
    }

    public String getParameterFile() {
        return parameterFile;
    }

    public boolean hasParameterApi() {
        return !parameterApiUrl.isEmpty();
    }

    public boolean hasParameterFile() {
        return !parameterFile.isEmpty();
    }

    public int getThreads() {
        return threads;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    // Lookup helpers
    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String getString(UnaryOperator<String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(UnaryOperator<String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(UnaryOperator<String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "parameterApiUrl='" + parameterApiUrl + '\'' +
                ", parameterFile='" + parameterFile + '\'' +
                ", threads=" + threads +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private String parameterApiUrl = "";
        private String parameterApiToken = "";
        private String parameterFile = "";
        private int threads = DEFAULT_THREADS;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = false;

        public Builder parameterApiUrl(String parameterApiUrl) {
            this.parameterApiUrl = Objects.requireNonNull(parameterApiUrl, "parameterApiUrl must not be null");
            return this;
        }

        public Builder parameterApiToken(String parameterApiToken) {
            this.parameterApiToken = Objects.requireNonNull(parameterApiToken, "parameterApiToken must not be null");
            return this;
        }

        public Builder parameterFile(String parameterFile) {
            this.parameterFile = Objects.requireNonNull(parameterFile, "parameterFile must not be null");
            return this;
        }

        public Builder threads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be at least 1");
            }
            this.threads = threads;
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
