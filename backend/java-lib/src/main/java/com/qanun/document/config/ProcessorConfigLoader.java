package com.qanun.document.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Builds a {@link ProcessorConfig} from environment variables, falling back to defaults.
 */
public class ProcessorConfigLoader {

    static final String ENV_MAX_KEYWORDS = "LEGAL_MAX_KEYWORDS";
    static final String ENV_MIN_ARTICLE_LENGTH = "LEGAL_MIN_ARTICLE_LENGTH";
    static final String ENV_DESCRIPTION_WINDOW = "LEGAL_DESCRIPTION_WINDOW";
    static final String ENV_BATCH_WORKERS = "LEGAL_BATCH_WORKERS";
    static final String ENV_DOCUMENT_TIMEOUT_SECONDS = "LEGAL_DOCUMENT_TIMEOUT_SECONDS";

    private final EnvironmentReader environmentReader;

    public ProcessorConfigLoader() {
        this(new SystemEnvironmentReader());
    }

    public ProcessorConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public ProcessorConfig load() {
        int maxKeywords = readPositiveInteger(ENV_MAX_KEYWORDS, ProcessorConfig.DEFAULT_MAX_KEYWORDS);
        int minArticleLength = readPositiveInteger(ENV_MIN_ARTICLE_LENGTH, ProcessorConfig.DEFAULT_MIN_ARTICLE_LENGTH);
        int descriptionWindow = readPositiveInteger(ENV_DESCRIPTION_WINDOW, ProcessorConfig.DEFAULT_DESCRIPTION_WINDOW);
        int batchWorkers = readPositiveInteger(ENV_BATCH_WORKERS, ProcessorConfig.DEFAULT_BATCH_WORKERS);
        int timeoutSeconds = readPositiveInteger(ENV_DOCUMENT_TIMEOUT_SECONDS,
                (int) ProcessorConfig.DEFAULT_DOCUMENT_TIMEOUT.getSeconds());

        return new ProcessorConfig(maxKeywords, minArticleLength, descriptionWindow, batchWorkers,
                Duration.ofSeconds(timeoutSeconds));
    }

    private int readPositiveInteger(String key, int defaultValue) {
        return environmentReader.get(key)
                .filter(ProcessorConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parsePositiveInteger(key, raw))
                .orElse(defaultValue);
    }

    private static int parsePositiveInteger(String key, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(key + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
