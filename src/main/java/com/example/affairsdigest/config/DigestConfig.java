/**
 * DigestConfig collects every setting of a run from environment variables.
 * - BASE_URL, PAGE_COUNT and EXCLUDE_URL_MARKER drive link discovery.
 * - TARGET_LANGUAGE is the single language articles are translated into.
 * - LEDGER_FILE is the deduplication ledger, WORKER_THREADS bounds the worker pool.
 * - TELEGRAM_BOT_TOKEN and TELEGRAM_CHANNEL_ID are the delivery credentials (required at delivery time).
 * - GOOGLE_CREDENTIALS_FILE points at the Google credentials used for the remote documents.
 * - CAPTION_FOOTER is the last line of the delivery caption.
 */

package com.example.affairsdigest.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

public final class DigestConfig {
    public static final String DEFAULT_BASE_URL = "https://www.gktoday.in/current-affairs/";
    public static final int DEFAULT_PAGE_COUNT = 3;
    public static final String DEFAULT_EXCLUDE_MARKER = "daily-current-affairs-quiz";
    public static final String DEFAULT_TARGET_LANGUAGE = "gu";
    public static final String DEFAULT_LEDGER_FILE = "scraped_urls.txt";
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final String DEFAULT_CREDENTIALS_FILE = "token.json";
    public static final String DEFAULT_CAPTION_FOOTER = "🎉 Join us :- @gujtest 🎉";

    private final String baseUrl;
    private final int pageCount;
    private final String excludeUrlMarker;
    private final String targetLanguage;
    private final Path ledgerFile;
    private final int workerThreads;
    private final String botToken;
    private final String channelId;
    private final Path credentialsFile;
    private final String captionFooter;

    private DigestConfig(Builder builder) {
        this.baseUrl = builder.baseUrl.endsWith("/") ? builder.baseUrl : builder.baseUrl + "/";
        this.pageCount = builder.pageCount;
        this.excludeUrlMarker = builder.excludeUrlMarker;
        this.targetLanguage = builder.targetLanguage;
        this.ledgerFile = builder.ledgerFile;
        this.workerThreads = builder.workerThreads;
        this.botToken = builder.botToken;
        this.channelId = builder.channelId;
        this.credentialsFile = builder.credentialsFile;
        this.captionFooter = builder.captionFooter;
    }

    public static DigestConfig fromEnvironment(Map<String, String> env) {
        return builder()
                .baseUrl(valueOr(env, "BASE_URL", DEFAULT_BASE_URL))
                .pageCount(positiveInt(env, "PAGE_COUNT", DEFAULT_PAGE_COUNT))
                .excludeUrlMarker(valueOr(env, "EXCLUDE_URL_MARKER", DEFAULT_EXCLUDE_MARKER))
                .targetLanguage(valueOr(env, "TARGET_LANGUAGE", DEFAULT_TARGET_LANGUAGE))
                .ledgerFile(Path.of(valueOr(env, "LEDGER_FILE", DEFAULT_LEDGER_FILE)))
                .workerThreads(positiveInt(env, "WORKER_THREADS", DEFAULT_WORKER_THREADS))
                .botToken(env.get("TELEGRAM_BOT_TOKEN"))
                .channelId(env.get("TELEGRAM_CHANNEL_ID"))
                .credentialsFile(Path.of(valueOr(env, "GOOGLE_CREDENTIALS_FILE", DEFAULT_CREDENTIALS_FILE)))
                .captionFooter(valueOr(env, "CAPTION_FOOTER", DEFAULT_CAPTION_FOOTER))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String valueOr(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static int positiveInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                throw new IllegalArgumentException(key + " must be at least 1: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }
    public int getPageCount() {
        return pageCount;
    }
    public String getExcludeUrlMarker() {
        return excludeUrlMarker;
    }
    public String getTargetLanguage() {
        return targetLanguage;
    }
    public Path getLedgerFile() {
        return ledgerFile;
    }
    public int getWorkerThreads() {
        return workerThreads;
    }
    public Optional<String> getBotToken() {
        return Optional.ofNullable(botToken).filter(s -> !s.isBlank());
    }
    public Optional<String> getChannelId() {
        return Optional.ofNullable(channelId).filter(s -> !s.isBlank());
    }
    public Path getCredentialsFile() {
        return credentialsFile;
    }
    public String getCaptionFooter() {
        return captionFooter;
    }

    public static final class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private int pageCount = DEFAULT_PAGE_COUNT;
        private String excludeUrlMarker = DEFAULT_EXCLUDE_MARKER;
        private String targetLanguage = DEFAULT_TARGET_LANGUAGE;
        private Path ledgerFile = Path.of(DEFAULT_LEDGER_FILE);
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private String botToken;
        private String channelId;
        private Path credentialsFile = Path.of(DEFAULT_CREDENTIALS_FILE);
        private String captionFooter = DEFAULT_CAPTION_FOOTER;

        private Builder() {
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }
        public Builder pageCount(int pageCount) {
            this.pageCount = pageCount;
            return this;
        }
        public Builder excludeUrlMarker(String excludeUrlMarker) {
            this.excludeUrlMarker = excludeUrlMarker;
            return this;
        }
        public Builder targetLanguage(String targetLanguage) {
            this.targetLanguage = targetLanguage;
            return this;
        }
        public Builder ledgerFile(Path ledgerFile) {
            this.ledgerFile = ledgerFile;
            return this;
        }
        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }
        public Builder botToken(String botToken) {
            this.botToken = botToken;
            return this;
        }
        public Builder channelId(String channelId) {
            this.channelId = channelId;
            return this;
        }
        public Builder credentialsFile(Path credentialsFile) {
            this.credentialsFile = credentialsFile;
            return this;
        }
        public Builder captionFooter(String captionFooter) {
            this.captionFooter = captionFooter;
            return this;
        }

        public DigestConfig build() {
            return new DigestConfig(this);
        }
    }
}
