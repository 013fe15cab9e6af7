/**
 * PipelineContext owns every collaborator of a run and is built once at process start.
 * - fromConfig() wires the production implementations: jsoup fetching, the file ledger, Google translation,
 *   HTTP image download, Google Docs and Telegram delivery, all sharing one HttpClient and one Logger.
 * - Remote documents are disabled (with a warning) when no Google credentials can be loaded;
 *   delivery is absent when the Telegram credentials are missing, which the pipeline treats as fatal.
 * - close() shuts down the worker pool.
 */

package com.example.affairsdigest;

import com.example.affairsdigest.config.DigestConfig;
import com.example.affairsdigest.repository.FileUrlLedger;
import com.example.affairsdigest.repository.UrlLedger;
import com.example.affairsdigest.service.BilingualBlockBuilder;
import com.example.affairsdigest.service.DigestNormalizer;
import com.example.affairsdigest.service.delivery.CaptionComposer;
import com.example.affairsdigest.service.delivery.DeliveryAdapter;
import com.example.affairsdigest.service.delivery.RetryPolicy;
import com.example.affairsdigest.service.delivery.TelegramChannel;
import com.example.affairsdigest.service.docs.GoogleCredentialsTokenProvider;
import com.example.affairsdigest.service.docs.GoogleDocsClient;
import com.example.affairsdigest.service.docs.RemoteDocumentBuilder;
import com.example.affairsdigest.service.extract.ArticleExtractor;
import com.example.affairsdigest.service.extract.ArticleLinkScraper;
import com.example.affairsdigest.service.extract.CategoryDetector;
import com.example.affairsdigest.service.extract.JsoupPageFetcher;
import com.example.affairsdigest.service.extract.PageFetcher;
import com.example.affairsdigest.service.render.DocxDigestRenderer;
import com.example.affairsdigest.service.render.HttpImageFetcher;
import com.example.affairsdigest.service.render.ImageNormalizer;
import com.example.affairsdigest.service.translate.GoogleTranslator;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

public final class PipelineContext implements AutoCloseable {
    private static final int DELIVERY_ATTEMPTS = 5;
    private static final Duration DELIVERY_BACKOFF = Duration.ofSeconds(10);

    private final Logger logger;
    private final Clock clock;
    private final ExecutorService workers;
    private final ArticleLinkScraper linkScraper;
    private final UrlLedger ledger;
    private final ArticleExtractor extractor;
    private final DigestNormalizer normalizer;
    private final DocxDigestRenderer renderer;
    private final CaptionComposer captionComposer;
    private final DeliveryAdapter deliveryAdapter;
    private final RemoteDocumentBuilder documentBuilder;

    private PipelineContext(Builder builder) {
        this.logger = builder.logger;
        this.clock = builder.clock;
        this.workers = builder.workers;
        this.linkScraper = builder.linkScraper;
        this.ledger = builder.ledger;
        this.extractor = builder.extractor;
        this.normalizer = builder.normalizer;
        this.renderer = builder.renderer;
        this.captionComposer = builder.captionComposer;
        this.deliveryAdapter = builder.deliveryAdapter;
        this.documentBuilder = builder.documentBuilder;
    }

    public static PipelineContext fromConfig(DigestConfig config, Logger logger) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        ExecutorService workers = Executors.newFixedThreadPool(config.getWorkerThreads());

        PageFetcher pageFetcher = new JsoupPageFetcher(logger);
        BilingualBlockBuilder blockBuilder = new BilingualBlockBuilder(
                new GoogleTranslator(client, logger), config.getTargetLanguage(), logger);

        DeliveryAdapter deliveryAdapter = null;
        if (config.getBotToken().isPresent() && config.getChannelId().isPresent()) {
            TelegramChannel channel = new TelegramChannel(client, config.getBotToken().get(), config.getChannelId().get(), logger);
            deliveryAdapter = new DeliveryAdapter(channel, RetryPolicy.fixed(DELIVERY_ATTEMPTS, DELIVERY_BACKOFF), logger);
        }

        RemoteDocumentBuilder documentBuilder = null;
        if (Files.isRegularFile(config.getCredentialsFile())) {
            try {
                GoogleCredentialsTokenProvider tokens = GoogleCredentialsTokenProvider.fromFile(config.getCredentialsFile());
                documentBuilder = new RemoteDocumentBuilder(new GoogleDocsClient(client, tokens, logger), workers, logger);
            } catch (IOException e) {
                logger.warning("Could not load Google credentials from " + config.getCredentialsFile() + ": " + e.getMessage());
            }
        } else {
            logger.warning("Google credentials file " + config.getCredentialsFile() + " not found, remote documents disabled");
        }

        return builder()
                .logger(logger)
                .clock(Clock.systemDefaultZone())
                .workers(workers)
                .linkScraper(new ArticleLinkScraper(pageFetcher, config.getBaseUrl(), config.getPageCount(),
                        config.getExcludeUrlMarker(), logger))
                .ledger(new FileUrlLedger(config.getLedgerFile(), logger))
                .extractor(new ArticleExtractor(pageFetcher, ArticleExtractor.defaultStrategies(),
                        new CategoryDetector(), blockBuilder, logger))
                .normalizer(new DigestNormalizer(logger))
                .renderer(new DocxDigestRenderer(new HttpImageFetcher(client, logger), new ImageNormalizer(logger), logger))
                .captionComposer(new CaptionComposer(config.getCaptionFooter()))
                .deliveryAdapter(deliveryAdapter)
                .documentBuilder(documentBuilder)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Logger getLogger() {
        return logger;
    }
    public Clock getClock() {
        return clock;
    }
    public ExecutorService getWorkers() {
        return workers;
    }
    public ArticleLinkScraper getLinkScraper() {
        return linkScraper;
    }
    public UrlLedger getLedger() {
        return ledger;
    }
    public ArticleExtractor getExtractor() {
        return extractor;
    }
    public DigestNormalizer getNormalizer() {
        return normalizer;
    }
    public DocxDigestRenderer getRenderer() {
        return renderer;
    }
    public CaptionComposer getCaptionComposer() {
        return captionComposer;
    }
    public Optional<DeliveryAdapter> getDeliveryAdapter() {
        return Optional.ofNullable(deliveryAdapter);
    }
    public Optional<RemoteDocumentBuilder> getDocumentBuilder() {
        return Optional.ofNullable(documentBuilder);
    }

    @Override
    public void close() {
        workers.shutdown();
    }

    public static final class Builder {
        private Logger logger;
        private Clock clock = Clock.systemDefaultZone();
        private ExecutorService workers;
        private ArticleLinkScraper linkScraper;
        private UrlLedger ledger;
        private ArticleExtractor extractor;
        private DigestNormalizer normalizer;
        private DocxDigestRenderer renderer;
        private CaptionComposer captionComposer;
        private DeliveryAdapter deliveryAdapter;
        private RemoteDocumentBuilder documentBuilder;

        private Builder() {
        }

        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }
        public Builder workers(ExecutorService workers) {
            this.workers = workers;
            return this;
        }
        public Builder linkScraper(ArticleLinkScraper linkScraper) {
            this.linkScraper = linkScraper;
            return this;
        }
        public Builder ledger(UrlLedger ledger) {
            this.ledger = ledger;
            return this;
        }
        public Builder extractor(ArticleExtractor extractor) {
            this.extractor = extractor;
            return this;
        }
        public Builder normalizer(DigestNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }
        public Builder renderer(DocxDigestRenderer renderer) {
            this.renderer = renderer;
            return this;
        }
        public Builder captionComposer(CaptionComposer captionComposer) {
            this.captionComposer = captionComposer;
            return this;
        }
        public Builder deliveryAdapter(DeliveryAdapter deliveryAdapter) {
            this.deliveryAdapter = deliveryAdapter;
            return this;
        }
        public Builder documentBuilder(RemoteDocumentBuilder documentBuilder) {
            this.documentBuilder = documentBuilder;
            return this;
        }

        public PipelineContext build() {
            if (logger == null || workers == null || linkScraper == null || ledger == null || extractor == null
                    || normalizer == null || renderer == null || captionComposer == null) {
                throw new IllegalStateException("PipelineContext is missing a required component");
            }
            return new PipelineContext(this);
        }
    }
}
