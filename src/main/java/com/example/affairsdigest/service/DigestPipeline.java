package com.example.affairsdigest.service;

import com.example.affairsdigest.PipelineContext;
import com.example.affairsdigest.exception.DeliveryException;
import com.example.affairsdigest.exception.PipelineAbortedException;
import com.example.affairsdigest.model.Article;
import com.example.affairsdigest.model.DigestBatch;
import com.example.affairsdigest.service.delivery.DeliveryAdapter;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.logging.Logger;

public class DigestPipeline {
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("dd-MM-yyyy");

    private final PipelineContext context;
    private final Logger logger;

    public DigestPipeline(PipelineContext context) {
        this.context = context;
        this.logger = context.getLogger();
    }

    /**
     * Executes one full run: discover URLs, keep the new ones, extract them in parallel, render the
     * combined document, deliver it, then write one remote document per category.
     *
     * @return the normalized batch; empty when there was nothing new to process
     * @throws PipelineAbortedException when nothing was scraped or extracted, delivery is not configured,
     *                                  or delivery failed
     */
    public DigestBatch run() throws PipelineAbortedException {
        DeliveryAdapter deliveryAdapter = context.getDeliveryAdapter()
                .orElseThrow(() -> new PipelineAbortedException("Delivery credentials are not configured"));
        LocalDateTime startedAt = LocalDateTime.now(context.getClock());
        LocalDate today = startedAt.toLocalDate();

        List<String> articleUrls = context.getLinkScraper().discover();
        if (articleUrls.isEmpty()) {
            throw new PipelineAbortedException("No URLs scraped. Check website structure or connectivity.");
        }

        List<String> newUrls = new ArrayList<>();
        for (String url : articleUrls) {
            if (context.getLedger().checkAndInsert(url, startedAt)) {
                newUrls.add(url);
            }
        }
        logger.info("Found " + newUrls.size() + " new URLs: " + newUrls);
        if (newUrls.isEmpty()) {
            logger.warning("No new URLs to process");
            return new DigestBatch(Collections.emptyList(), Collections.emptyMap(), Collections.emptyList());
        }

        DigestBatch batch = context.getNormalizer().normalize(extractAll(newUrls));
        if (batch.isEmpty()) {
            throw new PipelineAbortedException("No content scraped from new URLs");
        }

        Path artifact = renderArtifact(batch, today);
        String caption = context.getCaptionComposer().compose(today, batch.getTitles());
        try {
            deliveryAdapter.deliver(artifact, FILE_DATE.format(today) + "_Current_Affairs.docx", caption);
        } catch (DeliveryException e) {
            logger.severe("Failed to deliver document, keeping " + artifact + ": " + e.getMessage());
            throw new PipelineAbortedException("Delivery failed", e);
        }

        if (context.getDocumentBuilder().isEmpty()) {
            logger.warning("Remote documents are not configured, skipping");
        } else if (batch.getCategoryBlocks().isEmpty()) {
            logger.warning("No categories found to create documents");
        } else {
            Map<String, String> documents = context.getDocumentBuilder().get().buildAll(batch.getCategoryBlocks(), today);
            logger.info("Wrote " + documents.size() + " of " + batch.getCategoryBlocks().size() + " category documents");
        }

        try {
            Files.deleteIfExists(artifact);
            logger.info("Temporary file deleted");
        } catch (IOException e) {
            logger.warning("Could not delete temporary file " + artifact + ": " + e.getMessage());
        }
        return batch;
    }

    private List<Article> extractAll(List<String> urls) {
        List<Future<Article>> pending = new ArrayList<>();
        for (String url : urls) {
            pending.add(context.getWorkers().submit(() -> context.getExtractor().extract(url)));
        }
        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            try {
                Article article = pending.get(i).get();
                if (!article.isEmpty()) {
                    articles.add(article);
                }
            } catch (ExecutionException e) {
                logger.severe("Extraction of " + urls.get(i) + " crashed: " + e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warning("Interrupted while extracting articles");
                break;
            }
        }
        return articles;
    }

    private Path renderArtifact(DigestBatch batch, LocalDate date) throws PipelineAbortedException {
        try {
            Path artifact = Files.createTempFile("current-affairs-", ".docx");
            try (OutputStream out = Files.newOutputStream(artifact)) {
                context.getRenderer().render(batch.getCombinedBlocks(), date, out);
            }
            logger.info("Document saved to: " + artifact);
            return artifact;
        } catch (IOException e) {
            throw new PipelineAbortedException("Could not write the document: " + e.getMessage(), e);
        }
    }
}
