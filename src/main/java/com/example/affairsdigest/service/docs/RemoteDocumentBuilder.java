/**
 * Writes one remote document per category. Every category gets its own plan and cursor and a
 * single batch submission; a failed category is logged and never stops the others.
 */

package com.example.affairsdigest.service.docs;

import com.example.affairsdigest.exception.RemoteApiException;
import com.example.affairsdigest.model.ContentBlock;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

public class RemoteDocumentBuilder {
    private final RemoteDocumentApi api;
    private final ExecutorService executor;
    private final Logger logger;

    public RemoteDocumentBuilder(RemoteDocumentApi api, ExecutorService executor, Logger logger) {
        this.api = api;
        this.executor = executor;
        this.logger = logger;
    }

    /**
     * Builds the documents of all categories, concurrently across categories.
     *
     * @return document id per category, for the categories that were written
     */
    public Map<String, String> buildAll(Map<String, List<ContentBlock>> categoryBlocks, LocalDate date) {
        Map<String, Future<Optional<String>>> pending = new LinkedHashMap<>();
        categoryBlocks.forEach((category, blocks) ->
                pending.put(category, executor.submit(() -> build(category, blocks, date))));

        Map<String, String> documents = new LinkedHashMap<>();
        for (Map.Entry<String, Future<Optional<String>>> entry : pending.entrySet()) {
            try {
                entry.getValue().get().ifPresent(id -> documents.put(entry.getKey(), id));
            } catch (ExecutionException e) {
                logger.severe("Document build for " + entry.getKey() + " crashed: " + e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warning("Interrupted while waiting for document " + entry.getKey());
                break;
            }
        }
        return documents;
    }

    /**
     * Creates and fills the document of one category.
     *
     * @return the document id, or empty when the category had no content or the API rejected it
     */
    public Optional<String> build(String category, List<ContentBlock> blocks, LocalDate date) {
        if (blocks.isEmpty()) {
            logger.info("No content for category " + category + ", skipping document");
            return Optional.empty();
        }
        String title = DocumentPlanner.documentTitle(category, date);
        DocumentPlan plan = DocumentPlanner.plan(DocumentPlanner.pageTitle(date), blocks);
        String documentId = null;
        try {
            documentId = api.createDocument(title);
            logger.info("Created new document: " + title + " with ID " + documentId);
            api.batchUpdate(documentId, plan.getOperations());
            logger.info("Appended " + plan.getOperations().size() + " requests to document: " + title);
            return Optional.of(documentId);
        } catch (RemoteApiException e) {
            String where = documentId == null ? title : title + " (ID: " + documentId + ")";
            logger.warning("Failed to write document " + where + ": " + e.getMessage());
            return Optional.empty();
        }
    }
}
