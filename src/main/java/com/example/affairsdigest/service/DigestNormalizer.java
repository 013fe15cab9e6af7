package com.example.affairsdigest.service;

import com.example.affairsdigest.model.Article;
import com.example.affairsdigest.model.ContentBlock;
import com.example.affairsdigest.model.DigestBatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class DigestNormalizer {
    private final Logger logger;

    public DigestNormalizer(Logger logger) {
        this.logger = logger;
    }

    /**
     * Groups the extracted articles of one run.
     * Articles keep the order they were given in. Empty articles are dropped; articles without a
     * category reach only the combined sequence.
     *
     * @param articles extracted articles, in URL processing order
     * @return combined blocks, blocks per category and the caption titles
     */
    public DigestBatch normalize(List<Article> articles) {
        List<ContentBlock> combined = new ArrayList<>();
        Map<String, List<ContentBlock>> byCategory = new LinkedHashMap<>();
        List<String> titles = new ArrayList<>();

        for (Article article : articles) {
            if (article.isEmpty()) {
                continue;
            }
            combined.addAll(article.getBlocks());
            article.getDisplayTitle().ifPresent(titles::add);
            article.getCategory().ifPresent(category ->
                    byCategory.computeIfAbsent(category, key -> new ArrayList<>()).addAll(article.getBlocks()));
        }
        logger.info("Categories detected: " + byCategory.keySet());
        return new DigestBatch(combined, byCategory, titles);
    }
}
