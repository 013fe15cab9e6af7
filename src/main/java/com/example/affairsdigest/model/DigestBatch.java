/**
 * DigestBatch is the normalized result of one run.
 * - combinedBlocks: every article's blocks, in URL processing order (local artifact).
 * - categoryBlocks: blocks grouped by category, categories in first-seen order (remote documents).
 * - titles: the original-language heading of each article, for the delivery caption.
 */

package com.example.affairsdigest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class DigestBatch {
    private final List<ContentBlock> combinedBlocks;
    private final Map<String, List<ContentBlock>> categoryBlocks;
    private final List<String> titles;

    public DigestBatch(List<ContentBlock> combinedBlocks,
                       Map<String, List<ContentBlock>> categoryBlocks,
                       List<String> titles) {
        this.combinedBlocks = List.copyOf(combinedBlocks);
        Map<String, List<ContentBlock>> copy = new LinkedHashMap<>();
        categoryBlocks.forEach((category, blocks) -> copy.put(category, List.copyOf(blocks)));
        this.categoryBlocks = Collections.unmodifiableMap(copy);
        this.titles = List.copyOf(titles);
    }

    public List<ContentBlock> getCombinedBlocks() {
        return combinedBlocks;
    }
    public Map<String, List<ContentBlock>> getCategoryBlocks() {
        return categoryBlocks;
    }
    public List<String> getTitles() {
        return titles;
    }
    public boolean isEmpty() {
        return combinedBlocks.isEmpty();
    }
}
