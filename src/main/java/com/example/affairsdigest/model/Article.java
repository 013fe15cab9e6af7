/**
 * Article holds one scraped URL, its detected category (if any) and its bilingual block sequence.
 * - An article with no blocks means extraction failed and the URL is skipped downstream.
 * - equals()/hashCode() use the URL, the only identity an article has.
 */

package com.example.affairsdigest.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class Article {
    private final String url;
    private final String category;
    private final List<ContentBlock> blocks;

    public Article(String url, String category, List<ContentBlock> blocks) {
        this.url = Objects.requireNonNull(url, "url");
        this.category = category == null || category.isBlank() ? null : category.trim();
        this.blocks = List.copyOf(blocks);
    }

    public static Article empty(String url) {
        return new Article(url, null, Collections.emptyList());
    }

    public String getUrl() {
        return url;
    }
    public Optional<String> getCategory() {
        return Optional.ofNullable(category);
    }
    public List<ContentBlock> getBlocks() {
        return blocks;
    }
    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    /**
     * The original-language heading, which is always the second block of a non-empty article.
     */
    public Optional<String> getDisplayTitle() {
        if (blocks.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(blocks.get(1).getText());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return url.equals(((Article) o).url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url);
    }
}
