package com.example.affairsdigest.service.extract;

import com.example.affairsdigest.exception.FetchException;
import com.example.affairsdigest.exception.StructuralMismatchException;
import com.example.affairsdigest.model.Article;
import com.example.affairsdigest.model.BlockKind;
import com.example.affairsdigest.model.ContentBlock;
import com.example.affairsdigest.service.BilingualBlockBuilder;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

public class ArticleExtractor {
    private static final Map<String, BlockKind> CONTENT_TAGS = Map.of(
            "p", BlockKind.PARAGRAPH,
            "h2", BlockKind.SUB_HEADING,
            "h4", BlockKind.SUB_SUB_HEADING,
            "ul", BlockKind.BULLET_ITEM,
            "ol", BlockKind.NUMBERED_ITEM);
    private static final Set<String> EXCLUDED_CLASSES = Set.of(
            "sharethis-inline-share-buttons", "st-inline-share-buttons", "prenext",
            "breadcrumb", "breadcrumbs", "navigation", "nav-links", "comments", "comment-respond");
    private static final String EXCLUDED_ELEMENTS = "nav, aside, footer, form, #comments, .comments, .breadcrumbs";

    private final PageFetcher pageFetcher;
    private final List<LayoutStrategy> strategies;
    private final CategoryDetector categoryDetector;
    private final BilingualBlockBuilder blockBuilder;
    private final Logger logger;

    public ArticleExtractor(PageFetcher pageFetcher, List<LayoutStrategy> strategies,
                            CategoryDetector categoryDetector, BilingualBlockBuilder blockBuilder, Logger logger) {
        this.pageFetcher = pageFetcher;
        this.strategies = List.copyOf(strategies);
        this.categoryDetector = categoryDetector;
        this.blockBuilder = blockBuilder;
        this.logger = logger;
    }

    public static List<LayoutStrategy> defaultStrategies() {
        return List.of(new CurrentLayoutStrategy(), new LegacyLayoutStrategy());
    }

    /**
     * Fetches one article page and returns its bilingual content.
     * Any failure is logged and reported as an empty article so the caller can skip the URL.
     *
     * @param url article URL
     * @return the article, empty when the page could not be fetched or understood
     */
    public Article extract(String url) {
        try {
            logger.info("Starting to scrape content from " + url);
            Document document = pageFetcher.fetch(url);
            Article article = extract(url, document);
            logger.info("Finished scraping content for " + url);
            return article;
        } catch (FetchException e) {
            logger.warning("Error fetching " + url + ": " + e.getMessage());
        } catch (StructuralMismatchException e) {
            logger.warning("Error scraping " + url + ": " + e.getMessage());
        } catch (RuntimeException e) {
            logger.severe("Unexpected error scraping " + url + ": " + e);
        }
        return Article.empty(url);
    }

    Article extract(String url, Document document) throws StructuralMismatchException {
        for (LayoutStrategy strategy : strategies) {
            Optional<Element> root = strategy.matchRoot(document);
            if (root.isPresent()) {
                return extractWith(strategy, url, document, root.get());
            }
        }
        throw new StructuralMismatchException("Main content container not found");
    }

    private Article extractWith(LayoutStrategy strategy, String url, Document document, Element root)
            throws StructuralMismatchException {
        Element heading = strategy.findHeading(document, root)
                .orElseThrow(() -> new StructuralMismatchException("Heading not found (" + strategy.name() + " layout)"));
        String imageUrl = strategy.findImageUrl(document, root).orElse(null);

        Optional<String> category = categoryDetector.detect(root);
        if (category.isPresent()) {
            logger.info("Detected category for " + url + ": " + category.get());
        } else {
            logger.warning("No category detected for " + url);
        }

        List<RawBlock> rawBlocks = collectRawBlocks(root);
        List<ContentBlock> blocks = blockBuilder.build(heading.text(), imageUrl, rawBlocks);
        return new Article(url, category.orElse(null), blocks);
    }

    private List<RawBlock> collectRawBlocks(Element root) {
        List<RawBlock> rawBlocks = new ArrayList<>();
        for (Element child : root.children()) {
            BlockKind kind = CONTENT_TAGS.get(child.normalName());
            if (kind == null || isExcluded(child, root)) {
                continue;
            }
            String text = child.text().trim();
            if (text.isEmpty() || categoryDetector.isCategoryMarker(text)) {
                continue;
            }
            if (kind.isListItem()) {
                // nested lists stay inside their parent item's text
                for (Element item : child.children()) {
                    if (!item.normalName().equals("li")) {
                        continue;
                    }
                    String itemText = item.text().trim();
                    if (!itemText.isEmpty()) {
                        rawBlocks.add(new RawBlock(kind, itemText));
                    }
                }
            } else {
                rawBlocks.add(new RawBlock(kind, text));
            }
        }
        return rawBlocks;
    }

    private boolean isExcluded(Element element, Element root) {
        for (Element current = element; current != null && current != root; current = current.parent()) {
            for (String className : current.classNames()) {
                if (EXCLUDED_CLASSES.contains(className)) {
                    return true;
                }
            }
            if (current.is(EXCLUDED_ELEMENTS)) {
                return true;
            }
        }
        return false;
    }
}
