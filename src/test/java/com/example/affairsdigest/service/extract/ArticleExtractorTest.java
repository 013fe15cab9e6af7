package com.example.affairsdigest.service.extract;

import com.example.affairsdigest.exception.FetchException;
import com.example.affairsdigest.exception.TranslationException;
import com.example.affairsdigest.model.Article;
import com.example.affairsdigest.model.BlockKind;
import com.example.affairsdigest.model.ContentBlock;
import com.example.affairsdigest.model.Language;
import com.example.affairsdigest.service.BilingualBlockBuilder;
import com.example.affairsdigest.service.translate.Translator;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class ArticleExtractorTest {

    private static final String URL = "https://news.example.com/article-1/";

    private final Logger logger = Logger.getLogger("test");

    @Test
    void shouldExtractCurrentLayoutArticle() {
        String html = """
            <html><body>
              <div class="featured_image"><img src="https://img.example.com/a.jpg"></div>
              <div class="inside_post column content_width">
                <h1 id="list">Parliament passes bill</h1>
                <p>The bill was passed on Monday.</p>
                <ul><li>First point</li><li>Second point</li></ul>
                <p class="prenext">Previous Next</p>
                <p class="small-font"><b>Category:</b> <a href="/category/polity" rel="category tag">Polity</a></p>
              </div>
            </body></html>
            """;

        Article article = extractor(html, prefixing()).extract(URL);

        assertThat(article.getCategory()).contains("Polity");
        assertThat(article.getBlocks()).extracting(ContentBlock::getKind).containsExactly(
                BlockKind.HEADING, BlockKind.HEADING,
                BlockKind.PARAGRAPH, BlockKind.PARAGRAPH,
                BlockKind.BULLET_ITEM, BlockKind.BULLET_ITEM,
                BlockKind.BULLET_ITEM, BlockKind.BULLET_ITEM);
        assertThat(article.getBlocks()).extracting(ContentBlock::getText).containsExactly(
                "gu:Parliament passes bill", "Parliament passes bill",
                "gu:The bill was passed on Monday.", "The bill was passed on Monday.",
                "gu:First point", "First point",
                "gu:Second point", "Second point");
        assertThat(article.getBlocks().get(0).getImageRef()).contains("https://img.example.com/a.jpg");
        assertThat(article.getBlocks().stream().filter(b -> b.getImageRef().isPresent())).hasSize(1);
        assertThat(article.getDisplayTitle()).contains("Parliament passes bill");
    }

    @Test
    void shouldFallBackToLegacyLayoutAndTextCategory() {
        String html = """
            <html><head><meta property="og:image" content="https://img.example.com/old.png"></head><body>
              <div class="post-content">
                <h1>Budget highlights</h1>
                <h2>Key numbers</h2>
                <ol><li>Deficit</li><li>Growth</li></ol>
                <h4>Note</h4>
                <ol><li>Inflation</li></ol>
                <p>Category: Economy</p>
              </div>
            </body></html>
            """;

        Article article = extractor(html, prefixing()).extract(URL);

        assertThat(article.getCategory()).contains("Economy");
        assertThat(article.getBlocks().get(0).getImageRef()).contains("https://img.example.com/old.png");
        assertThat(article.getBlocks()).extracting(ContentBlock::getKind).containsExactly(
                BlockKind.HEADING, BlockKind.HEADING,
                BlockKind.SUB_HEADING, BlockKind.SUB_HEADING,
                BlockKind.NUMBERED_ITEM, BlockKind.NUMBERED_ITEM,
                BlockKind.NUMBERED_ITEM, BlockKind.NUMBERED_ITEM,
                BlockKind.SUB_SUB_HEADING, BlockKind.SUB_SUB_HEADING,
                BlockKind.NUMBERED_ITEM, BlockKind.NUMBERED_ITEM);
        assertThat(article.getBlocks().stream()
                .filter(b -> b.getOrdinal().isPresent())
                .mapToInt(b -> b.getOrdinal().getAsInt()))
                .containsExactly(1, 1, 2, 2, 3, 3);
    }

    @Test
    void shouldNotMixStrategiesWhenMatchedRootHasNoHeading() {
        String html = """
            <html><body>
              <div class="inside_post column content_width"><p>No heading here</p></div>
              <div class="post-content"><h1>Legacy heading</h1><p>text</p></div>
            </body></html>
            """;

        Article article = extractor(html, prefixing()).extract(URL);

        assertThat(article.isEmpty()).isTrue();
    }

    @Test
    void shouldReturnEmptyArticleWhenNoLayoutMatches() {
        Article article = extractor("<html><body><div class=\"other\"><h1>x</h1></div></body></html>", prefixing())
                .extract(URL);

        assertThat(article.isEmpty()).isTrue();
        assertThat(article.getUrl()).isEqualTo(URL);
    }

    @Test
    void shouldReturnEmptyArticleWhenPageCannotBeFetched() {
        PageFetcher failing = url -> {
            throw new FetchException("HTTP 503 for " + url);
        };
        ArticleExtractor extractor = new ArticleExtractor(failing, ArticleExtractor.defaultStrategies(),
                new CategoryDetector(), new BilingualBlockBuilder(prefixing(), "gu", logger), logger);

        assertThat(extractor.extract(URL).isEmpty()).isTrue();
    }

    @Test
    void shouldSkipNavigationWidgetsAndEmptyElements() {
        String html = """
            <html><body>
              <div class="inside_post column content_width">
                <h1 id="list">Heading</h1>
                <ul class="breadcrumbs"><li>Home</li><li>News</li></ul>
                <p class="sharethis-inline-share-buttons st-center">Share</p>
                <p>   </p>
                <div>Plain div text is not content</div>
                <p>Kept paragraph</p>
              </div>
            </body></html>
            """;

        Article article = extractor(html, prefixing()).extract(URL);

        assertThat(article.getCategory()).isEmpty();
        assertThat(article.getBlocks()).extracting(ContentBlock::getText)
                .containsExactly("gu:Heading", "Heading", "gu:Kept paragraph", "Kept paragraph");
    }

    @Test
    void shouldProduceIdenticalPairsWhenTranslationAlwaysFails() {
        String html = """
            <html><body><div class="inside_post column content_width">
              <h1 id="list">Heading</h1><p>Body</p><ol><li>One</li></ol>
            </div></body></html>
            """;
        Translator failing = (text, lang) -> {
            throw new TranslationException("quota exceeded");
        };

        Article article = extractor(html, failing).extract(URL);

        List<ContentBlock> blocks = article.getBlocks();
        assertThat(blocks).hasSize(6);
        for (int i = 0; i < blocks.size(); i += 2) {
            assertThat(blocks.get(i).getLanguage()).isEqualTo(Language.TRANSLATED);
            assertThat(blocks.get(i).getText()).isEqualTo(blocks.get(i + 1).getText());
        }
    }

    private ArticleExtractor extractor(String html, Translator translator) {
        PageFetcher fetcher = url -> Jsoup.parse(html, url);
        return new ArticleExtractor(fetcher, ArticleExtractor.defaultStrategies(), new CategoryDetector(),
                new BilingualBlockBuilder(translator, "gu", logger), logger);
    }

    private static Translator prefixing() {
        return (text, lang) -> lang + ":" + text;
    }
}
