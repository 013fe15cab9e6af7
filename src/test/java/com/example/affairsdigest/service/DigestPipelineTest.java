package com.example.affairsdigest.service;

import com.example.affairsdigest.PipelineContext;
import com.example.affairsdigest.exception.DeliveryException;
import com.example.affairsdigest.exception.FetchException;
import com.example.affairsdigest.exception.PipelineAbortedException;
import com.example.affairsdigest.model.DigestBatch;
import com.example.affairsdigest.repository.FileUrlLedger;
import com.example.affairsdigest.service.delivery.CaptionComposer;
import com.example.affairsdigest.service.delivery.DeliveryAdapter;
import com.example.affairsdigest.service.delivery.DeliveryChannel;
import com.example.affairsdigest.service.delivery.RetryPolicy;
import com.example.affairsdigest.service.docs.RemoteDocumentApi;
import com.example.affairsdigest.service.docs.RemoteDocumentBuilder;
import com.example.affairsdigest.service.extract.ArticleExtractor;
import com.example.affairsdigest.service.extract.ArticleLinkScraper;
import com.example.affairsdigest.service.extract.CategoryDetector;
import com.example.affairsdigest.service.extract.PageFetcher;
import com.example.affairsdigest.service.render.DocxDigestRenderer;
import com.example.affairsdigest.service.render.ImageNormalizer;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DigestPipelineTest {

    private static final String BASE_URL = "https://affairs.example.com/current-affairs/";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T06:00:00Z"), ZoneOffset.UTC);
    private static final Logger LOGGER = Logger.getLogger("test");

    @TempDir
    Path tempDir;

    @Mock
    private DeliveryChannel channel;

    @Mock
    private RemoteDocumentApi documentApi;

    private final Map<String, String> pages = new HashMap<>();
    private final AtomicInteger articleFetches = new AtomicInteger();
    private final ExecutorService workers = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void shouldDeliverCombinedDocumentAndWriteCategoryDocuments() throws Exception {
        listing("/article-1/", "/article-2/", "/daily-current-affairs-quiz-19-october/");
        article("/article-1/", "Parliament passes bill", "Polity");
        article("/article-2/", "Rates cut", "Economy");
        when(documentApi.createDocument("October 2026 - Polity")).thenReturn("doc-polity");
        when(documentApi.createDocument("October 2026 - Economy")).thenReturn("doc-economy");

        DigestBatch batch = pipeline(true).run();

        assertThat(batch.getTitles()).containsExactly("Parliament passes bill", "Rates cut");
        assertThat(batch.getCategoryBlocks().keySet()).containsExactly("Polity", "Economy");
        ArgumentCaptor<Path> file = ArgumentCaptor.forClass(Path.class);
        ArgumentCaptor<String> caption = ArgumentCaptor.forClass(String.class);
        verify(channel).sendDocument(file.capture(), eq("19-10-2026_Current_Affairs.docx"), caption.capture());
        assertThat(caption.getValue())
                .startsWith("🎗️ 19 October 2026 Current Affairs 🎗️")
                .contains("👉 Parliament passes bill\n👉 Rates cut\n")
                .endsWith("footer");
        assertThat(file.getValue()).doesNotExist();
        verify(documentApi).batchUpdate(eq("doc-polity"), anyList());
        verify(documentApi).batchUpdate(eq("doc-economy"), anyList());
        assertThat(Files.readAllLines(tempDir.resolve("ledger.txt"))).hasSize(2);
    }

    @Test
    void shouldSkipUrlsAlreadyInLedger() throws Exception {
        listing("/article-1/", "/article-2/");
        article("/article-1/", "Parliament passes bill", "Polity");
        article("/article-2/", "Rates cut", "Economy");
        Files.writeString(tempDir.resolve("ledger.txt"), BASE_URL + "article-1/\t2026-10-18 06:00:00\n");
        when(documentApi.createDocument("October 2026 - Economy")).thenReturn("doc-economy");

        DigestBatch batch = pipeline(true).run();

        assertThat(batch.getTitles()).containsExactly("Rates cut");
        assertThat(articleFetches).hasValue(1);
        verify(documentApi, never()).createDocument("October 2026 - Polity");
    }

    @Test
    void shouldReturnEmptyBatchWhenNothingIsNew() throws Exception {
        listing("/article-1/");
        article("/article-1/", "Parliament passes bill", "Polity");
        Files.writeString(tempDir.resolve("ledger.txt"), BASE_URL + "article-1/\t2026-10-18 06:00:00\n");

        DigestBatch batch = pipeline(true).run();

        assertThat(batch.isEmpty()).isTrue();
        assertThat(articleFetches).hasValue(0);
        verifyNoInteractions(channel, documentApi);
    }

    @Test
    void shouldKeepUncategorizedArticlesInCombinedDocumentOnly() throws Exception {
        listing("/article-1/", "/article-2/");
        article("/article-1/", "Parliament passes bill", null);
        article("/article-2/", "Rates cut", null);

        DigestBatch batch = pipeline(true).run();

        assertThat(batch.getCombinedBlocks()).hasSize(8);
        assertThat(batch.getCategoryBlocks()).isEmpty();
        verify(channel).sendDocument(any(), anyString(), anyString());
        verifyNoInteractions(documentApi);
    }

    @Test
    void shouldAbortWhenListingHasNoLinks() {
        listing();

        assertThatThrownBy(() -> pipeline(true).run())
                .isInstanceOf(PipelineAbortedException.class)
                .hasMessageContaining("No URLs scraped");
        verifyNoInteractions(channel);
    }

    @Test
    void shouldAbortWhenNoArticleCouldBeExtracted() {
        listing("/article-1/", "/broken/");
        pages.put(BASE_URL + "broken/", "<html><body><p>maintenance</p></body></html>");

        assertThatThrownBy(() -> pipeline(true).run())
                .isInstanceOf(PipelineAbortedException.class)
                .hasMessageContaining("No content");
        verifyNoInteractions(channel);
    }

    @Test
    void shouldAbortWithoutDeliveryCredentials() {
        listing("/article-1/");
        article("/article-1/", "Parliament passes bill", "Polity");

        assertThatThrownBy(() -> pipeline(false).run())
                .isInstanceOf(PipelineAbortedException.class)
                .hasMessageContaining("Delivery");
        assertThat(articleFetches).hasValue(0);
    }

    @Test
    void shouldAbortAndSkipDocumentsWhenDeliveryFails() throws Exception {
        listing("/article-1/");
        article("/article-1/", "Parliament passes bill", "Polity");
        doThrow(new DeliveryException("401 Unauthorized", false)).when(channel).sendDocument(any(), anyString(), anyString());

        assertThatThrownBy(() -> pipeline(true).run())
                .isInstanceOf(PipelineAbortedException.class)
                .hasCauseInstanceOf(DeliveryException.class);
        verifyNoInteractions(documentApi);
    }

    private PipelineContext pipelineContext(boolean withDelivery) {
        PageFetcher fetcher = url -> {
            String html = pages.get(url);
            if (html == null) {
                throw new FetchException("HTTP 404 for " + url);
            }
            if (!url.equals(BASE_URL) && !url.contains("/page/")) {
                articleFetches.incrementAndGet();
            }
            return Jsoup.parse(html, url);
        };
        BilingualBlockBuilder blockBuilder = new BilingualBlockBuilder((text, language) -> "gu:" + text, "gu", LOGGER);
        return PipelineContext.builder()
                .logger(LOGGER)
                .clock(CLOCK)
                .workers(workers)
                .linkScraper(new ArticleLinkScraper(fetcher, BASE_URL, 2, "daily-current-affairs-quiz", LOGGER))
                .ledger(new FileUrlLedger(tempDir.resolve("ledger.txt"), LOGGER))
                .extractor(new ArticleExtractor(fetcher, ArticleExtractor.defaultStrategies(), new CategoryDetector(),
                        blockBuilder, LOGGER))
                .normalizer(new DigestNormalizer(LOGGER))
                .renderer(new DocxDigestRenderer(url -> {
                    throw new FetchException("offline");
                }, new ImageNormalizer(LOGGER), LOGGER))
                .captionComposer(new CaptionComposer("footer"))
                .deliveryAdapter(withDelivery
                        ? new DeliveryAdapter(channel, new RetryPolicy(2, Duration.ZERO, Duration.ZERO, d -> { }), LOGGER)
                        : null)
                .documentBuilder(new RemoteDocumentBuilder(documentApi, workers, LOGGER))
                .build();
    }

    private DigestPipeline pipeline(boolean withDelivery) {
        return new DigestPipeline(pipelineContext(withDelivery));
    }

    private void listing(String... paths) {
        StringBuilder html = new StringBuilder("<html><body>");
        for (String path : paths) {
            html.append("<h1 id=\"list\"><a href=\"").append(path.substring(1)).append("\">").append(path).append("</a></h1>");
        }
        pages.put(BASE_URL, html.append("</body></html>").toString());
    }

    private void article(String path, String heading, String category) {
        String categoryLine = category == null ? ""
                : "<p class=\"small-font\"><b>Category:</b> <a href=\"/c\" rel=\"category tag\">" + category + "</a></p>";
        pages.put(BASE_URL + path.substring(1), "<html><body>"
                + "<div class=\"inside_post column content_width\">"
                + "<h1 id=\"list\">" + heading + "</h1>"
                + "<p>Body of " + heading + ".</p>"
                + categoryLine
                + "</div></body></html>");
    }
}
