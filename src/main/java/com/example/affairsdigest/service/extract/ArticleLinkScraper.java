/**
 * ArticleLinkScraper collects article URLs from the first pages of the listing.
 * - Page 1 is the base URL itself, page N is baseUrl + "page/N/".
 * - Links are taken from the listing headings, made absolute and de-duplicated in listing order.
 * - URLs containing the exclusion marker (quiz pages) are dropped.
 * A listing page that cannot be fetched is logged and skipped.
 */

package com.example.affairsdigest.service.extract;

import com.example.affairsdigest.exception.FetchException;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

public class ArticleLinkScraper {
    private static final String LINK_SELECTOR = "h1#list a[href]";

    private final PageFetcher pageFetcher;
    private final String baseUrl;
    private final int pageCount;
    private final String excludeMarker;
    private final Logger logger;

    public ArticleLinkScraper(PageFetcher pageFetcher, String baseUrl, int pageCount,
                              String excludeMarker, Logger logger) {
        this.pageFetcher = pageFetcher;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.pageCount = pageCount;
        this.excludeMarker = excludeMarker;
        this.logger = logger;
    }

    public List<String> discover() {
        Set<String> urls = new LinkedHashSet<>();
        for (int page = 1; page <= pageCount; page++) {
            String listingUrl = page == 1 ? baseUrl : baseUrl + "page/" + page + "/";
            try {
                Document listing = pageFetcher.fetch(listingUrl);
                for (Element link : listing.select(LINK_SELECTOR)) {
                    String href = link.absUrl("href");
                    if (href.isEmpty()) {
                        href = link.attr("href").trim();
                    }
                    if (href.isEmpty()) {
                        continue;
                    }
                    if (excludeMarker != null && !excludeMarker.isEmpty() && href.contains(excludeMarker)) {
                        continue;
                    }
                    urls.add(href);
                }
            } catch (FetchException e) {
                logger.warning("Failed to fetch URLs from " + listingUrl + ": " + e.getMessage());
            }
        }
        logger.info("Scraped " + urls.size() + " URLs");
        return new ArrayList<>(urls);
    }
}
