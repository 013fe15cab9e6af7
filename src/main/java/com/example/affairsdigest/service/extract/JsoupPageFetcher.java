package com.example.affairsdigest.service.extract;

import com.example.affairsdigest.exception.FetchException;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.util.logging.Logger;

public class JsoupPageFetcher implements PageFetcher {
    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/126 Safari/537.36";
    private static final int TIMEOUT_MILLIS = 10_000;

    private final Logger logger;

    public JsoupPageFetcher(Logger logger) {
        this.logger = logger;
    }

    @Override
    public Document fetch(String url) throws FetchException {
        try {
            Document document = Jsoup.connect(url)
                    .userAgent(USER_AGENT)
                    .timeout(TIMEOUT_MILLIS)
                    .followRedirects(true)
                    .get();
            logger.info("Content fetched for " + url);
            return document;
        } catch (HttpStatusException e) {
            throw new FetchException("HTTP " + e.getStatusCode() + " for " + url, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchException("Failed to fetch " + url + ": " + e.getMessage(), e);
        }
    }
}
