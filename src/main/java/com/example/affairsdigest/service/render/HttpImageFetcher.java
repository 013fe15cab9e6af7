package com.example.affairsdigest.service.render;

import com.example.affairsdigest.exception.FetchException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.logging.Logger;

public class HttpImageFetcher implements ImageFetcher {
    private final HttpClient client;
    private final Logger logger;

    public HttpImageFetcher(HttpClient client, Logger logger) {
        this.client = client;
        this.logger = logger;
    }

    @Override
    public byte[] fetch(String url) throws FetchException {
        logger.info("Downloading image from " + url);
        HttpResponse<byte[]> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(10))
                    .GET()
                    .build();
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchException("Image download failed for " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Image download interrupted for " + url, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new FetchException("Image download for " + url + " returned " + response.statusCode());
        }
        return response.body();
    }
}
