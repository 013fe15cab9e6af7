/**
 * Translator backed by the public Google Translate web endpoint. The source language is auto-detected.
 */

package com.example.affairsdigest.service.translate;

import com.example.affairsdigest.exception.TranslationException;
import org.json.JSONArray;
import org.json.JSONException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.logging.Logger;

public class GoogleTranslator implements Translator {
    public static final String DEFAULT_ENDPOINT = "https://translate.googleapis.com/translate_a/single";
    static final int MAX_TEXT_LENGTH = 5000;

    private final HttpClient client;
    private final String endpoint;
    private final Logger logger;

    public GoogleTranslator(HttpClient client, Logger logger) {
        this(client, DEFAULT_ENDPOINT, logger);
    }

    public GoogleTranslator(HttpClient client, String endpoint, Logger logger) {
        this.client = client;
        this.endpoint = endpoint;
        this.logger = logger;
    }

    @Override
    public String translate(String text, String targetLanguage) throws TranslationException {
        if (text.length() > MAX_TEXT_LENGTH) {
            logger.warning("Text of " + text.length() + " characters is too long to translate, keeping original");
            return text;
        }
        String params = String.format("client=gtx&sl=auto&tl=%s&dt=t&q=%s",
                URLEncoder.encode(targetLanguage, StandardCharsets.UTF_8),
                URLEncoder.encode(text, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint + "?" + params))
                .timeout(Duration.ofSeconds(15))
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TranslationException("Translation request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Translation interrupted", e);
        }
        if (response.statusCode() != 200) {
            throw new TranslationException("Translation API returned " + response.statusCode());
        }
        return parse(response.body());
    }

    // [[["translated","original",...],["translated","original",...]],null,"en",...]
    static String parse(String body) throws TranslationException {
        try {
            JSONArray segments = new JSONArray(body).getJSONArray(0);
            StringBuilder translated = new StringBuilder();
            for (int i = 0; i < segments.length(); i++) {
                JSONArray segment = segments.optJSONArray(i);
                if (segment != null && !segment.isNull(0)) {
                    translated.append(segment.getString(0));
                }
            }
            if (translated.length() == 0) {
                throw new TranslationException("Translation response had no text");
            }
            return translated.toString();
        } catch (JSONException e) {
            throw new TranslationException("Unreadable translation response: " + e.getMessage(), e);
        }
    }
}
