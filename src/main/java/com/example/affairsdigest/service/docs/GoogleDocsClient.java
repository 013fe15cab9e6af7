/**
 * GoogleDocsClient is the RemoteDocumentApi implementation for the Google Docs REST API.
 * - createDocument(): POST /v1/documents with the title, returns the new documentId.
 * - batchUpdate(): POST /v1/documents/{id}:batchUpdate with every request of one document at once.
 * A bearer token from the AccessTokenProvider is sent with each call; any non-2xx answer becomes a
 * RemoteApiException carrying the HTTP status.
 */

package com.example.affairsdigest.service.docs;

import com.example.affairsdigest.exception.RemoteApiException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

public class GoogleDocsClient implements RemoteDocumentApi {
    public static final String DEFAULT_ENDPOINT = "https://docs.googleapis.com";

    private final HttpClient client;
    private final AccessTokenProvider tokenProvider;
    private final String endpoint;
    private final Logger logger;

    public GoogleDocsClient(HttpClient client, AccessTokenProvider tokenProvider, Logger logger) {
        this(client, tokenProvider, DEFAULT_ENDPOINT, logger);
    }

    public GoogleDocsClient(HttpClient client, AccessTokenProvider tokenProvider, String endpoint, Logger logger) {
        this.client = client;
        this.tokenProvider = tokenProvider;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.logger = logger;
    }

    @Override
    public String createDocument(String title) throws RemoteApiException {
        JSONObject body = new JSONObject().put("title", title);
        String response = post(endpoint + "/v1/documents", body);
        try {
            return new JSONObject(response).getString("documentId");
        } catch (JSONException e) {
            throw new RemoteApiException("Create response without documentId: " + e.getMessage(), e);
        }
    }

    @Override
    public void batchUpdate(String documentId, List<DocumentOperation> operations) throws RemoteApiException {
        JSONArray requests = new JSONArray();
        for (DocumentOperation operation : operations) {
            requests.put(operation.toJson());
        }
        String path = "/v1/documents/" + URLEncoder.encode(documentId, StandardCharsets.UTF_8) + ":batchUpdate";
        post(endpoint + path, new JSONObject().put("requests", requests));
    }

    private String post(String url, JSONObject body) throws RemoteApiException {
        String token;
        try {
            token = tokenProvider.getAccessToken();
        } catch (IOException e) {
            throw new RemoteApiException("Could not obtain access token: " + e.getMessage(), e);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(60))
                .header("Authorization", "Bearer " + token)
                .header("Content-Type", "application/json; charset=UTF-8")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RemoteApiException("Document API call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteApiException("Document API call interrupted", e);
        }
        logger.fine("Document API response code: " + response.statusCode());
        if (response.statusCode() / 100 != 2) {
            throw new RemoteApiException("Document API returned " + response.statusCode() + ": " + response.body(),
                    response.statusCode());
        }
        return response.body();
    }
}
