/**
 * DeliveryChannel backed by the Telegram Bot API.
 */

package com.example.affairsdigest.service.delivery;

import com.example.affairsdigest.exception.DeliveryException;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.logging.Logger;

public class TelegramChannel implements DeliveryChannel {
    public static final String DEFAULT_ENDPOINT = "https://api.telegram.org";
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient client;
    private final String endpoint;
    private final String botToken;
    private final String chatId;
    private final Logger logger;

    public TelegramChannel(HttpClient client, String botToken, String chatId, Logger logger) {
        this(client, DEFAULT_ENDPOINT, botToken, chatId, logger);
    }

    public TelegramChannel(HttpClient client, String endpoint, String botToken, String chatId, Logger logger) {
        this.client = client;
        this.endpoint = endpoint;
        this.botToken = botToken;
        this.chatId = chatId;
        this.logger = logger;
    }

    @Override
    public void sendDocument(Path file, String filename, String caption) throws DeliveryException {
        String boundary = "----digest" + UUID.randomUUID().toString().replace("-", "");
        byte[] body;
        try {
            ByteArrayOutputStream multipart = new ByteArrayOutputStream();
            writeField(multipart, boundary, "chat_id", chatId);
            writeField(multipart, boundary, "caption", caption);
            multipart.write(("--" + boundary + "\r\n"
                    + "Content-Disposition: form-data; name=\"document\"; filename=\"" + filename + "\"\r\n"
                    + "Content-Type: application/vnd.openxmlformats-officedocument.wordprocessingml.document\r\n\r\n")
                    .getBytes(StandardCharsets.UTF_8));
            multipart.write(Files.readAllBytes(file));
            multipart.write(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
            body = multipart.toByteArray();
        } catch (IOException e) {
            throw new DeliveryException("Could not read " + file + ": " + e.getMessage(), false, e);
        }
        logger.info(String.format("Attempting to send document of size %.2f KB", body.length / 1024.0));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(methodUrl("sendDocument")))
                .timeout(TIMEOUT)
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        send(request, "sendDocument");
    }

    @Override
    public void sendMessage(String text) throws DeliveryException {
        JSONObject payload = new JSONObject()
                .put("chat_id", chatId)
                .put("text", text);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(methodUrl("sendMessage")))
                .timeout(TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString(), StandardCharsets.UTF_8))
                .build();
        send(request, "sendMessage");
    }

    private void send(HttpRequest request, String method) throws DeliveryException {
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new DeliveryException("Telegram " + method + " timed out", true, e);
        } catch (IOException e) {
            throw new DeliveryException("Telegram " + method + " failed: " + e.getMessage(), false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Telegram " + method + " interrupted", false, e);
        }
        if (response.statusCode() != 200 || !isOk(response.body())) {
            throw new DeliveryException("Telegram " + method + " returned " + response.statusCode() + ": "
                    + response.body(), false);
        }
        logger.info("Telegram " + method + " succeeded");
    }

    private static boolean isOk(String body) {
        try {
            return new JSONObject(body).optBoolean("ok", false);
        } catch (JSONException e) {
            return false;
        }
    }

    private String methodUrl(String method) {
        return endpoint + "/bot" + botToken + "/" + method;
    }

    private static void writeField(ByteArrayOutputStream out, String boundary, String name, String value) throws IOException {
        out.write(("--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"" + name + "\"\r\n"
                + "Content-Type: text/plain; charset=UTF-8\r\n\r\n"
                + value + "\r\n").getBytes(StandardCharsets.UTF_8));
    }
}
