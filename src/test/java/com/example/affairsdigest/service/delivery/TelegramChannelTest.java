package com.example.affairsdigest.service.delivery;

import com.example.affairsdigest.exception.DeliveryException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TelegramChannelTest {

    private HttpServer server;

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void shouldUploadDocumentAsMultipart() throws Exception {
        List<String> paths = new CopyOnWriteArrayList<>();
        List<String> contentTypes = new CopyOnWriteArrayList<>();
        List<String> bodies = new CopyOnWriteArrayList<>();
        server = startServer(exchange -> {
            paths.add(exchange.getRequestURI().getPath());
            contentTypes.add(exchange.getRequestHeaders().getFirst("Content-Type"));
            bodies.add(readBody(exchange));
            writeJson(exchange, 200, "{\"ok\":true,\"result\":{}}");
        });
        Path file = Files.writeString(tempDir.resolve("digest.docx"), "docx-bytes");

        channel().sendDocument(file, "19-10-2026_Current_Affairs.docx", "🎗️ caption");

        assertThat(paths).containsExactly("/botTOKEN/sendDocument");
        assertThat(contentTypes.get(0)).startsWith("multipart/form-data; boundary=");
        assertThat(bodies.get(0))
                .contains("name=\"chat_id\"\r\nContent-Type: text/plain; charset=UTF-8\r\n\r\n@channel\r\n")
                .contains("🎗️ caption")
                .contains("filename=\"19-10-2026_Current_Affairs.docx\"")
                .contains("docx-bytes");
    }

    @Test
    void shouldPostFullCaptionAsJsonMessage() throws Exception {
        List<String> bodies = new CopyOnWriteArrayList<>();
        server = startServer(exchange -> {
            bodies.add(readBody(exchange));
            writeJson(exchange, 200, "{\"ok\":true}");
        });

        channel().sendMessage("full caption");

        JSONObject payload = new JSONObject(bodies.get(0));
        assertThat(payload.getString("chat_id")).isEqualTo("@channel");
        assertThat(payload.getString("text")).isEqualTo("full caption");
    }

    @Test
    void shouldTreatRejectionAsPermanent() throws Exception {
        server = startServer(exchange -> writeJson(exchange, 401, "{\"ok\":false,\"description\":\"Unauthorized\"}"));

        assertThatThrownBy(() -> channel().sendMessage("text"))
                .isInstanceOfSatisfying(DeliveryException.class, e -> assertThat(e.isTransient()).isFalse())
                .hasMessageContaining("401");
    }

    @Test
    void shouldTreatNotOkAnswerAsPermanent() throws Exception {
        server = startServer(exchange -> writeJson(exchange, 200, "{\"ok\":false}"));

        assertThatThrownBy(() -> channel().sendMessage("text"))
                .isInstanceOfSatisfying(DeliveryException.class, e -> assertThat(e.isTransient()).isFalse());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldTreatTimeoutAsTransient() throws Exception {
        HttpClient client = mock(HttpClient.class);
        when(client.send(any(), any(HttpResponse.BodyHandler.class))).thenThrow(new HttpTimeoutException("request timed out"));
        TelegramChannel channel = new TelegramChannel(client, "http://127.0.0.1:1", "TOKEN", "@channel", Logger.getLogger("test"));

        assertThatThrownBy(() -> channel.sendMessage("text"))
                .isInstanceOfSatisfying(DeliveryException.class, e -> assertThat(e.isTransient()).isTrue());
    }

    private TelegramChannel channel() {
        return new TelegramChannel(HttpClient.newHttpClient(), "http://127.0.0.1:" + server.getAddress().getPort(),
                "TOKEN", "@channel", Logger.getLogger("test"));
    }

    private static HttpServer startServer(HttpHandler handler) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", handler);
        server.start();
        return server;
    }

    private static void writeJson(HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        exchange.getResponseBody().write(bytes);
        exchange.close();
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream input = exchange.getRequestBody()) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
