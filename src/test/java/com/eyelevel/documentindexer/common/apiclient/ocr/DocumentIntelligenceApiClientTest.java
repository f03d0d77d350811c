package com.eyelevel.documentindexer.common.apiclient.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eyelevel.documentindexer.common.apiclient.authentication.impl.APIKeyAuthentication;
import com.eyelevel.documentindexer.common.apiclient.ocr.model.AnalyzeOperationResponse;
import com.eyelevel.documentindexer.common.json.jackson.JacksonJsonParser;
import com.eyelevel.documentindexer.exception.OcrAnalysisException;
import com.eyelevel.documentindexer.exception.apiclient.UnauthorizedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Verifies the analyze request shape and status mapping against a local stub server.
 */
class DocumentIntelligenceApiClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutorService serverExecutor;
    private HttpServer httpServer;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        serverExecutor = Executors.newSingleThreadExecutor();
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.setExecutor(serverExecutor);
        baseUrl = "http://" + httpServer.getAddress().getHostString() + ":" + httpServer.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        httpServer.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void startAnalysis_postsUrlSourceAndReturnsOperationLocation() {
        AtomicReference<String> observedQuery = new AtomicReference<>();
        AtomicReference<String> observedKey = new AtomicReference<>();
        AtomicReference<JsonNode> observedBody = new AtomicReference<>();
        httpServer.createContext("/documentintelligence/documentModels/prebuilt-read:analyze", exchange -> {
            observedQuery.set(exchange.getRequestURI().getQuery());
            observedKey.set(exchange.getRequestHeaders().getFirst("Ocp-Apim-Subscription-Key"));
            observedBody.set(objectMapper.readTree(exchange.getRequestBody().readAllBytes()));
            exchange.getResponseHeaders().add("Operation-Location", baseUrl + "/operations/42");
            exchange.sendResponseHeaders(202, -1);
            exchange.close();
        });
        httpServer.start();

        URI operation = client().startAnalysis("prebuilt-read", "https://files.example.com/scan.pdf");

        assertEquals(URI.create(baseUrl + "/operations/42"), operation);
        assertEquals("api-version=2024-07-31-preview", observedQuery.get());
        assertEquals("secret", observedKey.get());
        assertEquals("https://files.example.com/scan.pdf", observedBody.get().path("urlSource").asText());
    }

    @Test
    void startAnalysis_failsWithoutOperationLocation() {
        httpServer.createContext("/documentintelligence/documentModels/prebuilt-read:analyze", exchange -> {
            exchange.sendResponseHeaders(202, -1);
            exchange.close();
        });
        httpServer.start();

        assertThrows(OcrAnalysisException.class,
                     () -> client().startAnalysis("prebuilt-read", "https://files.example.com/scan.pdf"));
    }

    @Test
    void fetchAnalysis_parsesOperationStatusFromAbsoluteUrl() {
        httpServer.createContext("/operations/42", exchange -> respondJson(exchange, 200,
                "{\"status\":\"succeeded\",\"createdDateTime\":\"2024-01-01T00:00:00Z\","
                + "\"analyzeResult\":{\"modelId\":\"prebuilt-read\",\"content\":\"Hello\","
                + "\"pages\":[{\"pageNumber\":1,\"unit\":\"pixel\",\"words\":[{\"content\":\"Hello\","
                + "\"confidence\":0.99}],\"lines\":[{\"content\":\"Hello\"}]}],"
                + "\"languages\":[{\"locale\":\"en\",\"confidence\":1.0}]}}"));
        httpServer.start();

        AnalyzeOperationResponse response = client().fetchAnalysis(URI.create(baseUrl + "/operations/42"));

        assertEquals("succeeded", response.status());
        assertEquals("Hello", response.analyzeResult().content());
        assertEquals(1, response.analyzeResult().pages().size());
        assertEquals("en", response.analyzeResult().languages().get(0).locale());
    }

    @Test
    void fetchAnalysis_mapsUnauthorizedStatus() {
        httpServer.createContext("/operations/42",
                                 exchange -> respondJson(exchange, 401, "{\"error\":{\"code\":\"401\"}}"));
        httpServer.start();

        UnauthorizedException error = assertThrows(UnauthorizedException.class,
                () -> client().fetchAnalysis(URI.create(baseUrl + "/operations/42")));

        assertEquals(401, error.getStatusCode());
        assertTrue(!error.isTransient());
    }

    private DocumentIntelligenceApiClient client() {
        return new DocumentIntelligenceApiClient(WebClient.builder().baseUrl(baseUrl).build(),
                                                 new APIKeyAuthentication("Ocp-Apim-Subscription-Key", "secret"),
                                                 new JacksonJsonParser(objectMapper), "2024-07-31-preview",
                                                 "/documentintelligence/documentModels/{modelId}:analyze", 5);
    }

    private static void respondJson(HttpExchange exchange, int statusCode, String responseJson) throws IOException {
        byte[] jsonBytes = responseJson.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, jsonBytes.length);
        try (OutputStream outputStream = exchange.getResponseBody()) {
            outputStream.write(jsonBytes);
        }
    }
}
