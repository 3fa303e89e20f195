package com.vidnyan.dtc.adapter.out.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.vidnyan.dtc.DtcProperties;
import com.vidnyan.dtc.application.port.out.Explainer;
import com.vidnyan.dtc.domain.model.CodeRecord;
import com.vidnyan.dtc.domain.model.Severity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpExplainerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> lastRequest = new AtomicReference<>();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();

    private HttpServer server;
    private volatile int status = 200;
    private volatile String responseBody = "";

    private final CodeRecord record = CodeRecord.builder()
            .code("P0420")
            .description("Catalyst System Efficiency Below Threshold (Bank 1)")
            .severity(Severity.MEDIUM)
            .system("Exhaust")
            .possibleCauses(List.of("Failing catalytic converter"))
            .recommendedActions(List.of("Check for exhaust leaks"))
            .build();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            lastRequest.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void explain_ShouldReturnRemoteContent() throws Exception {
        responseBody = """
                {"choices":[{"message":{"role":"assistant","content":"Your catalytic converter is tired."}}]}
                """;

        Explainer.Explanation explanation = explainer("secret").explain(record);

        assertEquals("Your catalytic converter is tired.", explanation.text());
        assertEquals("remote:test-model", explanation.provider());
        assertEquals("Bearer secret", lastAuthorization.get());

        JsonNode request = objectMapper.readTree(lastRequest.get());
        assertEquals("test-model", request.get("model").asText());
        assertEquals("system", request.get("messages").get(0).get("role").asText());
        assertTrue(request.get("messages").get(1).get("content").asText().contains("Code: P0420"));
    }

    @Test
    void explain_ShouldFallBackOnHttpError() {
        status = 500;
        responseBody = "{\"error\":\"boom\"}";

        Explainer.Explanation explanation = explainer("").explain(record);

        assertEquals(TemplateExplainer.PROVIDER, explanation.provider());
        assertNull(lastAuthorization.get());
    }

    @Test
    void explain_ShouldFallBackOnMissingContent() {
        responseBody = "{\"choices\":[]}";

        assertEquals(TemplateExplainer.PROVIDER, explainer("").explain(record).provider());
    }

    @Test
    void explain_ShouldFallBackWhenUnreachable() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        DtcProperties.Explainer config = config("");
        config.setEndpoint("http://127.0.0.1:" + port + "/v1/chat/completions");
        Explainer.Explanation explanation = new HttpExplainer(config, objectMapper, new TemplateExplainer())
                .explain(record);

        assertEquals(TemplateExplainer.PROVIDER, explanation.provider());
    }

    private HttpExplainer explainer(String apiKey) {
        return new HttpExplainer(config(apiKey), objectMapper, new TemplateExplainer());
    }

    private DtcProperties.Explainer config(String apiKey) {
        DtcProperties.Explainer config = new DtcProperties.Explainer();
        config.setEndpoint("http://127.0.0.1:" + server.getAddress().getPort() + "/v1/chat/completions");
        config.setApiKey(apiKey);
        config.setModel("test-model");
        config.setTimeoutSeconds(5);
        return config;
    }
}
