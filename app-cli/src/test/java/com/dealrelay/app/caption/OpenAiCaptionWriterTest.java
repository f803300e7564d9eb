package com.dealrelay.app.caption;

import com.dealrelay.core.api.CaptionException;
import com.dealrelay.core.message.FactHints;
import com.dealrelay.core.model.RelayConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiCaptionWriterTest {

    private HttpServer server;
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final List<String> auth = new CopyOnWriteArrayList<>();
    private volatile int status = 200;
    private volatile String reply = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  מבצע חם! 🔥 \"}}]}";

    @BeforeEach
    void start() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", ex -> {
            auth.add(ex.getRequestHeaders().getFirst("Authorization"));
            bodies.add(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] out = reply.getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(status, out.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(out); }
        });
        server.start();
    }

    @AfterEach
    void stop() { server.stop(0); }

    private OpenAiCaptionWriter writer() {
        return new OpenAiCaptionWriter(new RelayConfig.Caption("sk-test", "gpt-4o-mini",
                "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/chat/completions",
                Duration.ofSeconds(5), "Hebrew"));
    }

    @Test
    void rewrite_returnsTrimmedContent() throws Exception {
        String out = writer().rewrite("USB hub", "https://s.click.aliexpress.com/e/_aff1", new FactHints("$9", "Hub"));

        assertThat(out).isEqualTo("מבצע חם! 🔥");
        assertThat(auth).containsExactly("Bearer sk-test");
        JsonNode req = new ObjectMapper().readTree(bodies.get(0));
        assertThat(req.path("model").asText()).isEqualTo("gpt-4o-mini");
        assertThat(req.path("max_tokens").asInt()).isEqualTo(200);
        assertThat(req.path("messages").path(0).path("content").asText())
                .contains("in Hebrew")
                .contains("Product: Hub")
                .contains("Estimated price: $9");
    }

    @Test
    void prompt_capsSourceExcerpt() {
        String prompt = writer().prompt("a".repeat(500), FactHints.NONE);

        assertThat(prompt).contains("Source text: " + "a".repeat(300) + "\n");
        assertThat(prompt).doesNotContain("a".repeat(301));
        assertThat(prompt).doesNotContain("Product:");
    }

    @Test
    void httpError_isCaptionException() {
        status = 429;
        reply = "{\"error\":{\"message\":\"rate limited\"}}";

        assertThatThrownBy(() -> writer().rewrite("x", "l", FactHints.NONE))
                .isInstanceOf(CaptionException.class)
                .hasMessageContaining("429");
    }

    @Test
    void emptyContent_isCaptionException() {
        reply = "{\"choices\":[]}";

        assertThatThrownBy(() -> writer().rewrite("x", "l", FactHints.NONE))
                .isInstanceOf(CaptionException.class);
    }
}
