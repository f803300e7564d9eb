package com.dealrelay.app.delivery;

import com.dealrelay.core.api.PublishException;
import com.dealrelay.core.model.AffiliateLink;
import com.dealrelay.core.model.LinkOrigin;
import com.dealrelay.core.model.ProductId;
import com.dealrelay.core.model.PublishRequest;
import com.dealrelay.core.model.RelayConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelegramBotPublisherTest {

    private static final AffiliateLink LINK =
            new AffiliateLink("https://s.click.aliexpress.com/e/_aff1", LinkOrigin.API);
    private static final ProductId ID = new ProductId("1005001111111111", ProductId.Kind.ITEM_ID);

    private HttpServer server;
    private final List<String> paths = new CopyOnWriteArrayList<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private volatile String reply = "{\"ok\":true,\"result\":{\"message_id\":7}}";

    @BeforeEach
    void start() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            paths.add(ex.getRequestURI().getPath());
            bodies.add(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] out = reply.getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(reply.contains("\"ok\":true") ? 200 : 400, out.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(out); }
        });
        server.start();
    }

    @AfterEach
    void stop() { server.stop(0); }

    private TelegramBotPublisher publisher(boolean hiddenId) {
        var cfg = new RelayConfig.Delivery("123:ABC", "@target",
                "http://127.0.0.1:" + server.getAddress().getPort(), hiddenId, Path.of("unused"),
                Duration.ofSeconds(5));
        return new TelegramBotPublisher(cfg);
    }

    @Test
    @DisplayName("텍스트만: sendMessage + HTML 이스케이프 + 숨김 ID 앵커")
    void textOnly_sendMessage() throws Exception {
        publisher(true).publish(new PublishRequest("Hub <7in1> & more\n" + LINK.url(), null, ID, LINK));

        assertThat(paths).containsExactly("/bot123:ABC/sendMessage");
        JsonNode json = new ObjectMapper().readTree(bodies.get(0));
        assertThat(json.path("chat_id").asText()).isEqualTo("@target");
        assertThat(json.path("parse_mode").asText()).isEqualTo("HTML");
        assertThat(json.path("text").asText()).isEqualTo(
                "<a href=\"http://bot-id/1005001111111111\">\u200E</a>Hub &lt;7in1&gt; &amp; more\n" + LINK.url());
    }

    @Test
    @DisplayName("해시 id 는 숨김 앵커를 달지 않는다")
    void hashId_noHiddenAnchor() {
        var hash = new ProductId("h:0123456789abcdef", ProductId.Kind.HASH);

        String html = publisher(true).render(new PublishRequest("Deal", null, hash, LINK));

        assertThat(html).isEqualTo("Deal");
        assertThat(publisher(true).render(new PublishRequest("Deal", null, ID, LINK)))
                .startsWith("<a href=\"http://bot-id/1005001111111111\">");
    }

    @Test
    void media_sendPhotoWithCaption() throws Exception {
        publisher(false).publish(new PublishRequest("Deal\n" + LINK.url(), "AgACAgQ", ID, LINK));

        assertThat(paths).containsExactly("/bot123:ABC/sendPhoto");
        JsonNode json = new ObjectMapper().readTree(bodies.get(0));
        assertThat(json.path("photo").asText()).isEqualTo("AgACAgQ");
        assertThat(json.path("caption").asText()).isEqualTo("Deal\n" + LINK.url());
    }

    @Test
    @DisplayName("캡션 한도를 넘으면 미디어 없이 sendMessage")
    void longText_withMedia_fallsBackToSendMessage() throws Exception {
        String longText = "x".repeat(TelegramBotPublisher.CAPTION_LIMIT + 1);
        publisher(false).publish(new PublishRequest(longText, "AgACAgQ", ID, LINK));

        assertThat(paths).containsExactly("/bot123:ABC/sendMessage");
    }

    @Test
    void rejected_isPublishException() {
        reply = "{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: chat not found\"}";

        assertThatThrownBy(() -> publisher(false).publish(new PublishRequest("hi", null, ID, LINK)))
                .isInstanceOf(PublishException.class)
                .hasMessageContaining("chat not found");
    }

    @Test
    void esc_escapesHtmlSpecials() {
        assertThat(TelegramBotPublisher.esc("a<b>&\"c\"")).isEqualTo("a&lt;b&gt;&amp;&quot;c&quot;");
        assertThat(TelegramBotPublisher.esc(null)).isEmpty();
    }
}
