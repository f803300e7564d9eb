package com.dealrelay.app.caption;

import com.dealrelay.core.api.CaptionException;
import com.dealrelay.core.api.ICaptionWriter;
import com.dealrelay.core.http.HttpSender;
import com.dealrelay.core.message.FactHints;
import com.dealrelay.core.model.RelayConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Chat Completions 로 짧은 판매 문구를 만든다.
 * 링크는 넣지 말라고 요청하지만 결과에 URL이 섞여도 조립 단계에서 걸러진다.
 */
public final class OpenAiCaptionWriter implements ICaptionWriter {

    static final int SOURCE_EXCERPT_CHARS = 300;
    static final int MAX_TOKENS = 200;

    private final RelayConfig.Caption cfg;
    private final HttpSender sender;
    private final ObjectMapper om = new ObjectMapper();

    public OpenAiCaptionWriter(RelayConfig.Caption cfg) {
        this(cfg, HttpSender.of(HttpClient.newBuilder().connectTimeout(cfg.timeout()).build()));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public OpenAiCaptionWriter(RelayConfig.Caption cfg, HttpSender sender) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    @Override
    public String rewrite(String rawText, String affiliateLink, FactHints hints) throws CaptionException {
        String body = requestBody(prompt(rawText, hints));
        HttpRequest req = HttpRequest.newBuilder(URI.create(cfg.endpoint()))
                .timeout(cfg.timeout())
                .header("Authorization", "Bearer " + cfg.apiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> resp;
        try {
            resp = sender.send(req);
        } catch (IOException e) {
            throw new CaptionException("caption request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaptionException("caption request interrupted", e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new CaptionException("caption endpoint returned HTTP " + resp.statusCode());
        }
        return contentOf(resp.body());
    }

    String prompt(String rawText, FactHints hints) {
        String src = rawText == null ? "" : rawText.strip();
        if (src.length() > SOURCE_EXCERPT_CHARS) src = src.substring(0, SOURCE_EXCERPT_CHARS);
        FactHints h = hints == null ? FactHints.NONE : hints;

        StringBuilder sb = new StringBuilder(512);
        sb.append("Role: copywriter for a Telegram deals channel.\n");
        sb.append("Task: write a short sales post (2-3 sentences), catchy and light, in ")
          .append(cfg.language()).append(".\n");
        sb.append("Source text: ").append(src).append('\n');
        if (h.title() != null) sb.append("Product: ").append(h.title()).append('\n');
        sb.append("Estimated price: ").append(h.price() == null ? "" : h.price()).append('\n');
        sb.append("Requirements: use emoji, no hashtags, no 'click here', do not include any links.");
        return sb.toString();
    }

    private String requestBody(String prompt) throws CaptionException {
        ObjectNode root = om.createObjectNode();
        root.put("model", cfg.model());
        root.put("max_tokens", MAX_TOKENS);
        ArrayNode messages = root.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", prompt);
        try {
            return om.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new CaptionException("cannot serialise caption request", e);
        }
    }

    private String contentOf(String body) throws CaptionException {
        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CaptionException("caption response is not JSON", e);
        }
        JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual() || content.asText().isBlank()) {
            throw new CaptionException("caption response has no content");
        }
        return content.asText().strip();
    }
}
