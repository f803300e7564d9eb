package com.dealrelay.app.delivery;

import com.dealrelay.core.api.IPublisher;
import com.dealrelay.core.api.PublishException;
import com.dealrelay.core.http.HttpSender;
import com.dealrelay.core.ledger.FeedScanLedger;
import com.dealrelay.core.model.PublishRequest;
import com.dealrelay.core.model.RelayConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Telegram Bot API 게시 (HTML parse mode).
 * 미디어가 있으면 sendPhoto(캡션 길이 제한 안쪽일 때), 아니면 sendMessage.
 * 설정 시 본문 앞에 숨김 앵커 {@code http://bot-id/<id>} 를 붙여 피드 자체를 원장으로 쓸 수 있게 한다.
 */
public final class TelegramBotPublisher implements IPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(TelegramBotPublisher.class);

    static final int CAPTION_LIMIT = 1024;
    private static final String INVISIBLE = "\u200E";

    private final RelayConfig.Delivery cfg;
    private final HttpSender sender;
    private final ObjectMapper om = new ObjectMapper();

    public TelegramBotPublisher(RelayConfig.Delivery cfg) {
        this(cfg, HttpSender.of(HttpClient.newBuilder().connectTimeout(cfg.timeout()).build()));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public TelegramBotPublisher(RelayConfig.Delivery cfg, HttpSender sender) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    @Override
    public void publish(PublishRequest request) throws PublishException {
        Objects.requireNonNull(request, "request");
        String html = render(request);

        ObjectNode payload = om.createObjectNode();
        payload.put("chat_id", cfg.targetChannel());
        payload.put("parse_mode", "HTML");
        String method;
        if (request.hasMedia() && html.length() <= CAPTION_LIMIT) {
            method = "sendPhoto";
            payload.put("photo", request.mediaRef());
            payload.put("caption", html);
        } else {
            if (request.hasMedia()) {
                LOG.info("Caption too long for media post ({} chars); sending text only", html.length());
            }
            method = "sendMessage";
            payload.put("text", html);
        }
        call(method, payload);
    }

    /** 평문 본문 → Telegram HTML (+ 숨김 ID 앵커) */
    String render(PublishRequest request) {
        String body = esc(request.text());
        // 해시 id 는 영속 기록 대상이 아니므로 앵커로도 남기지 않는다
        if (!cfg.hiddenIdMarker() || request.productId() == null || !request.productId().stable()) return body;
        return "<a href=\"" + FeedScanLedger.BOT_ID_PREFIX + esc(request.productId().value()) + "\">"
                + INVISIBLE + "</a>" + body;
    }

    private void call(String method, ObjectNode payload) throws PublishException {
        String url = cfg.apiBase() + "/bot" + cfg.botToken() + "/" + method;
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(cfg.timeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(om.writeValueAsString(payload), StandardCharsets.UTF_8))
                    .build();
        } catch (JsonProcessingException e) {
            throw new PublishException("cannot serialise " + method + " payload", e);
        }

        HttpResponse<String> resp;
        try {
            resp = sender.send(req);
        } catch (IOException e) {
            throw new PublishException(method + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException(method + " interrupted", e);
        }

        JsonNode root = parse(resp.body());
        boolean ok = root != null && root.path("ok").asBoolean(false);
        if (!ok) {
            String desc = root == null ? "non-JSON response" : root.path("description").asText("unknown error");
            throw new PublishException(method + " rejected (HTTP " + resp.statusCode() + "): " + desc);
        }
        LOG.debug("{} ok, message_id={}", method, root.path("result").path("message_id").asText());
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    static String esc(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
