package com.dealrelay.core.model;

import com.dealrelay.core.util.ConfigException;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 실행 설정 (relay.yml 매핑 대상). 시작 시 한 번 만들어 각 컴포넌트 생성자로 전달한다.
 * 섹션은 모두 불변 record이며 검증은 {@link Builder#build()} 한 곳에서만 수행.
 */
public final class RelayConfig {

    /** 실행 범위 한도 + 후보 링크 필터 */
    public record Run(List<String> sourceChannels,
                      int maxMessagesPerChannel,
                      int maxPostsPerRun,
                      Duration maxRunTime,
                      Duration publishDelay,
                      Duration publishJitter,
                      List<String> candidateMarkers,
                      boolean hashFallback) {

        public static Run defaults() {
            return new Run(List.of(), 50, 10, Duration.ZERO, Duration.ofSeconds(2), Duration.ZERO,
                    List.of("aliexpress", "s.click", "bit.ly"), false);
        }

        public Run withSourceChannels(List<String> channels) {
            return new Run(List.copyOf(channels), maxMessagesPerChannel, maxPostsPerRun, maxRunTime,
                    publishDelay, publishJitter, candidateMarkers, hashFallback);
        }

        public Run withLimits(int maxMessages, int maxPosts) {
            return new Run(sourceChannels, maxMessages, maxPosts, maxRunTime,
                    publishDelay, publishJitter, candidateMarkers, hashFallback);
        }

        public Run withPublishDelay(Duration delay, Duration jitter) {
            return new Run(sourceChannels, maxMessagesPerChannel, maxPostsPerRun, maxRunTime,
                    delay, jitter, candidateMarkers, hashFallback);
        }

        public Run withHashFallback(boolean enabled) {
            return new Run(sourceChannels, maxMessagesPerChannel, maxPostsPerRun, maxRunTime,
                    publishDelay, publishJitter, candidateMarkers, enabled);
        }
    }

    /** 단축 링크 해제 + 호스트 정규화 */
    public record Resolver(boolean enabled,
                           Duration timeout,
                           List<String> redirectDomains,
                           Map<String, String> hostAliases) {

        public static Resolver defaults() {
            Map<String, String> aliases = new LinkedHashMap<>();
            aliases.put("m.aliexpress.com", "www.aliexpress.com");
            aliases.put("aliexpress.com", "www.aliexpress.com");
            return new Resolver(true, Duration.ofSeconds(10),
                    List.of("s.click.aliexpress.com", "a.aliexpress.com", "click.aliexpress.com",
                            "bit.ly", "tinyurl.com", "t.me"),
                    Map.copyOf(aliases));
        }

        public Resolver withEnabled(boolean v) {
            return new Resolver(v, timeout, redirectDomains, hostAliases);
        }

        public Resolver withRedirectDomains(List<String> domains) {
            return new Resolver(enabled, timeout, List.copyOf(domains), hostAliases);
        }
    }

    /** 마켓플레이스 서명 API */
    public record Api(String endpoint,
                      String appKey,
                      String appSecret,
                      String trackingId,
                      String apiVersion,
                      String promotionLinkType,
                      TimestampFormat timestampFormat,
                      ZoneId timestampZone,
                      Duration timeout,
                      int maxAttempts,
                      Duration backoffBase,
                      boolean productDetails,
                      String targetCurrency,
                      String targetLanguage) {

        public static Api defaults() {
            return new Api("https://api-sg.aliexpress.com/sync", null, null, "telegram_bot", "2.0", "0",
                    TimestampFormat.EPOCH_MILLIS, ZoneId.of("GMT+8"), Duration.ofSeconds(15),
                    3, Duration.ofMillis(500), false, "USD", "EN");
        }

        /** 키/시크릿이 둘 다 있어야 API 전략을 켠다 */
        public boolean credentialsPresent() {
            return appKey != null && !appKey.isBlank() && appSecret != null && !appSecret.isBlank();
        }

        public Api withCredentials(String key, String secret) {
            return new Api(endpoint, key, secret, trackingId, apiVersion, promotionLinkType, timestampFormat,
                    timestampZone, timeout, maxAttempts, backoffBase, productDetails, targetCurrency, targetLanguage);
        }

        public Api withEndpoint(String url) {
            return new Api(url, appKey, appSecret, trackingId, apiVersion, promotionLinkType, timestampFormat,
                    timestampZone, timeout, maxAttempts, backoffBase, productDetails, targetCurrency, targetLanguage);
        }

        public Api withTimestampFormat(TimestampFormat format) {
            return new Api(endpoint, appKey, appSecret, trackingId, apiVersion, promotionLinkType, format,
                    timestampZone, timeout, maxAttempts, backoffBase, productDetails, targetCurrency, targetLanguage);
        }

        public Api withProductDetails(boolean enabled) {
            return new Api(endpoint, appKey, appSecret, trackingId, apiVersion, promotionLinkType, timestampFormat,
                    timestampZone, timeout, maxAttempts, backoffBase, enabled, targetCurrency, targetLanguage);
        }
    }

    /** 템플릿/접두어 전략 + 상품 링크 판정 마커 */
    public record Links(String portalTemplate, String prefix, List<String> productMarkers) {

        public static Links defaults() {
            return new Links(null, null, List.of("/item/", "/e/", "/_", "/share/", "aff_short_key="));
        }

        public Links withPortalTemplate(String template) {
            return new Links(template, prefix, productMarkers);
        }

        public Links withPrefix(String p) {
            return new Links(portalTemplate, p, productMarkers);
        }
    }

    /** 중복 방지 원장 */
    public record Ledger(LedgerType type, Path path, DedupMode mode, Duration cooldown, int feedLookback) {

        public static Ledger defaults() {
            return new Ledger(LedgerType.FILE, Path.of("data", "posted-ids.txt"), DedupMode.PERMANENT,
                    Duration.ZERO, 200);
        }

        public Ledger withType(LedgerType t, Path p) {
            return new Ledger(t, p, mode, cooldown, feedLookback);
        }

        public Ledger withCooldown(Duration window) {
            return new Ledger(type, path, DedupMode.COOLDOWN, window, feedLookback);
        }
    }

    /** 게시 본문 조립 */
    public record Message(String buyHereLabel, int fallbackCaptionMaxChars) {
        public static Message defaults() {
            return new Message("👇 Buy here:", 300);
        }
    }

    /** 캡션 작성 협력자 (OpenAI chat completions) */
    public record Caption(String apiKey, String model, String endpoint, Duration timeout, String language) {
        public static Caption defaults() {
            return new Caption(null, "gpt-4o-mini", "https://api.openai.com/v1/chat/completions",
                    Duration.ofSeconds(20), "Hebrew");
        }

        public boolean enabled() { return apiKey != null && !apiKey.isBlank(); }
    }

    /** 배달 협력자 (Telegram Bot API) + 소스 파일 위치 */
    public record Delivery(String botToken, String targetChannel, String apiBase, boolean hiddenIdMarker,
                           Path sourceDir, Duration timeout) {
        public static Delivery defaults() {
            return new Delivery(null, null, "https://api.telegram.org", true, Path.of("data", "sources"),
                    Duration.ofSeconds(20));
        }
    }

    private final Run run;
    private final Resolver resolver;
    private final Api api;
    private final Links links;
    private final Ledger ledger;
    private final Message message;
    private final Caption caption;
    private final Delivery delivery;

    private RelayConfig(Builder b) {
        this.run = b.run;
        this.resolver = b.resolver;
        this.api = b.api;
        this.links = b.links;
        this.ledger = b.ledger;
        this.message = b.message;
        this.caption = b.caption;
        this.delivery = b.delivery;
    }

    public Run run() { return run; }
    public Resolver resolver() { return resolver; }
    public Api api() { return api; }
    public Links links() { return links; }
    public Ledger ledger() { return ledger; }
    public Message message() { return message; }
    public Caption caption() { return caption; }
    public Delivery delivery() { return delivery; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private Run run = Run.defaults();
        private Resolver resolver = Resolver.defaults();
        private Api api = Api.defaults();
        private Links links = Links.defaults();
        private Ledger ledger = Ledger.defaults();
        private Message message = Message.defaults();
        private Caption caption = Caption.defaults();
        private Delivery delivery = Delivery.defaults();

        public Builder run(Run v) { this.run = Objects.requireNonNull(v, "run"); return this; }
        public Builder resolver(Resolver v) { this.resolver = Objects.requireNonNull(v, "resolver"); return this; }
        public Builder api(Api v) { this.api = Objects.requireNonNull(v, "api"); return this; }
        public Builder links(Links v) { this.links = Objects.requireNonNull(v, "links"); return this; }
        public Builder ledger(Ledger v) { this.ledger = Objects.requireNonNull(v, "ledger"); return this; }
        public Builder message(Message v) { this.message = Objects.requireNonNull(v, "message"); return this; }
        public Builder caption(Caption v) { this.caption = Objects.requireNonNull(v, "caption"); return this; }
        public Builder delivery(Delivery v) { this.delivery = Objects.requireNonNull(v, "delivery"); return this; }

        public RelayConfig build() {
            validate();
            return new RelayConfig(this);
        }

        private void validate() {
            require(run.sourceChannels() != null && !run.sourceChannels().isEmpty(),
                    "run.sourceChannels must not be empty");
            require(run.maxMessagesPerChannel() >= 1, "run.maxMessagesPerChannel must be >= 1");
            require(run.maxPostsPerRun() >= 1, "run.maxPostsPerRun must be >= 1");
            require(notNegative(run.maxRunTime()), "run.maxRunTime must be >= 0");
            require(notNegative(run.publishDelay()), "run.publishDelay must be >= 0");
            require(notNegative(run.publishJitter()), "run.publishJitter must be >= 0");
            require(run.candidateMarkers() != null && !run.candidateMarkers().isEmpty(),
                    "run.candidateMarkers must not be empty");

            require(positive(resolver.timeout()), "resolver.timeoutMs must be > 0");
            Objects.requireNonNull(resolver.redirectDomains(), "resolver.redirectDomains");
            Objects.requireNonNull(resolver.hostAliases(), "resolver.hostAliases");

            require(api.endpoint() != null && api.endpoint().startsWith("http"), "api.endpoint must be an http(s) URL");
            require(positive(api.timeout()), "api.timeoutMs must be > 0");
            require(api.maxAttempts() >= 1, "api.maxAttempts must be >= 1");
            require(notNegative(api.backoffBase()), "api.backoffMs must be >= 0");
            Objects.requireNonNull(api.timestampFormat(), "api.timestampFormat");
            Objects.requireNonNull(api.timestampZone(), "api.timestampZone");

            require(links.productMarkers() != null && !links.productMarkers().isEmpty(),
                    "links.productMarkers must not be empty");

            Objects.requireNonNull(ledger.type(), "ledger.type");
            Objects.requireNonNull(ledger.mode(), "ledger.mode");
            if (ledger.type() == LedgerType.FILE) {
                require(ledger.path() != null, "ledger.path is required for FILE ledger");
            }
            if (ledger.mode() == DedupMode.COOLDOWN) {
                require(positive(ledger.cooldown()), "ledger.cooldownHours must be > 0 in COOLDOWN mode");
            }
            require(ledger.feedLookback() >= 1, "ledger.feedLookback must be >= 1");

            require(message.buyHereLabel() != null, "message.buyHereLabel");
            require(message.fallbackCaptionMaxChars() >= 20, "message.fallbackCaptionMaxChars must be >= 20");
            require(positive(caption.timeout()), "caption.timeoutMs must be > 0");
            require(positive(delivery.timeout()), "delivery.timeoutMs must be > 0");
        }

        private static boolean positive(Duration d) { return d != null && !d.isNegative() && !d.isZero(); }
        private static boolean notNegative(Duration d) { return d != null && !d.isNegative(); }

        private static void require(boolean ok, String message) {
            if (!ok) throw new ConfigException(message);
        }
    }
}
