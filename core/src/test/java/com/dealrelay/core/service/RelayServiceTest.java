package com.dealrelay.core.service;

import com.dealrelay.core.api.CaptionException;
import com.dealrelay.core.api.ICaptionWriter;
import com.dealrelay.core.api.IMessageSource;
import com.dealrelay.core.api.IPublisher;
import com.dealrelay.core.api.PublishException;
import com.dealrelay.core.http.BodyCapture;
import com.dealrelay.core.http.HttpSender;
import com.dealrelay.core.http.StubResponse;
import com.dealrelay.core.ledger.InMemoryLedger;
import com.dealrelay.core.model.LinkOrigin;
import com.dealrelay.core.model.PostRecord;
import com.dealrelay.core.model.ProductId;
import com.dealrelay.core.model.PublishRequest;
import com.dealrelay.core.model.RelayConfig;
import com.dealrelay.core.model.SourceMessage;
import com.dealrelay.core.service.RunReport.SkipReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RelayServiceTest {

    private static final String ITEM_1 = "https://www.aliexpress.com/item/1005001111111111.html";
    private static final String ITEM_2 = "https://www.aliexpress.com/item/1005002222222222.html";
    private static final String ITEM_3 = "https://www.aliexpress.com/item/1005003333333333.html";
    private static final String AFF = "https://s.click.aliexpress.com/e/_aff1";

    private static final String LINK_OK = """
            {"aliexpress_affiliate_link_generate_response":{"resp_result":{"resp_code":200,
             "result":{"promotion_links":{"promotion_link":[{"promotion_link":"%s"}]}}}}}""".formatted(AFF);

    private final Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final List<String> apiBodies = new ArrayList<>();
    private final List<String> resolved = new ArrayList<>();
    private final List<Duration> sleeps = new ArrayList<>();
    private final List<PublishRequest> published = new ArrayList<>();

    private HttpSender apiSender;
    private HttpSender resolverSender;
    private InMemoryLedger ledger;

    @BeforeEach
    void setUp() {
        apiSender = req -> {
            apiBodies.add(BodyCapture.of(req));
            return new StubResponse(200, LINK_OK, req);
        };
        // s.click 단축 링크는 ITEM_2 로 풀린다
        resolverSender = req -> {
            resolved.add(req.uri().toString());
            return new StubResponse(200, "", req, URI.create(ITEM_2 + "?aff_fcid=zz"));
        };
        ledger = new InMemoryLedger();
    }

    private RelayConfig.Builder config() {
        return RelayConfig.builder()
                .run(RelayConfig.Run.defaults()
                        .withSourceChannels(List.of("@deals"))
                        .withPublishDelay(Duration.ZERO, Duration.ZERO))
                .api(RelayConfig.Api.defaults().withCredentials("k", "s"));
    }

    private IPublisher collecting() {
        return published::add;
    }

    private static IMessageSource source(Map<String, List<SourceMessage>> byChannel) {
        return (channel, limit) -> {
            List<SourceMessage> msgs = byChannel.get(channel);
            if (msgs == null) throw new IOException("channel not found: " + channel);
            return msgs.subList(0, Math.min(limit, msgs.size()));
        };
    }

    private static SourceMessage msg(String text) {
        return SourceMessage.text("@deals", text);
    }

    private RelayService service(RelayConfig cfg, IMessageSource src, ICaptionWriter writer, IPublisher pub) {
        var parts = RelayService.Components.wire(cfg, apiSender, resolverSender, sleeps::add, clock);
        return new RelayService(cfg, src, writer, pub, ledger, parts);
    }

    @Test
    @DisplayName("정상 흐름: API 링크 1개만 남기고 게시 후 원장 기록")
    void postsWithApiLink_andRecords() {
        var cfg = config().build();
        ICaptionWriter writer = (raw, link, hints) -> "Amazing hub, see https://evil.example/x";
        var src = source(Map.of("@deals", List.of(msg("🔥 Hub " + ITEM_1 + "?spm=a2g0o"))));

        RunReport.Snapshot snap = service(cfg, src, writer, collecting()).run();

        assertThat(snap.posted()).isEqualTo(1);
        assertThat(snap.postedByOrigin().get(LinkOrigin.API)).isEqualTo(1);
        assertThat(snap.stopReason()).isEqualTo("completed");
        assertThat(snap.posts()).containsExactly(
                new PostRecord("1005001111111111", Instant.parse("2025-01-01T00:00:00Z"), "@deals"));
        assertThat(published).hasSize(1);
        PublishRequest req = published.get(0);
        assertThat(req.text()).isEqualTo("Amazing hub, see\n\n👇 Buy here:\n" + AFF);
        assertThat(req.productId()).isEqualTo(new ProductId("1005001111111111", ProductId.Kind.ITEM_ID));
        assertThat(ledger.seen(req.productId())).isTrue();
        // 쿼리 제거된 URL이 API로 나간다
        assertThat(apiBodies.get(0)).contains("source_values=https%3A%2F%2Fwww.aliexpress.com%2Fitem%2F1005001111111111.html&");
        assertThat(resolved).isEmpty();
    }

    @Test
    @DisplayName("이미 본 상품은 API/리다이렉트 호출 없이 조기 스킵")
    void earlyDuplicate_skipsBeforeAnyNetworkCall() {
        ledger.record(new ProductId("1005001111111111", ProductId.Kind.ITEM_ID));
        var src = source(Map.of("@deals", List.of(msg("again " + ITEM_1))));

        RunReport.Snapshot snap = service(config().build(), src, null, collecting()).run();

        assertThat(snap.posted()).isZero();
        assertThat(snap.skipped(SkipReason.DUPLICATE_EARLY)).isEqualTo(1);
        assertThat(apiBodies).isEmpty();
        assertThat(resolved).isEmpty();
        assertThat(published).isEmpty();
    }

    @Test
    void secondRunOverSameFeed_postsNothing() {
        var cfg = config().build();
        var src = source(Map.of("@deals", List.of(msg("a " + ITEM_1), msg("b " + ITEM_2))));

        assertThat(service(cfg, src, null, collecting()).run().posted()).isEqualTo(2);
        int callsAfterFirst = apiBodies.size();

        RunReport.Snapshot second = service(cfg, src, null, collecting()).run();
        assertThat(second.posted()).isZero();
        assertThat(second.skipped(SkipReason.DUPLICATE_EARLY)).isEqualTo(2);
        assertThat(apiBodies).hasSize(callsAfterFirst);
    }

    @Test
    @DisplayName("단축 링크: 해제 후 ID로 최종 판정, 조기 ID도 함께 기록")
    void shortLink_resolvedThenBothIdsRecorded() {
        var src = source(Map.of("@deals", List.of(
                msg("Deal https://s.click.aliexpress.com/e/_srcTok"),
                msg("Same item another way " + ITEM_2))));

        RunReport.Snapshot snap = service(config().build(), src, null, collecting()).run();

        assertThat(resolved).containsExactly("https://s.click.aliexpress.com/e/_srcTok");
        assertThat(snap.posted()).isEqualTo(1);
        assertThat(snap.skipped(SkipReason.DUPLICATE_EARLY)).isEqualTo(1);
        assertThat(published.get(0).productId().value()).isEqualTo("1005002222222222");
        assertThat(ledger.seen(new ProductId("srcTok", ProductId.Kind.SHORT_TOKEN))).isTrue();
    }

    @Test
    void shortLinkResolvingToPostedItem_isFinalDuplicate() {
        ledger.record(new ProductId("1005002222222222", ProductId.Kind.ITEM_ID));
        var src = source(Map.of("@deals", List.of(msg("https://s.click.aliexpress.com/e/_other"))));

        RunReport.Snapshot snap = service(config().build(), src, null, collecting()).run();

        assertThat(snap.skipped(SkipReason.DUPLICATE_FINAL)).isEqualTo(1);
        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("게시 실패는 원장에 남기지 않는다 (다음 실행에서 재시도 가능)")
    void publishFailure_isNotRecorded() {
        IPublisher failing = req -> { throw new PublishException("chat not found"); };
        var src = source(Map.of("@deals", List.of(msg(ITEM_1))));

        RunReport.Snapshot snap = service(config().build(), src, null, failing).run();

        assertThat(snap.publishFailed()).isEqualTo(1);
        assertThat(snap.posted()).isZero();
        assertThat(ledger.size()).isZero();
    }

    @Test
    void maxPosts_stopsRun_andPausesBetweenPosts() {
        var cfg = config()
                .run(RelayConfig.Run.defaults()
                        .withSourceChannels(List.of("@deals"))
                        .withLimits(50, 2)
                        .withPublishDelay(Duration.ofSeconds(1), Duration.ZERO))
                .build();
        var src = source(Map.of("@deals", List.of(msg(ITEM_1), msg(ITEM_2), msg(ITEM_3))));

        RunReport.Snapshot snap = service(cfg, src, null, collecting()).run();

        assertThat(snap.posted()).isEqualTo(2);
        assertThat(snap.scanned()).isEqualTo(2);
        assertThat(snap.stopReason()).isEqualTo("max-posts");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("채널 하나가 실패해도 다음 채널은 처리")
    void channelFailure_isIsolated() {
        var cfg = config()
                .run(RelayConfig.Run.defaults()
                        .withSourceChannels(List.of("@broken", "@deals"))
                        .withPublishDelay(Duration.ZERO, Duration.ZERO))
                .build();
        var src = source(Map.of("@deals", List.of(msg(ITEM_1))));

        RunReport.Snapshot snap = service(cfg, src, null, collecting()).run();

        assertThat(snap.channelFailures()).isEqualTo(1);
        assertThat(snap.posted()).isEqualTo(1);
    }

    @Test
    void captionFailure_fallsBackToFirstLine() {
        ICaptionWriter broken = (raw, link, hints) -> { throw new CaptionException("HTTP 429"); };
        var src = source(Map.of("@deals", List.of(msg("🔥\nUSB-C hub only $9 " + ITEM_1 + "\nfree shipping"))));

        service(config().build(), src, broken, collecting()).run();

        assertThat(published.get(0).text()).isEqualTo("USB-C hub only $9\n\n👇 Buy here:\n" + AFF);
    }

    @Test
    @DisplayName("캡션 작성기의 런타임 예외도 게시를 막지 않는다")
    void captionRuntimeFailure_stillPostsWithFallback() {
        ICaptionWriter broken = (raw, link, hints) -> { throw new IllegalStateException("boom"); };
        var src = source(Map.of("@deals", List.of(msg("USB-C hub " + ITEM_1))));

        RunReport.Snapshot snap = service(config().build(), src, broken, collecting()).run();

        assertThat(snap.posted()).isEqualTo(1);
        assertThat(snap.errors()).isZero();
        assertThat(published.get(0).text()).isEqualTo("USB-C hub\n\n👇 Buy here:\n" + AFF);
    }

    @Test
    void messagesWithoutTextOrCandidate_areSkipped() {
        var src = source(Map.of("@deals", List.of(
                new SourceMessage("@deals", null, "photo-1", 10, Instant.EPOCH),
                msg("news https://example.com/post/1"))));

        RunReport.Snapshot snap = service(config().build(), src, null, collecting()).run();

        assertThat(snap.skipped(SkipReason.NO_TEXT)).isEqualTo(1);
        assertThat(snap.skipped(SkipReason.NO_CANDIDATE)).isEqualTo(1);
        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("ID 를 못 뽑으면 기본은 스킵, hashFallback 이면 메모리 전용 해시로 게시")
    void noIdentifier_skipOrHash() {
        resolverSender = req -> new StubResponse(404, "", req);
        var src = source(Map.of("@deals", List.of(msg("https://bit.ly/abc"))));

        RunReport.Snapshot skipped = service(config().build(), src, null, collecting()).run();
        assertThat(skipped.skipped(SkipReason.NO_IDENTIFIER)).isEqualTo(1);

        var hashing = config()
                .run(RelayConfig.Run.defaults()
                        .withSourceChannels(List.of("@deals"))
                        .withPublishDelay(Duration.ZERO, Duration.ZERO)
                        .withHashFallback(true))
                .build();
        RunReport.Snapshot posted = service(hashing, src, null, collecting()).run();
        assertThat(posted.posted()).isEqualTo(1);
        assertThat(published.get(0).productId().kind()).isEqualTo(ProductId.Kind.HASH);
    }

    @Test
    @DisplayName("자격 증명이 없으면 템플릿 전략으로")
    void withoutCredentials_usesTemplate() {
        var cfg = config()
                .api(RelayConfig.Api.defaults())
                .links(RelayConfig.Links.defaults()
                        .withPortalTemplate("https://portals.aliexpress.com/affi?aff_short_key=abc&dl_target_url={url}"))
                .build();
        var src = source(Map.of("@deals", List.of(msg(ITEM_1))));

        RunReport.Snapshot snap = service(cfg, src, null, collecting()).run();

        assertThat(snap.postedByOrigin().get(LinkOrigin.TEMPLATE)).isEqualTo(1);
        assertThat(apiBodies).isEmpty();
        assertThat(published.get(0).link().url()).contains("dl_target_url=https%3A%2F%2Fwww.aliexpress.com");
    }

    @Test
    void transientApiFailure_isRetriedAndCounted() {
        int[] calls = {0};
        apiSender = req -> {
            apiBodies.add(BodyCapture.of(req));
            return calls[0]++ == 0 ? new StubResponse(503, "<html>busy</html>", req) : new StubResponse(200, LINK_OK, req);
        };
        var src = source(Map.of("@deals", List.of(msg(ITEM_1))));

        RunReport.Snapshot snap = service(config().build(), src, null, collecting()).run();

        assertThat(snap.posted()).isEqualTo(1);
        assertThat(snap.apiRetries()).isEqualTo(1);
        assertThat(apiBodies).hasSize(2);
        assertThat(sleeps).hasSize(1);
    }
}
