package com.dealrelay.core.service;

import com.dealrelay.core.api.CaptionException;
import com.dealrelay.core.api.ICaptionWriter;
import com.dealrelay.core.api.IMessageSource;
import com.dealrelay.core.api.IPublisher;
import com.dealrelay.core.api.PublishException;
import com.dealrelay.core.http.CountingRetryPolicy;
import com.dealrelay.core.http.DefaultRetryPolicy;
import com.dealrelay.core.http.HttpSender;
import com.dealrelay.core.http.RedirectResolver;
import com.dealrelay.core.id.IdentifierExtractor;
import com.dealrelay.core.ledger.Ledger;
import com.dealrelay.core.ledger.LedgerException;
import com.dealrelay.core.link.AffiliateLinkBuilder;
import com.dealrelay.core.link.ApiLinkStrategy;
import com.dealrelay.core.link.LinkStrategy;
import com.dealrelay.core.link.PrefixLinkStrategy;
import com.dealrelay.core.link.ProductLinkValidator;
import com.dealrelay.core.link.TemplateLinkStrategy;
import com.dealrelay.core.marketplace.MarketplaceApi;
import com.dealrelay.core.marketplace.SignedRequestClient;
import com.dealrelay.core.message.FactHints;
import com.dealrelay.core.message.FallbackCaption;
import com.dealrelay.core.message.MessageAssembler;
import com.dealrelay.core.model.AffiliateLink;
import com.dealrelay.core.model.PostRecord;
import com.dealrelay.core.model.ProductId;
import com.dealrelay.core.model.PublishRequest;
import com.dealrelay.core.model.RelayConfig;
import com.dealrelay.core.model.SourceMessage;
import com.dealrelay.core.service.RunReport.SkipReason;
import com.dealrelay.core.util.DefaultSleeper;
import com.dealrelay.core.util.LinkScanner;
import com.dealrelay.core.util.Sleeper;
import com.dealrelay.core.util.StructuredLog;
import com.dealrelay.core.util.UrlNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 릴레이 오케스트레이터:
 *  - 채널 순서대로, 채널 안에서는 원본 순서대로 메시지 1건씩 처리
 *  - 후보 링크 → 정규화 → 조기 ID/원장 확인 → 리다이렉트 해제 → 제휴 링크 → 최종 ID/원장 확인
 *    → 캡션 → 본문 조립 → 게시 → 원장 기록 → 게시 간격 대기
 *  - 실패는 후보 1건 단위로 격리, 채널 하나의 실패가 다음 채널을 막지 않음
 *  - 원장 기록은 게시가 확인된 뒤에만
 */
public final class RelayService {

    private static final Logger LOG = LoggerFactory.getLogger(RelayService.class);
    private static final StructuredLog SLOG = StructuredLog.get(RelayService.class);

    /** 파이프라인 부품 묶음. 테스트/플러그인은 직접 만들어 주입한다. */
    public record Components(UrlNormalizer normalizer,
                             LinkScanner scanner,
                             RedirectResolver resolver,
                             IdentifierExtractor extractor,
                             AffiliateLinkBuilder linkBuilder,
                             MarketplaceApi detailsApi,
                             CountingRetryPolicy retries,
                             Sleeper sleeper,
                             Clock clock) {

        /** 기본 배선(실제 HttpClient) */
        public static Components wire(RelayConfig config) {
            return wire(config, null, null, new DefaultSleeper(), Clock.systemUTC());
        }

        /**
         * 송신 훅을 지정한 배선. null 훅은 실제 HttpClient 로 대체된다.
         * API 자격 증명이 없으면 API 전략/상품 상세는 꺼진다.
         */
        public static Components wire(RelayConfig config, HttpSender apiSender, HttpSender resolverSender,
                                      Sleeper sleeper, Clock clock) {
            Objects.requireNonNull(config, "config");
            UrlNormalizer normalizer = new UrlNormalizer(config.resolver().hostAliases());
            RedirectResolver resolver = resolverSender == null
                    ? new RedirectResolver(config.resolver(), normalizer)
                    : new RedirectResolver(config.resolver(), normalizer, resolverSender);

            RelayConfig.Api api = config.api();
            CountingRetryPolicy retries = new CountingRetryPolicy(
                    DefaultRetryPolicy.of(api.maxAttempts(), api.backoffBase()));

            List<LinkStrategy> strategies = new ArrayList<>();
            MarketplaceApi marketplace = null;
            if (api.credentialsPresent()) {
                HttpSender sender = apiSender != null ? apiSender : HttpSender.of(HttpClient.newBuilder()
                        .connectTimeout(api.timeout())
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .build());
                SignedRequestClient client = new SignedRequestClient(api, new ObjectMapper(), sender,
                        retries, sleeper, clock);
                marketplace = new MarketplaceApi(client, api);
                strategies.add(new ApiLinkStrategy(marketplace));
            } else {
                LOG.warn("Marketplace API credentials missing; API link strategy disabled");
                SLOG.warn("api-disabled", "reason", "credentials-missing");
            }
            strategies.add(new TemplateLinkStrategy(config.links().portalTemplate()));
            strategies.add(new PrefixLinkStrategy(config.links().prefix()));

            AffiliateLinkBuilder builder = new AffiliateLinkBuilder(strategies,
                    new ProductLinkValidator(config.links().productMarkers()));

            return new Components(normalizer,
                    new LinkScanner(config.run().candidateMarkers()),
                    resolver,
                    new IdentifierExtractor(),
                    builder,
                    api.productDetails() ? marketplace : null,
                    retries,
                    sleeper,
                    clock);
        }
    }

    private final RelayConfig config;
    private final IMessageSource source;
    private final ICaptionWriter captionWriter; // null이면 결정적 캡션만 사용
    private final IPublisher publisher;
    private final Ledger ledger;
    private final Components parts;
    private final MessageAssembler assembler;
    private final FallbackCaption fallbackCaption;

    /** 기본 구현 */
    public RelayService(RelayConfig config, IMessageSource source, ICaptionWriter captionWriter,
                        IPublisher publisher, Ledger ledger) {
        this(config, source, captionWriter, publisher, ledger, Components.wire(config));
    }

    /** DI/테스트용 */
    public RelayService(RelayConfig config, IMessageSource source, ICaptionWriter captionWriter,
                        IPublisher publisher, Ledger ledger, Components parts) {
        this.config = Objects.requireNonNull(config, "config");
        this.source = Objects.requireNonNull(source, "source");
        this.captionWriter = captionWriter;
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.parts = Objects.requireNonNull(parts, "parts");
        this.assembler = new MessageAssembler(config.message());
        this.fallbackCaption = new FallbackCaption(config.message().fallbackCaptionMaxChars());
    }

    /** 실행 1회. 인터럽트되면 플래그를 복원하고 그때까지의 집계를 돌려준다. */
    public RunReport.Snapshot run() {
        final RelayConfig.Run run = config.run();
        final RunReport report = new RunReport();
        final RunBudget budget = new RunBudget(run.maxPostsPerRun(), run.maxRunTime(), parts.clock());

        LOG.info("Relay run start: channels={}, maxPosts={}, ledgerSize={}, strategies={}",
                run.sourceChannels(), run.maxPostsPerRun(), ledger.size(), parts.linkBuilder().activeOrigins());
        SLOG.info("run-start",
                "channels", String.join(",", run.sourceChannels()),
                "maxPosts", run.maxPostsPerRun(),
                "maxMessagesPerChannel", run.maxMessagesPerChannel(),
                "ledgerSize", ledger.size());

        outer:
        for (String channel : run.sourceChannels()) {
            if (!budget.hasRoom()) {
                report.stoppedBecause(stopReason(budget));
                break;
            }
            List<SourceMessage> messages;
            try {
                messages = source.fetch(channel, run.maxMessagesPerChannel());
            } catch (IOException | RuntimeException e) {
                LOG.warn("Channel {} could not be read: {}", channel, e.toString());
                SLOG.error("channel-failed", e, "channel", channel);
                report.onChannelFailed();
                continue;
            }
            LOG.debug("Channel {}: {} messages", channel, messages.size());

            for (SourceMessage msg : messages) {
                if (!budget.hasRoom()) {
                    report.stoppedBecause(stopReason(budget));
                    break outer;
                }
                try {
                    if (process(channel, msg, report)) {
                        budget.onPosted();
                        if (budget.hasRoom()) pause();
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    report.stoppedBecause("interrupted");
                    LOG.warn("Relay run interrupted");
                    break outer;
                } catch (RuntimeException e) {
                    report.onError();
                    LOG.warn("Message in {} failed: {}", channel, e.toString());
                    SLOG.error("candidate-failed", e, "channel", channel);
                }
            }
        }

        if (parts.retries() != null) report.setApiRetries(parts.retries().getRetryCount());
        RunReport.Snapshot snap = report.snapshot();
        LOG.info("Relay run done: posted={}, skipped={}, publishFailed={}, errors={}, apiRetries={}, stop={}",
                snap.posted(), snap.skippedTotal(), snap.publishFailed(), snap.errors(), snap.apiRetries(),
                snap.stopReason());
        SLOG.info("run-done",
                "scanned", snap.scanned(),
                "posted", snap.posted(),
                "skipped", snap.skippedTotal(),
                "publishFailed", snap.publishFailed(),
                "errors", snap.errors(),
                "channelFailures", snap.channelFailures(),
                "apiRetries", snap.apiRetries(),
                "stop", snap.stopReason());
        return snap;
    }

    /** 메시지 1건 처리. 게시했으면 true. */
    boolean process(String channel, SourceMessage msg, RunReport report) throws InterruptedException {
        report.onScanned();
        if (!msg.hasText()) {
            return skip(report, SkipReason.NO_TEXT, channel, null, null);
        }
        List<String> candidates = parts.scanner().candidates(msg.text());
        if (candidates.isEmpty()) {
            return skip(report, SkipReason.NO_CANDIDATE, channel, null, null);
        }

        // 1) 정규화 + 조기 확인 (유료/제한 API 호출 전)
        String clean = parts.normalizer().normalize(candidates.get(0));
        Optional<ProductId> earlyId = parts.extractor().extract(clean);
        if (earlyId.isPresent() && ledger.seen(earlyId.get())) {
            return skip(report, SkipReason.DUPLICATE_EARLY, channel, earlyId.get(), clean);
        }

        // 2) 해제 + 제휴 링크
        String resolved = parts.normalizer().normalize(parts.resolver().resolve(clean));
        AffiliateLink link = parts.linkBuilder().build(resolved);

        // 3) 최종 ID (해제로 ID가 바뀔 수 있음)
        Optional<ProductId> finalOpt = parts.extractor().extract(resolved).or(() -> earlyId);
        if (finalOpt.isEmpty() && config.run().hashFallback()) {
            finalOpt = Optional.of(parts.extractor().hashOf(resolved));
        }
        if (finalOpt.isEmpty()) {
            return skip(report, SkipReason.NO_IDENTIFIER, channel, null, resolved);
        }
        ProductId finalId = finalOpt.get();
        if (ledger.seen(finalId)) {
            return skip(report, SkipReason.DUPLICATE_FINAL, channel, finalId, resolved);
        }

        // 4) 캡션 + 조립
        FactHints hints = hints(msg.text(), finalId);
        String caption = caption(msg.text(), link, hints, finalId);
        String body = assembler.assemble(caption, link.url());

        // 5) 게시 → 기록
        try {
            publisher.publish(new PublishRequest(body, msg.mediaRef(), finalId, link));
        } catch (PublishException e) {
            report.onPublishFailed();
            LOG.warn("Publish failed for {}: {}", finalId, e.getMessage());
            SLOG.error("publish-failed", e, "channel", channel, "id", finalId.value(),
                    "origin", link.origin().name());
            return false;
        }
        recordSafely(finalId);
        earlyId.filter(ProductId::stable)
                .filter(id -> !id.value().equals(finalId.value()))
                .ifPresent(this::recordSafely);

        PostRecord post = new PostRecord(finalId.value(), parts.clock().instant(), channel);
        report.onPosted(link.origin(), post);
        LOG.info("Posted {} from {} via {}", finalId, channel, link.origin());
        SLOG.info("posted",
                "channel", post.channel(),
                "id", post.productId(),
                "at", post.postedAt().toString(),
                "idKind", finalId.kind().name(),
                "origin", link.origin().name(),
                "commissioned", link.commissioned(),
                "media", msg.hasMedia());
        return true;
    }

    private FactHints hints(String text, ProductId id) throws InterruptedException {
        FactHints hints = FactHints.fromText(text);
        MarketplaceApi details = parts.detailsApi();
        if (details != null && id.kind() == ProductId.Kind.ITEM_ID) {
            hints = details.productDetails(id.value()).map(hints::withDetails).orElse(hints);
        }
        return hints;
    }

    private String caption(String text, AffiliateLink link, FactHints hints, ProductId id) {
        if (captionWriter != null) {
            try {
                String out = captionWriter.rewrite(text, link.url(), hints);
                if (out != null && !out.isBlank()) return out;
                SLOG.warn("caption-fallback", "id", id.value(), "reason", "empty");
            } catch (CaptionException e) {
                SLOG.warn("caption-fallback", "id", id.value(), "reason", e.getMessage());
            } catch (RuntimeException e) {
                SLOG.warn("caption-fallback", "id", id.value(),
                        "error", e.getClass().getSimpleName(), "reason", e.getMessage());
            }
        }
        return fallbackCaption.from(text);
    }

    private void recordSafely(ProductId id) {
        try {
            ledger.record(id);
        } catch (LedgerException e) {
            LOG.error("Ledger write failed for {} (kept in memory): {}", id, e.getMessage());
            SLOG.error("ledger-write-failed", e, "id", id.value());
        }
    }

    private void pause() throws InterruptedException {
        RelayConfig.Run run = config.run();
        long jitterMs = run.publishJitter().toMillis();
        long extra = jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs + 1) : 0;
        Duration d = run.publishDelay().plusMillis(extra);
        if (!d.isZero()) parts.sleeper().sleep(d);
    }

    private static boolean skip(RunReport report, SkipReason reason, String channel, ProductId id, String url) {
        report.onSkipped(reason);
        SLOG.info("skip",
                "reason", reason.name(),
                "channel", channel,
                "id", id == null ? null : id.value(),
                "url", url);
        return false;
    }

    private static String stopReason(RunBudget budget) {
        return budget.postsExhausted() ? "max-posts" : "time-budget";
    }
}
