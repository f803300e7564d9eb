package com.dealrelay.core.marketplace;

import com.dealrelay.core.http.HttpSender;
import com.dealrelay.core.http.RetryPolicy;
import com.dealrelay.core.model.RelayConfig;
import com.dealrelay.core.util.Sleeper;
import com.dealrelay.core.util.StructuredLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * 서명 요청 클라이언트.
 * 시스템 파라미터(app_key, timestamp, format, sign_method, v, method) + 호출 파라미터를 합쳐 서명하고
 * form-encoded POST 1회를 보낸다. 결과는 봉투 모양별로 분류해 {@link ApiResult} 로 돌려준다.
 * TRANSIENT 만 {@link RetryPolicy} 에 따라 재시도하며 매 시도마다 timestamp/서명을 새로 만든다.
 */
public class SignedRequestClient {

    private static final Logger LOG = LoggerFactory.getLogger(SignedRequestClient.class);
    private static final StructuredLog SLOG = StructuredLog.get(SignedRequestClient.class);
    // "sign" 단독 단어만 (design, assign 등 제외)
    private static final Pattern SIGN_WORD = Pattern.compile("(?<![a-z])sign(?![a-z])");

    private final RelayConfig.Api cfg;
    private final RequestSigner signer;
    private final EnvelopeParser parser;
    private final HttpSender sender;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;

    public SignedRequestClient(RelayConfig.Api cfg, ObjectMapper mapper, RetryPolicy retryPolicy, Sleeper sleeper) {
        this(cfg, mapper, HttpSender.of(HttpClient.newBuilder()
                        .connectTimeout(cfg.timeout())
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .build()),
                retryPolicy, sleeper, Clock.systemUTC());
    }

    /** 테스트용 생성자(송신 훅/시계 주입) */
    public SignedRequestClient(RelayConfig.Api cfg, ObjectMapper mapper, HttpSender sender,
                               RetryPolicy retryPolicy, Sleeper sleeper, Clock clock) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        if (!cfg.credentialsPresent()) {
            throw new IllegalArgumentException("api.appKey and api.appSecret are required for signed calls");
        }
        this.signer = new RequestSigner(cfg.appSecret());
        this.parser = new EnvelopeParser(Objects.requireNonNull(mapper, "mapper"));
        this.sender = Objects.requireNonNull(sender, "sender");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 재시도 포함 호출. 인터럽트되면 즉시 전파. */
    public ApiResult call(String method, Map<String, String> params) throws InterruptedException {
        Objects.requireNonNull(method, "method");
        int attempt = 1;
        while (true) {
            ApiResult result = callOnce(method, params);
            if (result instanceof ApiResult.Err err) {
                ApiError e = err.error();
                if (retryPolicy.shouldRetry(e.kind(), attempt)) {
                    var delay = retryPolicy.nextDelay(attempt);
                    SLOG.warn("api-retry", "method", method, "attempt", attempt, "delayMs", delay.toMillis(),
                            "kind", e.kind().name(), "message", e.message());
                    sleeper.sleep(delay);
                    attempt++;
                    continue;
                }
                logFailure(method, attempt, e);
            }
            return result;
        }
    }

    /** 서명된 전체 파라미터 집합 (전송 집합과 동일) */
    public Map<String, String> signedParams(String method, Map<String, String> params) {
        Map<String, String> all = new LinkedHashMap<>();
        all.put("app_key", cfg.appKey());
        all.put("timestamp", cfg.timestampFormat().format(clock.instant(), cfg.timestampZone()));
        all.put("format", "json");
        all.put("sign_method", "md5");
        all.put("v", cfg.apiVersion());
        all.put("method", method);
        if (params != null) all.putAll(params);
        return signer.signed(all);
    }

    ApiResult callOnce(String method, Map<String, String> params) throws InterruptedException {
        Map<String, String> signed = signedParams(method, params);
        HttpRequest req = HttpRequest.newBuilder(URI.create(cfg.endpoint()))
                .timeout(cfg.timeout())
                .header("Content-Type", "application/x-www-form-urlencoded;charset=utf-8")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(signed), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> resp;
        try {
            LOG.debug("API call {} params={}", method, signed.keySet());
            resp = sender.send(req);
        } catch (IOException e) {
            return ApiResult.err(ApiError.transientError(e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
        return classify(method, resp.statusCode(), resp.body());
    }

    ApiResult classify(String method, int status, String body) {
        ResponseEnvelope env = parser.parse(method, body);
        boolean transientStatus = status == 429 || status >= 500;

        if (env instanceof ResponseEnvelope.ErrorResponse er) {
            String code = er.subCode() != null ? er.code() + "/" + er.subCode() : er.code();
            String msg = er.subMessage() != null ? er.message() + " (" + er.subMessage() + ")" : er.message();
            return ApiResult.err(new ApiError(kindOf(code, msg), code, msg, body));
        }
        if (env instanceof ResponseEnvelope.GatewayError ge) {
            return ApiResult.err(new ApiError(kindOf(ge.code(), ge.message()), ge.code(), ge.message(), body));
        }
        if (env instanceof ResponseEnvelope.NestedSuccess ns) {
            return success(ns.respCode(), ns.respMsg(), ns.result(), body);
        }
        if (env instanceof ResponseEnvelope.FlatSuccess fs) {
            return success(fs.respCode(), fs.respMsg(), fs.result(), body);
        }
        if (env instanceof ResponseEnvelope.NotJson nj) {
            return ApiResult.err(new ApiError(ApiErrorKind.TRANSIENT, String.valueOf(status),
                    "non-JSON response body (HTTP " + status + ")", nj.raw()));
        }
        // 미인식 JSON: 429/5xx 면 게이트웨이 일시 장애로 본다
        ApiErrorKind kind = transientStatus ? ApiErrorKind.TRANSIENT : ApiErrorKind.MALFORMED;
        return ApiResult.err(new ApiError(kind, String.valueOf(status), "unrecognized response shape", body));
    }

    private static ApiResult success(String respCode, String respMsg, com.fasterxml.jackson.databind.JsonNode result,
                                     String body) {
        if (respCode != null && !respCode.isBlank() && !respCode.equals("200")) {
            return ApiResult.err(new ApiError(ApiErrorKind.BUSINESS, respCode, respMsg, body));
        }
        return ApiResult.ok(result);
    }

    static ApiErrorKind kindOf(String code, String message) {
        String s = (String.valueOf(code) + " " + String.valueOf(message)).toLowerCase(Locale.ROOT);
        if (s.contains("signature") || SIGN_WORD.matcher(s).find()
                || s.contains("appkey") || s.contains("app_key") || s.contains("app key")
                || s.contains("session") || s.contains("access_token") || s.contains("unauthorized")
                || s.contains("permission") || s.contains("apikey")) {
            return ApiErrorKind.AUTH;
        }
        return ApiErrorKind.BUSINESS;
    }

    private void logFailure(String method, int attempts, ApiError e) {
        switch (e.kind()) {
            case MALFORMED -> SLOG.warn("api-malformed", "method", method, "attempts", attempts, "raw", e.raw());
            case TRANSIENT -> SLOG.warn("api-transient-exhausted", "method", method, "attempts", attempts,
                    "message", e.message());
            default -> SLOG.warn("api-error", "method", method, "kind", e.kind().name(),
                    "code", e.code(), "message", e.message());
        }
    }

    static String formEncode(Map<String, String> params) {
        StringJoiner sj = new StringJoiner("&");
        for (Map.Entry<String, String> e : params.entrySet()) {
            sj.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                    + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        return sj.toString();
    }
}
