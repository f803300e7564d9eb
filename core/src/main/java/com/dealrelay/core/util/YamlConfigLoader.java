package com.dealrelay.core.util;

import com.dealrelay.core.model.DedupMode;
import com.dealrelay.core.model.LedgerType;
import com.dealrelay.core.model.RelayConfig;
import com.dealrelay.core.model.TimestampFormat;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * relay.yml 을 읽어 불변 RelayConfig 로 변환.
 * 문자열 값의 ${ENV} / ${ENV:기본값} 은 환경변수로 치환한다 (시크릿을 파일에 두지 않기 위함).
 *
 * 예상 YAML 키:
 * run:
 *   sourceChannels: ["@deals_a", "@deals_b"]
 *   maxMessagesPerChannel: 50
 *   maxPostsPerRun: 10
 *   maxRunSeconds: 0
 *   publishDelayMs: 2000
 *   publishJitterMs: 0
 *   candidateMarkers: ["aliexpress", "s.click", "bit.ly"]
 *   hashFallback: false
 * resolver:
 *   enabled: true
 *   timeoutMs: 10000
 *   redirectDomains: ["s.click.aliexpress.com", "bit.ly"]
 *   hostAliases: { "m.aliexpress.com": "www.aliexpress.com" }
 * api:
 *   endpoint: "https://api-sg.aliexpress.com/sync"
 *   appKey: "${ALIEXPRESS_APP_KEY}"
 *   appSecret: "${ALIEXPRESS_APP_SECRET}"
 *   trackingId: "telegram_bot"
 *   timestampFormat: EPOCH_MILLIS | FORMATTED
 *   timestampZone: "GMT+8"
 *   timeoutMs: 15000
 *   maxAttempts: 3
 *   backoffMs: 500
 *   productDetails: false
 * links:
 *   portalTemplate: "https://s.click.aliexpress.com/deep_link.htm?aff_short_key=XXX&dl_target_url={url}"
 *   prefix: null
 *   productMarkers: ["/item/", "/e/"]
 * ledger:
 *   type: FILE | MEMORY | FEED
 *   path: "data/posted-ids.txt"
 *   mode: PERMANENT | COOLDOWN
 *   cooldownHours: 72
 *   feedLookback: 200
 * message / caption / delivery: 협력자 설정
 */
public final class YamlConfigLoader {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_.]+)(?::([^}]*))?}");

    private YamlConfigLoader() {}

    public static RelayConfig loadDefault() throws IOException {
        return load(Path.of("relay.yml"));
    }

    public static RelayConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("relay.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromMap(readTree(in), System::getenv);
        }
    }

    /** 테스트/임베딩용: 문자열 + 환경 조회 함수 */
    public static RelayConfig parse(String yaml, Function<String, String> env) {
        Yaml parser = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root;
        try {
            root = parser.load(yaml);
        } catch (YAMLException e) {
            throw new ConfigException("invalid YAML: " + e.getMessage(), e);
        }
        return fromMap(root, env);
    }

    private static Object readTree(InputStream in) {
        Yaml parser = new Yaml(new SafeConstructor(new LoaderOptions()));
        try {
            return parser.load(in);
        } catch (YAMLException e) {
            throw new ConfigException("invalid YAML: " + e.getMessage(), e);
        }
    }

    private static RelayConfig fromMap(Object root, Function<String, String> env) {
        Section top = new Section("", root instanceof Map<?, ?> m ? m : Map.of(), env);
        RelayConfig.Builder b = RelayConfig.builder();

        Section run = top.child("run");
        RelayConfig.Run rd = RelayConfig.Run.defaults();
        b.run(new RelayConfig.Run(
                run.strings("sourceChannels", rd.sourceChannels()),
                run.integer("maxMessagesPerChannel", rd.maxMessagesPerChannel()),
                run.integer("maxPostsPerRun", rd.maxPostsPerRun()),
                run.seconds("maxRunSeconds", rd.maxRunTime()),
                run.millis("publishDelayMs", rd.publishDelay()),
                run.millis("publishJitterMs", rd.publishJitter()),
                run.strings("candidateMarkers", rd.candidateMarkers()),
                run.bool("hashFallback", rd.hashFallback())));

        Section res = top.child("resolver");
        RelayConfig.Resolver resd = RelayConfig.Resolver.defaults();
        b.resolver(new RelayConfig.Resolver(
                res.bool("enabled", resd.enabled()),
                res.millis("timeoutMs", resd.timeout()),
                res.strings("redirectDomains", resd.redirectDomains()),
                res.stringMap("hostAliases", resd.hostAliases())));

        Section api = top.child("api");
        RelayConfig.Api ad = RelayConfig.Api.defaults();
        b.api(new RelayConfig.Api(
                api.string("endpoint", ad.endpoint()),
                api.string("appKey", ad.appKey()),
                api.string("appSecret", ad.appSecret()),
                api.string("trackingId", ad.trackingId()),
                api.string("version", ad.apiVersion()),
                api.string("promotionLinkType", ad.promotionLinkType()),
                api.enumValue("timestampFormat", TimestampFormat.class, ad.timestampFormat()),
                api.zone("timestampZone", ad.timestampZone()),
                api.millis("timeoutMs", ad.timeout()),
                api.integer("maxAttempts", ad.maxAttempts()),
                api.millis("backoffMs", ad.backoffBase()),
                api.bool("productDetails", ad.productDetails()),
                api.string("targetCurrency", ad.targetCurrency()),
                api.string("targetLanguage", ad.targetLanguage())));

        Section links = top.child("links");
        RelayConfig.Links ld = RelayConfig.Links.defaults();
        b.links(new RelayConfig.Links(
                links.string("portalTemplate", ld.portalTemplate()),
                links.string("prefix", ld.prefix()),
                links.strings("productMarkers", ld.productMarkers())));

        Section ledger = top.child("ledger");
        RelayConfig.Ledger led = RelayConfig.Ledger.defaults();
        String path = ledger.string("path", null);
        b.ledger(new RelayConfig.Ledger(
                ledger.enumValue("type", LedgerType.class, led.type()),
                path == null ? led.path() : Path.of(path),
                ledger.enumValue("mode", DedupMode.class, led.mode()),
                ledger.hours("cooldownHours", led.cooldown()),
                ledger.integer("feedLookback", led.feedLookback())));

        Section msg = top.child("message");
        RelayConfig.Message md = RelayConfig.Message.defaults();
        b.message(new RelayConfig.Message(
                msg.string("buyHereLabel", md.buyHereLabel()),
                msg.integer("fallbackCaptionMaxChars", md.fallbackCaptionMaxChars())));

        Section cap = top.child("caption");
        RelayConfig.Caption cd = RelayConfig.Caption.defaults();
        b.caption(new RelayConfig.Caption(
                cap.string("apiKey", cd.apiKey()),
                cap.string("model", cd.model()),
                cap.string("endpoint", cd.endpoint()),
                cap.millis("timeoutMs", cd.timeout()),
                cap.string("language", cd.language())));

        Section del = top.child("delivery");
        RelayConfig.Delivery dd = RelayConfig.Delivery.defaults();
        String sourceDir = del.string("sourceDir", null);
        b.delivery(new RelayConfig.Delivery(
                del.string("botToken", dd.botToken()),
                del.string("targetChannel", dd.targetChannel()),
                del.string("apiBase", dd.apiBase()),
                del.bool("hiddenIdMarker", dd.hiddenIdMarker()),
                sourceDir == null ? dd.sourceDir() : Path.of(sourceDir),
                del.millis("timeoutMs", dd.timeout())));

        return b.build();
    }

    static String resolvePlaceholders(String raw, Function<String, String> env) {
        if (raw == null || raw.indexOf("${") < 0) return raw;
        Matcher m = PLACEHOLDER.matcher(raw);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = env.apply(m.group(1));
            if (value == null) value = m.group(2) == null ? "" : m.group(2);
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    // ------------ helpers ------------
    private static final class Section {
        private final String prefix;
        private final Map<?, ?> map;
        private final Function<String, String> env;

        Section(String prefix, Map<?, ?> map, Function<String, String> env) {
            this.prefix = prefix;
            this.map = map;
            this.env = env;
        }

        Section child(String key) {
            Object v = map.get(key);
            return new Section(key + ".", v instanceof Map<?, ?> m ? m : Map.of(), env);
        }

        String string(String key, String def) {
            Object v = map.get(key);
            if (v == null) return def;
            String s = resolvePlaceholders(String.valueOf(v), env).trim();
            return s.isEmpty() ? def : s;
        }

        boolean bool(String key, boolean def) {
            Object v = map.get(key);
            if (v instanceof Boolean b) return b;
            String s = string(key, null);
            return s == null ? def : Boolean.parseBoolean(s);
        }

        int integer(String key, int def) {
            Object v = map.get(key);
            if (v instanceof Number n) return n.intValue();
            String s = string(key, null);
            if (s == null) return def;
            try {
                return Integer.parseInt(s);
            } catch (NumberFormatException e) {
                throw new ConfigException(prefix + key + " must be an integer: " + s, e);
            }
        }

        private long longValue(String key, long def) {
            Object v = map.get(key);
            if (v instanceof Number n) return n.longValue();
            String s = string(key, null);
            if (s == null) return def;
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException e) {
                throw new ConfigException(prefix + key + " must be a number: " + s, e);
            }
        }

        Duration millis(String key, Duration def) {
            return map.get(key) == null ? def : Duration.ofMillis(longValue(key, 0));
        }

        Duration seconds(String key, Duration def) {
            return map.get(key) == null ? def : Duration.ofSeconds(longValue(key, 0));
        }

        Duration hours(String key, Duration def) {
            return map.get(key) == null ? def : Duration.ofHours(longValue(key, 0));
        }

        ZoneId zone(String key, ZoneId def) {
            String s = string(key, null);
            if (s == null) return def;
            try {
                return ZoneId.of(s);
            } catch (DateTimeException e) {
                throw new ConfigException(prefix + key + " is not a valid zone: " + s, e);
            }
        }

        List<String> strings(String key, List<String> def) {
            Object v = map.get(key);
            if (v == null) return def;
            List<String> out = new ArrayList<>();
            if (v instanceof List<?> list) {
                for (Object o : list) {
                    if (o == null) continue;
                    String s = resolvePlaceholders(String.valueOf(o), env).trim();
                    if (!s.isEmpty()) out.add(s);
                }
            } else {
                // "a,b,c" 형태 지원 (환경변수 한 줄로 채널 목록을 줄 때)
                for (String p : resolvePlaceholders(String.valueOf(v), env).split("\\s*,\\s*")) {
                    if (!p.isBlank()) out.add(p.trim());
                }
            }
            return List.copyOf(out);
        }

        Map<String, String> stringMap(String key, Map<String, String> def) {
            Object v = map.get(key);
            if (!(v instanceof Map<?, ?> m)) return def;
            Map<String, String> out = new LinkedHashMap<>();
            for (var e : m.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                out.put(String.valueOf(e.getKey()).toLowerCase(Locale.ROOT),
                        resolvePlaceholders(String.valueOf(e.getValue()), env).trim());
            }
            return Map.copyOf(out);
        }

        <E extends Enum<E>> E enumValue(String key, Class<E> type, E def) {
            String s = string(key, null);
            if (s == null) return def;
            for (E e : type.getEnumConstants()) {
                if (e.name().equalsIgnoreCase(s)) return e;
            }
            throw new ConfigException(prefix + key + " has unknown value: " + s);
        }
    }
}
