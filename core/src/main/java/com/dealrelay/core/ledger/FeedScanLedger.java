package com.dealrelay.core.ledger;

import com.dealrelay.core.model.DedupMode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 목적지 피드 자체를 원장으로 쓴다.
 * 최근 N개 게시물에서 숨김 앵커 {@code http://bot-id/<id>} 와 보이는 {@code /item/<id>.html} 링크를 읽어 적재.
 * 이번 실행의 record 는 메모리에만 남긴다 (게시물 자체가 다음 실행의 기록이 된다).
 */
public final class FeedScanLedger extends AbstractLedger {

    private static final Logger LOG = LoggerFactory.getLogger(FeedScanLedger.class);

    public static final String BOT_ID_PREFIX = "http://bot-id/";
    // 해시 id 는 실행 범위 전용이라 피드에서 읽어 오지 않는다
    private static final String HASH_PREFIX = "h:";
    private static final Pattern ITEM_HTML = Pattern.compile("/item/(\\d+)\\.html");

    public FeedScanLedger(FeedHistory history, int lookback, DedupMode mode, Duration cooldown, Clock clock) {
        super(mode, cooldown, clock);
        Objects.requireNonNull(history, "history");
        load(history, Math.max(1, lookback));
    }

    private void load(FeedHistory history, int lookback) {
        var posts = fetch(history, lookback);
        int ids = 0;
        int scanned = 0;
        for (FeedHistory.FeedPost post : posts) {
            if (scanned++ >= lookback) break;
            long at = post.postedAt() == null ? UNKNOWN_TIME : post.postedAt().toEpochMilli();
            for (String id : idsIn(post.html())) {
                remember(id, at);
                ids++;
            }
        }
        LOG.info("Feed ledger loaded: {} ids from {} posts", ids, scanned);
    }

    private static List<FeedHistory.FeedPost> fetch(FeedHistory history, int lookback) {
        try {
            return history.recent(lookback);
        } catch (IOException e) {
            throw new LedgerException("Cannot read destination feed history", e);
        }
    }

    /** 게시물 HTML 하나에서 식별자 추출 (숨김 앵커 우선, 이어서 보이는 상품 링크) */
    static Set<String> idsIn(String html) {
        Set<String> out = new LinkedHashSet<>();
        if (html == null || html.isBlank()) return out;
        Document doc = Jsoup.parseBodyFragment(html);
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            if (href.startsWith(BOT_ID_PREFIX)) {
                String id = href.substring(BOT_ID_PREFIX.length());
                int end = indexOfAny(id, "/?#");
                if (end >= 0) id = id.substring(0, end);
                if (!id.isBlank() && !id.startsWith(HASH_PREFIX)) out.add(id);
            } else {
                addItemIds(href, out);
            }
        }
        addItemIds(doc.text(), out);
        return out;
    }

    private static void addItemIds(String s, Set<String> out) {
        Matcher m = ITEM_HTML.matcher(s);
        while (m.find()) out.add(m.group(1));
    }

    private static int indexOfAny(String s, String chars) {
        for (int i = 0; i < s.length(); i++) {
            if (chars.indexOf(s.charAt(i)) >= 0) return i;
        }
        return -1;
    }
}
