package com.dealrelay.app;

import com.dealrelay.app.caption.OpenAiCaptionWriter;
import com.dealrelay.app.delivery.TelegramBotPublisher;
import com.dealrelay.app.logging.LogSetup;
import com.dealrelay.app.source.JsonlMessageSource;
import com.dealrelay.core.api.ICaptionWriter;
import com.dealrelay.core.ledger.Ledger;
import com.dealrelay.core.ledger.LedgerException;
import com.dealrelay.core.ledger.Ledgers;
import com.dealrelay.core.model.LedgerType;
import com.dealrelay.core.model.RelayConfig;
import com.dealrelay.core.service.RelayService;
import com.dealrelay.core.service.RunReport;
import com.dealrelay.core.util.ConfigException;
import com.dealrelay.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * 1회 실행 진입점 (스케줄러/cron 에서 주기 호출).
 * 사용법: {@code java -jar dealrelay-app-cli.jar [relay.yml]}
 * 종료 코드: 0 정상, 1 실행 불가(원장/입출력), 2 설정 오류.
 */
public final class App {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG = 2;

    private App() {}

    public static void main(String[] args) {
        // 로그 초기화 (-Ddr.out.dir 없으면 "out")
        Path outRoot = Paths.get(System.getProperty("dr.out.dir", "out"));
        LogSetup.configure(outRoot);

        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));

        System.exit(run(args));
    }

    static int run(String[] args) {
        Path configPath = Path.of(args.length > 0 ? args[0] : "relay.yml");
        RelayConfig config;
        try {
            config = YamlConfigLoader.load(configPath);
            requireDelivery(config);
        } catch (ConfigException e) {
            LOG.error("Invalid configuration in {}: {}", configPath, e.getMessage());
            return EXIT_CONFIG;
        } catch (IOException e) {
            LOG.error("Cannot read configuration: {}", e.getMessage());
            return EXIT_CONFIG;
        }

        Ledger ledger;
        try {
            ledger = Ledgers.create(config.ledger(), Clock.systemUTC());
        } catch (LedgerException e) {
            LOG.error("Cannot open ledger: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }

        ICaptionWriter writer = config.caption().enabled() ? new OpenAiCaptionWriter(config.caption()) : null;
        if (writer == null) LOG.info("Caption writer not configured; using source text captions");

        RelayService service = new RelayService(config,
                new JsonlMessageSource(config.delivery().sourceDir()),
                writer,
                new TelegramBotPublisher(config.delivery()),
                ledger);

        RunReport.Snapshot report = service.run();
        LOG.info("Run summary: scanned={}, posted={}, skipped={}, failed={}",
                report.scanned(), report.posted(), report.skippedTotal(), report.publishFailed() + report.errors());
        return EXIT_OK;
    }

    /** 배달 설정은 앱에서만 필수 (코어는 게시 수단을 모른다) */
    static void requireDelivery(RelayConfig config) {
        RelayConfig.Delivery d = config.delivery();
        if (d.botToken() == null || d.botToken().isBlank()) {
            throw new ConfigException("delivery.botToken is required");
        }
        if (d.targetChannel() == null || d.targetChannel().isBlank()) {
            throw new ConfigException("delivery.targetChannel is required");
        }
        // Bot API 로는 채널 이력을 읽을 수 없다
        if (config.ledger().type() == LedgerType.FEED) {
            throw new ConfigException("ledger.type=FEED is not supported by the Bot API publisher; use FILE or MEMORY");
        }
    }
}
