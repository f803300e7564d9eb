package com.dealrelay.core.ledger;

import com.dealrelay.core.model.DedupMode;
import com.dealrelay.core.model.ProductId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 줄 단위 파일 원장: {@code id} 또는 {@code id<TAB>epochMillis}.
 * 시작 시 전부 읽고, 게시 성공마다 한 줄 추가한다. 해시 id 는 파일에 쓰지 않는다.
 */
public final class FileLedger extends AbstractLedger {

    private static final Logger LOG = LoggerFactory.getLogger(FileLedger.class);

    private final Path path;

    public FileLedger(Path path, DedupMode mode, Duration cooldown, Clock clock) {
        super(mode, cooldown, clock);
        this.path = Objects.requireNonNull(path, "path");
        load();
    }

    public Path path() { return path; }

    private void load() {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            LOG.info("Ledger file {} does not exist yet; starting empty", path);
            return;
        } catch (IOException e) {
            throw new LedgerException("Cannot read ledger file " + path, e);
        }
        int loaded = 0;
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            int tab = line.indexOf('\t');
            if (tab < 0) {
                remember(line, UNKNOWN_TIME);
            } else {
                remember(line.substring(0, tab).strip(), parseMillis(line.substring(tab + 1).strip()));
            }
            loaded++;
        }
        LOG.info("Ledger loaded: {} entries from {}", loaded, path);
    }

    private static long parseMillis(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return UNKNOWN_TIME;
        }
    }

    @Override
    protected void persist(ProductId id, long epochMillis) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                w.write(id.value() + "\t" + epochMillis);
                w.newLine();
            }
        } catch (IOException e) {
            throw new LedgerException("Cannot append to ledger file " + path, e);
        }
    }
}
