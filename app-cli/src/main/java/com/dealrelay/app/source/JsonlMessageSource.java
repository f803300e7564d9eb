package com.dealrelay.app.source;

import com.dealrelay.core.api.IMessageSource;
import com.dealrelay.core.model.SourceMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 내보낸 채널 메시지(JSON Lines) 읽기: {@code <sourceDir>/<channel>.jsonl}.
 * 채널 이름 앞의 '@' 는 파일명에서 뺀다. 파일 순서 그대로 최대 limit 건.
 * 깨진 줄은 경고만 남기고 건너뛴다. 파일이 없으면 IOException (해당 채널만 실패).
 */
public final class JsonlMessageSource implements IMessageSource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonlMessageSource.class);

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path dir;

    public JsonlMessageSource(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    Path fileFor(String channel) {
        String name = channel.startsWith("@") ? channel.substring(1) : channel;
        return dir.resolve(name + ".jsonl");
    }

    @Override
    public List<SourceMessage> fetch(String channel, int limit) throws IOException {
        Objects.requireNonNull(channel, "channel");
        Path file = fileFor(channel);
        List<SourceMessage> out = new ArrayList<>();
        int lineNo = 0;
        try (BufferedReader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while (out.size() < limit && (line = r.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                try {
                    ExportedMessage m = om.readValue(line, ExportedMessage.class);
                    out.add(new SourceMessage(channel, m.text, m.media, m.views,
                            m.date == null ? Instant.EPOCH : m.date));
                } catch (JsonProcessingException e) {
                    LOG.warn("Skipping malformed line {} in {}: {}", lineNo, file, e.getOriginalMessage());
                }
            }
        }
        return out;
    }
}
