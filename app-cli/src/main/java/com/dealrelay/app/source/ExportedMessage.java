package com.dealrelay.app.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/** 채널 내보내기 JSONL 한 줄. 모르는 필드는 무시. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportedMessage {
    @JsonAlias({"message", "caption"})
    public String text;

    @JsonAlias({"photo", "mediaRef"})
    public String media;

    @JsonAlias("viewCount")
    public long views;

    @JsonAlias({"timestamp", "postedAt"})
    public Instant date;
}
