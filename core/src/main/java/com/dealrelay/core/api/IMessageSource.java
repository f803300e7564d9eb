package com.dealrelay.core.api;

import com.dealrelay.core.model.SourceMessage;

import java.io.IOException;
import java.util.List;

/** 소스 채널 메시지 공급자. 채널 순서/메시지 순서는 원본 그대로. */
public interface IMessageSource {
    List<SourceMessage> fetch(String channel, int limit) throws IOException;
}
