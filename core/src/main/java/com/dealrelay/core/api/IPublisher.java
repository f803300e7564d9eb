package com.dealrelay.core.api;

import com.dealrelay.core.model.PublishRequest;

/** 목적지 채널로 게시. 예외 없이 반환되면 게시 확정으로 본다. */
public interface IPublisher {
    void publish(PublishRequest request) throws PublishException;
}
