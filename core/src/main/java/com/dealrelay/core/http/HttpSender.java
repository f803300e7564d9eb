package com.dealrelay.core.http;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/** 송신 훅: 프로덕션은 HttpClient, 테스트는 람다로 응답을 흉내낸다. */
@FunctionalInterface
public interface HttpSender {
    HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;

    static HttpSender of(HttpClient client) {
        Objects.requireNonNull(client, "client");
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }
}
