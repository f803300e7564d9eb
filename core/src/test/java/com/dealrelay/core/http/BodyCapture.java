package com.dealrelay.core.http;

import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/** 테스트에서 HttpRequest 본문을 문자열로 꺼낸다 */
public final class BodyCapture {
    private BodyCapture() {}

    public static String of(HttpRequest req) {
        var publisher = req.bodyPublisher().orElseThrow();
        var out = new StringBuilder();
        var done = new CompletableFuture<Void>();
        publisher.subscribe(new Flow.Subscriber<ByteBuffer>() {
            @Override public void onSubscribe(Flow.Subscription s) { s.request(Long.MAX_VALUE); }
            @Override public void onNext(ByteBuffer item) {
                byte[] bytes = new byte[item.remaining()];
                item.get(bytes);
                out.append(new String(bytes, StandardCharsets.UTF_8));
            }
            @Override public void onError(Throwable t) { done.completeExceptionally(t); }
            @Override public void onComplete() { done.complete(null); }
        });
        done.join();
        return out.toString();
    }
}
