package com.dealrelay.core.http;

import javax.net.ssl.SSLSession;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Optional;

/** HttpSender 람다에서 돌려줄 고정 응답 */
public final class StubResponse implements HttpResponse<String> {
    private final int status;
    private final String body;
    private final HttpRequest request;
    private final URI uri;

    public StubResponse(int status, String body, HttpRequest request) {
        this(status, body, request, request.uri());
    }

    public StubResponse(int status, String body, HttpRequest request, URI uri) {
        this.status = status;
        this.body = body;
        this.request = request;
        this.uri = uri;
    }

    public static HttpSender always(int status, String body) {
        return req -> new StubResponse(status, body, req);
    }

    @Override public int statusCode() { return status; }
    @Override public HttpRequest request() { return request; }
    @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
    @Override public HttpHeaders headers() { return HttpHeaders.of(Map.of(), (a, b) -> true); }
    @Override public String body() { return body; }
    @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
    @Override public URI uri() { return uri; }
    @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
}
