package com.sitemirror.core.http;

import com.sitemirror.core.api.Fetcher;
import com.sitemirror.core.model.FetchResult;
import com.sitemirror.core.model.MirrorConfig;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/** java.net.http 기반 Fetcher: GET 1회, 리다이렉트 추종, 예외 시 status -1 반환 */
public class HttpFetcher implements Fetcher {

    private static final String ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final HttpClient client;
    private final Duration timeout;
    private final String userAgent;

    public HttpFetcher(MirrorConfig config) {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .connectTimeout(Objects.requireNonNull(config, "config").getTimeout())
                        .build(),
                config.getTimeout(),
                config.getUserAgent());
    }

    /** 테스트/공유 클라이언트 주입용 */
    public HttpFetcher(HttpClient client, Duration timeout, String userAgent) {
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    }

    @Override
    public FetchResult fetch(URI url) {
        Objects.requireNonNull(url, "url");
        String u = url.toString();
        try {
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", ACCEPT)
                    .GET()
                    .build();

            HttpResponse<byte[]> resp = client.send(req, HttpResponse.BodyHandlers.ofByteArray());
            String contentType = resp.headers().firstValue("Content-Type").orElse(null);
            return FetchResult.ok(u, resp.uri().toString(), resp.statusCode(), contentType, resp.body());
        } catch (HttpTimeoutException e) {
            return FetchResult.transportError(u, "timeout after " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.transportError(u, "interrupted");
        } catch (Exception e) {
            // 연결 거부, DNS 실패, 잘못된 URI 등
            String msg = e.getMessage();
            return FetchResult.transportError(u, e.getClass().getSimpleName() + (msg == null ? "" : ": " + msg));
        }
    }
}
