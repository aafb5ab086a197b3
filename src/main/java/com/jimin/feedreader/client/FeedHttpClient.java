package com.jimin.feedreader.client;

import com.jimin.feedreader.config.FeedFetchProperties;
import com.jimin.feedreader.exception.FeedTransportException;
import com.jimin.feedreader.exception.TransportErrorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 피드 HTTP GET 클라이언트
 *
 * 동작 방식:
 * 1. 요청 1회(헤더 + 본문)를 feeds.fetch.timeout 안에 끝내지 못하면 TIMEOUT
 * 2. 3xx + Location 이면 직접 따라감 (최대 feeds.fetch.max-redirects 회)
 * 3. 최종 응답이 2xx가 아니면 HTTP_ERROR
 *
 * 실패는 모두 FeedTransportException으로 분류해서 던짐
 */
@Component
@Slf4j
public class FeedHttpClient {

    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);

    private static final String ACCEPT =
            "application/rss+xml, application/atom+xml, application/xml;q=0.9, text/xml;q=0.8, */*;q=0.1";

    private final HttpClient httpClient;
    private final FeedFetchProperties properties;

    public FeedHttpClient(HttpClient feedJdkHttpClient, FeedFetchProperties properties) {
        this.httpClient = feedJdkHttpClient;
        this.properties = properties;
    }

    /**
     * URL을 GET으로 가져옴 (리다이렉트 포함)
     *
     * @param url 피드 URL (http/https)
     * @return 최종 2xx 응답
     * @throws FeedTransportException 시간 초과, 연결 실패, 리다이렉트 초과, 2xx 외 상태
     */
    public FetchResponse get(String url) {
        URI current = URI.create(url);
        int redirects = 0;

        while (true) {
            HttpResponse<byte[]> response = send(current, url);
            int status = response.statusCode();

            Optional<String> location = response.headers().firstValue("Location");
            if (REDIRECT_STATUSES.contains(status) && location.isPresent()) {
                if (redirects >= properties.getMaxRedirects()) {
                    throw new FeedTransportException(TransportErrorType.TOO_MANY_REDIRECTS, url,
                            "리다이렉트 " + properties.getMaxRedirects() + "회 초과: " + url, null);
                }
                redirects++;
                URI next = resolveLocation(current, location.get(), url);
                log.debug("리다이렉트 {} → {} ({}회)", current, next, redirects);
                current = next;
                continue;
            }

            if (status < 200 || status >= 300) {
                throw FeedTransportException.httpError(url, status);
            }
            return new FetchResponse(current, status, response.headers(), response.body());
        }
    }

    private HttpResponse<byte[]> send(URI uri, String originalUrl) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(properties.getTimeout())
                    .header("User-Agent", properties.getUserAgent())
                    .header("Accept", ACCEPT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            // 리다이렉트 Location이 http/https가 아닌 경우 등
            throw new FeedTransportException(TransportErrorType.CONNECTION_ERROR, originalUrl,
                    "요청할 수 없는 URI: " + uri, e);
        }

        // Why: request.timeout은 헤더 수신까지만 제한함. 본문까지 포함해서 제한하려고 future.get(timeout)
        CompletableFuture<HttpResponse<byte[]>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        try {
            return future.get(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FeedTransportException(TransportErrorType.TIMEOUT, originalUrl,
                    "시간 초과 (" + properties.getTimeout() + "): " + uri, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new FeedTransportException(TransportErrorType.CONNECTION_ERROR, originalUrl,
                    "요청 중단됨: " + uri, e);
        } catch (ExecutionException e) {
            throw classify(e.getCause() != null ? e.getCause() : e, uri, originalUrl);
        }
    }

    private URI resolveLocation(URI current, String location, String originalUrl) {
        try {
            return current.resolve(location.trim());
        } catch (IllegalArgumentException e) {
            throw new FeedTransportException(TransportErrorType.CONNECTION_ERROR, originalUrl,
                    "잘못된 리다이렉트 Location: " + location, e);
        }
    }

    private FeedTransportException classify(Throwable cause, URI uri, String originalUrl) {
        if (cause instanceof HttpTimeoutException) {
            return new FeedTransportException(TransportErrorType.TIMEOUT, originalUrl,
                    "시간 초과: " + uri, cause);
        }
        if (cause instanceof IOException) {
            return new FeedTransportException(TransportErrorType.CONNECTION_ERROR, originalUrl,
                    "연결 실패: " + uri + " - " + cause.getMessage(), cause);
        }
        return new FeedTransportException(TransportErrorType.CONNECTION_ERROR, originalUrl,
                "요청 실패: " + uri + " - " + cause, cause);
    }
}
