package com.jimin.feedreader.client;

import java.net.URI;
import java.net.http.HttpHeaders;

/**
 * 피드 fetch 결과 (리다이렉트를 모두 따라간 최종 응답)
 *
 * @param uri         최종 응답을 준 URI
 * @param status      HTTP 상태 코드 (항상 2xx)
 * @param headers     응답 헤더
 * @param body        응답 본문
 */
public record FetchResponse(
        URI uri,
        int status,
        HttpHeaders headers,
        byte[] body
) {
    /**
     * Content-Type 헤더 (없으면 null). XmlReader의 charset 판별에 사용
     */
    public String contentType() {
        return headers.firstValue("Content-Type").orElse(null);
    }
}
