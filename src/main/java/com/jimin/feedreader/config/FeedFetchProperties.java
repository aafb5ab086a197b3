package com.jimin.feedreader.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 피드 fetch 설정 (application.properties의 feeds.fetch.*)
 *
 * 예시:
 *   feeds.fetch.timeout=10s
 *   feeds.fetch.max-redirects=5
 *   feeds.fetch.user-agent=RSS Feed Reader/1.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "feeds.fetch")
public class FeedFetchProperties {

    // 요청 1회(헤더 + 본문)의 전체 시간 제한
    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    // 이 횟수를 넘는 리다이렉트는 too-many-redirects
    @Min(0)
    private int maxRedirects = 5;

    @NotBlank
    private String userAgent = "RSS Feed Reader/1.0";

    // refreshAll() 동시 sync 개수 (원격 서버 예의 + 로컬 자원)
    @Min(1)
    private int maxConcurrentSyncs = 4;
}
