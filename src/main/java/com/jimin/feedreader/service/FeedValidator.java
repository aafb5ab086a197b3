package com.jimin.feedreader.service;

import com.jimin.feedreader.dto.ParseResult;
import com.jimin.feedreader.dto.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * 피드 URL 검증
 *
 * 1. URL 형식/scheme 검사 (네트워크 호출 없음)
 * 2. 실제 fetch + 파싱
 * 3. 제목 또는 항목이 하나라도 있으면 피드로 인정
 *
 * DB에는 아무것도 쓰지 않음
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeedValidator {

    public static final String NOT_A_FEED = "not a recognizable feed";

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    private final FeedParser feedParser;

    public ValidationResult validate(String url) {
        String inputError = checkUrl(url);
        if (inputError != null) {
            log.info("피드 URL 형식 오류: {} - {}", url, inputError);
            return ValidationResult.invalid(inputError);
        }

        ParseResult result = feedParser.parse(url.trim());
        if (result.isFailed()) {
            log.info("피드 검증 실패: {} - {}", url, result.diagnostic());
            return ValidationResult.invalid(result.diagnostic());
        }
        if (!result.hasUsableContent()) {
            log.info("피드 검증 실패: {} - 제목과 항목이 모두 없음", url);
            return ValidationResult.invalid(NOT_A_FEED);
        }
        if (result.isMalformed()) {
            // Why: XML 오류가 조금 있어도 내용이 있으면 실제로는 쓸 수 있는 피드가 많음
            log.warn("피드 파싱 경고 (사용 가능): {} - {}", url, result.diagnostic());
        }

        log.info("피드 검증 성공: {} (항목 {}개)", url, result.entries().size());
        return ValidationResult.ok();
    }

    /**
     * @return 형식 오류 사유 (문제 없으면 null)
     */
    String checkUrl(String url) {
        if (url == null || url.isBlank()) {
            return "URL must not be empty";
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return "URL is not well-formed: " + e.getMessage();
        }

        String scheme = uri.getScheme();
        if (scheme == null || !ALLOWED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
            return "URL scheme must be http or https";
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            return "URL must include a host";
        }
        return null;
    }
}
