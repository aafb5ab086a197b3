package com.jimin.feedreader.dto;

import java.time.LocalDateTime;

/**
 * 항목 조회 / 일괄 읽음 처리 조건 (null 필드는 조건에서 제외)
 *
 * @param feedId          특정 피드의 항목만
 * @param read            읽음 여부 (조회에서만 사용)
 * @param keyword         제목 포함 검색어
 * @param publishedBefore 이 시각 이전에 발행된 항목만 (일괄 읽음 처리에서만 사용)
 */
public record FeedItemFilter(
        Long feedId,
        Boolean read,
        String keyword,
        LocalDateTime publishedBefore
) {
    public static FeedItemFilter all() {
        return new FeedItemFilter(null, null, null, null);
    }

    public static FeedItemFilter forFeed(Long feedId) {
        return new FeedItemFilter(feedId, null, null, null);
    }

    /**
     * 빈 검색어는 조건 없음으로 취급
     */
    public String normalizedKeyword() {
        return keyword == null || keyword.isBlank() ? null : keyword.trim();
    }
}
