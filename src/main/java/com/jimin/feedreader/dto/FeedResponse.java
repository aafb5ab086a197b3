package com.jimin.feedreader.dto;

import com.jimin.feedreader.entity.Feed;

import java.time.LocalDateTime;

/**
 * 피드 응답 DTO
 *
 * Entity를 직접 노출하지 않고 필요한 필드만 전달
 */
public record FeedResponse(
        Long id,
        String url,
        String title,
        LocalDateTime lastFetchedAt,
        LocalDateTime addedAt,
        long itemCount,
        long unreadCount
) {
    public static FeedResponse from(Feed feed, long itemCount, long unreadCount) {
        return new FeedResponse(
                feed.getId(),
                feed.getUrl(),
                feed.getTitle(),
                feed.getLastFetchedAt(),
                feed.getAddedAt(),
                itemCount,
                unreadCount
        );
    }
}
