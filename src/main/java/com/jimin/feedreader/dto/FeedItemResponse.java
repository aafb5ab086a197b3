package com.jimin.feedreader.dto;

import com.jimin.feedreader.entity.FeedItem;

import java.time.LocalDateTime;

/**
 * 피드 항목 응답 DTO
 *
 * from() 팩토리 메서드로 Entity → DTO 변환
 */
public record FeedItemResponse(
        Long id,
        Long feedId,
        String feedTitle,
        String feedUrl,
        String title,
        String content,
        LocalDateTime publishedAt,
        boolean read,
        String guid,
        LocalDateTime createdAt
) {
    public static FeedItemResponse from(FeedItem item) {
        return new FeedItemResponse(
                item.getId(),
                item.getFeed().getId(),
                item.getFeed().getTitle(),
                item.getFeed().getUrl(),
                item.getTitle(),
                item.getContent(),
                item.getPublishedAt(),
                item.isRead(),
                item.getGuid(),
                item.getCreatedAt()
        );
    }
}
