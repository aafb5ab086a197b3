package com.jimin.feedreader.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;

/**
 * FeedItem Entity - 피드에서 수집한 개별 항목
 *
 * DB 테이블: feed_items
 * 관계: FeedItem N:1 Feed
 * 식별: (feed_id, guid) UNIQUE. 같은 항목을 다시 fetch해도 중복 저장되지 않음
 */
@Entity
@Table(name = "feed_items",
        uniqueConstraints = @UniqueConstraint(name = "uk_feed_items_feed_guid", columnNames = {"feed_id", "guid"}),
        indexes = {
                @Index(name = "idx_feed_items_feed_guid", columnList = "feed_id, guid"),
                @Index(name = "idx_feed_items_feed_published", columnList = "feed_id, published_at"),
                @Index(name = "idx_feed_items_is_read", columnList = "is_read")
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedItem {

    public static final int TITLE_MAX_LENGTH = 500;
    public static final int GUID_MAX_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Why: 피드 삭제 시 DB 레벨에서 항목도 삭제 (ON DELETE CASCADE)
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "feed_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Feed feed;

    @Column(nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String content;

    // 원문 발행일. 원문에 날짜가 없으면 수집 시각으로 대체
    @Column(name = "published_at", nullable = false)
    private LocalDateTime publishedAt;

    @Column(name = "is_read", nullable = false)
    private boolean read = false;

    // id/guid → link 순으로 결정된 식별자
    @Column(nullable = false, length = GUID_MAX_LENGTH, updatable = false)
    private String guid;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
