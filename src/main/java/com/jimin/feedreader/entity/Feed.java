package com.jimin.feedreader.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Feed Entity - 구독 중인 RSS/Atom 피드
 *
 * DB 테이블: feeds
 * 역할: "어떤 URL에서 항목을 수집할 것인가?"
 * 관계: Feed 1:N FeedItem (피드 삭제 시 항목도 함께 삭제, DB cascade)
 */
@Entity
@Table(name = "feeds", indexes = {
        @Index(name = "idx_feeds_url", columnList = "url"),
        @Index(name = "idx_feeds_last_fetched_at", columnList = "last_fetched_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Feed {

    public static final int TITLE_MAX_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Why: 피드 식별자. 생성 후 변경 불가 (updatable = false)
    @Column(nullable = false, length = 500, unique = true, updatable = false)
    private String url;

    // 첫 fetch 성공 시 피드 제목으로 채워짐 (없으면 null)
    @Column(length = TITLE_MAX_LENGTH)
    private String title;

    // 마지막으로 신규 항목을 저장한 시각 (첫 sync 전에는 null)
    @Column(name = "last_fetched_at")
    private LocalDateTime lastFetchedAt;

    @Column(name = "added_at", nullable = false, updatable = false)
    private LocalDateTime addedAt;

    public Feed(String url) {
        this.url = url;
    }

    @PrePersist
    protected void onCreate() {
        addedAt = LocalDateTime.now();
    }
}
