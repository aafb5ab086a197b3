package com.jimin.feedreader.repository;

import com.jimin.feedreader.entity.Feed;
import com.jimin.feedreader.entity.FeedItem;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

public interface FeedItemRepository extends JpaRepository<FeedItem, Long> {

    // Why: sync 시 (feed, guid) 중복 체크. 최종 보장은 UNIQUE 제약
    boolean existsByFeedAndGuid(Feed feed, String guid);

    long countByFeedId(Long feedId);

    long countByFeedIdAndReadFalse(Long feedId);

    /**
     * 조건별 항목 조회 (null 조건은 무시)
     */
    @Query(value = "select i from FeedItem i join fetch i.feed f"
            + " where (:feedId is null or f.id = :feedId)"
            + " and (:read is null or i.read = :read)"
            + " and (:keyword is null or lower(i.title) like lower(concat('%', :keyword, '%')))"
            + " order by i.publishedAt desc, i.id desc",
            countQuery = "select count(i) from FeedItem i"
                    + " where (:feedId is null or i.feed.id = :feedId)"
                    + " and (:read is null or i.read = :read)"
                    + " and (:keyword is null or lower(i.title) like lower(concat('%', :keyword, '%')))")
    Page<FeedItem> search(@Param("feedId") Long feedId,
                          @Param("read") Boolean read,
                          @Param("keyword") String keyword,
                          Pageable pageable);

    /**
     * 피드의 안 읽은 항목을 모두 읽음 처리
     * is_read 외의 컬럼(guid, feed, created_at)은 건드리지 않음
     *
     * @return 업데이트된 행 수
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update FeedItem i set i.read = true where i.read = false and i.feed.id = :feedId")
    int markAllReadByFeedId(@Param("feedId") Long feedId);

    /**
     * 조건에 맞는 안 읽은 항목을 모두 읽음 처리 (null 조건은 무시)
     *
     * @return 업데이트된 행 수
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update FeedItem i set i.read = true where i.read = false"
            + " and (:feedId is null or i.feed.id = :feedId)"
            + " and (:keyword is null or lower(i.title) like lower(concat('%', :keyword, '%')))"
            + " and (:publishedBefore is null or i.publishedAt < :publishedBefore)")
    int markAllReadMatching(@Param("feedId") Long feedId,
                            @Param("keyword") String keyword,
                            @Param("publishedBefore") LocalDateTime publishedBefore);
}
