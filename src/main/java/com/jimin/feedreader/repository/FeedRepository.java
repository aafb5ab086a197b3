package com.jimin.feedreader.repository;

import com.jimin.feedreader.entity.Feed;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface FeedRepository extends JpaRepository<Feed, Long> {

    Optional<Feed> findByUrl(String url);

    // Why: 구독 요청 시 같은 URL 중복 방지
    boolean existsByUrl(String url);

    // 최근 수집된 피드 먼저, 한 번도 수집 안 된 피드는 뒤로
    List<Feed> findAllByOrderByLastFetchedAtDescAddedAtDesc();
}
