package com.jimin.feedreader.service;

import com.jimin.feedreader.config.FeedFetchProperties;
import com.jimin.feedreader.dto.FeedItemFilter;
import com.jimin.feedreader.dto.FeedItemResponse;
import com.jimin.feedreader.dto.FeedResponse;
import com.jimin.feedreader.dto.SyncResult;
import com.jimin.feedreader.dto.ValidationResult;
import com.jimin.feedreader.entity.Feed;
import com.jimin.feedreader.entity.FeedItem;
import com.jimin.feedreader.exception.DuplicateFeedException;
import com.jimin.feedreader.exception.FeedItemNotFoundException;
import com.jimin.feedreader.exception.FeedNotFoundException;
import com.jimin.feedreader.exception.InvalidFeedException;
import com.jimin.feedreader.repository.FeedItemRepository;
import com.jimin.feedreader.repository.FeedRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 피드 구독/조회/읽음 처리 Service
 *
 * 역할: 외부 호출자(API 계층 등)가 사용하는 진입점
 * 수집 자체는 FeedValidator, FeedSyncService가 담당
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedService {

    private final FeedRepository feedRepository;
    private final FeedItemRepository itemRepository;
    private final FeedValidator feedValidator;
    private final FeedSyncService syncService;
    private final FeedFetchProperties properties;

    /**
     * 피드 구독: 검증 → 저장 → 첫 sync
     *
     * @throws DuplicateFeedException 이미 등록된 URL
     * @throws InvalidFeedException   URL 형식 오류, fetch 실패, 피드가 아님
     */
    public FeedResponse subscribe(String url) {
        String normalized = url == null ? null : url.trim();
        if (normalized != null && feedRepository.existsByUrl(normalized)) {
            throw new DuplicateFeedException(normalized);
        }

        ValidationResult validation = feedValidator.validate(normalized);
        if (!validation.valid()) {
            throw new InvalidFeedException(normalized, validation.reason());
        }

        Feed feed;
        try {
            feed = feedRepository.save(new Feed(normalized));
        } catch (DataIntegrityViolationException e) {
            // 검증 중에 같은 URL이 먼저 등록됨 (url UNIQUE 제약)
            throw new DuplicateFeedException(normalized);
        }
        log.info("피드 등록: {} (ID: {})", feed.getUrl(), feed.getId());

        // 첫 sync 실패는 구독 자체를 막지 않음 (refresh로 다시 시도)
        SyncResult result = syncService.sync(feed);
        if (result.hasError()) {
            log.warn("첫 sync 결과: {} - {}", feed.getUrl(), result.error());
        }
        return toResponse(feed);
    }

    /**
     * 피드 1개 수동 새로고침
     */
    public SyncResult refresh(Long feedId) {
        Feed feed = getFeedEntity(feedId);
        return syncService.sync(feed);
    }

    /**
     * 모든 피드 새로고침
     * 동시 실행 수는 feeds.fetch.max-concurrent-syncs로 제한, 피드끼리 서로 영향 없음
     *
     * @return 피드 URL별 결과
     */
    public Map<String, SyncResult> refreshAll() {
        List<Feed> feeds = feedRepository.findAll();
        log.info("전체 피드 새로고침 시작: {} 개", feeds.size());

        Map<String, SyncResult> results = new LinkedHashMap<>();
        if (feeds.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(properties.getMaxConcurrentSyncs(), feeds.size()));
        try {
            List<Future<SyncResult>> futures = new ArrayList<>(feeds.size());
            for (Feed feed : feeds) {
                futures.add(executor.submit(() -> syncService.sync(feed)));
            }
            for (int i = 0; i < feeds.size(); i++) {
                results.put(feeds.get(i).getUrl(), await(feeds.get(i), futures.get(i)));
            }
        } finally {
            executor.shutdownNow();
        }

        int totalNew = results.values().stream().mapToInt(SyncResult::newItemCount).sum();
        long failed = results.values().stream().filter(SyncResult::hasError).count();
        log.info("전체 피드 새로고침 완료: 총 {} 건 신규 저장, {} 개 피드 오류", totalNew, failed);
        return results;
    }

    private SyncResult await(Feed feed, Future<SyncResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SyncResult.failed("interrupted");
        } catch (ExecutionException e) {
            log.error("sync 실패: {}", feed.getUrl(), e.getCause());
            return SyncResult.failed("sync error: " + e.getCause().getMessage());
        }
    }

    @Transactional(readOnly = true)
    public List<FeedResponse> getFeeds() {
        return feedRepository.findAllByOrderByLastFetchedAtDescAddedAtDesc()
                .stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public FeedResponse getFeed(Long feedId) {
        return toResponse(getFeedEntity(feedId));
    }

    /**
     * 항목 조회 (최신 발행순)
     */
    @Transactional(readOnly = true)
    public Page<FeedItemResponse> getItems(FeedItemFilter filter, Pageable pageable) {
        return itemRepository.search(filter.feedId(), filter.read(), filter.normalizedKeyword(), pageable)
                .map(FeedItemResponse::from);
    }

    /**
     * 피드의 안 읽은 항목 전체 읽음 처리
     *
     * @return 읽음 처리된 항목 수
     */
    public int markAllRead(Long feedId) {
        getFeedEntity(feedId);
        int updated = itemRepository.markAllReadByFeedId(feedId);
        log.info("피드 {} 항목 {}건 읽음 처리", feedId, updated);
        return updated;
    }

    /**
     * 조건에 맞는 안 읽은 항목 전체 읽음 처리 (read 조건은 무시)
     *
     * @return 읽음 처리된 항목 수
     */
    public int markAllRead(FeedItemFilter filter) {
        int updated = itemRepository.markAllReadMatching(
                filter.feedId(), filter.normalizedKeyword(), filter.publishedBefore());
        log.info("조건 {} 에 맞는 항목 {}건 읽음 처리", filter, updated);
        return updated;
    }

    /**
     * 항목 1개 읽음/안읽음 설정
     */
    @Transactional
    public FeedItemResponse markRead(Long itemId, boolean read) {
        FeedItem item = itemRepository.findById(itemId)
                .orElseThrow(() -> new FeedItemNotFoundException(itemId));
        item.setRead(read);
        return FeedItemResponse.from(itemRepository.save(item));
    }

    /**
     * 피드 삭제 (항목은 DB cascade로 함께 삭제)
     */
    @Transactional
    public void deleteFeed(Long feedId) {
        Feed feed = getFeedEntity(feedId);
        feedRepository.delete(feed);
        log.info("피드 삭제: {} (ID: {})", feed.getUrl(), feedId);
    }

    private Feed getFeedEntity(Long feedId) {
        return feedRepository.findById(feedId)
                .orElseThrow(() -> new FeedNotFoundException(feedId));
    }

    private FeedResponse toResponse(Feed feed) {
        return FeedResponse.from(feed,
                itemRepository.countByFeedId(feed.getId()),
                itemRepository.countByFeedIdAndReadFalse(feed.getId()));
    }
}
