package com.jimin.feedreader.service;

import com.jimin.feedreader.dto.EntrySkip;
import com.jimin.feedreader.dto.ExtractedItem;
import com.jimin.feedreader.dto.ParseResult;
import com.jimin.feedreader.dto.RawEntry;
import com.jimin.feedreader.dto.SkipReason;
import com.jimin.feedreader.dto.SyncResult;
import com.jimin.feedreader.dto.SyncState;
import com.jimin.feedreader.entity.Feed;
import com.jimin.feedreader.entity.FeedItem;
import com.jimin.feedreader.repository.FeedItemRepository;
import com.jimin.feedreader.repository.FeedRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fetch-and-Sync Service
 *
 * 동작 방식:
 * 1. 피드 URL을 fetch + 파싱 (FETCHING → PARSED)
 * 2. 실패했거나 제목/항목이 모두 없으면 DB를 건드리지 않고 종료 (FAILED)
 * 3. 피드 제목이 비어 있으면 파싱한 제목으로 채움
 * 4. 항목마다 필드 추출 → guid 없으면 skip → 같은 fetch 안 중복 skip → 이미 저장된 항목 skip
 * 5. 남은 항목을 1건씩 저장 (UNIQUE 제약 위반은 "이미 있음"으로 보고 계속 진행)
 * 6. 1건 이상 저장했으면 lastFetchedAt 갱신 (DONE)
 *
 * 같은 피드를 다시 sync해도 새 항목이 없으면 (0, 오류 없음). 중복 저장 없음.
 * 클래스 단위 트랜잭션 없음: 각 쓰기는 독립적으로 커밋되므로 중간에 중단돼도 일관성 유지
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedSyncService {

    public static final String NO_ENTRIES = "no entries found";

    private final FeedParser feedParser;
    private final FieldExtractor fieldExtractor;
    private final FeedRepository feedRepository;
    private final FeedItemRepository itemRepository;
    private final Clock clock;

    /**
     * 피드 1개 sync
     *
     * @return 신규 저장 수와 피드 단위 오류 (예외를 던지지 않음)
     */
    public SyncResult sync(Feed feed) {
        String url = feed.getUrl();
        log.info("sync 시작: {}", url);

        try {
            enter(url, SyncState.FETCHING);
            ParseResult parsed = feedParser.parse(url);
            enter(url, SyncState.PARSED);

            if (parsed.isFailed() || !parsed.hasUsableContent()) {
                String error = parsed.isFailed() ? parsed.diagnostic() : FeedValidator.NOT_A_FEED;
                enter(url, SyncState.FAILED);
                log.warn("sync 실패: {} - {}", url, error);
                return SyncResult.failed(error);
            }
            if (parsed.isMalformed()) {
                log.warn("깨진 피드지만 내용이 있어 계속 진행: {} - {}", url, parsed.diagnostic());
            }

            fillTitle(feed, parsed.title());

            if (parsed.entries().isEmpty()) {
                enter(url, SyncState.DONE);
                log.info("sync 완료: {} - 항목 없음", url);
                return SyncResult.done(0, NO_ENTRIES, List.of());
            }

            List<EntrySkip> skipped = new ArrayList<>();
            List<Candidate> candidates = extract(url, parsed.entries(), skipped);
            List<Candidate> fresh = dedupe(feed, candidates, skipped);

            enter(url, SyncState.PERSISTING);
            int created = persist(feed, fresh, skipped);

            if (created > 0) {
                feed.setLastFetchedAt(LocalDateTime.now(clock));
                feedRepository.save(feed);
            }

            enter(url, SyncState.DONE);
            log.info("sync 완료: {} - 항목 {}개 중 {}건 신규 저장, {}건 skip",
                    url, parsed.entries().size(), created, skipped.size());
            return SyncResult.done(created, null, skipped);

        } catch (DataAccessException e) {
            log.error("sync 중 DB 오류: {}", url, e);
            return SyncResult.failed("store error: " + e.getMostSpecificCause().getMessage());
        }
    }

    private void fillTitle(Feed feed, String parsedTitle) {
        if (feed.getTitle() != null || parsedTitle == null || parsedTitle.isBlank()) {
            return;
        }
        feed.setTitle(abbreviate(parsedTitle.trim(), Feed.TITLE_MAX_LENGTH));
        feedRepository.save(feed);
        log.info("피드 제목 설정: {} → {}", feed.getUrl(), feed.getTitle());
    }

    /**
     * EXTRACTING: 항목마다 필드 추출. 실패하거나 guid가 없는 항목은 skip
     */
    private List<Candidate> extract(String url, List<RawEntry> entries, List<EntrySkip> skipped) {
        enter(url, SyncState.EXTRACTING);
        List<Candidate> candidates = new ArrayList<>(entries.size());

        for (int position = 0; position < entries.size(); position++) {
            ExtractedItem extracted;
            try {
                extracted = fieldExtractor.extract(entries.get(position));
            } catch (RuntimeException e) {
                log.warn("항목 {} 필드 추출 실패, skip: {} - {}", position, url, e.toString());
                skipped.add(new EntrySkip(position, null, SkipReason.EXTRACTION_FAILED, e.getMessage()));
                continue;
            }

            String guid = extracted.guid();
            if (guid == null) {
                log.warn("guid 없는 항목 skip: {} - '{}'", url, extracted.title());
                skipped.add(new EntrySkip(position, null, SkipReason.MISSING_GUID, extracted.title()));
                continue;
            }
            if (guid.length() > FeedItem.GUID_MAX_LENGTH) {
                log.warn("guid가 너무 긴 항목 skip: {} ({}자)", url, guid.length());
                skipped.add(new EntrySkip(position, guid, SkipReason.INVALID_GUID,
                        "guid longer than " + FeedItem.GUID_MAX_LENGTH));
                continue;
            }
            candidates.add(new Candidate(position, extracted));
        }
        return candidates;
    }

    /**
     * DEDUPING: 같은 fetch 안 중복(먼저 나온 항목 사용)과 이미 저장된 항목을 걸러냄
     */
    private List<Candidate> dedupe(Feed feed, List<Candidate> candidates, List<EntrySkip> skipped) {
        enter(feed.getUrl(), SyncState.DEDUPING);
        List<Candidate> fresh = new ArrayList<>();
        Set<String> seenGuids = new HashSet<>();

        for (Candidate candidate : candidates) {
            String guid = candidate.item().guid();
            if (!seenGuids.add(guid)) {
                skipped.add(new EntrySkip(candidate.position(), guid, SkipReason.DUPLICATE_IN_FETCH, null));
                continue;
            }
            if (itemRepository.existsByFeedAndGuid(feed, guid)) {
                skipped.add(new EntrySkip(candidate.position(), guid, SkipReason.ALREADY_EXISTS, null));
                continue;
            }
            fresh.add(candidate);
        }
        return fresh;
    }

    /**
     * 1건씩 저장. 한 건 실패가 나머지 저장을 막지 않음
     *
     * @return 실제 저장된 수
     */
    private int persist(Feed feed, List<Candidate> fresh, List<EntrySkip> skipped) {
        int created = 0;
        for (Candidate candidate : fresh) {
            FeedItem item = toEntity(feed, candidate.item());
            try {
                itemRepository.saveAndFlush(item);
                created++;
            } catch (DataIntegrityViolationException e) {
                // 동시에 실행된 sync가 먼저 저장함
                log.info("이미 저장된 항목 (UNIQUE 제약): guid={}", item.getGuid());
                skipped.add(new EntrySkip(candidate.position(), item.getGuid(), SkipReason.PERSIST_CONFLICT, null));
            } catch (DataAccessException e) {
                log.error("항목 저장 실패: guid={}", item.getGuid(), e);
                skipped.add(new EntrySkip(candidate.position(), item.getGuid(), SkipReason.PERSIST_FAILED,
                        e.getMostSpecificCause().getMessage()));
            }
        }
        return created;
    }

    private FeedItem toEntity(Feed feed, ExtractedItem extracted) {
        FeedItem item = new FeedItem();
        item.setFeed(feed);
        item.setGuid(extracted.guid());
        item.setTitle(abbreviate(extracted.title(), FeedItem.TITLE_MAX_LENGTH));
        item.setContent(extracted.content());
        // Why: 날짜 없는 항목도 정렬/표시가 가능하도록 수집 시각으로 대체
        item.setPublishedAt(extracted.publishedAt() != null ? extracted.publishedAt() : LocalDateTime.now(clock));
        item.setRead(false);
        return item;
    }

    private void enter(String url, SyncState state) {
        log.debug("[{}] {}", url, state);
    }

    private static String abbreviate(String s, int max) {
        if (s.length() <= max) return s;
        return s.substring(0, Math.max(0, max - 1)) + "…";
    }

    private record Candidate(int position, ExtractedItem item) {
    }
}
