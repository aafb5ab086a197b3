package com.jimin.feedreader.service;

import com.jimin.feedreader.config.FeedFetchProperties;
import com.jimin.feedreader.dto.FeedItemFilter;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedServiceTest {

    private static final String URL = "https://example.com/rss";

    @Mock FeedRepository feedRepository;
    @Mock FeedItemRepository itemRepository;
    @Mock FeedValidator feedValidator;
    @Mock FeedSyncService syncService;

    FeedService feedService;

    @BeforeEach
    void setUp() {
        FeedFetchProperties properties = new FeedFetchProperties();
        properties.setMaxConcurrentSyncs(2);
        feedService = new FeedService(feedRepository, itemRepository, feedValidator, syncService, properties);
    }

    private static Feed feed(Long id, String url) {
        Feed feed = new Feed(url);
        feed.setId(id);
        return feed;
    }

    @Test
    void subscribe_alreadySubscribed_throwsDuplicate() {
        when(feedRepository.existsByUrl(URL)).thenReturn(true);

        DuplicateFeedException e = assertThrows(DuplicateFeedException.class,
                () -> feedService.subscribe(" " + URL + " "));

        assertEquals(URL, e.getUrl());
        verifyNoInteractions(feedValidator, syncService);
        verify(feedRepository, never()).save(any(Feed.class));
    }

    @Test
    void subscribe_invalidFeed_throwsWithReasonAndStoresNothing() {
        when(feedRepository.existsByUrl(URL)).thenReturn(false);
        when(feedValidator.validate(URL)).thenReturn(ValidationResult.invalid("http-error(404)"));

        InvalidFeedException e = assertThrows(InvalidFeedException.class, () -> feedService.subscribe(URL));

        assertEquals("http-error(404)", e.getReason());
        verify(feedRepository, never()).save(any(Feed.class));
        verifyNoInteractions(syncService);
    }

    @Test
    void subscribe_emptyUrl_isRejectedByValidator() {
        when(feedValidator.validate(null)).thenReturn(ValidationResult.invalid("URL must not be empty"));

        InvalidFeedException e = assertThrows(InvalidFeedException.class, () -> feedService.subscribe(null));

        assertEquals("URL must not be empty", e.getReason());
        verifyNoInteractions(feedRepository);
    }

    @Test
    void subscribe_validFeed_storesAndRunsFirstSync() {
        when(feedRepository.existsByUrl(URL)).thenReturn(false);
        when(feedValidator.validate(URL)).thenReturn(ValidationResult.ok());
        when(feedRepository.save(any(Feed.class))).thenAnswer(inv -> {
            Feed saved = inv.getArgument(0);
            saved.setId(7L);
            return saved;
        });
        when(syncService.sync(any(Feed.class))).thenReturn(SyncResult.done(3, null, List.of()));
        when(itemRepository.countByFeedId(7L)).thenReturn(3L);
        when(itemRepository.countByFeedIdAndReadFalse(7L)).thenReturn(3L);

        FeedResponse response = feedService.subscribe(URL);

        assertEquals(7L, response.id());
        assertEquals(URL, response.url());
        assertEquals(3L, response.itemCount());
        assertEquals(3L, response.unreadCount());
    }

    @Test
    void subscribe_concurrentInsertOfSameUrl_throwsDuplicate() {
        when(feedRepository.existsByUrl(URL)).thenReturn(false);
        when(feedValidator.validate(URL)).thenReturn(ValidationResult.ok());
        when(feedRepository.save(any(Feed.class)))
                .thenThrow(new DataIntegrityViolationException("Duplicate entry for key 'feeds.url'"));

        DuplicateFeedException e = assertThrows(DuplicateFeedException.class, () -> feedService.subscribe(URL));

        assertEquals(URL, e.getUrl());
        verifyNoInteractions(syncService);
    }

    @Test
    void subscribe_firstSyncFailure_stillKeepsSubscription() {
        when(feedRepository.existsByUrl(URL)).thenReturn(false);
        when(feedValidator.validate(URL)).thenReturn(ValidationResult.ok());
        when(feedRepository.save(any(Feed.class))).thenAnswer(inv -> inv.getArgument(0));
        when(syncService.sync(any(Feed.class))).thenReturn(SyncResult.failed("timeout"));

        FeedResponse response = feedService.subscribe(URL);

        assertEquals(URL, response.url());
        assertEquals(0L, response.itemCount());
    }

    @Test
    void refresh_unknownFeed_throwsNotFound() {
        when(feedRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(FeedNotFoundException.class, () -> feedService.refresh(99L));
        verifyNoInteractions(syncService);
    }

    @Test
    void refresh_delegatesToSync() {
        Feed feed = feed(1L, URL);
        SyncResult expected = SyncResult.done(0, null, List.of());
        when(feedRepository.findById(1L)).thenReturn(Optional.of(feed));
        when(syncService.sync(feed)).thenReturn(expected);

        assertSame(expected, feedService.refresh(1L));
    }

    @Test
    void refreshAll_oneFeedThrowing_doesNotAffectOthers() {
        Feed a = feed(1L, "https://a.example.com/rss");
        Feed b = feed(2L, "https://b.example.com/rss");
        Feed c = feed(3L, "https://c.example.com/rss");
        when(feedRepository.findAll()).thenReturn(List.of(a, b, c));
        when(syncService.sync(a)).thenReturn(SyncResult.done(2, null, List.of()));
        when(syncService.sync(b)).thenThrow(new IllegalStateException("boom"));
        when(syncService.sync(c)).thenReturn(SyncResult.failed("timeout"));

        Map<String, SyncResult> results = feedService.refreshAll();

        assertEquals(List.of(a.getUrl(), b.getUrl(), c.getUrl()), List.copyOf(results.keySet()));
        assertEquals(2, results.get(a.getUrl()).newItemCount());
        assertEquals("sync error: boom", results.get(b.getUrl()).error());
        assertEquals("timeout", results.get(c.getUrl()).error());
    }

    @Test
    void refreshAll_noFeeds_returnsEmpty() {
        when(feedRepository.findAll()).thenReturn(List.of());

        assertTrue(feedService.refreshAll().isEmpty());
        verifyNoInteractions(syncService);
    }

    @Test
    void markAllRead_unknownFeed_throwsNotFound() {
        when(feedRepository.findById(5L)).thenReturn(Optional.empty());

        assertThrows(FeedNotFoundException.class, () -> feedService.markAllRead(5L));
        verify(itemRepository, never()).markAllReadByFeedId(any());
    }

    @Test
    void markAllRead_returnsUpdatedCount() {
        when(feedRepository.findById(1L)).thenReturn(Optional.of(feed(1L, URL)));
        when(itemRepository.markAllReadByFeedId(1L)).thenReturn(4);

        assertEquals(4, feedService.markAllRead(1L));
    }

    @Test
    void markAllRead_withFilter_passesNormalizedConditions() {
        LocalDateTime before = LocalDateTime.of(2024, 6, 1, 0, 0);
        when(itemRepository.markAllReadMatching(null, "spring", before)).thenReturn(2);

        int updated = feedService.markAllRead(new FeedItemFilter(null, false, "  spring ", before));

        assertEquals(2, updated);
    }

    @Test
    void markRead_unknownItem_throwsNotFound() {
        when(itemRepository.findById(42L)).thenReturn(Optional.empty());

        assertThrows(FeedItemNotFoundException.class, () -> feedService.markRead(42L, true));
    }

    @Test
    void markRead_updatesFlag() {
        FeedItem item = new FeedItem();
        item.setId(10L);
        item.setFeed(feed(1L, URL));
        item.setGuid("a");
        when(itemRepository.findById(10L)).thenReturn(Optional.of(item));
        when(itemRepository.save(item)).thenReturn(item);

        assertTrue(feedService.markRead(10L, true).read());
        assertTrue(item.isRead());
    }

    @Test
    void deleteFeed_unknownFeed_throwsNotFound() {
        when(feedRepository.findById(3L)).thenReturn(Optional.empty());

        assertThrows(FeedNotFoundException.class, () -> feedService.deleteFeed(3L));
        verify(feedRepository, never()).delete(any(Feed.class));
    }
}
