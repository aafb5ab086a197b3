package com.jimin.feedreader.repository;

import com.jimin.feedreader.entity.Feed;
import com.jimin.feedreader.entity.FeedItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
class FeedItemRepositoryTest {

    @Autowired FeedRepository feedRepository;
    @Autowired FeedItemRepository itemRepository;
    @Autowired TestEntityManager entityManager;

    Feed tech;
    Feed news;

    @BeforeEach
    void setUp() {
        tech = feedRepository.save(new Feed("https://tech.example.com/rss"));
        news = feedRepository.save(new Feed("https://news.example.com/rss"));
    }

    private FeedItem item(Feed feed, String guid, String title, LocalDateTime publishedAt) {
        FeedItem item = new FeedItem();
        item.setFeed(feed);
        item.setGuid(guid);
        item.setTitle(title);
        item.setContent("");
        item.setPublishedAt(publishedAt);
        return itemRepository.saveAndFlush(item);
    }

    private static LocalDateTime day(int d) {
        return LocalDateTime.of(2024, 1, d, 9, 0);
    }

    @Test
    void saveAndFlush_sameGuidInSameFeed_violatesUniqueConstraint() {
        item(tech, "a", "First", day(1));

        assertThrows(DataIntegrityViolationException.class, () -> item(tech, "a", "Again", day(2)));
    }

    @Test
    void saveAndFlush_sameGuidInDifferentFeeds_isAllowed() {
        item(tech, "shared", "Tech", day(1));
        item(news, "shared", "News", day(1));

        assertEquals(1, itemRepository.countByFeedId(tech.getId()));
        assertEquals(1, itemRepository.countByFeedId(news.getId()));
    }

    @Test
    void existsByFeedAndGuid_isScopedToFeed() {
        item(tech, "a", "First", day(1));

        assertTrue(itemRepository.existsByFeedAndGuid(tech, "a"));
        assertFalse(itemRepository.existsByFeedAndGuid(news, "a"));
        assertFalse(itemRepository.existsByFeedAndGuid(tech, "b"));
    }

    @Test
    void search_ordersByPublishedDateDescending() {
        item(tech, "old", "Old", day(1));
        item(news, "newest", "Newest", day(3));
        item(tech, "middle", "Middle", day(2));

        Page<FeedItem> page = itemRepository.search(null, null, null, PageRequest.of(0, 10));

        assertEquals(List.of("newest", "middle", "old"), page.map(FeedItem::getGuid).getContent());
        assertEquals(3, page.getTotalElements());
    }

    @Test
    void search_appliesFeedReadAndKeywordFilters() {
        item(tech, "a", "Spring Boot 3 released", day(1));
        FeedItem read = item(tech, "b", "Spring Data tips", day(2));
        item(tech, "c", "Kubernetes news", day(3));
        item(news, "d", "Spring weather", day(4));
        read.setRead(true);
        itemRepository.saveAndFlush(read);

        List<String> techOnly = itemRepository.search(tech.getId(), null, null, PageRequest.of(0, 10))
                .map(FeedItem::getGuid).getContent();
        List<String> unreadSpringInTech = itemRepository.search(tech.getId(), false, "spring", PageRequest.of(0, 10))
                .map(FeedItem::getGuid).getContent();
        List<String> readOnly = itemRepository.search(null, true, null, PageRequest.of(0, 10))
                .map(FeedItem::getGuid).getContent();

        assertEquals(List.of("c", "b", "a"), techOnly);
        assertEquals(List.of("a"), unreadSpringInTech);
        assertEquals(List.of("b"), readOnly);
    }

    @Test
    void countByFeedIdAndReadFalse_countsUnreadOnly() {
        item(tech, "a", "A", day(1));
        FeedItem read = item(tech, "b", "B", day(2));
        read.setRead(true);
        itemRepository.saveAndFlush(read);

        assertEquals(2, itemRepository.countByFeedId(tech.getId()));
        assertEquals(1, itemRepository.countByFeedIdAndReadFalse(tech.getId()));
    }

    @Test
    void markAllReadByFeedId_onlyTouchesReadFlagOfThatFeed() {
        Long first = item(tech, "a", "A", day(1)).getId();
        item(tech, "b", "B", day(2));
        Long other = item(news, "c", "C", day(3)).getId();
        entityManager.clear();
        FeedItem before = itemRepository.findById(first).orElseThrow();
        LocalDateTime createdAt = before.getCreatedAt();
        entityManager.clear();

        int updated = itemRepository.markAllReadByFeedId(tech.getId());

        assertEquals(2, updated);
        FeedItem after = itemRepository.findById(first).orElseThrow();
        assertTrue(after.isRead());
        assertEquals("a", after.getGuid());
        assertEquals(createdAt, after.getCreatedAt());
        assertEquals(tech.getId(), after.getFeed().getId());
        assertFalse(itemRepository.findById(other).orElseThrow().isRead());
        assertEquals(0, itemRepository.markAllReadByFeedId(tech.getId()));
    }

    @Test
    void markAllReadMatching_appliesKeywordAndDateConditions() {
        item(tech, "a", "Spring one", day(1));
        item(tech, "b", "Spring two", day(5));
        item(news, "c", "Spring three", day(2));
        item(news, "d", "Other", day(1));

        int updated = itemRepository.markAllReadMatching(null, "spring", day(3));

        assertEquals(2, updated);
        assertEquals(List.of("c", "a"), itemRepository.search(null, true, null, PageRequest.of(0, 10))
                .map(FeedItem::getGuid).getContent());
    }

    @Test
    void deleteFeed_removesItsItems() {
        item(tech, "a", "A", day(1));
        item(tech, "b", "B", day(2));
        item(news, "c", "C", day(3));
        entityManager.clear();

        feedRepository.deleteById(tech.getId());
        entityManager.flush();
        entityManager.clear();

        assertEquals(0, itemRepository.countByFeedId(tech.getId()));
        assertEquals(1, itemRepository.countByFeedId(news.getId()));
        assertTrue(feedRepository.findByUrl("https://news.example.com/rss").isPresent());
        assertFalse(feedRepository.existsByUrl("https://tech.example.com/rss"));
    }
}
