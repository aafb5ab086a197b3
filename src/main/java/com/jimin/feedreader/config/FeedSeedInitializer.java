package com.jimin.feedreader.config;

import com.jimin.feedreader.exception.DuplicateFeedException;
import com.jimin.feedreader.exception.InvalidFeedException;
import com.jimin.feedreader.repository.FeedRepository;
import com.jimin.feedreader.service.FeedService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 기본 구독 피드 초기화
 *
 * feeds.seed-urls 에 적힌 URL을 시작 시 구독함.
 * 배포 시마다 실행되지만 existsByUrl로 중복 구독 방지 (멱등성 보장).
 * 검증에 실패한 URL은 로그만 남기고 나머지 계속 진행
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class FeedSeedInitializer {

    private final FeedRepository feedRepository;
    private final FeedService feedService;

    @Value("${feeds.seed-urls:}")
    private List<String> seedUrls;

    @Bean
    public ApplicationRunner initSeedFeeds() {
        return args -> {
            int added = 0;
            for (String url : seedUrls) {
                if (url == null || url.isBlank() || feedRepository.existsByUrl(url.trim())) {
                    continue;
                }
                try {
                    feedService.subscribe(url);
                    added++;
                } catch (InvalidFeedException e) {
                    log.warn("기본 피드 구독 실패: {} ({})", e.getUrl(), e.getReason());
                } catch (DuplicateFeedException e) {
                    log.info("이미 구독 중인 피드: {}", e.getUrl());
                }
            }

            if (added > 0) {
                log.info("기본 피드 {}개 구독 완료", added);
            } else {
                log.info("기본 피드 초기화 완료 (추가 없음)");
            }
        };
    }
}
