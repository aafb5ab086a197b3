package com.jimin.feedreader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * FeedReaderApplication - RSS/Atom 피드 수집 애플리케이션
 *
 * Features:
 * - Feed URL 검증 (형식 + 실제 fetch/parse)
 * - Fetch-and-Sync (중복 제거 후 신규 항목만 저장)
 * - 읽음 처리 (피드 단위 / 필터 단위 일괄 업데이트)
 *
 * Note: 스케줄링은 하지 않음. 언제 sync를 호출할지는 외부(호출자)가 결정
 */
@SpringBootApplication
public class FeedReaderApplication {

	public static void main(String[] args) {
		SpringApplication.run(FeedReaderApplication.class, args);
	}

}
