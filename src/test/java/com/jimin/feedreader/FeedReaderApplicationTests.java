package com.jimin.feedreader;

import com.jimin.feedreader.client.FeedHttpClient;
import com.jimin.feedreader.service.FeedService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.net.http.HttpClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

// Why: CI 환경에서 MySQL 없이 H2 In-Memory DB로 테스트
//      application-test.properties 사용 (src/test/resources/)
@SpringBootTest
@ActiveProfiles("test")
class FeedReaderApplicationTests {

	@Autowired
	FeedHttpClient feedHttpClient;

	@Autowired
	HttpClient feedJdkHttpClient;

	@Autowired
	FeedService feedService;

	@Test
	void contextLoads() {
		assertNotNull(feedHttpClient);
		assertNotNull(feedService);
	}

	@Test
	void jdkHttpClient_doesNotFollowRedirects() {
		assertEquals(HttpClient.Redirect.NEVER, feedJdkHttpClient.followRedirects());
		assertTrue(feedJdkHttpClient.connectTimeout().isPresent());
	}

}
