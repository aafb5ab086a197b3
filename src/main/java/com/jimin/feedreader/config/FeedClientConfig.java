package com.jimin.feedreader.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * 피드 수집에 필요한 공용 Bean
 *
 * - HttpClient: 리다이렉트는 FeedHttpClient가 직접 따라감 (횟수 제한 때문에 NEVER)
 * - Clock: "지금" 시각 주입 (lastFetchedAt, 날짜 없는 항목의 publishedAt)
 */
@Configuration
@EnableConfigurationProperties(FeedFetchProperties.class)
public class FeedClientConfig {

    @Bean
    public HttpClient feedJdkHttpClient(FeedFetchProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
