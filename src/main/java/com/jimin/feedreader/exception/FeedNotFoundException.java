package com.jimin.feedreader.exception;

/**
 * FeedNotFoundException - 피드를 찾을 수 없을 때 발생하는 예외
 *
 * API 계층에서는 404로 매핑
 */
public class FeedNotFoundException extends RuntimeException {

    private final Long feedId;

    /**
     * @param feedId 찾지 못한 피드 ID
     */
    public FeedNotFoundException(Long feedId) {
        super("피드를 찾을 수 없습니다. ID: " + feedId);
        this.feedId = feedId;
    }

    public Long getFeedId() {
        return feedId;
    }
}
