package com.jimin.feedreader.exception;

public class FeedItemNotFoundException extends RuntimeException {

    private final Long itemId;

    public FeedItemNotFoundException(Long itemId) {
        super("피드 항목을 찾을 수 없습니다. ID: " + itemId);
        this.itemId = itemId;
    }

    public Long getItemId() {
        return itemId;
    }
}
