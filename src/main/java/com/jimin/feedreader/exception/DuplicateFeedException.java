package com.jimin.feedreader.exception;

/**
 * DuplicateFeedException - 이미 구독 중인 URL을 다시 구독하려 할 때 발생
 */
public class DuplicateFeedException extends RuntimeException {

    private final String url;

    public DuplicateFeedException(String url) {
        super("이미 등록된 피드입니다: " + url);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
