package com.jimin.feedreader.exception;

/**
 * InvalidFeedException - 구독 요청한 URL이 피드로 검증되지 않을 때 발생
 *
 * API 계층에서는 400 Bad Request로 매핑
 */
public class InvalidFeedException extends RuntimeException {

    private final String url;
    private final String reason;

    /**
     * @param url    검증에 실패한 URL
     * @param reason 실패 사유 (예: "timeout", "not a recognizable feed")
     */
    public InvalidFeedException(String url, String reason) {
        super("유효한 피드가 아닙니다: " + url + " (" + reason + ")");
        this.url = url;
        this.reason = reason;
    }

    public String getUrl() {
        return url;
    }

    public String getReason() {
        return reason;
    }
}
