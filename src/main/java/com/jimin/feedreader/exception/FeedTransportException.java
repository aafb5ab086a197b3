package com.jimin.feedreader.exception;

/**
 * FeedTransportException - 피드 fetch 중 전송 계층 실패
 *
 * timeout, 연결 실패, 리다이렉트 초과, 2xx 외 상태 코드.
 * 나중에 재시도하면 복구될 수 있는 실패이므로 프로세스를 멈추지 않고 결과로 보고됨
 */
public class FeedTransportException extends RuntimeException {

    private final TransportErrorType type;
    private final String url;

    // HTTP_ERROR일 때만 의미 있음
    private final Integer status;

    public FeedTransportException(TransportErrorType type, String url, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.url = url;
        this.status = null;
    }

    private FeedTransportException(String url, int status) {
        super("HTTP " + status + ": " + url);
        this.type = TransportErrorType.HTTP_ERROR;
        this.url = url;
        this.status = status;
    }

    public static FeedTransportException httpError(String url, int status) {
        return new FeedTransportException(url, status);
    }

    public TransportErrorType getType() {
        return type;
    }

    public String getUrl() {
        return url;
    }

    public Integer getStatus() {
        return status;
    }

    /**
     * 결과에 노출할 분류 문자열 (예: "timeout", "http-error(404)")
     */
    public String getReason() {
        if (type == TransportErrorType.HTTP_ERROR && status != null) {
            return type.getLabel() + "(" + status + ")";
        }
        return type.getLabel();
    }
}
