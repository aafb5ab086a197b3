package com.jimin.feedreader.exception;

/**
 * 전송 계층 실패 분류
 *
 * label은 validate/sync 결과의 reason 문자열로 그대로 노출됨
 */
public enum TransportErrorType {

    TIMEOUT("timeout"),
    CONNECTION_ERROR("connection-error"),
    TOO_MANY_REDIRECTS("too-many-redirects"),
    HTTP_ERROR("http-error");

    private final String label;

    TransportErrorType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
