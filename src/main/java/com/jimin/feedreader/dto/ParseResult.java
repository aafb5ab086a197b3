package com.jimin.feedreader.dto;

import com.jimin.feedreader.exception.FeedTransportException;
import com.jimin.feedreader.exception.TransportErrorType;

import java.util.List;

/**
 * FeedParser 결과
 *
 * @param status         CLEAN / TOLERATED / FAILED
 * @param title          피드 제목 (없으면 null)
 * @param entries        원문 순서 그대로의 항목 목록
 * @param diagnostic     TOLERATED/FAILED일 때 사유
 * @param transportError fetch 단계에서 실패했을 때만 값이 있음
 */
public record ParseResult(
        ParseStatus status,
        String title,
        List<RawEntry> entries,
        String diagnostic,
        TransportErrorType transportError
) {
    public ParseResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static ParseResult clean(String title, List<RawEntry> entries) {
        return new ParseResult(ParseStatus.CLEAN, title, entries, null, null);
    }

    public static ParseResult tolerated(String title, List<RawEntry> entries, String diagnostic) {
        return new ParseResult(ParseStatus.TOLERATED, title, entries, diagnostic, null);
    }

    public static ParseResult failed(String diagnostic) {
        return new ParseResult(ParseStatus.FAILED, null, List.of(), diagnostic, null);
    }

    public static ParseResult transportFailed(FeedTransportException e) {
        return new ParseResult(ParseStatus.FAILED, null, List.of(), e.getReason(), e.getType());
    }

    /**
     * XML 오류가 있었는지 (TOLERATED 또는 FAILED)
     */
    public boolean isMalformed() {
        return status != ParseStatus.CLEAN;
    }

    public boolean isFailed() {
        return status == ParseStatus.FAILED;
    }

    /**
     * 피드로 쓸 수 있는 내용이 있는지 (제목 또는 항목 1개 이상)
     */
    public boolean hasUsableContent() {
        return (title != null && !title.isBlank()) || !entries.isEmpty();
    }
}
