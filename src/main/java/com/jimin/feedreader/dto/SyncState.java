package com.jimin.feedreader.dto;

/**
 * sync 1회의 진행 상태
 *
 * FETCHING → PARSED → (FAILED | EXTRACTING → DEDUPING → PERSISTING → DONE)
 * FAILED, DONE만 종료 상태
 */
public enum SyncState {
    FETCHING,
    PARSED,
    FAILED,
    EXTRACTING,
    DEDUPING,
    PERSISTING,
    DONE
}
