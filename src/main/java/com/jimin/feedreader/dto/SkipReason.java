package com.jimin.feedreader.dto;

/**
 * sync 중 항목을 저장하지 않은 이유
 *
 * 모두 항목 단위 skip이며 sync 전체 오류가 아님
 */
public enum SkipReason {
    // id, link 모두 없음 → 중복 체크 불가
    MISSING_GUID,
    // guid가 컬럼 길이를 넘음
    INVALID_GUID,
    EXTRACTION_FAILED,
    // 같은 fetch 안에서 guid 중복 (먼저 나온 항목 사용)
    DUPLICATE_IN_FETCH,
    ALREADY_EXISTS,
    // 저장 시 UNIQUE 제약 위반 (동시 sync 경쟁)
    PERSIST_CONFLICT,
    PERSIST_FAILED
}
