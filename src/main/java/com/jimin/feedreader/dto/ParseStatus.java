package com.jimin.feedreader.dto;

/**
 * 피드 파싱 결과 상태
 *
 * CLEAN     - 문제 없이 파싱됨
 * TOLERATED - XML 오류가 있었지만 복구해서 파싱됨 (diagnostic에 원래 오류)
 * FAILED    - fetch 또는 파싱 실패 (diagnostic에 사유)
 */
public enum ParseStatus {
    CLEAN,
    TOLERATED,
    FAILED
}
