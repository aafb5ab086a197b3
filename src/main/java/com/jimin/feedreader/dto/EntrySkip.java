package com.jimin.feedreader.dto;

/**
 * 저장하지 않은 항목 1개
 *
 * @param position 피드 원문에서의 위치 (0부터)
 * @param guid     결정된 guid (없으면 null)
 * @param reason   skip 사유
 * @param detail   부가 설명 (예외 메시지 등, 없으면 null)
 */
public record EntrySkip(int position, String guid, SkipReason reason, String detail) {
}
