package com.jimin.feedreader.dto;

import java.time.LocalDateTime;

/**
 * RawEntry에서 뽑아낸 정규화된 항목 필드
 *
 * @param guid        id → link 순으로 결정 (둘 다 없으면 null: 중복 체크 불가, 저장하지 않음)
 * @param title       제목 (없으면 "Untitled")
 * @param content     본문 (없으면 빈 문자열)
 * @param publishedAt 발행 시각 (어떤 날짜도 해석 못하면 null)
 * @param link        원문 링크 (없으면 null)
 * @param author      작성자 (없으면 null)
 */
public record ExtractedItem(
        String guid,
        String title,
        String content,
        LocalDateTime publishedAt,
        String link,
        String author
) {
    public boolean hasGuid() {
        return guid != null;
    }
}
