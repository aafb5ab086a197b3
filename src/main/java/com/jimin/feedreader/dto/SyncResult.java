package com.jimin.feedreader.dto;

import java.util.List;

/**
 * Fetch-and-Sync 결과
 *
 * "신규 없음"(newItemCount=0, error=null)과 "fetch 실패"(newItemCount=0, error 있음)를 구분함
 *
 * @param state        종료 상태 (DONE / FAILED)
 * @param newItemCount 실제로 저장된 항목 수
 * @param error        피드 단위 오류 (없으면 null)
 * @param skipped      저장하지 않은 항목과 사유
 */
public record SyncResult(
        SyncState state,
        int newItemCount,
        String error,
        List<EntrySkip> skipped
) {
    public SyncResult {
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public static SyncResult failed(String error) {
        return new SyncResult(SyncState.FAILED, 0, error, List.of());
    }

    public static SyncResult done(int newItemCount, String error, List<EntrySkip> skipped) {
        return new SyncResult(SyncState.DONE, newItemCount, error, skipped);
    }

    public boolean hasError() {
        return error != null;
    }

    public List<EntrySkip> skippedFor(SkipReason reason) {
        return skipped.stream()
                .filter(skip -> skip.reason() == reason)
                .toList();
    }
}
