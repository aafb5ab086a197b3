package com.jimin.feedreader.dto;

/**
 * URL 검증 결과
 *
 * @param valid  피드로 사용 가능하면 true
 * @param reason 실패 사유 (valid면 null)
 */
public record ValidationResult(boolean valid, String reason) {

    public static ValidationResult ok() {
        return new ValidationResult(true, null);
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, reason);
    }
}
