package com.ryuqq.reskit.core.outcome;

import com.ryuqq.reskit.core.model.ResourceKey;

/**
 * 로드 실패.
 *
 * <p>엔진은 실패한 로드를 재시도하지 않습니다. 재시도 여부는 호출자가 결정합니다.</p>
 *
 * @param key 리소스 키
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public record Failure(ResourceKey key, ErrorCode errorCode, String message) implements LoadResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key, errorCode 또는 message가 null인 경우
     */
    public Failure {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Failure 생성.
     *
     * @param key 리소스 키
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @return Failure 인스턴스
     */
    public static Failure of(ResourceKey key, ErrorCode errorCode, String message) {
        return new Failure(key, errorCode, message);
    }
}
