package com.ryuqq.reskit.core.outcome;

/**
 * {@link Failure}의 오류 코드.
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 백엔드가 예외를 던지거나 예외로 완료된 future를 반환함.
     */
    BACKEND_FAILURE,

    /**
     * 동기 번들 로드가 진행 중인 비동기 로드와 충돌함. 비동기로 재시도 가능.
     */
    CONCURRENCY_CONFLICT,

    /**
     * 동기 조회를 지원하지 않는 백엔드에 동기 로드를 요청함.
     */
    SYNC_UNSUPPORTED
}
