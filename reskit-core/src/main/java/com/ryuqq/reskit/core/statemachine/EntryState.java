package com.ryuqq.reskit.core.statemachine;

/**
 * 캐시 항목의 생명주기 상태.
 *
 * <pre>
 * LOADING ──► READY ──► INVALID
 *    │                    ▲
 *    └────────────────────┘ (로드 실패)
 * </pre>
 *
 * <p>캐시에는 READY 항목만 존재합니다. 로드 중인 리소스는 진행 중 요청 테이블이
 * 나타내므로, 항목은 READY 상태로 생성됩니다. 파괴된 항목은 INVALID가 되어
 * 남아 있는 참조가 이를 알 수 있습니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public enum EntryState {

    /**
     * 로드 중.
     */
    LOADING,

    /**
     * 사용 가능.
     */
    READY,

    /**
     * 파괴됨 (종료 상태).
     */
    INVALID;

    /**
     * 종료 상태인지 확인.
     *
     * @return INVALID인 경우 true
     */
    public boolean isTerminal() {
        return this == INVALID;
    }
}
