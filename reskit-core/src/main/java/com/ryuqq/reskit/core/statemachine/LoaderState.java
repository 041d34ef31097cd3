package com.ryuqq.reskit.core.statemachine;

/**
 * 풀링된 로더의 상태.
 *
 * <pre>
 * POOLED ◄──► ACTIVE
 * </pre>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public enum LoaderState {

    /**
     * 풀에 반납됨. 사용 불가.
     */
    POOLED,

    /**
     * 할당되어 사용 중.
     */
    ACTIVE
}
