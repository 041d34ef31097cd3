package com.ryuqq.reskit.core.statemachine;

/**
 * 번들 노드의 생명주기 상태.
 *
 * <pre>
 * UNLOADED ──► LOADING ──► READY ──► UNLOADING ──► UNLOADED
 *                 │
 *                 └──► UNLOADED (로드 실패)
 * </pre>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public enum BundleState {

    /**
     * 로드되지 않음.
     */
    UNLOADED,

    /**
     * 로드 중.
     */
    LOADING,

    /**
     * 로드 완료.
     */
    READY,

    /**
     * 해제 중.
     */
    UNLOADING
}
