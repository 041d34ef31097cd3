package com.ryuqq.reskit.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>캐시 항목: LOADING → READY, LOADING → INVALID, READY → INVALID</li>
 *   <li>번들: UNLOADED → LOADING, LOADING → READY, LOADING → UNLOADED,
 *       READY → UNLOADING, UNLOADING → UNLOADED</li>
 *   <li>로더: POOLED → ACTIVE, ACTIVE → POOLED</li>
 * </ul>
 *
 * <p>허용되지 않은 전이는 {@link IllegalStateException}을 발생시킵니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 캐시 항목 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(EntryState from, EntryState to) {
        requireStates(from, to);

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case LOADING -> to == EntryState.READY || to == EntryState.INVALID;
            case READY -> to == EntryState.INVALID;
            case INVALID -> false;
        };
        reject(valid, from, to);
    }

    /**
     * 번들 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(BundleState from, BundleState to) {
        requireStates(from, to);

        boolean valid = switch (from) {
            case UNLOADED -> to == BundleState.LOADING;
            case LOADING -> to == BundleState.READY || to == BundleState.UNLOADED;
            case READY -> to == BundleState.UNLOADING;
            case UNLOADING -> to == BundleState.UNLOADED;
        };
        reject(valid, from, to);
    }

    /**
     * 로더 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(LoaderState from, LoaderState to) {
        requireStates(from, to);
        reject(from != to, from, to);
    }

    /**
     * 캐시 항목 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static EntryState transition(EntryState current, EntryState next) {
        validate(current, next);
        return next;
    }

    /**
     * 번들 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static BundleState transition(BundleState current, BundleState next) {
        validate(current, next);
        return next;
    }

    /**
     * 로더 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static LoaderState transition(LoaderState current, LoaderState next) {
        validate(current, next);
        return next;
    }

    private static void requireStates(Object from, Object to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
    }

    private static void reject(boolean valid, Object from, Object to) {
        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }
}
