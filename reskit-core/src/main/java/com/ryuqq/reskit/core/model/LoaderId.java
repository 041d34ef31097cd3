package com.ryuqq.reskit.core.model;

/**
 * 풀링된 로더의 세대(generation) 식별자.
 *
 * <p>slot은 로더가 위치한 아레나 인덱스이고, generation은 로더의 버전입니다.
 * 로더가 재활용되거나 일괄 해제되면 버전이 증가하므로, 이전에 발급된
 * LoaderId는 더 이상 해당 로더로 해석되지 않습니다.</p>
 *
 * @param slot 아레나 슬롯 인덱스 (0 이상)
 * @param generation 발급 시점의 로더 버전 (0 이상)
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public record LoaderId(int slot, int generation) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException slot 또는 generation이 음수인 경우
     */
    public LoaderId {
        if (slot < 0) {
            throw new IllegalArgumentException("slot cannot be negative (current: " + slot + ")");
        }
        if (generation < 0) {
            throw new IllegalArgumentException("generation cannot be negative (current: " + generation + ")");
        }
    }

    @Override
    public String toString() {
        return "LoaderId{" + slot + "@" + generation + '}';
    }
}
