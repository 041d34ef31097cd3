package com.ryuqq.reskit.core.cache;

import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.statemachine.EntryState;
import com.ryuqq.reskit.core.statemachine.StateTransition;

/**
 * 캐시 항목.
 *
 * <p>참조 카운트와 상태는 {@link ResourceCache}만 변경합니다. 외부에서는 읽기만
 * 가능하며, 파괴된 항목은 {@link EntryState#INVALID}로 보입니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public final class CacheEntry {

    private final ResourceKey key;
    private final Asset asset;
    private volatile int refCount;
    private volatile boolean pinned;
    private volatile EntryState state;

    CacheEntry(ResourceKey key, Asset asset, int refCount) {
        this.key = key;
        this.asset = asset;
        this.refCount = refCount;
        this.state = StateTransition.transition(EntryState.LOADING, EntryState.READY);
    }

    public ResourceKey getKey() {
        return key;
    }

    public Asset getAsset() {
        return asset;
    }

    public int getRefCount() {
        return refCount;
    }

    public boolean isPinned() {
        return pinned;
    }

    public EntryState getState() {
        return state;
    }

    /**
     * 사용 가능 여부.
     *
     * @return READY인 경우 true
     */
    public boolean isReady() {
        return state == EntryState.READY;
    }

    void addRefs(int count) {
        refCount += count;
    }

    void decrement() {
        refCount--;
    }

    void setPinned(boolean pinned) {
        this.pinned = pinned;
    }

    void invalidate() {
        state = StateTransition.transition(state, EntryState.INVALID);
    }

    @Override
    public String toString() {
        return "CacheEntry{" + key.asCacheKey()
            + ", refCount=" + refCount
            + ", state=" + state
            + (pinned ? ", pinned" : "") + '}';
    }
}
