package com.ryuqq.reskit.adapter.runner.archive;

import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.statemachine.BundleState;
import com.ryuqq.reskit.core.statemachine.StateTransition;

import java.util.List;

/**
 * 의존성 그래프의 번들 노드.
 *
 * <p>상태와 참조 카운트는 {@link DependencyGraph}만 변경합니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public final class BundleNode {

    private final String name;
    private final List<String> dependencies;
    private final boolean pinned;
    private volatile int refCount;
    private volatile Asset bundle;
    private volatile BundleState state = BundleState.UNLOADED;

    BundleNode(String name, List<String> dependencies, boolean pinned) {
        this.name = name;
        this.dependencies = List.copyOf(dependencies);
        this.pinned = pinned;
    }

    public String getName() {
        return name;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public boolean isPinned() {
        return pinned;
    }

    public int getRefCount() {
        return refCount;
    }

    public Asset getBundle() {
        return bundle;
    }

    public BundleState getState() {
        return state;
    }

    void beginLoad() {
        state = StateTransition.transition(state, BundleState.LOADING);
    }

    void markReady(Asset bundle, int refs) {
        state = StateTransition.transition(state, BundleState.READY);
        this.bundle = bundle;
        this.refCount = refs;
    }

    void markFailed() {
        state = StateTransition.transition(state, BundleState.UNLOADED);
    }

    void increment() {
        refCount++;
    }

    void decrement() {
        refCount--;
    }

    void beginUnload() {
        state = StateTransition.transition(state, BundleState.UNLOADING);
    }

    void finishUnload() {
        state = StateTransition.transition(state, BundleState.UNLOADED);
        bundle = null;
    }

    @Override
    public String toString() {
        return "BundleNode{" + name
            + ", refCount=" + refCount
            + ", state=" + state
            + (pinned ? ", pinned" : "") + '}';
    }
}
