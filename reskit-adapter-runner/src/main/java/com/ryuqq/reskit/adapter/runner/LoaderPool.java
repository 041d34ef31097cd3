package com.ryuqq.reskit.adapter.runner;

import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.LoaderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * 저장소 종류별 LIFO 로더 풀.
 *
 * <p>모든 로더는 세대(generation) 아레나의 슬롯에 한 번 생성되어 파괴되지 않으며,
 * 반납된 로더는 종류별 스택에 쌓였다가 가장 최근에 반납된 것부터 재사용됩니다.</p>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>이미 반납된 로더의 재반납: ERROR 기록 후 false 반환</li>
 *   <li>이 풀이 만들지 않은 로더: {@link IllegalArgumentException}</li>
 * </ul>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public class LoaderPool {

    private static final Logger log = LoggerFactory.getLogger(LoaderPool.class);

    private final BiFunction<Integer, BackendKind, PooledResLoader> factory;
    private final List<PooledResLoader> arena = new ArrayList<>();
    private final Map<BackendKind, Deque<PooledResLoader>> free = new EnumMap<>(BackendKind.class);

    /**
     * 생성자.
     *
     * @param factory (slot, kind)로 새 로더를 만드는 팩토리
     * @throws IllegalArgumentException factory가 null인 경우
     */
    public LoaderPool(BiFunction<Integer, BackendKind, PooledResLoader> factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        this.factory = factory;
    }

    /**
     * 로더 할당. 풀에 있으면 가장 최근에 반납된 로더를, 없으면 새 로더를 반환합니다.
     *
     * @param kind 저장소 종류
     * @return ACTIVE 상태의 로더
     */
    public synchronized PooledResLoader allocate(BackendKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        Deque<PooledResLoader> stack = free.get(kind);
        PooledResLoader loader = stack == null ? null : stack.pollFirst();
        if (loader == null) {
            loader = factory.apply(arena.size(), kind);
            arena.add(loader);
            log.debug("Created loader {} for {}", loader.slot(), kind);
        }
        loader.activate();
        return loader;
    }

    /**
     * 로더 반납.
     *
     * <p>보유 목록은 반납 시점에 비워지고, 참조 해제는 풀의 모니터를 놓은 뒤 수행됩니다.</p>
     *
     * @param loader 반납할 로더
     * @return 반납되었으면 true, 이미 반납된 로더면 false
     * @throws IllegalArgumentException loader가 null이거나 이 풀의 로더가 아닌 경우
     */
    public boolean recycle(PooledResLoader loader) {
        List<String> held;
        synchronized (this) {
            if (loader == null) {
                throw new IllegalArgumentException("loader cannot be null");
            }
            if (!owns(loader)) {
                throw new IllegalArgumentException("loader does not belong to this pool: " + loader);
            }
            held = loader.deactivate();
            if (held == null) {
                log.error("Loader {} recycled twice, ignoring", loader.slot());
                return false;
            }
            free.computeIfAbsent(loader.kind(), k -> new ArrayDeque<>()).push(loader);
        }
        loader.releaseKeys(held);
        return true;
    }

    /**
     * 식별자로 로더 조회.
     *
     * @param id 로더 식별자
     * @return ACTIVE이고 세대가 일치하는 로더 (아니면 empty)
     */
    public synchronized Optional<PooledResLoader> resolve(LoaderId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (id.slot() >= arena.size()) {
            return Optional.empty();
        }
        PooledResLoader loader = arena.get(id.slot());
        if (!loader.isActive() || loader.version() != id.generation()) {
            return Optional.empty();
        }
        return Optional.of(loader);
    }

    /**
     * 생성된 로더 수 (사용 중 + 반납됨).
     *
     * @return 아레나 크기
     */
    public synchronized int size() {
        return arena.size();
    }

    /**
     * 반납되어 대기 중인 로더 수.
     *
     * @param kind 저장소 종류
     * @return 대기 중인 로더 수
     */
    public synchronized int pooledCount(BackendKind kind) {
        Deque<PooledResLoader> stack = free.get(kind);
        return stack == null ? 0 : stack.size();
    }

    private boolean owns(PooledResLoader loader) {
        int slot = loader.slot();
        return slot >= 0 && slot < arena.size() && arena.get(slot) == loader;
    }
}
